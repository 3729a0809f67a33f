package com.barthel.regcalc.application.service.audit;

import com.barthel.regcalc.application.port.out.AppendAuditRecordPort;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Builds audit records for engine invocations and hands them to the sink.
 * Engines only write through this class; they never read the trail.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditTrailRecorder {

    private final AppendAuditRecordPort appendAuditRecordPort;
    private final Clock clock;

    /**
     * Digests input and result and appends one record.
     *
     * @param operation engine operation name
     * @param input canonical input value
     * @param result canonical result value
     * @param regulatoryReference standard the calculation follows
     * @return the appended record
     */
    public AuditRecord record(String operation, Object input, Object result, String regulatoryReference) {
        AuditRecord auditRecord = new AuditRecord(
                clock.instant(),
                operation,
                digest(input),
                digest(result),
                regulatoryReference);
        appendAuditRecordPort.append(auditRecord);
        log.debug("Audit {} input={} result={}", operation, auditRecord.inputDigest(), auditRecord.resultDigest());
        return auditRecord;
    }

    /**
     * SHA-256 hex of {@code String.valueOf(value)}. Records, enum maps and
     * sorted maps render deterministically, so equal values digest equally.
     */
    public static String digest(Object value) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
