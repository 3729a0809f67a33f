package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.in.RollForwardCsmUseCase;
import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.liability.CsmMovement;
import com.barthel.regcalc.domain.model.liability.CsmResult;
import com.barthel.regcalc.domain.model.liability.CsmRollForwardInput;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * CSM at initial recognition and its period-over-period roll-forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsmCalculator implements RollForwardCsmUseCase {

    private final Rounding rounding;
    private final AuditTrailRecorder auditTrailRecorder;

    /**
     * {@code premiums - acquisition costs - BEL - RA}; a negative margin is
     * recognised as a loss component and the CSM set to zero.
     */
    public CsmResult initialRecognition(BigDecimal premiums, BigDecimal acquisitionCosts, BigDecimal bel,
                                        BigDecimal riskAdjustment) {
        BigDecimal margin = rounding.money(premiums.subtract(acquisitionCosts).subtract(bel).subtract(riskAdjustment));
        if (margin.signum() < 0) {
            return new CsmResult(rounding.zeroMoney(), margin.negate());
        }
        return new CsmResult(margin, rounding.zeroMoney());
    }

    @Override
    public CsmMovement rollForward(CsmRollForwardInput input) {
        BigDecimal interest;
        BigDecimal adjustment;
        if (input.model() == MeasurementModel.VFA) {
            interest = BigDecimal.ZERO;
            adjustment = input.changeInUnderlyingFairValue().add(input.nonVariableFcfChanges());
        } else {
            interest = input.opening().multiply(input.interestRate());
            adjustment = input.changesInFutureService();
        }

        BigDecimal beforeRelease = input.opening()
                .add(input.newBusiness())
                .add(interest)
                .add(adjustment)
                .add(input.currencyEffect());
        BigDecimal release = release(beforeRelease.max(BigDecimal.ZERO),
                input.coverageUnitsCurrent(), input.coverageUnitsRemaining());
        BigDecimal unfloored = beforeRelease.subtract(release);

        CsmMovement movement = new CsmMovement(
                input.model(),
                rounding.money(input.opening()),
                rounding.money(input.newBusiness()),
                rounding.money(interest),
                rounding.money(adjustment),
                rounding.money(input.currencyEffect()),
                rounding.money(release),
                rounding.money(unfloored.max(BigDecimal.ZERO)),
                unfloored.signum() < 0);
        auditTrailRecorder.record("CSM roll-forward", input, movement, RegulatoryReference.IFRS_17);
        log.info("CSM roll-forward {} opening={} release={} closing={}", input.model(), movement.opening(),
                movement.release(), movement.closing());
        return movement;
    }

    /**
     * {@code csm * current / remaining}; zero when no units remain.
     */
    public BigDecimal release(BigDecimal csm, BigDecimal unitsCurrent, BigDecimal unitsRemaining) {
        if (unitsRemaining.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return csm.multiply(unitsCurrent).divide(unitsRemaining, Rounding.WORKING);
    }
}
