package com.barthel.regcalc;

import com.barthel.regcalc.adapter.out.db.entity.AuditRecordEntity;
import com.barthel.regcalc.adapter.out.db.repository.AuditRecordRepository;
import com.barthel.regcalc.application.port.in.AssessSolvencyUseCase;
import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.application.port.in.RunUnifiedCalculationUseCase;
import com.barthel.regcalc.application.port.out.FetchMacroContextPort;
import com.barthel.regcalc.application.service.liability.LiabilityMeasurementRouter;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class RegcalcApplicationTests {

    @Autowired
    private MeasureLiabilityUseCase measureLiabilityUseCase;

    @Autowired
    private AssessSolvencyUseCase assessSolvencyUseCase;

    @Autowired
    private RunUnifiedCalculationUseCase runUnifiedCalculationUseCase;

    @Autowired
    private FetchMacroContextPort fetchMacroContextPort;

    @Autowired
    private AuditRecordRepository auditRecordRepository;

    @Test
    void contextLoads() {
        assertThat(measureLiabilityUseCase).isInstanceOf(LiabilityMeasurementRouter.class);
        assertThat(runUnifiedCalculationUseCase).isNotNull();
    }

    @Test
    void assessmentIsPersistedToAuditTable() {
        SolvencyPosition position = assessSolvencyUseCase.assess(
                MinimumMarginInput.builder()
                        .grossPremiums(new BigDecimal("35000000000"))
                        .incurredClaims(new BigDecimal("18000000000"))
                        .build(),
                OwnFundsInput.builder().equity(new BigDecimal("20000000000")).build(),
                null,
                fetchMacroContextPort.fetchMacroContext(EngineFixtures.VALUATION_DATE));

        assertThat(position.compliant()).isTrue();
        assertThat(auditRecordRepository.findAll())
                .extracting(AuditRecordEntity::getOperation)
                .contains("Solvency assessment");
    }
}
