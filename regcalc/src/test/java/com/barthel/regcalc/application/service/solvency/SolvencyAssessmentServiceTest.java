package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.InsurerClass;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.solvency.SolvencyBand;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolvencyAssessmentServiceTest {

    private final EngineFixtures fixtures = new EngineFixtures();
    private final SolvencyAssessmentService service = fixtures.solvencyService;
    private final MacroContext macro = fixtures.macroContext();

    private final MinimumMarginInput margin = MinimumMarginInput.builder()
            .grossPremiums(new BigDecimal("35000000000"))
            .incurredClaims(new BigDecimal("18000000000"))
            .build();
    private final OwnFundsInput ownFunds = OwnFundsInput.builder()
            .equity(new BigDecimal("20000000000"))
            .build();
    private final IfrsAdjustments adjustments =
            new IfrsAdjustments(new BigDecimal("2100000000"), new BigDecimal("11800000000"));

    @Test
    void largeNonLifeInsurerIsComfortablySolvent() {
        SolvencyPosition position = service.assess(margin, ownFunds, adjustments, macro);

        assertThat(position.minimumMargin().byPremiums()).isEqualByComparingTo("3969000000");
        assertThat(position.minimumMargin().byClaims()).isEqualByComparingTo("2950500000");
        assertThat(position.minimumMargin().amount()).isEqualByComparingTo("3969000000");
        assertThat(position.minimumMargin().floorApplied()).isFalse();
        assertThat(position.ownFunds().amount()).isEqualByComparingTo("29700000000");
        assertThat(position.ratio()).isEqualByComparingTo("7.4829931973");
        assertThat(position.compliant()).isTrue();
        assertThat(position.band()).isEqualTo(SolvencyBand.EXCELLENT);
    }

    @Test
    void identicalInputsGiveIdenticalPositionsAndDigests() {
        SolvencyPosition first = service.assess(margin, ownFunds, adjustments, macro);
        SolvencyPosition second = service.assess(margin, ownFunds, adjustments, macro);

        assertThat(second).isEqualTo(first);
        assertThat(first.auditDigest()).hasSize(64);
        List<AuditRecord> records = fixtures.auditTrail.records();
        assertThat(records).hasSize(2);
        assertThat(records.get(0).inputDigest()).isEqualTo(records.get(1).inputDigest());
        assertThat(records.get(0).resultDigest()).isEqualTo(records.get(1).resultDigest());
        assertThat(records.get(0).regulatoryReference()).isEqualTo(RegulatoryReference.SOLVENCY_MARGIN);
    }

    @Test
    void digestChangesWithInputs() {
        SolvencyPosition base = service.assess(margin, ownFunds, adjustments, macro);
        SolvencyPosition lessEquity = service.assess(margin,
                OwnFundsInput.builder().equity(new BigDecimal("19000000000")).build(), adjustments, macro);

        assertThat(lessEquity.auditDigest()).isNotEqualTo(base.auditDigest());
    }

    @Test
    void smallInsurerIsHeldToGuaranteedFund() {
        MinimumMarginInput small = MinimumMarginInput.builder()
                .insurerClass(InsurerClass.LIFE)
                .grossPremiums(new BigDecimal("1000000"))
                .incurredClaims(new BigDecimal("500000"))
                .build();

        SolvencyPosition position = service.assess(small, ownFunds, IfrsAdjustments.NONE, macro);

        assertThat(position.minimumMargin().floorApplied()).isTrue();
        assertThat(position.minimumMargin().amount()).isEqualByComparingTo("1966000000");
    }

    @Test
    void negativeOwnFundsAreNotCompliant() {
        OwnFundsInput thin = OwnFundsInput.builder()
                .equity(new BigDecimal("1000000000"))
                .intangibleAssets(new BigDecimal("3000000000"))
                .build();

        SolvencyPosition position = service.assess(margin, thin, IfrsAdjustments.NONE, macro);

        assertThat(position.ownFunds().amount()).isNegative();
        assertThat(position.compliant()).isFalse();
        assertThat(position.band()).isEqualTo(SolvencyBand.INSUFFICIENT);
    }

    @Test
    void missingAdjustmentsDefaultToNone() {
        SolvencyPosition withNull = service.assess(margin, ownFunds, null, macro);
        SolvencyPosition withNone = service.assess(margin, ownFunds, IfrsAdjustments.NONE, macro);

        assertThat(withNull).isEqualTo(withNone);
        assertThat(withNull.ownFunds().amount()).isEqualByComparingTo("20000000000");
    }

    @Test
    void missingBasesAreRejected() {
        assertThatThrownBy(() -> service.assess(null, ownFunds, adjustments, macro))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new IfrsAdjustments(new BigDecimal("-1"), BigDecimal.ZERO))
                .isInstanceOf(InvalidInputException.class);
    }
}
