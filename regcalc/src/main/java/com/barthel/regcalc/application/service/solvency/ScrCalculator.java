package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.config.SolvencyProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.solvency.MarketRiskExposure;
import com.barthel.regcalc.domain.model.solvency.ScrInput;
import com.barthel.regcalc.domain.model.solvency.ScrResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Standard-formula capital requirement. Sub-modules aggregate by square root
 * of the sum of squares, which treats the risks as independent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrCalculator {

    private final SolvencyProperties properties;
    private final Rounding rounding;
    private final AuditTrailRecorder auditTrailRecorder;

    public ScrResult calculate(ScrInput input) {
        SolvencyProperties.Scr scr = properties.getScr();
        MarketRiskExposure exposure = input.market();
        BigDecimal market = rootSumOfSquares(
                exposure.equity().multiply(scr.getEquityShock()),
                exposure.property().multiply(scr.getPropertyShock()),
                exposure.interestRateSensitivity().multiply(scr.getInterestShock()),
                exposure.spread().multiply(scr.getSpreadShock()));
        BigDecimal underwriting = rootSumOfSquares(
                input.underwriting().premiumRisk(),
                input.underwriting().reserveRisk(),
                input.underwriting().catastropheRisk());
        BigDecimal basic = rootSumOfSquares(market, underwriting);

        BigDecimal operationalBase = input.grossPremiums().multiply(scr.getOperationalPremiumRate())
                .max(input.technicalProvisions().multiply(scr.getOperationalProvisionRate()));
        BigDecimal operational = rounding.money(operationalBase.min(basic.multiply(scr.getOperationalCap())));

        ScrResult result = new ScrResult(market, underwriting, basic, operational, basic.add(operational));
        auditTrailRecorder.record("SCR calculation", input, result, RegulatoryReference.SOLVENCY_II_SCR);
        log.info("SCR market={} underwriting={} bscr={} op={} total={}", market, underwriting, basic, operational,
                result.total());
        return result;
    }

    private BigDecimal rootSumOfSquares(BigDecimal... components) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal component : components) {
            sum = sum.add(component.multiply(component));
        }
        return rounding.money(sum.sqrt(Rounding.WORKING));
    }
}
