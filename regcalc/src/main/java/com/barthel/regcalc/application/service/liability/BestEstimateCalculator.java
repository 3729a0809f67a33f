package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.domain.calc.Discounting;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.common.DiscountForm;
import com.barthel.regcalc.domain.model.liability.BelPeriod;
import com.barthel.regcalc.domain.model.liability.BelResult;
import com.barthel.regcalc.domain.model.liability.CashFlow;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Survival-weighted present value of net outflows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BestEstimateCalculator {

    private final Rounding rounding;

    public BelResult calculate(CashFlowSchedule schedule, BigDecimal lapseRate, BigDecimal rate, DiscountForm form) {
        BigDecimal persistency = BigDecimal.ONE.subtract(lapseRate);
        List<BelPeriod> periods = new ArrayList<>(schedule.term());
        BigDecimal total = BigDecimal.ZERO;
        for (CashFlow cashFlow : schedule.periods()) {
            int t = cashFlow.period();
            BigDecimal net = cashFlow.netOutflow();
            BigDecimal survival = persistency.pow(t - 1, Rounding.WORKING);
            BigDecimal discountFactor = Discounting.factor(form, rate, t);
            BigDecimal presentValue = net.multiply(survival).multiply(discountFactor, Rounding.WORKING);
            total = total.add(presentValue);
            periods.add(new BelPeriod(t, rounding.money(net), rounding.ratio(survival),
                    rounding.ratio(discountFactor), rounding.money(presentValue)));
        }
        BigDecimal bel = rounding.money(total);
        log.debug("BEL {} rate={} form={} bel={}", schedule.groupId(), rate, form, bel);
        return new BelResult(rate, form, periods, bel);
    }
}
