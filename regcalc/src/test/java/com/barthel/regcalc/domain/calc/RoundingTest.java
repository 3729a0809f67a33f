package com.barthel.regcalc.domain.calc;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundingTest {

    private final Rounding rounding = Rounding.standard();

    @Test
    void moneyKeepsThreeDecimalsHalfUp() {
        assertThat(rounding.money(new BigDecimal("1.2345"))).isEqualTo(new BigDecimal("1.235"));
        assertThat(rounding.money(new BigDecimal("-1.2345"))).isEqualTo(new BigDecimal("-1.235"));
        assertThat(rounding.zeroMoney()).isEqualTo(new BigDecimal("0.000"));
    }

    @Test
    void ratiosKeepTenDecimals() {
        assertThat(rounding.divide(BigDecimal.ONE, new BigDecimal("3"))).isEqualTo(new BigDecimal("0.3333333333"));
        assertThat(rounding.ratio(2.0 / 3.0)).isEqualTo(new BigDecimal("0.6666666667"));
    }

    @Test
    void ratioScaleMustNotBeBelowCurrencyScale() {
        assertThatThrownBy(() -> new Rounding(4, 2, RoundingMode.HALF_UP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Rounding(3, 10, RoundingMode.UNNECESSARY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
