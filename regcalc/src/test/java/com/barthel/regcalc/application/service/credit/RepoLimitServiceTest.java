package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.model.credit.RepoLimitCheck;
import com.barthel.regcalc.domain.model.credit.RepoPosition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class RepoLimitServiceTest {

    private final RepoLimitService service = new EngineFixtures().repoLimitService;
    private final RepoPosition halfOfReserves = new RepoPosition(new BigDecimal("500"), new BigDecimal("1000"));

    @Test
    void limitBeforeChangeDateIsFiftyPercent() {
        RepoLimitCheck check = service.check(halfOfReserves, LocalDate.of(2025, 6, 30));

        assertThat(check.limit()).isEqualByComparingTo("0.50");
        assertThat(check.compliant()).isTrue();
        assertThat(check.penalty()).isZero();
    }

    @Test
    void breachAfterChangeDateIsPenalised() {
        RepoLimitCheck check = service.check(halfOfReserves, LocalDate.of(2025, 7, 1));

        assertThat(check.limit()).isEqualByComparingTo("0.35");
        assertThat(check.compliant()).isFalse();
        assertThat(check.ratio()).isEqualByComparingTo("0.5");
        assertThat(check.excess()).isEqualByComparingTo("0.15");
        assertThat(check.penalty()).isEqualByComparingTo("7.5");
    }

    @Test
    void zeroReservesIsNonCompliantWithoutRatio() {
        RepoLimitCheck check = service.check(new RepoPosition(new BigDecimal("10"), BigDecimal.ZERO),
                LocalDate.of(2025, 11, 1));

        assertThat(check.ratio()).isNull();
        assertThat(check.compliant()).isFalse();
    }
}
