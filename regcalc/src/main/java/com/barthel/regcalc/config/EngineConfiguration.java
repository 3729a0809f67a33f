package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.calc.Rounding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        RoundingProperties.class,
        MacroProperties.class,
        CreditRiskProperties.class,
        LiabilityProperties.class,
        SolvencyProperties.class,
        GuaranteeFundProperties.class
})
public class EngineConfiguration {

    @Bean
    public Rounding rounding(RoundingProperties properties) {
        return properties.toRounding();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
