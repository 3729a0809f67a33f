package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.model.common.Scenario;

import java.math.BigDecimal;

/**
 * ECL under one stress multiplier.
 *
 * @param scenario stressed scenario
 * @param multiplier multiplier applied to the base ECL
 * @param stressedEcl stressed ECL at currency precision
 * @param changePercent change against base in percent
 */
public record EclStressResult(Scenario scenario, BigDecimal multiplier, BigDecimal stressedEcl, BigDecimal changePercent) {
}
