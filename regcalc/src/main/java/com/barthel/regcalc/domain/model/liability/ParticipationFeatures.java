package com.barthel.regcalc.domain.model.liability;

/**
 * Direct-participation features tested for variable-fee eligibility.
 *
 * @param substantialFairValueShare policyholder shares in a clearly identified pool of underlying items
 * @param variablePayoutPortion a substantial share of payouts varies with the underlying items
 * @param investmentService the contract provides an investment-related service
 */
public record ParticipationFeatures(
        boolean substantialFairValueShare,
        boolean variablePayoutPortion,
        boolean investmentService) {

    public static final ParticipationFeatures NONE = new ParticipationFeatures(false, false, false);

    public boolean allHold() {
        return substantialFairValueShare && variablePayoutPortion && investmentService;
    }
}
