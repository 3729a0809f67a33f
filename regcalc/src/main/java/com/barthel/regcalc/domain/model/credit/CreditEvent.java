package com.barthel.regcalc.domain.model.credit;

/**
 * Qualitative facts about a borrower. A default event makes the exposure
 * credit-impaired; the others signal a significant increase in credit risk.
 */
public enum CreditEvent {
    DEFAULT_EVENT,
    RESTRUCTURING,
    WATCHLIST,
    COVENANT_BREACH
}
