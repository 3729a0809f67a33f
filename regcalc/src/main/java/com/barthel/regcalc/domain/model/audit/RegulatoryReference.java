package com.barthel.regcalc.domain.model.audit;

public final class RegulatoryReference {

    public static final String IFRS_9 = "IFRS 9 Financial Instruments, 5.5 Impairment";
    public static final String IFRS_17 = "IFRS 17 Insurance Contracts, 32-52";
    public static final String IFRS_17_PAA = "IFRS 17 Insurance Contracts, 53-59 Premium allocation approach";
    public static final String SOLVENCY_MARGIN = "ARDFM Resolution No. 304, solvency margin";
    public static final String SOLVENCY_II_SCR = "Solvency II standard formula";
    public static final String GUARANTEE_FUND = "Insurance payment guarantee fund rules";

    private RegulatoryReference() {
    }
}
