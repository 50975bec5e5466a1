package com.grantvet.vetting.domain;

/**
 * Categories of advisory findings, each with the factor text used in summaries.
 */
public enum RedFlagType {
    STALE_FILING("Financial data is severely outdated"),
    LOW_FUND_DEPLOYMENT("Low fund deployment ratio"),
    EXCESSIVE_OVERHEAD("Unsustainable expense-to-revenue ratio"),
    VERY_LOW_REVENUE("Very small operation"),
    REVENUE_DECLINE("Significant revenue decline"),
    TOO_NEW("Organization is very new"),
    HIGH_OFFICER_COMPENSATION("High officer/director compensation ratio"),
    COURT_RECORDS("Federal court cases on record"),
    SANCTIONS_NEAR_MATCH("Possible sanctions list near-match");

    private final String factor;

    RedFlagType(String factor) {
        this.factor = factor;
    }

    public String getFactor() {
        return factor;
    }
}
