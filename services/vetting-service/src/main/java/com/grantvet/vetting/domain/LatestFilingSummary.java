package com.grantvet.vetting.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Financial summary of the most recent tax filing.
 * Ratios are null when the underlying data is missing or the denominator is not positive.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LatestFilingSummary {

    YearMonth taxPeriod;
    String formType;
    BigDecimal totalRevenue;
    BigDecimal totalExpenses;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    Double overheadRatio;
    Double officerCompensationRatio;

    @JsonIgnore
    public Integer getTaxYear() {
        return taxPeriod != null ? taxPeriod.getYear() : null;
    }

    public static class LatestFilingSummaryBuilder {

        public LatestFilingSummaryBuilder overheadRatio(Double overheadRatio) {
            this.overheadRatio = FilingMath.finiteOrNull(overheadRatio);
            return this;
        }

        public LatestFilingSummaryBuilder officerCompensationRatio(Double officerCompensationRatio) {
            this.officerCompensationRatio = FilingMath.finiteOrNull(officerCompensationRatio);
            return this;
        }
    }
}
