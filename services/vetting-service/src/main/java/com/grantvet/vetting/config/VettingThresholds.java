package com.grantvet.vetting.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable set of every numeric threshold the decision engines consult.
 *
 * Built once from {@link VettingProperties} and handed to each engine
 * explicitly; the engines never carry defaults of their own. Builder defaults
 * match the production deployment and keep tests short.
 */
@Value
@Builder(toBuilder = true)
public class VettingThresholds {

    // Check weights (sum to 100)
    @Builder.Default
    int tenureWeight = 10;
    @Builder.Default
    int revenueWeight = 25;
    @Builder.Default
    int operatingRatioWeight = 35;
    @Builder.Default
    int recencyWeight = 30;

    // Tenure, in whole years operating
    @Builder.Default
    int tenurePassYears = 3;
    @Builder.Default
    int tenureReviewYears = 1;

    // Revenue range, in dollars
    @Builder.Default
    BigDecimal revenueFloor = BigDecimal.valueOf(25_000);
    @Builder.Default
    BigDecimal revenuePassMin = BigDecimal.valueOf(50_000);
    @Builder.Default
    BigDecimal revenuePassMax = BigDecimal.valueOf(10_000_000);
    @Builder.Default
    BigDecimal revenueReviewMax = BigDecimal.valueOf(50_000_000);

    // Operating ratio bands
    @Builder.Default
    double ratioPassMin = 0.6;
    @Builder.Default
    double ratioPassMax = 1.3;
    @Builder.Default
    double ratioReviewLow = 0.4;
    @Builder.Default
    double ratioReviewHigh = 1.5;

    // Filing recency, in tax years
    @Builder.Default
    int recencyPassYears = 3;
    @Builder.Default
    int recencyReviewYears = 4;

    // Recommendation cutoffs
    @Builder.Default
    int passCutoff = 75;
    @Builder.Default
    int reviewCutoff = 50;
    @Builder.Default
    boolean highSeverityFlagRejects = false;

    // Red flags
    @Builder.Default
    int staleFilingYears = 4;
    @Builder.Default
    double excessiveOverheadRatio = 1.5;
    @Builder.Default
    double lowFundDeploymentRatio = 0.4;
    @Builder.Default
    BigDecimal veryLowRevenue = BigDecimal.valueOf(25_000);
    @Builder.Default
    double revenueDeclinePct = 0.2;
    @Builder.Default
    int revenueDeclineMaxGapMonths = 18;
    @Builder.Default
    int tooNewYears = 1;
    @Builder.Default
    double compensationHigh = 0.40;
    @Builder.Default
    double compensationModerate = 0.25;

    // Sanctions near-match
    @Builder.Default
    double nearMatchThreshold = 0.85;
    @Builder.Default
    double nearMatchHighSimilarity = 0.95;

    public static VettingThresholds defaults() {
        return builder().build();
    }

    public int totalWeight() {
        return tenureWeight + revenueWeight + operatingRatioWeight + recencyWeight;
    }
}
