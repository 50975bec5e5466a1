package com.grantvet.vetting.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Vetting engine configuration bound from {@code grantvet.vetting.*}.
 *
 * Only field-level ranges are validated here; cross-field ordering (weights
 * summing to 100, ordered bands) is checked by {@link ThresholdValidator}
 * once the values are converted into {@link VettingThresholds}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "grantvet.vetting")
public class VettingProperties {

    static final int MIN_CACHE_AGE_DAYS = 1;
    static final int MAX_CACHE_AGE_DAYS = 365;

    @Valid
    private ScoringConfig scoring = new ScoringConfig();

    @Valid
    private RedFlagConfig redFlags = new RedFlagConfig();

    @Valid
    private SanctionsConfig sanctions = new SanctionsConfig();

    @Valid
    private PortfolioFitConfig portfolioFit = new PortfolioFitConfig();

    @Valid
    private CacheConfig cache = new CacheConfig();

    @Valid
    private BatchConfig batch = new BatchConfig();

    @Valid
    private AsyncConfig async = new AsyncConfig();

    public VettingThresholds toThresholds() {
        return VettingThresholds.builder()
                .tenureWeight(scoring.getWeights().getTenure())
                .revenueWeight(scoring.getWeights().getRevenue())
                .operatingRatioWeight(scoring.getWeights().getOperatingRatio())
                .recencyWeight(scoring.getWeights().getRecency())
                .tenurePassYears(scoring.getTenure().getPassYears())
                .tenureReviewYears(scoring.getTenure().getReviewYears())
                .revenueFloor(BigDecimal.valueOf(scoring.getRevenue().getFloor()))
                .revenuePassMin(BigDecimal.valueOf(scoring.getRevenue().getPassMin()))
                .revenuePassMax(BigDecimal.valueOf(scoring.getRevenue().getPassMax()))
                .revenueReviewMax(BigDecimal.valueOf(scoring.getRevenue().getReviewMax()))
                .ratioPassMin(scoring.getOperatingRatio().getPassMin())
                .ratioPassMax(scoring.getOperatingRatio().getPassMax())
                .ratioReviewLow(scoring.getOperatingRatio().getReviewLow())
                .ratioReviewHigh(scoring.getOperatingRatio().getReviewHigh())
                .recencyPassYears(scoring.getRecency().getPassYears())
                .recencyReviewYears(scoring.getRecency().getReviewYears())
                .passCutoff(scoring.getPassCutoff())
                .reviewCutoff(scoring.getReviewCutoff())
                .highSeverityFlagRejects(scoring.isHighSeverityFlagRejects())
                .staleFilingYears(redFlags.getStaleFilingYears())
                .excessiveOverheadRatio(redFlags.getExcessiveOverheadRatio())
                .lowFundDeploymentRatio(redFlags.getLowFundDeploymentRatio())
                .veryLowRevenue(BigDecimal.valueOf(redFlags.getVeryLowRevenue()))
                .revenueDeclinePct(redFlags.getRevenueDeclinePct())
                .revenueDeclineMaxGapMonths(redFlags.getRevenueDeclineMaxGapMonths())
                .tooNewYears(redFlags.getTooNewYears())
                .compensationHigh(redFlags.getCompensationHigh())
                .compensationModerate(redFlags.getCompensationModerate())
                .nearMatchThreshold(sanctions.getNearMatchThreshold())
                .nearMatchHighSimilarity(sanctions.getNearMatchHighSimilarity())
                .build();
    }

    public PortfolioFitPolicy toPortfolioFitPolicy() {
        return PortfolioFitPolicy.of(portfolioFit.isEnabled(), portfolioFit.getExcludedEins(),
                portfolioFit.getIncludedEins(), portfolioFit.getAllowedNteeCategories());
    }

    /**
     * Cached results older than this are re-evaluated. Clamped to [1, 365] days.
     */
    public Duration cacheMaxAge() {
        int days = Math.max(MIN_CACHE_AGE_DAYS, Math.min(MAX_CACHE_AGE_DAYS, cache.getMaxAgeDays()));
        return Duration.ofDays(days);
    }

    @Data
    public static class ScoringConfig {
        @Valid
        private Weights weights = new Weights();
        @Valid
        private Tenure tenure = new Tenure();
        @Valid
        private Revenue revenue = new Revenue();
        @Valid
        private OperatingRatio operatingRatio = new OperatingRatio();
        @Valid
        private Recency recency = new Recency();

        @Min(0)
        private int passCutoff = 75;
        @Min(0)
        private int reviewCutoff = 50;

        /**
         * When true any HIGH red flag forces REJECT regardless of score.
         */
        private boolean highSeverityFlagRejects = false;
    }

    @Data
    public static class Weights {
        @Min(0)
        private int tenure = 10;
        @Min(0)
        private int revenue = 25;
        @Min(0)
        private int operatingRatio = 35;
        @Min(0)
        private int recency = 30;
    }

    @Data
    public static class Tenure {
        @Min(0)
        private int passYears = 3;
        @Min(0)
        private int reviewYears = 1;
    }

    @Data
    public static class Revenue {
        @Min(0)
        private long floor = 25_000L;
        @Min(0)
        private long passMin = 50_000L;
        @Min(0)
        private long passMax = 10_000_000L;
        @Min(0)
        private long reviewMax = 50_000_000L;
    }

    @Data
    public static class OperatingRatio {
        @DecimalMin("0.0")
        private double passMin = 0.6;
        @DecimalMin("0.0")
        private double passMax = 1.3;
        @DecimalMin("0.0")
        private double reviewLow = 0.4;
        @DecimalMin("0.0")
        private double reviewHigh = 1.5;
    }

    @Data
    public static class Recency {
        @Min(0)
        private int passYears = 3;
        @Min(0)
        private int reviewYears = 4;
    }

    @Data
    public static class RedFlagConfig {
        @Min(0)
        private int staleFilingYears = 4;
        @DecimalMin("0.0")
        private double excessiveOverheadRatio = 1.5;
        @DecimalMin("0.0")
        private double lowFundDeploymentRatio = 0.4;
        @Min(0)
        private long veryLowRevenue = 25_000L;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double revenueDeclinePct = 0.2;
        @Min(1)
        private int revenueDeclineMaxGapMonths = 18;
        @Min(0)
        private int tooNewYears = 1;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double compensationHigh = 0.40;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double compensationModerate = 0.25;
    }

    @Data
    public static class SanctionsConfig {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double nearMatchThreshold = 0.85;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double nearMatchHighSimilarity = 0.95;
    }

    @Data
    public static class PortfolioFitConfig {
        private boolean enabled = true;
        private List<String> excludedEins = new ArrayList<>();
        private List<String> includedEins = new ArrayList<>();
        private List<String> allowedNteeCategories = new ArrayList<>(PortfolioFitPolicy.DEFAULT_NTEE_PREFIXES);
    }

    @Data
    public static class CacheConfig {
        private int maxAgeDays = 30;
        @NotBlank
        private String defaultAttribution = "vetting-pipeline";
    }

    @Data
    public static class BatchConfig {
        @Min(1)
        private int maxSize = 25;
    }

    @Data
    public static class AsyncConfig {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 100;
    }
}
