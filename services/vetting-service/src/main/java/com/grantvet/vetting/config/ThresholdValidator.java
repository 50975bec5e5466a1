package com.grantvet.vetting.config;

import com.grantvet.common.exception.ErrorCode;
import com.grantvet.common.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field checks on a threshold set. Every violation is collected so a
 * misconfigured deployment sees all of its problems in one startup failure.
 */
@Slf4j
public final class ThresholdValidator {

    private ThresholdValidator() {
    }

    /**
     * @throws InvalidArgumentException listing every violation, with code CONFIGURATION_INVALID
     */
    public static VettingThresholds validate(VettingThresholds thresholds) {
        List<String> violations = violations(thresholds);
        if (!violations.isEmpty()) {
            log.error("Rejecting vetting thresholds: {}", violations);
            throw (InvalidArgumentException) new InvalidArgumentException(ErrorCode.CONFIGURATION_INVALID,
                    "Invalid vetting thresholds: " + String.join("; ", violations))
                    .withMetadata("violations", List.copyOf(violations));
        }
        return thresholds;
    }

    public static List<String> violations(VettingThresholds t) {
        List<String> violations = new ArrayList<>();

        if (t.getTenureWeight() < 0 || t.getRevenueWeight() < 0
                || t.getOperatingRatioWeight() < 0 || t.getRecencyWeight() < 0) {
            violations.add("check weights must not be negative");
        }
        if (t.totalWeight() != 100) {
            violations.add("check weights must sum to 100 but sum to " + t.totalWeight());
        }

        if (t.getTenureReviewYears() < 0 || t.getTenureReviewYears() > t.getTenurePassYears()) {
            violations.add("tenure review years must be between 0 and tenure pass years");
        }

        if (anyNull(t.getRevenueFloor(), t.getRevenuePassMin(), t.getRevenuePassMax(), t.getRevenueReviewMax())) {
            violations.add("revenue bounds are required");
        } else if (!ordered(BigDecimal.ZERO, t.getRevenueFloor(), t.getRevenuePassMin(),
                t.getRevenuePassMax(), t.getRevenueReviewMax())) {
            violations.add("revenue bounds must satisfy 0 <= floor <= pass-min <= pass-max <= review-max");
        }

        if (!(0.0 <= t.getRatioReviewLow() && t.getRatioReviewLow() <= t.getRatioPassMin()
                && t.getRatioPassMin() <= t.getRatioPassMax() && t.getRatioPassMax() <= t.getRatioReviewHigh())) {
            violations.add("operating ratio bands must satisfy 0 <= review-low <= pass-min <= pass-max <= review-high");
        }

        if (t.getRecencyPassYears() < 0 || t.getRecencyPassYears() > t.getRecencyReviewYears()) {
            violations.add("recency pass years must be between 0 and recency review years");
        }

        if (t.getReviewCutoff() < 0 || t.getReviewCutoff() > t.getPassCutoff() || t.getPassCutoff() > 100) {
            violations.add("score cutoffs must satisfy 0 <= review <= pass <= 100");
        }

        if (t.getStaleFilingYears() < 0) {
            violations.add("stale filing years must not be negative");
        }
        if (t.getLowFundDeploymentRatio() < 0 || t.getLowFundDeploymentRatio() > t.getExcessiveOverheadRatio()) {
            violations.add("low fund deployment ratio must be between 0 and the excessive overhead ratio");
        }
        if (t.getVeryLowRevenue() == null || t.getVeryLowRevenue().signum() < 0) {
            violations.add("very low revenue threshold must not be negative");
        }
        if (!fraction(t.getRevenueDeclinePct())) {
            violations.add("revenue decline percentage must be in [0, 1]");
        }
        if (t.getRevenueDeclineMaxGapMonths() < 1) {
            violations.add("revenue decline gap must be at least one month");
        }
        if (t.getTooNewYears() < 0) {
            violations.add("too-new years must not be negative");
        }
        if (!fraction(t.getCompensationHigh()) || !fraction(t.getCompensationModerate())) {
            violations.add("compensation thresholds must be in [0, 1]");
        } else if (t.getCompensationModerate() > t.getCompensationHigh()) {
            violations.add("moderate compensation threshold must not exceed the high threshold");
        }

        if (!(t.getNearMatchThreshold() >= 0.0 && t.getNearMatchThreshold() < 1.0)) {
            violations.add("near-match threshold must be in [0, 1)");
        }
        if (!fraction(t.getNearMatchHighSimilarity())) {
            violations.add("near-match high similarity must be in [0, 1]");
        }
        return violations;
    }

    private static boolean fraction(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static boolean anyNull(Object... values) {
        for (Object value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    private static boolean ordered(BigDecimal... values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1].compareTo(values[i]) > 0) {
                return false;
            }
        }
        return true;
    }
}
