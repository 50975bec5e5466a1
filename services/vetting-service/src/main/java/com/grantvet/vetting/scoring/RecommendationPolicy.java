package com.grantvet.vetting.scoring;

import com.grantvet.vetting.config.VettingThresholds;
import com.grantvet.vetting.domain.Recommendation;
import com.grantvet.vetting.domain.RedFlag;
import com.grantvet.vetting.domain.RedFlagSeverity;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Maps a score to PASS, REVIEW or REJECT against the configured cutoffs.
 * Gate-blocked organizations are always rejected.
 */
@RequiredArgsConstructor
public class RecommendationPolicy {

    private final VettingThresholds thresholds;

    public Recommendation recommend(Integer score, boolean gateBlocked, List<RedFlag> redFlags) {
        if (gateBlocked || score == null) {
            return Recommendation.REJECT;
        }
        if (thresholds.isHighSeverityFlagRejects() && redFlags.stream()
                .anyMatch(flag -> flag.getSeverity() == RedFlagSeverity.HIGH)) {
            return Recommendation.REJECT;
        }
        if (score >= thresholds.getPassCutoff()) {
            return Recommendation.PASS;
        }
        if (score >= thresholds.getReviewCutoff()) {
            return Recommendation.REVIEW;
        }
        return Recommendation.REJECT;
    }
}
