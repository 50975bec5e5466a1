package com.grantvet.vetting.scoring;

import com.grantvet.vetting.domain.ScoredCheck;
import lombok.Value;

import java.util.List;

/**
 * Weighted checks in evaluation order and the rounded total they earn (0 to 100).
 */
@Value
public class ScoringOutcome {

    int score;
    List<ScoredCheck> checks;

    public int totalWeight() {
        return checks.stream().mapToInt(ScoredCheck::getWeight).sum();
    }
}
