package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Terminal artifact of a vetting run. Built once, never mutated; a later run
 * for the same EIN supersedes it.
 *
 * When {@code gateBlocked} is true, {@code score} and {@code checks} are null
 * and the recommendation is always {@link Recommendation#REJECT}. Red flags
 * are populated in both cases.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VettingResult {

    String ein;
    String name;
    boolean passed;
    GateLayerResult gates;
    boolean gateBlocked;
    Integer score;
    List<ScoredCheck> checks;
    Recommendation recommendation;
    List<String> reviewReasons;
    List<RedFlag> redFlags;
    VettingSummary summary;
    Instant evaluatedAt;
}
