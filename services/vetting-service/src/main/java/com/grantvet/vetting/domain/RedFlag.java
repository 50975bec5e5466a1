package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Advisory finding attached to a result regardless of recommendation.
 * {@code cases} is only populated for court-record flags.
 */
@Value
@Builder
@Jacksonized
public class RedFlag {

    RedFlagSeverity severity;
    RedFlagType type;
    String detail;
    List<CourtCaseSummary> cases;

    public static RedFlag high(RedFlagType type, String detail) {
        return new RedFlag(RedFlagSeverity.HIGH, type, detail, null);
    }

    public static RedFlag medium(RedFlagType type, String detail) {
        return new RedFlag(RedFlagSeverity.MEDIUM, type, detail, null);
    }
}
