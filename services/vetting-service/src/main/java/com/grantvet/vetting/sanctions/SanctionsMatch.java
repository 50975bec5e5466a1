package com.grantvet.vetting.sanctions;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A sanctions list entry matched by a candidate name. {@code similarity} is
 * only set for {@link MatchBasis#FUZZY} matches and lies in [0, 1].
 */
@Value
@Builder
@Jacksonized
public class SanctionsMatch {

    String entityNumber;
    String matchedName;
    String entityType;
    String program;
    MatchBasis basis;
    Double similarity;
}
