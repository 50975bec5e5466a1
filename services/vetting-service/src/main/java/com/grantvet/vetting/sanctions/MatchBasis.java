package com.grantvet.vetting.sanctions;

/**
 * How a candidate name was matched against a sanctions entry.
 */
public enum MatchBasis {
    /** Normalized candidate equals the normalized primary name. */
    EXACT,
    /** Normalized candidate equals a normalized alias. */
    ALIAS,
    /** Similarity-scored approximate match. */
    FUZZY
}
