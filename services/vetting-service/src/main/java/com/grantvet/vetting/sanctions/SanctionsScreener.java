package com.grantvet.vetting.sanctions;

import java.util.List;

/**
 * Name screening contract consumed by the gate and red-flag stages.
 */
public interface SanctionsScreener {

    /**
     * Entries whose normalized primary name or alias equals the normalized candidate.
     */
    List<SanctionsMatch> exactLookup(String name);

    /**
     * Entity-type entries whose similarity to the candidate is at least {@code threshold},
     * highest similarity first.
     *
     * @throws com.grantvet.common.exception.InvalidArgumentException if threshold is outside [0, 1]
     */
    List<SanctionsMatch> fuzzyLookup(String name, double threshold);
}
