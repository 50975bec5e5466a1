package com.grantvet.vetting.sanctions;

import java.util.List;

/**
 * Supplies the current sanctions list snapshot. Loading and refreshing the
 * underlying government list is the implementor's responsibility.
 */
@FunctionalInterface
public interface SanctionsListSource {

    /**
     * @throws com.grantvet.common.exception.UpstreamUnavailableException if the list cannot be read
     */
    List<SanctionsEntry> entries();
}
