package com.grantvet.vetting.cache;

import com.grantvet.vetting.domain.VettingResult;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of vetting results keyed by EIN. A later save for the
 * same EIN supersedes, never mutates, the earlier one.
 */
public interface ResultCache {

    /**
     * Most recent stored result for the EIN: newest vetted-at, highest id on ties.
     */
    Optional<CachedVetting> getLatest(String ein);

    void save(VettingResult result, String attribution);

    /**
     * Stored runs newest first, filtered by the query.
     */
    List<CachedVetting> listVetted(VettedQuery query);

    VettingStats stats();
}
