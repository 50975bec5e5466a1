package com.grantvet.vetting.cache;

import com.grantvet.vetting.domain.Recommendation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for browsing stored runs. Both filters are optional; the limit is
 * clamped to [1, 100].
 */
@Value
@Builder
public class VettedQuery {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    Recommendation recommendation;
    Instant since;
    Integer limit;

    public static VettedQuery all() {
        return VettedQuery.builder().build();
    }

    public int effectiveLimit() {
        int requested = limit != null ? limit : DEFAULT_LIMIT;
        return Math.max(1, Math.min(requested, MAX_LIMIT));
    }
}
