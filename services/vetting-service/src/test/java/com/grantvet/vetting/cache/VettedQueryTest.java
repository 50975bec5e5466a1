package com.grantvet.vetting.cache;

import com.grantvet.vetting.VettingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VettedQuery and CachedVetting Tests")
class VettedQueryTest {

    @Test
    @DisplayName("Limit should default to 20 and clamp to [1, 100]")
    void shouldClampLimit() {
        assertThat(VettedQuery.all().effectiveLimit()).isEqualTo(20);
        assertThat(VettedQuery.builder().limit(0).build().effectiveLimit()).isEqualTo(1);
        assertThat(VettedQuery.builder().limit(-3).build().effectiveLimit()).isEqualTo(1);
        assertThat(VettedQuery.builder().limit(40).build().effectiveLimit()).isEqualTo(40);
        assertThat(VettedQuery.builder().limit(1000).build().effectiveLimit()).isEqualTo(100);
    }

    @Test
    @DisplayName("Cached run should be stale only once past the maximum age")
    void shouldDetectStaleEntries() {
        Instant now = VettingFixtures.CLOCK.instant();
        CachedVetting fresh = CachedVetting.builder().vettedAt(now.minus(Duration.ofDays(30))).build();
        CachedVetting stale = CachedVetting.builder().vettedAt(now.minus(Duration.ofDays(31))).build();

        assertThat(fresh.isOlderThan(Duration.ofDays(30), now)).isFalse();
        assertThat(stale.isOlderThan(Duration.ofDays(30), now)).isTrue();
        assertThat(CachedVetting.builder().build().isOlderThan(Duration.ofDays(30), now)).isTrue();
    }
}
