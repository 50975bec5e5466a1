package com.grantvet.vetting.cache;

import com.grantvet.vetting.domain.VettingResult;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class CachedVetting {

    VettingResult result;
    Instant vettedAt;
    String vettedBy;

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return vettedAt == null || vettedAt.plus(maxAge).isBefore(now);
    }
}
