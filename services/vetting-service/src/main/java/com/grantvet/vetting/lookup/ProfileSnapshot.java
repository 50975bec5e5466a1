package com.grantvet.vetting.lookup;

import com.grantvet.vetting.domain.FilingRecord;
import com.grantvet.vetting.domain.OrganizationProfile;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Organization profile together with its filing history, in any order.
 */
@Value
@Builder
public class ProfileSnapshot {

    OrganizationProfile profile;
    @Builder.Default
    List<FilingRecord> filings = List.of();

    public static ProfileSnapshot of(OrganizationProfile profile, List<FilingRecord> filings) {
        return new ProfileSnapshot(profile, filings == null ? List.of() : List.copyOf(filings));
    }
}
