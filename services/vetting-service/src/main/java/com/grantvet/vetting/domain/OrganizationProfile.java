package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Immutable snapshot of an organization used for a single vetting run.
 *
 * The subsection code is always held two digits wide; {@code yearsOperating}
 * is null when no ruling date is on record and {@code latestFiling} is null
 * when no filing has been summarized.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OrganizationProfile {

    String ein;
    String name;
    String city;
    String state;
    String subsection;
    String nteeCode;
    LocalDate rulingDate;
    Integer yearsOperating;
    LatestFilingSummary latestFiling;
    int filingCount;

    public boolean hasFilingOnRecord() {
        return latestFiling != null || filingCount > 0;
    }

    public static class OrganizationProfileBuilder {

        public OrganizationProfileBuilder subsection(String subsection) {
            this.subsection = FilingMath.normalizeSubsection(subsection);
            return this;
        }
    }
}
