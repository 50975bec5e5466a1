package com.grantvet.vetting.gate;

import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.GateSubCheck;
import com.grantvet.vetting.domain.LatestFilingSummary;
import com.grantvet.vetting.domain.OrganizationProfile;

import java.util.List;

/**
 * Gate 3: at least one tax filing is on record.
 */
public class FilingExistsGate implements EligibilityGate {

    public static final String NAME = "filing_exists";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(OrganizationProfile profile) {
        if (!profile.hasFilingOnRecord()) {
            String detail = "No Form 990 filings on record";
            return GateResult.fail(NAME, detail, List.of(GateSubCheck.of("filing_on_record", false, detail)));
        }
        LatestFilingSummary latest = profile.getLatestFiling();
        String detail;
        if (latest != null && latest.getTaxPeriod() != null) {
            detail = "Latest filing: " + (latest.getFormType() != null ? latest.getFormType() : "Form 990")
                    + " for tax period " + latest.getTaxPeriod();
        } else {
            detail = profile.getFilingCount() + " filing(s) on record";
        }
        return GateResult.pass(NAME, detail, List.of(GateSubCheck.of("filing_on_record", true, detail)));
    }
}
