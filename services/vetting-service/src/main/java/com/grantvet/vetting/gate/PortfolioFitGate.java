package com.grantvet.vetting.gate;

import com.grantvet.vetting.config.PortfolioFitPolicy;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.GateSubCheck;
import com.grantvet.vetting.domain.OrganizationProfile;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Gate 4: the organization falls inside the platform's funding portfolio.
 *
 * The exclusion list is consulted first and wins over everything else, the
 * inclusion list bypasses the category check, and otherwise the NTEE code must
 * start with one of the allowed prefixes. A disabled policy passes but still
 * records what it would have decided.
 */
@RequiredArgsConstructor
public class PortfolioFitGate implements EligibilityGate {

    public static final String NAME = "portfolio_fit";

    private final PortfolioFitPolicy policy;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(OrganizationProfile profile) {
        boolean excluded = policy.isExcluded(profile.getEin());
        boolean included = policy.isIncluded(profile.getEin());
        String prefix = policy.matchingPrefix(profile.getNteeCode());
        String ntee = profile.getNteeCode() == null || profile.getNteeCode().isBlank() ? null : profile.getNteeCode();

        List<GateSubCheck> subChecks = List.of(
                GateSubCheck.of("not_excluded", !excluded, excluded
                        ? "EIN is on the platform exclusion list" : "Not on the exclusion list"),
                GateSubCheck.of("explicitly_included", included, included
                        ? "EIN is on the platform inclusion list" : "Not on the inclusion list"),
                GateSubCheck.of("ntee_category", prefix != null, nteeDetail(ntee, prefix)));

        if (!policy.isEnabled()) {
            return GateResult.pass(NAME, "Portfolio fit check disabled", subChecks);
        }
        if (excluded) {
            return GateResult.fail(NAME, "EIN is on the platform exclusion list", subChecks);
        }
        if (included) {
            return GateResult.pass(NAME, "EIN is on the platform inclusion list", subChecks);
        }
        if (prefix != null) {
            return GateResult.pass(NAME, nteeDetail(ntee, prefix), subChecks);
        }
        return GateResult.fail(NAME, nteeDetail(ntee, null), subChecks);
    }

    private static String nteeDetail(String ntee, String prefix) {
        if (ntee == null) {
            return "No NTEE category on record";
        }
        return prefix != null
                ? "NTEE " + ntee + " is in allowed category " + prefix
                : "NTEE " + ntee + " is outside the allowed categories";
    }
}
