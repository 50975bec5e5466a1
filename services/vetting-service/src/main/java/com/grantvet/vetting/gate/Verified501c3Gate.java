package com.grantvet.vetting.gate;

import com.grantvet.common.exception.UpstreamUnavailableException;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.GateSubCheck;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.lookup.RevocationLookup;
import com.grantvet.vetting.lookup.RevocationStatus;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Gate 1: the organization is a 501(c)(3) public charity in good standing.
 * Requires subsection code 03, absence from the auto-revocation list and a
 * ruling date on record.
 */
@RequiredArgsConstructor
public class Verified501c3Gate implements EligibilityGate {

    public static final String NAME = "verified_501c3";
    static final String PUBLIC_CHARITY_SUBSECTION = "03";

    private final RevocationLookup revocationLookup;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(OrganizationProfile profile) {
        String subsection = profile.getSubsection();
        boolean isPublicCharity = PUBLIC_CHARITY_SUBSECTION.equals(subsection);
        GateSubCheck subsectionCheck = GateSubCheck.of("subsection_501c3", isPublicCharity, isPublicCharity
                ? "Subsection 03: 501(c)(3) public charity"
                : "Subsection is " + (subsection != null ? subsection : "missing") + ", not 03 (501(c)(3))");

        RevocationStatus status = revocationLookup.check(profile.getEin());
        if (status == null) {
            throw new UpstreamUnavailableException("revocation-list", "Revocation lookup returned no status")
                    .withMetadata("ein", profile.getEin());
        }
        GateSubCheck revocationCheck = GateSubCheck.of("not_revoked", !status.isRevoked(), status.isRevoked()
                ? (status.getDetail() != null ? status.getDetail() : "Tax-exempt status revoked")
                : "Not on the IRS auto-revocation list");

        boolean hasRulingDate = profile.getRulingDate() != null;
        GateSubCheck rulingCheck = GateSubCheck.of("ruling_date", hasRulingDate, hasRulingDate
                ? "IRS ruling date " + profile.getRulingDate()
                : "No IRS ruling date on record");

        List<GateSubCheck> subChecks = List.of(subsectionCheck, revocationCheck, rulingCheck);
        List<GateSubCheck> failed = subChecks.stream().filter(check -> !check.isPassed()).collect(Collectors.toList());
        if (failed.isEmpty()) {
            return GateResult.pass(NAME, "Verified 501(c)(3) in good standing since " + profile.getRulingDate(), subChecks);
        }
        return GateResult.fail(NAME, failed.stream().map(GateSubCheck::getDetail).collect(Collectors.joining("; ")),
                subChecks);
    }
}
