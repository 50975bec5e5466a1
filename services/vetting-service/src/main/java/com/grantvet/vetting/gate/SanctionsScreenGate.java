package com.grantvet.vetting.gate;

import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.GateSubCheck;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.sanctions.NameNormalizer;
import com.grantvet.vetting.sanctions.SanctionsMatch;
import com.grantvet.vetting.sanctions.SanctionsScreener;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Gate 2: no exact (normalized) match of the legal name against the sanctions list.
 * Any match fails the gate whatever its entity type; near matches are left to red flags.
 * A profile without a screenable name fails rather than passing unchecked.
 */
@RequiredArgsConstructor
public class SanctionsScreenGate implements EligibilityGate {

    public static final String NAME = "ofac_sanctions";

    private final SanctionsScreener screener;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult evaluate(OrganizationProfile profile) {
        if (NameNormalizer.normalize(profile.getName()).isEmpty()) {
            String detail = "No legal name to screen";
            return GateResult.fail(NAME, detail, List.of(GateSubCheck.of("exact_name_match", false, detail)));
        }
        List<SanctionsMatch> matches = screener.exactLookup(profile.getName());
        if (matches.isEmpty()) {
            String detail = "No exact match on the OFAC SDN list";
            return GateResult.pass(NAME, detail, List.of(GateSubCheck.of("exact_name_match", true, detail)));
        }
        String detail = "Exact match on the OFAC SDN list: " + matches.stream()
                .map(SanctionsScreenGate::describe)
                .collect(Collectors.joining("; "));
        return GateResult.fail(NAME, detail, List.of(GateSubCheck.of("exact_name_match", false, detail)));
    }

    private static String describe(SanctionsMatch match) {
        StringBuilder text = new StringBuilder(match.getMatchedName())
                .append(" (entity #").append(match.getEntityNumber());
        if (match.getProgram() != null && !match.getProgram().isBlank()) {
            text.append(", program ").append(match.getProgram());
        }
        if (match.getEntityType() != null && !match.getEntityType().isBlank()) {
            text.append(", ").append(match.getEntityType());
        }
        return text.append(')').toString();
    }
}
