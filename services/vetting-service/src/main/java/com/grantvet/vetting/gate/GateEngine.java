package com.grantvet.vetting.gate;

import com.grantvet.vetting.config.PortfolioFitPolicy;
import com.grantvet.vetting.domain.GateLayerResult;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.lookup.RevocationLookup;
import com.grantvet.vetting.sanctions.SanctionsScreener;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the eligibility gates in fixed order. Every gate runs even after an
 * earlier one has failed, so a rejected organization keeps its full gate trace;
 * only the blocking gate reported downstream stops at the first failure.
 *
 * Failures of mandatory collaborators (revocation list, sanctions list)
 * propagate instead of being read as a pass.
 */
@Slf4j
public class GateEngine {

    private final List<EligibilityGate> gates;

    public GateEngine(RevocationLookup revocationLookup, SanctionsScreener screener, PortfolioFitPolicy policy) {
        this(List.of(
                new Verified501c3Gate(revocationLookup),
                new SanctionsScreenGate(screener),
                new FilingExistsGate(),
                new PortfolioFitGate(policy)));
    }

    GateEngine(List<EligibilityGate> gates) {
        this.gates = List.copyOf(gates);
    }

    public GateLayerResult evaluate(OrganizationProfile profile) {
        List<GateResult> results = new ArrayList<>(gates.size());
        for (EligibilityGate gate : gates) {
            results.add(gate.evaluate(profile));
        }
        GateLayerResult layer = GateLayerResult.of(results);
        if (!layer.isAllPassed()) {
            log.debug("EIN {} blocked at gate {}", profile.getEin(), layer.getBlockingGate());
        }
        return layer;
    }

    public List<String> gateNames() {
        return gates.stream().map(EligibilityGate::name).collect(Collectors.toList());
    }
}
