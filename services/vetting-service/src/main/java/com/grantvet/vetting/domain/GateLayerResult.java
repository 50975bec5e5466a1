package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * All gate outcomes of a run. {@code blockingGate} names the first gate, in
 * evaluation order, that failed; it is null when every gate passed.
 */
@Value
@Builder
@Jacksonized
public class GateLayerResult {

    boolean allPassed;
    List<GateResult> gates;
    String blockingGate;

    public static GateLayerResult of(List<GateResult> gates) {
        String blocking = gates.stream()
                .filter(gate -> !gate.isPassed())
                .map(GateResult::getGate)
                .findFirst()
                .orElse(null);
        return new GateLayerResult(blocking == null, List.copyOf(gates), blocking);
    }
}
