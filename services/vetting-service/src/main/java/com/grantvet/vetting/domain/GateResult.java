package com.grantvet.vetting.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of one eligibility gate, with its sub-checks in evaluation order.
 */
@Value
@Builder
@Jacksonized
public class GateResult {

    String gate;
    GateVerdict verdict;
    String detail;
    @Builder.Default
    List<GateSubCheck> subChecks = List.of();

    @JsonIgnore
    public boolean isPassed() {
        return verdict == GateVerdict.PASS;
    }

    public static GateResult pass(String gate, String detail, List<GateSubCheck> subChecks) {
        return new GateResult(gate, GateVerdict.PASS, detail, List.copyOf(subChecks));
    }

    public static GateResult fail(String gate, String detail, List<GateSubCheck> subChecks) {
        return new GateResult(gate, GateVerdict.FAIL, detail, List.copyOf(subChecks));
    }
}
