package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named sub-check recorded inside a gate for auditability.
 */
@Value
@Builder
@Jacksonized
public class GateSubCheck {

    String label;
    boolean passed;
    String detail;

    public static GateSubCheck of(String label, boolean passed, String detail) {
        return new GateSubCheck(label, passed, detail);
    }
}
