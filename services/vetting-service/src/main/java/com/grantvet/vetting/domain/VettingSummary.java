package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Human-readable verdict. Key factors are prefixed "+" (positive),
 * "~" (neutral) or "-" (negative).
 */
@Value
@Builder
@Jacksonized
public class VettingSummary {

    String headline;
    String justification;
    List<String> keyFactors;
    List<String> nextSteps;
}
