package com.grantvet.vetting.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScoredCheck {

    String name;
    CheckResult result;
    int weight;
    String detail;

    @JsonIgnore
    public double getPoints() {
        return weight * result.getPointsFactor();
    }

    @JsonIgnore
    public boolean isPassed() {
        return result == CheckResult.PASS;
    }
}
