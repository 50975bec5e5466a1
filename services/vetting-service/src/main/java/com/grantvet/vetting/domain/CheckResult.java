package com.grantvet.vetting.domain;

/**
 * Categorical result of a weighted check and the share of its weight it earns.
 */
public enum CheckResult {
    PASS(1.0),
    REVIEW(0.5),
    FAIL(0.0);

    private final double pointsFactor;

    CheckResult(double pointsFactor) {
        this.pointsFactor = pointsFactor;
    }

    public double getPointsFactor() {
        return pointsFactor;
    }
}
