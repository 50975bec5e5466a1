package com.grantvet.vetting.domain;

public enum Recommendation {
    PASS,
    REVIEW,
    REJECT
}
