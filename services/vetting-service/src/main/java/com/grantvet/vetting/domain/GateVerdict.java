package com.grantvet.vetting.domain;

public enum GateVerdict {
    PASS,
    FAIL
}
