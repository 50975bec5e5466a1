package com.grantvet.vetting.domain;

public enum RedFlagSeverity {
    HIGH,
    MEDIUM
}
