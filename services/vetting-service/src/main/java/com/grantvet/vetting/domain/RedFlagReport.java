package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RedFlagReport {

    String ein;
    String name;
    List<RedFlag> flags;
    boolean clean;
}
