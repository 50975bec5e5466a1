package com.grantvet.vetting.cache;

import lombok.Value;

/**
 * Counts over every stored run, superseded ones included.
 */
@Value
public class VettingStats {

    long total;
    long pass;
    long review;
    long reject;
}
