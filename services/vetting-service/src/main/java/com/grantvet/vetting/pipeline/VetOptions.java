package com.grantvet.vetting.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VetOptions {

    boolean forceRefresh;

    /**
     * Who or what requested the run; recorded with the stored result.
     */
    String requestedBy;

    public static VetOptions defaults() {
        return VetOptions.builder().build();
    }

    public static VetOptions forceRefresh() {
        return VetOptions.builder().forceRefresh(true).build();
    }
}
