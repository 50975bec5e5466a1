package com.grantvet.vetting.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class PipelineSettings {

    @Builder.Default
    Duration cacheMaxAge = Duration.ofDays(30);
    @Builder.Default
    String defaultAttribution = "vetting-pipeline";
    @Builder.Default
    int batchMaxSize = 25;

    public static PipelineSettings defaults() {
        return builder().build();
    }
}
