package com.grantvet.vetting.pipeline;

/**
 * Stage at which a vetting invocation terminated.
 */
public enum PipelineStage {
    /** Answered from the result cache without evaluation. */
    CACHE_CHECK,
    /** Evaluated; no cache configured or input rejected before persistence. */
    EVALUATED,
    /** Evaluated and handed to the result cache (the write itself is best-effort). */
    PERSISTED
}
