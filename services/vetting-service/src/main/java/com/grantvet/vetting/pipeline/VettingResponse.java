package com.grantvet.vetting.pipeline;

import com.grantvet.common.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a pipeline call. {@code success=false} means the organization
 * could not be evaluated, which is distinct from a successful REJECT.
 */
@Value
@Builder
public class VettingResponse<T> {

    boolean success;
    T data;
    ErrorCode errorCode;
    String error;
    boolean cached;
    String cachedNote;
    PipelineStage stage;

    public static <T> VettingResponse<T> success(T data, PipelineStage stage) {
        return VettingResponse.<T>builder()
                .success(true)
                .data(data)
                .stage(stage)
                .build();
    }

    public static <T> VettingResponse<T> fromCache(T data, String cachedNote) {
        return VettingResponse.<T>builder()
                .success(true)
                .data(data)
                .cached(true)
                .cachedNote(cachedNote)
                .stage(PipelineStage.CACHE_CHECK)
                .build();
    }

    public static <T> VettingResponse<T> error(ErrorCode errorCode, String message) {
        return VettingResponse.<T>builder()
                .success(false)
                .errorCode(errorCode)
                .error(message != null ? message : errorCode.getDefaultMessage())
                .stage(PipelineStage.EVALUATED)
                .build();
    }
}
