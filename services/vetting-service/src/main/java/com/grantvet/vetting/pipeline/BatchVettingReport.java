package com.grantvet.vetting.pipeline;

import com.grantvet.vetting.domain.VettingResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-identifier outcomes of a batch, in request order, with aggregate counts.
 */
@Value
@Builder
public class BatchVettingReport {

    int total;
    List<Entry> results;
    Stats stats;

    @Value
    public static class Entry {
        String ein;
        VettingResponse<VettingResult> response;
    }

    @Value
    @Builder
    public static class Stats {
        int pass;
        int review;
        int reject;
        int error;
        int cached;
    }
}
