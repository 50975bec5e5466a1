package com.grantvet.vetting.lookup;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CourtRecordsResult {

    boolean found;
    int caseCount;
    @Builder.Default
    List<CourtCase> cases = List.of();

    public static CourtRecordsResult none() {
        return CourtRecordsResult.builder().found(false).caseCount(0).build();
    }
}
