package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CourtCaseSummary {

    LocalDate dateFiled;
    String court;
    String url;
}
