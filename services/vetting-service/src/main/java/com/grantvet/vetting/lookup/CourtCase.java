package com.grantvet.vetting.lookup;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A docket as reported by the court records service; {@code courtCode} is the
 * short federal court identifier (e.g. "nysd").
 */
@Value
@Builder
public class CourtCase {

    LocalDate dateFiled;
    String courtCode;
    String url;
}
