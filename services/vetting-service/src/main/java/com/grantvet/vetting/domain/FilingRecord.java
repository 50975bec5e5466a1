package com.grantvet.vetting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One entry of an organization's filing history.
 */
@Value
@Builder
@Jacksonized
public class FilingRecord {

    YearMonth taxPeriod;
    String formType;
    BigDecimal totalRevenue;
    BigDecimal totalExpenses;
}
