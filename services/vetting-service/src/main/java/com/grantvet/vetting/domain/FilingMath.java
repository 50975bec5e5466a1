package com.grantvet.vetting.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;

/**
 * Derivations shared by profile builders: ratios, tenure and code normalization.
 * Every ratio returned here is either a finite number or null.
 */
public final class FilingMath {

    /** The IRS has not issued determinations before 1913. */
    private static final int EARLIEST_RULING_YEAR = 1913;

    private FilingMath() {
    }

    /**
     * Expenses divided by revenue; null when revenue is missing or not positive.
     */
    public static Double overheadRatio(BigDecimal revenue, BigDecimal expenses) {
        if (revenue == null || expenses == null || revenue.signum() <= 0) {
            return null;
        }
        return finiteOrNull(expenses.divide(revenue, MathContext.DECIMAL64).doubleValue());
    }

    /**
     * Officer compensation as a share of total expenses; null when expenses are not positive.
     */
    public static Double compensationRatio(BigDecimal officerCompensation, BigDecimal expenses) {
        if (officerCompensation == null || expenses == null || expenses.signum() <= 0) {
            return null;
        }
        return finiteOrNull(officerCompensation.divide(expenses, MathContext.DECIMAL64).doubleValue());
    }

    /**
     * Whole years between the ruling date and today; null for a missing or implausible date.
     */
    public static Integer yearsOperating(LocalDate rulingDate, Clock clock) {
        if (rulingDate == null) {
            return null;
        }
        LocalDate today = LocalDate.now(clock);
        if (rulingDate.getYear() < EARLIEST_RULING_YEAR || rulingDate.isAfter(today)) {
            return null;
        }
        return Period.between(rulingDate, today).getYears();
    }

    /**
     * Subsection codes are stored two digits wide ("3" becomes "03").
     */
    public static String normalizeSubsection(String subsection) {
        if (subsection == null) {
            return null;
        }
        String trimmed = subsection.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() == 1 ? "0" + trimmed : trimmed;
    }

    public static Double finiteOrNull(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }
}
