package com.grantvet.vetting.scoring;

import com.grantvet.vetting.config.VettingThresholds;
import com.grantvet.vetting.domain.CheckResult;
import com.grantvet.vetting.domain.LatestFilingSummary;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.domain.ScoredCheck;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Locale;

/**
 * Weighted financial and operational checks, run only for organizations that
 * cleared every gate.
 *
 * A missing operating ratio scores REVIEW rather than FAIL: missing data is not
 * evidence of a problem. Missing tenure, revenue or filing data all score FAIL.
 */
@RequiredArgsConstructor
public class ScoringEngine {

    public static final String YEARS_OPERATING = "years_operating";
    public static final String REVENUE_RANGE = "revenue_range";
    public static final String OPERATING_RATIO = "operating_ratio";
    public static final String FILING_RECENCY = "filing_recency";

    private final VettingThresholds thresholds;
    private final Clock clock;

    public ScoringOutcome score(OrganizationProfile profile) {
        List<ScoredCheck> checks = List.of(
                checkTenure(profile.getYearsOperating()),
                checkRevenue(profile.getLatestFiling()),
                checkOperatingRatio(profile.getLatestFiling()),
                checkRecency(profile.getLatestFiling()));

        double points = checks.stream().mapToDouble(ScoredCheck::getPoints).sum();
        int score = (int) Math.max(0, Math.min(100, Math.round(points)));
        return new ScoringOutcome(score, checks);
    }

    ScoredCheck checkTenure(Integer yearsOperating) {
        int weight = thresholds.getTenureWeight();
        if (yearsOperating == null) {
            return check(YEARS_OPERATING, CheckResult.FAIL, weight, "No IRS ruling date on record");
        }
        String detail = yearsOperating + " year" + (yearsOperating == 1 ? "" : "s") + " operating";
        if (yearsOperating >= thresholds.getTenurePassYears()) {
            return check(YEARS_OPERATING, CheckResult.PASS, weight, detail);
        }
        if (yearsOperating >= thresholds.getTenureReviewYears()) {
            return check(YEARS_OPERATING, CheckResult.REVIEW, weight,
                    detail + " (under " + thresholds.getTenurePassYears() + ")");
        }
        return check(YEARS_OPERATING, CheckResult.FAIL, weight,
                detail + " (under " + thresholds.getTenureReviewYears() + ")");
    }

    ScoredCheck checkRevenue(LatestFilingSummary filing) {
        int weight = thresholds.getRevenueWeight();
        BigDecimal revenue = filing != null ? filing.getTotalRevenue() : null;
        if (revenue == null) {
            return check(REVENUE_RANGE, CheckResult.FAIL, weight, "No revenue data on record");
        }
        String amount = money(revenue);
        if (revenue.signum() <= 0) {
            return check(REVENUE_RANGE, CheckResult.FAIL, weight, "Reported revenue is " + amount);
        }
        if (revenue.compareTo(thresholds.getRevenueFloor()) < 0) {
            return check(REVENUE_RANGE, CheckResult.FAIL, weight,
                    amount + " revenue is below the " + money(thresholds.getRevenueFloor()) + " floor");
        }
        if (revenue.compareTo(thresholds.getRevenuePassMin()) < 0) {
            return check(REVENUE_RANGE, CheckResult.REVIEW, weight,
                    amount + " revenue is below " + money(thresholds.getRevenuePassMin()));
        }
        if (revenue.compareTo(thresholds.getRevenuePassMax()) <= 0) {
            return check(REVENUE_RANGE, CheckResult.PASS, weight, amount + " revenue");
        }
        if (revenue.compareTo(thresholds.getRevenueReviewMax()) <= 0) {
            return check(REVENUE_RANGE, CheckResult.REVIEW, weight,
                    amount + " revenue exceeds " + money(thresholds.getRevenuePassMax()));
        }
        return check(REVENUE_RANGE, CheckResult.FAIL, weight,
                amount + " revenue exceeds " + money(thresholds.getRevenueReviewMax()));
    }

    ScoredCheck checkOperatingRatio(LatestFilingSummary filing) {
        int weight = thresholds.getOperatingRatioWeight();
        Double ratio = filing != null ? filing.getOverheadRatio() : null;
        if (ratio == null) {
            return check(OPERATING_RATIO, CheckResult.REVIEW, weight, "Insufficient data to compute expense ratio");
        }
        String detail = String.format(Locale.US, "Expense-to-revenue ratio %.2f", ratio);
        if (ratio < 0) {
            return check(OPERATING_RATIO, CheckResult.FAIL, weight, detail + " is negative");
        }
        if (ratio >= thresholds.getRatioPassMin() && ratio <= thresholds.getRatioPassMax()) {
            return check(OPERATING_RATIO, CheckResult.PASS, weight, detail);
        }
        if (ratio > thresholds.getRatioPassMax()) {
            return ratio <= thresholds.getRatioReviewHigh()
                    ? check(OPERATING_RATIO, CheckResult.REVIEW, weight, detail + ": spending exceeds revenue")
                    : check(OPERATING_RATIO, CheckResult.FAIL, weight, detail + ": unsustainable spending");
        }
        return ratio >= thresholds.getRatioReviewLow()
                ? check(OPERATING_RATIO, CheckResult.REVIEW, weight, detail + ": low fund deployment")
                : check(OPERATING_RATIO, CheckResult.FAIL, weight, detail + ": very low fund deployment");
    }

    ScoredCheck checkRecency(LatestFilingSummary filing) {
        int weight = thresholds.getRecencyWeight();
        Integer taxYear = filing != null ? filing.getTaxYear() : null;
        if (taxYear == null) {
            return check(FILING_RECENCY, CheckResult.FAIL, weight, "No filing on record");
        }
        int age = Math.max(0, Year.now(clock).getValue() - taxYear);
        String detail = "Latest filing is for tax year " + taxYear + " (" + age + " year" + (age == 1 ? "" : "s") + " old)";
        if (age <= thresholds.getRecencyPassYears()) {
            return check(FILING_RECENCY, CheckResult.PASS, weight, detail);
        }
        if (age <= thresholds.getRecencyReviewYears()) {
            return check(FILING_RECENCY, CheckResult.REVIEW, weight, detail);
        }
        return check(FILING_RECENCY, CheckResult.FAIL, weight, detail);
    }

    private static ScoredCheck check(String name, CheckResult result, int weight, String detail) {
        return ScoredCheck.builder().name(name).result(result).weight(weight).detail(detail).build();
    }

    static String money(BigDecimal amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }
}
