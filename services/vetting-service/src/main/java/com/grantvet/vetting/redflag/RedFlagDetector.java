package com.grantvet.vetting.redflag;

import com.grantvet.common.exception.UpstreamUnavailableException;
import com.grantvet.vetting.config.VettingThresholds;
import com.grantvet.vetting.domain.CourtCaseSummary;
import com.grantvet.vetting.domain.FilingRecord;
import com.grantvet.vetting.domain.LatestFilingSummary;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.domain.RedFlag;
import com.grantvet.vetting.domain.RedFlagSeverity;
import com.grantvet.vetting.domain.RedFlagType;
import com.grantvet.vetting.lookup.CourtCase;
import com.grantvet.vetting.lookup.CourtRecordsLookup;
import com.grantvet.vetting.lookup.CourtRecordsResult;
import com.grantvet.vetting.sanctions.SanctionsMatch;
import com.grantvet.vetting.sanctions.SanctionsScreener;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Advisory findings attached to every vetting result, whatever the gate and
 * score outcome. Every rule is evaluated; none short-circuits another.
 *
 * The court records lookup is optional: when it is absent or failing the rule
 * is skipped. The sanctions screener is mandatory and its failures propagate.
 */
@Slf4j
public class RedFlagDetector {

    private static final double DAYS_PER_YEAR = 365.25;
    private static final int MAX_NEAR_MATCHES_IN_DETAIL = 3;

    private final VettingThresholds thresholds;
    private final Clock clock;
    private final SanctionsScreener screener;
    private final CourtRecordsLookup courtRecords;
    private final CourtNameResolver courtNames;

    public RedFlagDetector(VettingThresholds thresholds, Clock clock, SanctionsScreener screener,
                           CourtRecordsLookup courtRecords, CourtNameResolver courtNames) {
        this.thresholds = thresholds;
        this.clock = clock;
        this.screener = screener;
        this.courtRecords = courtRecords;
        this.courtNames = courtNames;
    }

    public List<RedFlag> detect(OrganizationProfile profile, List<FilingRecord> filings) {
        List<RedFlag> flags = new ArrayList<>();
        checkTooNew(profile, flags);

        LatestFilingSummary latest = profile.getLatestFiling();
        if (latest != null) {
            checkStaleFiling(latest, flags);
            checkOperatingRatio(latest, flags);
            checkVeryLowRevenue(latest, flags);
            checkOfficerCompensation(latest, flags);
        }
        checkRevenueDecline(filings, flags);
        checkCourtRecords(profile, flags);
        checkSanctionsNearMatch(profile, flags);
        return List.copyOf(flags);
    }

    void checkTooNew(OrganizationProfile profile, List<RedFlag> flags) {
        Integer years = profile.getYearsOperating();
        if (years != null && years < thresholds.getTooNewYears()) {
            int floor = thresholds.getTooNewYears();
            flags.add(RedFlag.medium(RedFlagType.TOO_NEW,
                    "Organization is less than " + floor + " year" + (floor == 1 ? "" : "s") + " old"));
        }
    }

    void checkStaleFiling(LatestFilingSummary latest, List<RedFlag> flags) {
        if (latest.getTaxPeriod() == null) {
            return;
        }
        LocalDate periodStart = latest.getTaxPeriod().atDay(1);
        double yearsAgo = ChronoUnit.DAYS.between(periodStart, LocalDate.now(clock)) / DAYS_PER_YEAR;
        if (yearsAgo > thresholds.getStaleFilingYears()) {
            flags.add(RedFlag.high(RedFlagType.STALE_FILING, String.format(Locale.US,
                    "Most recent filing is for tax period %s (%.1f years old)", latest.getTaxPeriod(), yearsAgo)));
        }
    }

    void checkOperatingRatio(LatestFilingSummary latest, List<RedFlag> flags) {
        Double ratio = latest.getOverheadRatio();
        if (ratio == null) {
            return;
        }
        if (ratio > thresholds.getExcessiveOverheadRatio()) {
            flags.add(RedFlag.high(RedFlagType.EXCESSIVE_OVERHEAD,
                    "Expense-to-revenue ratio is " + percent(ratio) + ": spending far exceeds income"));
        } else if (ratio < thresholds.getLowFundDeploymentRatio()) {
            flags.add(RedFlag.medium(RedFlagType.LOW_FUND_DEPLOYMENT,
                    "Expense-to-revenue ratio is only " + percent(ratio) + ": low fund deployment"));
        }
    }

    void checkVeryLowRevenue(LatestFilingSummary latest, List<RedFlag> flags) {
        BigDecimal revenue = latest.getTotalRevenue();
        if (revenue != null && revenue.compareTo(thresholds.getVeryLowRevenue()) < 0) {
            flags.add(RedFlag.medium(RedFlagType.VERY_LOW_REVENUE,
                    "Revenue is only " + compact(revenue) + ": very small operation"));
        }
    }

    void checkOfficerCompensation(LatestFilingSummary latest, List<RedFlag> flags) {
        Double ratio = latest.getOfficerCompensationRatio();
        if (ratio == null || ratio <= 0) {
            return;
        }
        if (ratio > thresholds.getCompensationHigh()) {
            flags.add(RedFlag.high(RedFlagType.HIGH_OFFICER_COMPENSATION,
                    "Officer/director compensation is " + percent(ratio) + " of total expenses, above the "
                            + percent(thresholds.getCompensationHigh()) + " threshold"));
        } else if (ratio > thresholds.getCompensationModerate()) {
            flags.add(RedFlag.medium(RedFlagType.HIGH_OFFICER_COMPENSATION,
                    "Officer/director compensation is " + percent(ratio) + " of total expenses (elevated)"));
        }
    }

    /**
     * Compares the two most recent filings. Filings further apart than the
     * configured gap may reflect a lapse rather than a decline and are skipped.
     */
    void checkRevenueDecline(List<FilingRecord> filings, List<RedFlag> flags) {
        if (filings == null || filings.size() < 2) {
            return;
        }
        List<FilingRecord> sorted = filings.stream()
                .filter(Objects::nonNull)
                .filter(filing -> filing.getTaxPeriod() != null)
                .sorted(Comparator.comparing(FilingRecord::getTaxPeriod).reversed())
                .collect(Collectors.toList());
        if (sorted.size() < 2) {
            return;
        }
        FilingRecord latest = sorted.get(0);
        FilingRecord previous = sorted.get(1);

        long gapMonths = ChronoUnit.MONTHS.between(previous.getTaxPeriod(), latest.getTaxPeriod());
        BigDecimal latestRevenue = latest.getTotalRevenue();
        BigDecimal previousRevenue = previous.getTotalRevenue();
        if (gapMonths > thresholds.getRevenueDeclineMaxGapMonths()
                || latestRevenue == null || previousRevenue == null
                || previousRevenue.signum() <= 0 || latestRevenue.signum() < 0) {
            return;
        }
        double decline = previousRevenue.subtract(latestRevenue)
                .divide(previousRevenue, MathContext.DECIMAL64)
                .doubleValue();
        if (decline > thresholds.getRevenueDeclinePct()) {
            flags.add(RedFlag.medium(RedFlagType.REVENUE_DECLINE, "Revenue declined " + percent(decline)
                    + " year-over-year (" + compact(previousRevenue) + " to " + compact(latestRevenue) + ")"));
        }
    }

    void checkCourtRecords(OrganizationProfile profile, List<RedFlag> flags) {
        if (courtRecords == null || profile.getName() == null || profile.getName().isBlank()) {
            return;
        }
        CourtRecordsResult result;
        try {
            result = courtRecords.check(profile.getName());
        } catch (UpstreamUnavailableException e) {
            log.warn("Court records unavailable for EIN {}, skipping court records check: {}",
                    profile.getEin(), e.getUserMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("Court records lookup failed for EIN {}, skipping court records check", profile.getEin(), e);
            return;
        }
        if (result == null || !result.isFound() || result.getCaseCount() <= 0) {
            return;
        }
        // a positive count may arrive without the case list
        List<CourtCase> reported = result.getCases() == null ? List.of() : result.getCases();
        List<CourtCaseSummary> cases = reported.stream()
                .filter(Objects::nonNull)
                .map(this::summarize)
                .collect(Collectors.toList());
        flags.add(RedFlag.builder()
                .severity(RedFlagSeverity.HIGH)
                .type(RedFlagType.COURT_RECORDS)
                .detail(result.getCaseCount() + " federal court case(s) on record")
                .cases(List.copyOf(cases))
                .build());
    }

    void checkSanctionsNearMatch(OrganizationProfile profile, List<RedFlag> flags) {
        List<SanctionsMatch> matches = screener.fuzzyLookup(profile.getName(), thresholds.getNearMatchThreshold());
        if (matches.isEmpty()) {
            return;
        }
        double best = matches.get(0).getSimilarity();
        RedFlagSeverity severity = best >= thresholds.getNearMatchHighSimilarity()
                ? RedFlagSeverity.HIGH : RedFlagSeverity.MEDIUM;
        String listed = matches.stream()
                .limit(MAX_NEAR_MATCHES_IN_DETAIL)
                .map(match -> String.format(Locale.US, "%s (%.1f%%, entity #%s)",
                        match.getMatchedName(), match.getSimilarity() * 100, match.getEntityNumber()))
                .collect(Collectors.joining(", "));
        String more = matches.size() > MAX_NEAR_MATCHES_IN_DETAIL
                ? " and " + (matches.size() - MAX_NEAR_MATCHES_IN_DETAIL) + " more" : "";
        flags.add(RedFlag.builder()
                .severity(severity)
                .type(RedFlagType.SANCTIONS_NEAR_MATCH)
                .detail("Name resembles sanctions list entries: " + listed + more + "; manual review required")
                .build());
    }

    private CourtCaseSummary summarize(CourtCase courtCase) {
        return CourtCaseSummary.builder()
                .dateFiled(courtCase.getDateFiled())
                .court(courtNames.resolve(courtCase.getCourtCode()))
                .url(courtCase.getUrl())
                .build();
    }

    static String percent(double ratio) {
        return String.format(Locale.US, "%.1f%%", ratio * 100);
    }

    static String compact(BigDecimal amount) {
        double value = amount.doubleValue();
        double abs = Math.abs(value);
        String sign = value < 0 ? "-" : "";
        if (abs >= 1_000_000) {
            return String.format(Locale.US, "%s$%.1fM", sign, abs / 1_000_000);
        }
        if (abs >= 1_000) {
            return String.format(Locale.US, "%s$%.0fK", sign, abs / 1_000);
        }
        return String.format(Locale.US, "%s$%.0f", sign, abs);
    }
}
