package com.grantvet.vetting.pipeline;

import com.grantvet.vetting.config.VettingThresholds;
import com.grantvet.vetting.domain.CheckResult;
import com.grantvet.vetting.domain.GateLayerResult;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.Recommendation;
import com.grantvet.vetting.domain.RedFlag;
import com.grantvet.vetting.domain.ScoredCheck;
import com.grantvet.vetting.domain.VettingSummary;
import com.grantvet.vetting.gate.FilingExistsGate;
import com.grantvet.vetting.gate.PortfolioFitGate;
import com.grantvet.vetting.gate.SanctionsScreenGate;
import com.grantvet.vetting.gate.Verified501c3Gate;
import com.grantvet.vetting.scoring.ScoringEngine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the human-readable part of a verdict: headline, justification, signed
 * key factors ("+" positive, "~" neutral, "-" negative) and next steps.
 */
public class SummaryGenerator {

    private static final int MAX_ISSUES_IN_JUSTIFICATION = 3;

    private static final List<String> REJECT_NEXT_STEPS = List.of(
            "Do not proceed with funding consideration",
            "Document rejection reason for records",
            "Consider alternative organizations in this space");

    private static final Map<String, String> GATE_LABELS = Map.of(
            Verified501c3Gate.NAME, "501(c)(3) verification",
            SanctionsScreenGate.NAME, "OFAC sanctions check",
            FilingExistsGate.NAME, "990 filing requirement",
            PortfolioFitGate.NAME, "portfolio fit policy");

    private final Map<String, Map<CheckResult, String>> checkFactors;

    public SummaryGenerator(VettingThresholds thresholds) {
        this.checkFactors = Map.of(
                ScoringEngine.YEARS_OPERATING, factors(
                        "+ Established track record (" + thresholds.getTenurePassYears() + "+ years)",
                        "~ Newer organization (" + thresholds.getTenureReviewYears() + "-"
                                + thresholds.getTenurePassYears() + " years)",
                        "- Insufficient operating history"),
                ScoringEngine.REVENUE_RANGE, factors(
                        "+ Revenue in target range (" + compact(thresholds.getRevenuePassMin()) + "-"
                                + compact(thresholds.getRevenuePassMax()) + ")",
                        "~ Revenue outside ideal range",
                        "- Revenue outside acceptable range"),
                ScoringEngine.OPERATING_RATIO, factors(
                        "+ Healthy expense-to-revenue ratio",
                        "~ Expense ratio needs review",
                        "- Concerning expense ratio"),
                ScoringEngine.FILING_RECENCY, factors(
                        "+ Recent financial data available",
                        "~ Financial data slightly dated",
                        "- Financial data too old or missing"));
    }

    public VettingSummary summarize(String name, int score, Recommendation recommendation,
                                    List<ScoredCheck> checks, List<RedFlag> redFlags, Integer yearsOperating) {
        List<String> keyFactors = new ArrayList<>();
        for (ScoredCheck check : checks) {
            Map<CheckResult, String> byResult = checkFactors.get(check.getName());
            if (byResult != null) {
                keyFactors.add(byResult.get(check.getResult()));
            }
        }
        for (RedFlag flag : redFlags) {
            String factor = flag.getType() != null ? flag.getType().getFactor() : flag.getDetail();
            if (keyFactors.stream().noneMatch(existing -> existing.contains(factor))) {
                keyFactors.add("- " + factor + " (" + flag.getSeverity() + ")");
            }
        }

        List<String> issues = checks.stream()
                .filter(check -> check.getResult() != CheckResult.PASS)
                .map(ScoredCheck::getDetail)
                .limit(MAX_ISSUES_IN_JUSTIFICATION)
                .collect(Collectors.toList());
        String issuesSummary = issues.isEmpty()
                ? "No specific concerns identified."
                : "Key concerns: " + String.join("; ", issues) + ".";

        switch (recommendation) {
            case PASS:
                return VettingSummary.builder()
                        .headline("Approved for Tier 2 Vetting")
                        .justification(String.format(Locale.US,
                                "Organization meets Tier 1 criteria with a score of %d/100. %s is a verified 501(c)(3)"
                                        + " with %s years of operating history and healthy financials.",
                                score, name, yearsOperating != null ? yearsOperating : "unknown"))
                        .keyFactors(List.copyOf(keyFactors))
                        .nextSteps(List.of(
                                "Proceed to Tier 2 deep-dive vetting",
                                "Review program effectiveness and impact metrics",
                                "Verify leadership and governance structure"))
                        .build();
            case REVIEW:
                return VettingSummary.builder()
                        .headline("Manual Review Required")
                        .justification(String.format(Locale.US,
                                "Organization scored %d/100, requiring manual review. %s Verify these concerns before proceeding.",
                                score, issuesSummary))
                        .keyFactors(List.copyOf(keyFactors))
                        .nextSteps(List.of(
                                "Review flagged items manually",
                                "Request additional documentation if needed",
                                "Re-evaluate after addressing concerns"))
                        .build();
            default:
                return VettingSummary.builder()
                        .headline("Does Not Meet Criteria")
                        .justification(String.format(Locale.US,
                                "Organization does not meet minimum Tier 1 criteria (score: %d/100). %s",
                                score, issuesSummary))
                        .keyFactors(List.copyOf(keyFactors))
                        .nextSteps(REJECT_NEXT_STEPS)
                        .build();
        }
    }

    /**
     * Summary for an organization rejected at the gate layer, where no score exists.
     */
    public VettingSummary summarizeGateFailure(String name, GateLayerResult gates) {
        String blocking = gates.getBlockingGate();
        String label = GATE_LABELS.getOrDefault(blocking, blocking);
        List<String> keyFactors = gates.getGates().stream()
                .map(gate -> (gate.isPassed() ? "+ " : "- ") + gate.getDetail())
                .collect(Collectors.toList());
        return VettingSummary.builder()
                .headline("Does Not Meet Criteria: Pre-Screen Gate Failure")
                .justification(name + " failed pre-screen gate: " + label + ". Organization was rejected before scoring.")
                .keyFactors(List.copyOf(keyFactors))
                .nextSteps(REJECT_NEXT_STEPS)
                .build();
    }

    static String gateLabel(GateResult gate) {
        return GATE_LABELS.getOrDefault(gate.getGate(), gate.getGate());
    }

    private static Map<CheckResult, String> factors(String pass, String review, String fail) {
        Map<CheckResult, String> byResult = new EnumMap<>(CheckResult.class);
        byResult.put(CheckResult.PASS, pass);
        byResult.put(CheckResult.REVIEW, review);
        byResult.put(CheckResult.FAIL, fail);
        return byResult;
    }

    private static String compact(BigDecimal amount) {
        double value = amount.doubleValue();
        if (value >= 1_000_000) {
            return String.format(Locale.US, "$%.0fM", value / 1_000_000);
        }
        if (value >= 1_000) {
            return String.format(Locale.US, "$%.0fK", value / 1_000);
        }
        return String.format(Locale.US, "$%.0f", value);
    }
}
