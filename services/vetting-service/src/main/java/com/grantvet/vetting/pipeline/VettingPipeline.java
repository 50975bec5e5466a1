package com.grantvet.vetting.pipeline;

import com.grantvet.common.exception.ErrorCode;
import com.grantvet.common.exception.GrantVetException;
import com.grantvet.common.exception.InvalidArgumentException;
import com.grantvet.common.exception.NotFoundException;
import com.grantvet.common.exception.UpstreamUnavailableException;
import com.grantvet.vetting.cache.CachedVetting;
import com.grantvet.vetting.cache.ResultCache;
import com.grantvet.vetting.domain.CheckResult;
import com.grantvet.vetting.domain.Ein;
import com.grantvet.vetting.domain.GateLayerResult;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.domain.Recommendation;
import com.grantvet.vetting.domain.RedFlag;
import com.grantvet.vetting.domain.RedFlagReport;
import com.grantvet.vetting.domain.RedFlagSeverity;
import com.grantvet.vetting.domain.ScoredCheck;
import com.grantvet.vetting.domain.VettingResult;
import com.grantvet.vetting.gate.GateEngine;
import com.grantvet.vetting.lookup.ProfileBuilder;
import com.grantvet.vetting.lookup.ProfileSnapshot;
import com.grantvet.vetting.redflag.RedFlagDetector;
import com.grantvet.vetting.scoring.RecommendationPolicy;
import com.grantvet.vetting.scoring.ScoringEngine;
import com.grantvet.vetting.scoring.ScoringOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Vetting entry point: cache check, then gates, scoring and red flags, then a
 * best-effort cache write.
 *
 * Every failure is returned as a {@link VettingResponse} with
 * {@code success=false}; callers never see an exception from {@link #vet}.
 * Gates and scoring only run on a cache miss or a forced refresh. Cached
 * results older than the configured maximum age are re-evaluated.
 *
 * The engines hold no mutable state, so concurrent calls never interfere.
 * Two concurrent calls for the same EIN may both evaluate; the cache keeps
 * whichever write lands last.
 */
@Slf4j
public class VettingPipeline {

    static final String METRIC_REQUESTS = "grantvet.vetting.requests";
    static final String METRIC_CACHE_HITS = "grantvet.vetting.cache.hits";
    static final String METRIC_CACHE_WRITE_FAILURES = "grantvet.vetting.cache.write.failures";
    static final String METRIC_DURATION = "grantvet.vetting.duration";

    private final ProfileBuilder profileBuilder;
    private final GateEngine gateEngine;
    private final ScoringEngine scoringEngine;
    private final RedFlagDetector redFlagDetector;
    private final RecommendationPolicy recommendationPolicy;
    private final SummaryGenerator summaryGenerator;
    private final ResultCache resultCache;
    private final PipelineSettings settings;
    private final Clock clock;
    private final Executor asyncExecutor;

    private final MeterRegistry meterRegistry;
    private final Counter cacheHits;
    private final Counter cacheWriteFailures;
    private final Timer duration;

    /**
     * @param resultCache may be null, in which case every call evaluates and nothing is stored
     */
    public VettingPipeline(ProfileBuilder profileBuilder,
                           GateEngine gateEngine,
                           ScoringEngine scoringEngine,
                           RedFlagDetector redFlagDetector,
                           RecommendationPolicy recommendationPolicy,
                           SummaryGenerator summaryGenerator,
                           ResultCache resultCache,
                           PipelineSettings settings,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           Executor asyncExecutor) {
        this.profileBuilder = profileBuilder;
        this.gateEngine = gateEngine;
        this.scoringEngine = scoringEngine;
        this.redFlagDetector = redFlagDetector;
        this.recommendationPolicy = recommendationPolicy;
        this.summaryGenerator = summaryGenerator;
        this.resultCache = resultCache;
        this.settings = settings;
        this.clock = clock;
        this.asyncExecutor = asyncExecutor;
        this.meterRegistry = meterRegistry;
        this.cacheHits = Counter.builder(METRIC_CACHE_HITS)
                .description("Vetting calls answered from the result cache")
                .register(meterRegistry);
        this.cacheWriteFailures = Counter.builder(METRIC_CACHE_WRITE_FAILURES)
                .description("Vetting results that could not be stored")
                .register(meterRegistry);
        this.duration = Timer.builder(METRIC_DURATION)
                .description("Time to answer a vetting call")
                .register(meterRegistry);
    }

    public VettingResponse<VettingResult> vet(String ein) {
        return vet(ein, VetOptions.defaults());
    }

    public VettingResponse<VettingResult> vet(String ein, VetOptions options) {
        VetOptions effective = options != null ? options : VetOptions.defaults();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            VettingResponse<VettingResult> response = doVet(ein, effective);
            countOutcome(response);
            return response;
        } finally {
            sample.stop(duration);
        }
    }

    /**
     * Runs {@link #vet} on the pipeline executor. Cancelling the returned future
     * only detaches the caller; the evaluation and its cache write run to completion.
     */
    public CompletableFuture<VettingResponse<VettingResult>> vetAsync(String ein, VetOptions options) {
        return CompletableFuture.supplyAsync(() -> vet(ein, options), asyncExecutor);
    }

    /**
     * Vets each identifier in order. A failure for one identifier is recorded
     * in its entry and processing continues with the next.
     *
     * @throws InvalidArgumentException if the batch is empty or larger than the configured maximum
     */
    public BatchVettingReport vetBatch(List<String> eins, VetOptions options) {
        if (eins == null || eins.isEmpty()) {
            throw new InvalidArgumentException("EIN list is required and must not be empty");
        }
        if (eins.size() > settings.getBatchMaxSize()) {
            throw new InvalidArgumentException(String.format(Locale.US,
                    "Too many EINs. Max %d per batch, got %d", settings.getBatchMaxSize(), eins.size()));
        }

        List<BatchVettingReport.Entry> entries = new ArrayList<>(eins.size());
        int pass = 0;
        int review = 0;
        int reject = 0;
        int error = 0;
        int cached = 0;
        for (String ein : eins) {
            VettingResponse<VettingResult> response = vet(ein, options);
            entries.add(new BatchVettingReport.Entry(ein, response));
            if (response.isCached()) {
                cached++;
            }
            if (!response.isSuccess()) {
                error++;
                continue;
            }
            switch (response.getData().getRecommendation()) {
                case PASS:
                    pass++;
                    break;
                case REVIEW:
                    review++;
                    break;
                default:
                    reject++;
            }
        }
        log.info("Batch vetting of {} EINs: {} pass, {} review, {} reject, {} error, {} cached",
                eins.size(), pass, review, reject, error, cached);
        return BatchVettingReport.builder()
                .total(eins.size())
                .results(List.copyOf(entries))
                .stats(BatchVettingReport.Stats.builder()
                        .pass(pass).review(review).reject(reject).error(error).cached(cached)
                        .build())
                .build();
    }

    /**
     * Red flags only: no gates, no scoring, no cache.
     */
    public VettingResponse<RedFlagReport> screenRedFlags(String ein) {
        try {
            String normalized = Ein.normalize(ein);
            ProfileSnapshot snapshot = loadProfile(normalized);
            OrganizationProfile profile = snapshot.getProfile();
            List<RedFlag> flags = redFlagDetector.detect(profile, snapshot.getFilings());
            return VettingResponse.success(RedFlagReport.builder()
                    .ein(profile.getEin())
                    .name(profile.getName())
                    .flags(flags)
                    .clean(flags.isEmpty())
                    .build(), PipelineStage.EVALUATED);
        } catch (GrantVetException e) {
            return failure(ein, e);
        } catch (RuntimeException e) {
            log.error("Red flag screening failed for EIN {}", ein, e);
            return VettingResponse.error(ErrorCode.INTERNAL_ERROR, "Red flag screening failed: " + e.getMessage());
        }
    }

    private VettingResponse<VettingResult> doVet(String ein, VetOptions options) {
        try {
            String normalized = Ein.normalize(ein);

            if (!options.isForceRefresh() && resultCache != null) {
                Optional<CachedVetting> hit = readCache(normalized);
                if (hit.isPresent()) {
                    CachedVetting cachedVetting = hit.get();
                    if (!cachedVetting.isOlderThan(settings.getCacheMaxAge(), clock.instant())) {
                        cacheHits.increment();
                        log.debug("Cache hit for EIN {} (vetted {} by {})",
                                normalized, cachedVetting.getVettedAt(), cachedVetting.getVettedBy());
                        return VettingResponse.fromCache(cachedVetting.getResult(), String.format(
                                "Previously vetted on %s by %s. Use forceRefresh to re-vet.",
                                cachedVetting.getVettedAt(), cachedVetting.getVettedBy()));
                    }
                    log.info("Cached result for EIN {} from {} is older than {} days, re-evaluating",
                            normalized, cachedVetting.getVettedAt(), settings.getCacheMaxAge().toDays());
                }
            }

            VettingResult result = evaluate(loadProfile(normalized));

            if (resultCache == null) {
                return VettingResponse.success(result, PipelineStage.EVALUATED);
            }
            boolean stored = persist(result, options);
            return VettingResponse.success(result, stored ? PipelineStage.PERSISTED : PipelineStage.EVALUATED);
        } catch (GrantVetException e) {
            return failure(ein, e);
        } catch (RuntimeException e) {
            log.error("Vetting failed for EIN {}", ein, e);
            return VettingResponse.error(ErrorCode.INTERNAL_ERROR, "Vetting failed: " + e.getMessage());
        }
    }

    VettingResult evaluate(ProfileSnapshot snapshot) {
        OrganizationProfile profile = snapshot.getProfile();
        GateLayerResult gates = gateEngine.evaluate(profile);
        List<RedFlag> redFlags = redFlagDetector.detect(profile, snapshot.getFilings());

        VettingResult.VettingResultBuilder result = VettingResult.builder()
                .ein(profile.getEin())
                .name(profile.getName())
                .gates(gates)
                .redFlags(redFlags)
                .evaluatedAt(clock.instant());

        if (!gates.isAllPassed()) {
            GateResult blocking = gates.getGates().stream()
                    .filter(gate -> !gate.isPassed())
                    .findFirst()
                    .orElseThrow();
            log.info("EIN {} blocked at gate {}: {}", profile.getEin(), blocking.getGate(), blocking.getDetail());
            return result
                    .passed(false)
                    .gateBlocked(true)
                    .score(null)
                    .checks(null)
                    .recommendation(Recommendation.REJECT)
                    .reviewReasons(List.of("Gate failure (" + SummaryGenerator.gateLabel(blocking) + "): "
                            + blocking.getDetail()))
                    .summary(summaryGenerator.summarizeGateFailure(profile.getName(), gates))
                    .build();
        }

        ScoringOutcome outcome = scoringEngine.score(profile);
        Recommendation recommendation = recommendationPolicy.recommend(outcome.getScore(), false, redFlags);
        log.debug("EIN {} scored {} ({}) with {} red flag(s)",
                profile.getEin(), outcome.getScore(), recommendation, redFlags.size());
        return result
                .passed(recommendation == Recommendation.PASS)
                .gateBlocked(false)
                .score(outcome.getScore())
                .checks(outcome.getChecks())
                .recommendation(recommendation)
                .reviewReasons(reviewReasons(outcome.getChecks(), redFlags))
                .summary(summaryGenerator.summarize(profile.getName(), outcome.getScore(), recommendation,
                        outcome.getChecks(), redFlags, profile.getYearsOperating()))
                .build();
    }

    private ProfileSnapshot loadProfile(String ein) {
        Optional<ProfileSnapshot> snapshot;
        try {
            snapshot = profileBuilder.build(ein);
        } catch (GrantVetException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException("profile-builder", "Organization profile could not be built", e);
        }
        return snapshot
                .filter(found -> found.getProfile() != null)
                .orElseThrow(() -> new NotFoundException("Organization", Ein.format(ein)));
    }

    private Optional<CachedVetting> readCache(String ein) {
        try {
            return resultCache.getLatest(ein);
        } catch (RuntimeException e) {
            log.warn("Result cache read failed for EIN {}, evaluating fresh", ein, e);
            return Optional.empty();
        }
    }

    /**
     * Stored results are an audit trail, not part of the decision: a failed
     * write is logged and counted, and only the reported stage reflects it.
     *
     * @return true when the result was written
     */
    private boolean persist(VettingResult result, VetOptions options) {
        String attribution = options.getRequestedBy() != null && !options.getRequestedBy().isBlank()
                ? options.getRequestedBy() : settings.getDefaultAttribution();
        try {
            resultCache.save(result, attribution);
            return true;
        } catch (RuntimeException e) {
            cacheWriteFailures.increment();
            log.error("Failed to store vetting result for EIN {}", result.getEin(), e);
            return false;
        }
    }

    private static List<String> reviewReasons(List<ScoredCheck> checks, List<RedFlag> redFlags) {
        List<String> reasons = new ArrayList<>();
        for (ScoredCheck check : checks) {
            if (check.getResult() != CheckResult.PASS) {
                reasons.add(check.getDetail());
            }
        }
        for (RedFlag flag : redFlags) {
            if (flag.getSeverity() == RedFlagSeverity.HIGH) {
                reasons.add("RED FLAG: " + flag.getDetail());
            }
        }
        return List.copyOf(reasons);
    }

    private <T> VettingResponse<T> failure(String ein, GrantVetException e) {
        if (e.getErrorCode().isClientError()) {
            log.debug("Vetting request for EIN {} rejected: {}", ein, e.getUserMessage());
        } else {
            log.warn("Vetting for EIN {} could not complete [{}]: {}", ein, e.getErrorId(), e.getMessage());
        }
        return VettingResponse.error(e.getErrorCode(), e.getUserMessage());
    }

    private void countOutcome(VettingResponse<VettingResult> response) {
        String outcome = response.isSuccess()
                ? response.getData().getRecommendation().name().toLowerCase(Locale.ROOT)
                : "error";
        meterRegistry.counter(METRIC_REQUESTS, "outcome", outcome).increment();
    }
}
