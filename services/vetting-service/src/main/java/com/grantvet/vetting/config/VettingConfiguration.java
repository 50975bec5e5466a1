package com.grantvet.vetting.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantvet.vetting.cache.JpaResultCache;
import com.grantvet.vetting.cache.ResultCache;
import com.grantvet.vetting.cache.VettingRecordRepository;
import com.grantvet.vetting.gate.GateEngine;
import com.grantvet.vetting.lookup.CourtRecordsLookup;
import com.grantvet.vetting.lookup.ProfileBuilder;
import com.grantvet.vetting.lookup.ResilientCourtRecordsLookup;
import com.grantvet.vetting.lookup.RevocationLookup;
import com.grantvet.vetting.pipeline.PipelineSettings;
import com.grantvet.vetting.pipeline.SummaryGenerator;
import com.grantvet.vetting.pipeline.VettingPipeline;
import com.grantvet.vetting.redflag.CourtNameResolver;
import com.grantvet.vetting.redflag.RedFlagDetector;
import com.grantvet.vetting.sanctions.NameMatcher;
import com.grantvet.vetting.sanctions.SanctionsListSource;
import com.grantvet.vetting.scoring.RecommendationPolicy;
import com.grantvet.vetting.scoring.ScoringEngine;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wires the decision engines from {@link VettingProperties}.
 *
 * Data collaborators ({@link ProfileBuilder}, {@link RevocationLookup},
 * {@link SanctionsListSource}) are provided by the integration modules that
 * own the underlying data; a {@link CourtRecordsLookup} is optional.
 */
@Configuration
@EnableConfigurationProperties(VettingProperties.class)
@Slf4j
public class VettingConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VettingThresholds vettingThresholds(VettingProperties properties) {
        VettingThresholds thresholds = ThresholdValidator.validate(properties.toThresholds());
        log.info("Vetting thresholds loaded: pass cutoff {}, review cutoff {}, high-severity flags reject: {}",
                thresholds.getPassCutoff(), thresholds.getReviewCutoff(), thresholds.isHighSeverityFlagRejects());
        return thresholds;
    }

    @Bean
    public PortfolioFitPolicy portfolioFitPolicy(VettingProperties properties) {
        return properties.toPortfolioFitPolicy();
    }

    @Bean
    public NameMatcher nameMatcher(SanctionsListSource sanctionsListSource) {
        NameMatcher matcher = new NameMatcher(sanctionsListSource);
        matcher.reload();
        return matcher;
    }

    @Bean
    public GateEngine gateEngine(RevocationLookup revocationLookup, NameMatcher nameMatcher,
                                 PortfolioFitPolicy portfolioFitPolicy) {
        return new GateEngine(revocationLookup, nameMatcher, portfolioFitPolicy);
    }

    @Bean
    public ScoringEngine scoringEngine(VettingThresholds thresholds, Clock clock) {
        return new ScoringEngine(thresholds, clock);
    }

    @Bean
    public RedFlagDetector redFlagDetector(VettingThresholds thresholds, Clock clock, NameMatcher nameMatcher,
                                           ObjectProvider<CourtRecordsLookup> courtRecordsLookup,
                                           @Qualifier("courtRecordsCircuitBreaker") CircuitBreaker courtRecordsCircuitBreaker) {
        CourtRecordsLookup courtRecords = courtRecordsLookup.getIfAvailable();
        if (courtRecords == null) {
            log.info("No court records lookup configured, court records red flag disabled");
        } else {
            courtRecords = new ResilientCourtRecordsLookup(courtRecords, courtRecordsCircuitBreaker);
        }
        return new RedFlagDetector(thresholds, clock, nameMatcher, courtRecords, CourtNameResolver.fromClasspath());
    }

    @Bean
    public ResultCache resultCache(VettingRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
        return new JpaResultCache(repository, objectMapper, clock);
    }

    @Bean(name = "vettingExecutor")
    public ThreadPoolTaskExecutor vettingExecutor(VettingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAsync().getCorePoolSize());
        executor.setMaxPoolSize(properties.getAsync().getMaxPoolSize());
        executor.setQueueCapacity(properties.getAsync().getQueueCapacity());
        executor.setThreadNamePrefix("Vetting-");
        // in-flight cache writes finish before shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public VettingPipeline vettingPipeline(ProfileBuilder profileBuilder,
                                           GateEngine gateEngine,
                                           ScoringEngine scoringEngine,
                                           RedFlagDetector redFlagDetector,
                                           VettingThresholds thresholds,
                                           ObjectProvider<ResultCache> resultCache,
                                           VettingProperties properties,
                                           MeterRegistry meterRegistry,
                                           Clock clock,
                                           @Qualifier("vettingExecutor") ThreadPoolTaskExecutor vettingExecutor) {
        PipelineSettings settings = PipelineSettings.builder()
                .cacheMaxAge(properties.cacheMaxAge())
                .defaultAttribution(properties.getCache().getDefaultAttribution())
                .batchMaxSize(properties.getBatch().getMaxSize())
                .build();
        return new VettingPipeline(profileBuilder, gateEngine, scoringEngine, redFlagDetector,
                new RecommendationPolicy(thresholds), new SummaryGenerator(thresholds),
                resultCache.getIfAvailable(), settings, meterRegistry, clock, vettingExecutor);
    }
}
