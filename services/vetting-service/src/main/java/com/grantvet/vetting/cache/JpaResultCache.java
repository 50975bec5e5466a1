package com.grantvet.vetting.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantvet.common.exception.ErrorCode;
import com.grantvet.common.exception.GrantVetException;
import com.grantvet.common.exception.InvalidArgumentException;
import com.grantvet.vetting.domain.Ein;
import com.grantvet.vetting.domain.Recommendation;
import com.grantvet.vetting.domain.VettingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ResultCache} over the {@code vetting_results} table. Each save inserts
 * a new row; the latest row for an EIN is the current verdict.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaResultCache implements ResultCache {

    private final VettingRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<CachedVetting> getLatest(String ein) {
        return repository.findFirstByEinOrderByVettedAtDescIdDesc(Ein.strip(ein)).map(this::toCached);
    }

    @Override
    @Transactional
    public void save(VettingResult result, String attribution) {
        if (attribution == null || attribution.isBlank()) {
            throw new InvalidArgumentException("Attribution is required when saving a vetting result");
        }
        VettingRecord record = VettingRecord.builder()
                .ein(Ein.strip(result.getEin()))
                .name(result.getName() != null ? result.getName() : "")
                .recommendation(result.getRecommendation())
                .score(result.getScore())
                .passed(result.isPassed())
                .gateBlocked(result.isGateBlocked())
                .redFlagCount(result.getRedFlags() != null ? result.getRedFlags().size() : 0)
                .resultJson(write(result))
                .vettedAt(clock.instant())
                .vettedBy(attribution)
                .build();
        VettingRecord saved = repository.save(record);
        log.debug("Stored vetting result {} for EIN {} ({})", saved.getId(), saved.getEin(), saved.getRecommendation());
    }

    @Override
    @Transactional(readOnly = true)
    public List<CachedVetting> listVetted(VettedQuery query) {
        Pageable page = PageRequest.of(0, query.effectiveLimit());
        Recommendation recommendation = query.getRecommendation();
        List<VettingRecord> records;
        if (recommendation != null && query.getSince() != null) {
            records = repository.findByRecommendationAndVettedAtGreaterThanEqualOrderByVettedAtDescIdDesc(
                    recommendation, query.getSince(), page);
        } else if (recommendation != null) {
            records = repository.findByRecommendationOrderByVettedAtDescIdDesc(recommendation, page);
        } else if (query.getSince() != null) {
            records = repository.findByVettedAtGreaterThanEqualOrderByVettedAtDescIdDesc(query.getSince(), page);
        } else {
            records = repository.findAllByOrderByVettedAtDescIdDesc(page);
        }
        return records.stream().map(this::toCached).collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public VettingStats stats() {
        return new VettingStats(
                repository.count(),
                repository.countByRecommendation(Recommendation.PASS),
                repository.countByRecommendation(Recommendation.REVIEW),
                repository.countByRecommendation(Recommendation.REJECT));
    }

    private CachedVetting toCached(VettingRecord record) {
        return CachedVetting.builder()
                .result(read(record))
                .vettedAt(record.getVettedAt())
                .vettedBy(record.getVettedBy())
                .build();
    }

    private String write(VettingResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new GrantVetException(ErrorCode.INTERNAL_ERROR, "Unable to serialize vetting result", e)
                    .withMetadata("ein", result.getEin());
        }
    }

    private VettingResult read(VettingRecord record) {
        try {
            return objectMapper.readValue(record.getResultJson(), VettingResult.class);
        } catch (JsonProcessingException e) {
            throw new GrantVetException(ErrorCode.INTERNAL_ERROR, "Stored vetting result is unreadable", e)
                    .withMetadata("recordId", record.getId())
                    .withMetadata("ein", record.getEin());
        }
    }
}
