package com.grantvet.vetting.cache;

import com.grantvet.vetting.domain.Recommendation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface VettingRecordRepository extends JpaRepository<VettingRecord, Long> {

    Optional<VettingRecord> findFirstByEinOrderByVettedAtDescIdDesc(String ein);

    List<VettingRecord> findAllByOrderByVettedAtDescIdDesc(Pageable pageable);

    List<VettingRecord> findByRecommendationOrderByVettedAtDescIdDesc(Recommendation recommendation, Pageable pageable);

    List<VettingRecord> findByVettedAtGreaterThanEqualOrderByVettedAtDescIdDesc(Instant since, Pageable pageable);

    List<VettingRecord> findByRecommendationAndVettedAtGreaterThanEqualOrderByVettedAtDescIdDesc(
            Recommendation recommendation, Instant since, Pageable pageable);

    long countByRecommendation(Recommendation recommendation);
}
