package com.grantvet.vetting.cache;

import com.grantvet.vetting.domain.Recommendation;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One stored vetting run. The headline columns are flattened for filtering;
 * the complete result is kept as JSON.
 */
@Entity
@Table(name = "vetting_results", indexes = {
        @Index(name = "idx_vetting_ein", columnList = "ein"),
        @Index(name = "idx_vetting_recommendation", columnList = "recommendation"),
        @Index(name = "idx_vetting_vetted_at", columnList = "vetted_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VettingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "ein", nullable = false, length = 9, updatable = false)
    private String ein;

    @Column(name = "name", nullable = false, updatable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "recommendation", nullable = false, length = 10, updatable = false)
    private Recommendation recommendation;

    @Column(name = "score", updatable = false)
    private Integer score;

    @Column(name = "passed", nullable = false, updatable = false)
    private boolean passed;

    @Column(name = "gate_blocked", nullable = false, updatable = false)
    private boolean gateBlocked;

    @Column(name = "red_flag_count", nullable = false, updatable = false)
    private int redFlagCount;

    @Column(name = "result_json", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String resultJson;

    @Column(name = "vetted_at", nullable = false, updatable = false)
    private Instant vettedAt;

    @Column(name = "vetted_by", nullable = false, length = 100, updatable = false)
    private String vettedBy;
}
