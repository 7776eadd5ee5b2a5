package com.contest.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A gradable problem. Only the scoring configuration matters to the score cache.
 */
@Entity
@Table(name = "tasks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "contest_id")
    private Long contestId;

    @Column(name = "name", nullable = false)
    private String name;

    /** Raw configured value, resolved through {@link ScoreMode#fromConfig(String)}. */
    @Column(name = "score_mode", nullable = false)
    private String scoreMode;

    @Column(name = "score_precision", nullable = false)
    private Integer scorePrecision;
}
