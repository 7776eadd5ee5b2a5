package com.contest.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A point in time where the cached task score of a participation changed.
 */
@Entity
@Table(name = "score_history", indexes = {
    @Index(name = "idx_score_history_participation_task_timestamp", columnList = "participation_id,task_id,timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "participation_id", nullable = false)
    private Long participationId;

    @Column(name = "task_id", nullable = false)
    private Long taskId;

    @Column(name = "timestamp", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @Column(name = "score", nullable = false)
    private double score;

    @Column(name = "submission_id", nullable = false)
    private Long submissionId;
}
