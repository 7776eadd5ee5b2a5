package com.contest.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Cached task score of a participation, kept up to date incrementally as
 * submissions get scored and rebuilt from the submissions when stale.
 */
@Entity
@Table(name = "participation_task_scores",
    uniqueConstraints = @UniqueConstraint(name = "uq_participation_task_score", columnNames = {"participation_id", "task_id"}),
    indexes = {
        @Index(name = "idx_pts_participation", columnList = "participation_id"),
        @Index(name = "idx_pts_task", columnList = "task_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipationTaskScore {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "participation_id", nullable = false)
    private Long participationId;

    @Column(name = "task_id", nullable = false)
    private Long taskId;

    @Column(name = "score", nullable = false)
    private double score;

    /** Best score per subtask; only set under {@link ScoreMode#MAX_SUBTASK}. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "subtask_max_scores")
    private Map<String, Double> subtaskMaxScores;

    @Column(name = "max_tokened_score", nullable = false)
    private double maxTokenedScore;

    @Column(name = "last_submission_score")
    private Double lastSubmissionScore;

    @Column(name = "last_submission_timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastSubmissionTimestamp;

    @Column(name = "last_submission_id")
    private Long lastSubmissionId;

    @Column(name = "has_submissions", nullable = false)
    private boolean hasSubmissions;

    @Builder.Default
    @Column(name = "score_valid", nullable = false)
    private boolean scoreValid = true;

    @Builder.Default
    @Column(name = "history_valid", nullable = false)
    private boolean historyValid = true;

    @Column(name = "invalidated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant invalidatedAt;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "last_update", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastUpdate;

    /**
     * A stale entry must be rebuilt before its score can be trusted.
     */
    public boolean isStale() {
        return invalidatedAt != null || !scoreValid;
    }

    /**
     * A freshly created row. It is stale until a rebuild completes, so a row
     * committed ahead of a rebuild that then fails is never served as valid.
     */
    public static ParticipationTaskScore empty(Long participationId, Long taskId, Instant now) {
        return ParticipationTaskScore.builder()
            .participationId(participationId)
            .taskId(taskId)
            .score(0.0)
            .maxTokenedScore(0.0)
            .hasSubmissions(false)
            .scoreValid(false)
            .historyValid(true)
            .createdAt(now)
            .lastUpdate(now)
            .build();
    }
}
