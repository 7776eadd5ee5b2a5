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
import java.util.List;
import java.util.Map;

/**
 * A graded (or pending) submission as exposed by the evaluation pipeline.
 * {@code score} stays null until the submission has been scored.
 */
@Entity
@Table(name = "submissions", indexes = {
    @Index(name = "idx_submission_participation_task_timestamp", columnList = "participation_id,task_id,timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Submission {
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

    @Builder.Default
    @Column(name = "official", nullable = false)
    private boolean official = true;

    @Column(name = "tokened", nullable = false)
    private boolean tokened;

    @Column(name = "score")
    private Double score;

    /** Ordered subtask breakdown, each element carrying at least "idx" and "score". */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "score_details")
    private List<Map<String, Object>> scoreDetails;

    public boolean isScored() {
        return score != null;
    }
}
