package com.contest.platform.dto;

import com.contest.platform.model.ScoreHistory;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreHistoryPoint {
    private Long participationId;
    private Long taskId;
    private Long submissionId;
    private Double score;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;
    
    public static ScoreHistoryPoint from(ScoreHistory history) {
        return ScoreHistoryPoint.builder()
            .participationId(history.getParticipationId())
            .taskId(history.getTaskId())
            .submissionId(history.getSubmissionId())
            .score(history.getScore())
            .timestamp(history.getTimestamp())
            .build();
    }
}
