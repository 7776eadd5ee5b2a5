package com.contest.platform.dto;

import com.contest.platform.model.ParticipationTaskScore;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreCacheEntryResponse {
    private Long participationId;
    private Long taskId;
    private Double score;
    private Map<String, Double> subtaskMaxScores;
    private Double maxTokenedScore;
    private Double lastSubmissionScore;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastSubmissionTimestamp;
    
    private Boolean hasSubmissions;
    private Boolean scoreValid;
    private Boolean historyValid;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant invalidatedAt;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastUpdate;
    
    public static ScoreCacheEntryResponse from(ParticipationTaskScore entry) {
        return ScoreCacheEntryResponse.builder()
            .participationId(entry.getParticipationId())
            .taskId(entry.getTaskId())
            .score(entry.getScore())
            .subtaskMaxScores(entry.getSubtaskMaxScores())
            .maxTokenedScore(entry.getMaxTokenedScore())
            .lastSubmissionScore(entry.getLastSubmissionScore())
            .lastSubmissionTimestamp(entry.getLastSubmissionTimestamp())
            .hasSubmissions(entry.isHasSubmissions())
            .scoreValid(entry.isScoreValid())
            .historyValid(entry.isHistoryValid())
            .invalidatedAt(entry.getInvalidatedAt())
            .lastUpdate(entry.getLastUpdate())
            .build();
    }
}
