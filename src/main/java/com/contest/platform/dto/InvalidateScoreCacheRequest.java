package com.contest.platform.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scope of an invalidation; the given filters are combined.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidateScoreCacheRequest {
    @Positive(message = "ParticipationId must be positive")
    private Long participationId;
    
    @Positive(message = "TaskId must be positive")
    private Long taskId;
    
    @Positive(message = "ContestId must be positive")
    private Long contestId;
}
