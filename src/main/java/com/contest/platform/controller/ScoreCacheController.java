package com.contest.platform.controller;

import com.contest.platform.dto.ScoreCacheEntryResponse;
import com.contest.platform.dto.ScoreHistoryPoint;
import com.contest.platform.dto.ScoreHistoryResponse;
import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.model.ScoreHistory;
import com.contest.platform.service.ScoreCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/score-cache")
public class ScoreCacheController {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreCacheController.class);
    
    private final ScoreCacheService scoreCacheService;
    
    @Autowired
    public ScoreCacheController(ScoreCacheService scoreCacheService) {
        this.scoreCacheService = scoreCacheService;
    }
    
    /**
     * Cached task score of a participation, rebuilt on the fly if stale.
     * GET /api/v1/score-cache/participations/{participationId}/tasks/{taskId}
     */
    @GetMapping("/participations/{participationId}/tasks/{taskId}")
    public ResponseEntity<ScoreCacheEntryResponse> getCachedScore(
            @PathVariable Long participationId,
            @PathVariable Long taskId) {
        
        logger.debug("Received GET request for cached score - participationId: {}, taskId: {}", participationId, taskId);
        
        ParticipationTaskScore entry = scoreCacheService.getCachedScoreEntry(participationId, taskId);
        return ResponseEntity.ok(ScoreCacheEntryResponse.from(entry));
    }
    
    /**
     * Score history of a participation on a task.
     * GET /api/v1/score-cache/participations/{participationId}/tasks/{taskId}/history
     */
    @GetMapping("/participations/{participationId}/tasks/{taskId}/history")
    public ResponseEntity<ScoreHistoryResponse> getScoreHistory(
            @PathVariable Long participationId,
            @PathVariable Long taskId) {
        
        logger.debug("Received GET request for score history - participationId: {}, taskId: {}", participationId, taskId);
        
        List<ScoreHistory> history = scoreCacheService.getScoreHistory(participationId, taskId);
        ScoreHistoryResponse response = ScoreHistoryResponse.builder()
            .participationId(participationId)
            .taskId(taskId)
            .points(toPoints(history))
            .retrievedAt(Instant.now())
            .build();
        return ResponseEntity.ok(response);
    }
    
    /**
     * Score history of every participation of a contest.
     * GET /api/v1/score-cache/contests/{contestId}/history
     */
    @GetMapping("/contests/{contestId}/history")
    public ResponseEntity<ScoreHistoryResponse> getContestScoreHistory(@PathVariable Long contestId) {
        logger.info("Received GET request for contest score history - contestId: {}", contestId);
        
        try {
            List<ScoreHistory> history = scoreCacheService.getContestScoreHistory(contestId);
            ScoreHistoryResponse response = ScoreHistoryResponse.builder()
                .contestId(contestId)
                .points(toPoints(history))
                .retrievedAt(Instant.now())
                .build();
            
            logger.info("Successfully retrieved contest score history - contestId: {}, points: {}", 
                contestId, history.size());
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving contest score history - contestId: {}, error: {}", 
                contestId, e.getMessage(), e);
            throw e;
        }
    }
    
    private List<ScoreHistoryPoint> toPoints(List<ScoreHistory> history) {
        return history.stream()
            .map(ScoreHistoryPoint::from)
            .toList();
    }
}
