package com.contest.platform.controller;

import com.contest.platform.dto.InvalidateScoreCacheRequest;
import com.contest.platform.dto.InvalidateScoreCacheResponse;
import com.contest.platform.dto.ScoreCacheEntryResponse;
import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.service.ScoreCacheService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Admin operations on the score cache, used by rescoring, dataset switches
 * and token grants.
 */
@RestController
@RequestMapping("/api/v1/admin/score-cache")
public class ScoreCacheAdminController {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreCacheAdminController.class);
    
    private final ScoreCacheService scoreCacheService;
    
    @Autowired
    public ScoreCacheAdminController(ScoreCacheService scoreCacheService) {
        this.scoreCacheService = scoreCacheService;
    }
    
    /**
     * Invalidate the cache entries matching the given scope.
     * POST /api/v1/admin/score-cache/invalidate
     */
    @PostMapping("/invalidate")
    public ResponseEntity<InvalidateScoreCacheResponse> invalidate(@Valid @RequestBody InvalidateScoreCacheRequest request) {
        logger.info("Received POST request to invalidate score cache - participationId: {}, taskId: {}, contestId: {}", 
            request.getParticipationId(), request.getTaskId(), request.getContestId());
        
        try {
            int invalidated = scoreCacheService.invalidateScoreCache(
                request.getParticipationId(), request.getTaskId(), request.getContestId());
            
            InvalidateScoreCacheResponse response = InvalidateScoreCacheResponse.builder()
                .invalidatedEntries(invalidated)
                .invalidatedAt(Instant.now())
                .build();
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error invalidating score cache - participationId: {}, taskId: {}, contestId: {}, error: {}", 
                request.getParticipationId(), request.getTaskId(), request.getContestId(), e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * Force a rebuild of one pair.
     * POST /api/v1/admin/score-cache/participations/{participationId}/tasks/{taskId}/rebuild
     */
    @PostMapping("/participations/{participationId}/tasks/{taskId}/rebuild")
    public ResponseEntity<ScoreCacheEntryResponse> rebuild(
            @PathVariable Long participationId,
            @PathVariable Long taskId) {
        
        logger.info("Received POST request to rebuild score cache - participationId: {}, taskId: {}", participationId, taskId);
        
        ParticipationTaskScore entry = scoreCacheService.rebuildScoreCache(participationId, taskId);
        return ResponseEntity.ok(ScoreCacheEntryResponse.from(entry));
    }
}
