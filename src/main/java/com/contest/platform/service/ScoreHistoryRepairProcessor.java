package com.contest.platform.service;

import com.contest.platform.model.ParticipationTaskScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "score-cache.history-repair.enabled", havingValue = "true", matchIfMissing = true)
public class ScoreHistoryRepairProcessor {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreHistoryRepairProcessor.class);
    
    private final ScoreCacheService scoreCacheService;
    private final int batchSize;
    
    @Autowired
    public ScoreHistoryRepairProcessor(
            ScoreCacheService scoreCacheService,
            @Value("${score-cache.history-repair.batch-size:100}") int batchSize) {
        this.scoreCacheService = scoreCacheService;
        this.batchSize = batchSize;
    }
    
    /**
     * Regenerate histories left invalid by out-of-order submissions.
     */
    @Scheduled(fixedDelayString = "${score-cache.history-repair.interval-ms:60000}")
    public void repairInvalidHistories() {
        try {
            List<ParticipationTaskScore> entries = scoreCacheService.findEntriesWithInvalidHistory(batchSize);
            if (entries.isEmpty()) {
                return;
            }
            
            logger.info("Repairing score history of {} cache entries", entries.size());
            entries.forEach(this::repair);
        } catch (Exception e) {
            logger.error("Error repairing score history", e);
        }
    }
    
    private void repair(ParticipationTaskScore entry) {
        try {
            scoreCacheService.rebuildScoreHistory(entry.getParticipationId(), entry.getTaskId());
        } catch (Exception e) {
            logger.warn("Failed to repair score history for participation {} task {}, will retry later",
                entry.getParticipationId(), entry.getTaskId(), e);
        }
    }
}
