package com.contest.platform.service;

import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.repository.ScoreCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/**
 * Creates missing cache rows in their own transaction, so that the caller can
 * then lock the row with {@code SELECT ... FOR UPDATE}. A row lock cannot be
 * taken on a row that does not exist yet; the unique constraint on
 * (participation_id, task_id) decides which of two concurrent creators wins.
 * Rows are created stale; only a completed rebuild makes them valid.
 */
@Component
public class ScoreCacheEntryInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ScoreCacheEntryInitializer.class);

    private final ScoreCacheRepository scoreCacheRepository;
    private final TransactionTemplate requiresNewTransaction;

    @Autowired
    public ScoreCacheEntryInitializer(
            ScoreCacheRepository scoreCacheRepository,
            PlatformTransactionManager transactionManager) {
        this.scoreCacheRepository = scoreCacheRepository;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void createIfAbsent(Long participationId, Long taskId) {
        try {
            requiresNewTransaction.executeWithoutResult(status -> {
                if (scoreCacheRepository.findByParticipationIdAndTaskId(participationId, taskId).isEmpty()) {
                    scoreCacheRepository.create(ParticipationTaskScore.empty(participationId, taskId, Instant.now()));
                    logger.debug("Created score cache entry for participation {} task {}", participationId, taskId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent creator; the row exists now.
            logger.debug("Score cache entry for participation {} task {} was created concurrently",
                participationId, taskId);
        }
    }
}
