package com.contest.platform.service;

import com.contest.platform.event.SubmissionScoredEvent;
import com.contest.platform.exception.ScoreCacheException;
import com.contest.platform.model.Submission;
import com.contest.platform.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Feeds scored submissions into the score cache once the grading transaction
 * has committed. Each attempt runs in its own transaction, so lock contention
 * never rolls back the grader's write. Contention is retried with exponential
 * backoff; when retries run out the pair is invalidated so the next read
 * rebuilds it instead of serving a score missing this submission.
 */
@Component
public class ScoreCacheUpdateListener {

    private static final Logger logger = LoggerFactory.getLogger(ScoreCacheUpdateListener.class);

    private final ScoreCacheService scoreCacheService;
    private final SubmissionRepository submissionRepository;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final TransactionTemplate requiresNewTransaction;

    @Autowired
    public ScoreCacheUpdateListener(
            ScoreCacheService scoreCacheService,
            SubmissionRepository submissionRepository,
            PlatformTransactionManager transactionManager,
            @Value("${score-cache.update.max-attempts:5}") int maxAttempts,
            @Value("${score-cache.update.backoff-ms:100}") long initialBackoffMillis) {
        this.scoreCacheService = scoreCacheService;
        this.submissionRepository = submissionRepository;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMillis = Math.max(0, initialBackoffMillis);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSubmissionScored(SubmissionScoredEvent event) {
        Optional<Submission> found = requiresNewTransaction.execute(
            status -> submissionRepository.findById(event.getSubmissionId()));
        if (found.isEmpty()) {
            logger.warn("Scored submission {} not found, score cache not updated", event.getSubmissionId());
            return;
        }

        Submission submission = found.get();
        long backoff = initialBackoffMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                requiresNewTransaction.executeWithoutResult(status -> scoreCacheService.updateScoreCache(submission));
                return;
            } catch (PessimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    logger.error("Max retry count exceeded updating score cache for submission {}, invalidating participation {} task {}",
                        submission.getId(), submission.getParticipationId(), submission.getTaskId(), e);
                    requiresNewTransaction.executeWithoutResult(status -> scoreCacheService.invalidateScoreCache(
                        submission.getParticipationId(), submission.getTaskId(), null));
                    return;
                }
                logger.warn("Score cache row busy for submission {} (attempt {}/{}), retrying in {} ms",
                    submission.getId(), attempt, maxAttempts, backoff);
                pause(backoff);
                backoff *= 2;
            }
        }
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScoreCacheException("Interrupted while waiting to retry score cache update", e);
        }
    }
}
