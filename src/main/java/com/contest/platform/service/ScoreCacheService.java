package com.contest.platform.service;

import com.contest.platform.exception.InvalidRequestException;
import com.contest.platform.exception.ResourceNotFoundException;
import com.contest.platform.exception.ScoreCacheException;
import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.model.ScoreHistory;
import com.contest.platform.model.ScoreMode;
import com.contest.platform.model.Submission;
import com.contest.platform.model.Task;
import com.contest.platform.repository.ContestRepository;
import com.contest.platform.repository.ParticipationRepository;
import com.contest.platform.repository.ScoreCacheRepository;
import com.contest.platform.repository.ScoreHistoryRepository;
import com.contest.platform.repository.SubmissionRepository;
import com.contest.platform.repository.TaskRepository;
import com.contest.platform.scoring.ScoreAccumulator;
import com.contest.platform.scoring.ScoreAggregator;
import com.contest.platform.scoring.ScoreFact;
import com.contest.platform.scoring.ScoreTimeline;
import com.contest.platform.scoring.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the cached task score of each (participation, task) pair.
 *
 * <p>Every write path runs in one transaction holding the row lock of the
 * cache entry, so concurrent graders, admin invalidations and rebuilds of the
 * same pair serialize. Reading a valid entry takes no lock. The caller owns
 * retries on lock contention ({@link org.springframework.dao.PessimisticLockingFailureException}).
 */
@Service
public class ScoreCacheService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreCacheService.class);

    private final ScoreCacheRepository scoreCacheRepository;
    private final ScoreHistoryRepository scoreHistoryRepository;
    private final SubmissionRepository submissionRepository;
    private final ParticipationRepository participationRepository;
    private final TaskRepository taskRepository;
    private final ContestRepository contestRepository;
    private final ScoreCacheEntryInitializer entryInitializer;

    @Autowired
    public ScoreCacheService(
            ScoreCacheRepository scoreCacheRepository,
            ScoreHistoryRepository scoreHistoryRepository,
            SubmissionRepository submissionRepository,
            ParticipationRepository participationRepository,
            TaskRepository taskRepository,
            ContestRepository contestRepository,
            ScoreCacheEntryInitializer entryInitializer) {
        this.scoreCacheRepository = scoreCacheRepository;
        this.scoreHistoryRepository = scoreHistoryRepository;
        this.submissionRepository = submissionRepository;
        this.participationRepository = participationRepository;
        this.taskRepository = taskRepository;
        this.contestRepository = contestRepository;
        this.entryInitializer = entryInitializer;
    }

    /**
     * Get the cached score entry of a pair, rebuilding it first when it is
     * missing or stale. A valid entry is returned as is, without recomputation.
     */
    @Transactional
    public ParticipationTaskScore getCachedScoreEntry(Long participationId, Long taskId) {
        validateIds(participationId, taskId);
        Optional<ParticipationTaskScore> cached = scoreCacheRepository.findByParticipationIdAndTaskId(participationId, taskId);
        if (cached.isPresent() && !cached.get().isStale()) {
            return cached.get();
        }

        logger.debug("Score cache for participation {} task {} is {}, rebuilding",
            participationId, taskId, cached.isPresent() ? "stale" : "missing");
        return rebuildScoreCache(participationId, taskId);
    }

    /**
     * Fold a newly scored submission into the cache of its pair, without
     * looking at the other submissions of the pair.
     */
    @Transactional
    public void updateScoreCache(Submission submission) {
        if (submission == null) {
            throw new InvalidRequestException("Submission cannot be null");
        }
        if (!submission.isOfficial() || !submission.isScored()) {
            logger.debug("Skipping score cache update for submission {} (official={}, scored={})",
                submission.getId(), submission.isOfficial(), submission.isScored());
            return;
        }

        Long participationId = submission.getParticipationId();
        Long taskId = submission.getTaskId();
        validateIds(participationId, taskId);
        ScoringConfig config = loadScoringConfig(taskId);
        ScoreFact fact = ScoreFact.fromSubmission(submission);

        ParticipationTaskScore entry = lockEntry(participationId, taskId);
        ScoreAccumulator state = ScoreAccumulator.restore(entry);
        boolean outOfOrder = fact.precedes(state.getLastSubmissionTimestamp(), state.getLastSubmissionId());

        ScoreAggregator.fold(state, fact, config.getMode());
        double score = ScoreAggregator.aggregate(state, config.getMode(), config.getPrecision());
        applyState(entry, state, score, config.getMode());
        entry.setLastUpdate(Instant.now());

        if (outOfOrder) {
            if (entry.isHistoryValid()) {
                logger.info("Submission {} arrived out of order for participation {} task {}, history marked invalid",
                    submission.getId(), participationId, taskId);
            }
            entry.setHistoryValid(false);
        } else if (entry.isStale()) {
            logger.debug("Score cache for participation {} task {} is stale, next read rebuilds it",
                participationId, taskId);
        } else if (entry.isHistoryValid()) {
            appendHistoryIfChanged(entry, fact, score);
        }

        scoreCacheRepository.save(entry);
        logger.debug("Updated score cache for participation {} task {} with submission {}: score={}",
            participationId, taskId, submission.getId(), score);
    }

    /**
     * Mark every entry in scope as stale and drop its history. Filters are
     * combined; at least one must be given. Nothing is recomputed here, the
     * next read rebuilds.
     *
     * @return the number of entries invalidated
     */
    @Transactional
    public int invalidateScoreCache(Long participationId, Long taskId, Long contestId) {
        if (participationId == null && taskId == null && contestId == null) {
            throw new InvalidRequestException("At least one of participationId, taskId or contestId must be provided");
        }

        Instant now = Instant.now();
        List<Long> participationIds = resolveParticipationScope(participationId, contestId);
        int invalidated;

        // Cache rows first: the UPDATE waits on row locks held by running rebuilds,
        // so the history DELETE then also sees what they wrote.
        if (participationIds == null) {
            invalidated = scoreCacheRepository.invalidateByTaskId(taskId, now);
            scoreHistoryRepository.deleteByTaskId(taskId);
        } else if (participationIds.isEmpty()) {
            invalidated = 0;
        } else if (taskId != null) {
            invalidated = scoreCacheRepository.invalidateByParticipationIdsAndTaskId(participationIds, taskId, now);
            scoreHistoryRepository.deleteByParticipationIdsAndTaskId(participationIds, taskId);
        } else {
            invalidated = scoreCacheRepository.invalidateByParticipationIds(participationIds, now);
            scoreHistoryRepository.deleteByParticipationIds(participationIds);
        }

        logger.info("Invalidated {} score cache entries (participationId={}, taskId={}, contestId={})",
            invalidated, participationId, taskId, contestId);
        return invalidated;
    }

    /**
     * Recompute the entry and its history from all scored submissions of the pair.
     */
    @Transactional
    public ParticipationTaskScore rebuildScoreCache(Long participationId, Long taskId) {
        validateIds(participationId, taskId);
        participationRepository.findById(participationId)
            .orElseThrow(() -> ResourceNotFoundException.participation(participationId));
        ScoringConfig config = loadScoringConfig(taskId);

        ParticipationTaskScore entry = lockEntry(participationId, taskId);
        ScoreTimeline timeline = replaySubmissions(participationId, taskId, config);
        replaceHistory(participationId, taskId, timeline);

        applyState(entry, timeline.getState(), timeline.getFinalScore(), config.getMode());
        entry.setScoreValid(true);
        entry.setHistoryValid(true);
        entry.setInvalidatedAt(null);
        entry.setLastUpdate(Instant.now());
        ParticipationTaskScore saved = scoreCacheRepository.save(entry);

        logger.info("Rebuilt score cache for participation {} task {}: score={}, historyPoints={}",
            participationId, taskId, saved.getScore(), timeline.getChanges().size());
        return saved;
    }

    /**
     * Regenerate only the history of a pair, leaving the cached score alone.
     * An entry found stale once locked is rebuilt entirely.
     *
     * @return false when the pair has no cache entry
     */
    @Transactional
    public boolean rebuildScoreHistory(Long participationId, Long taskId) {
        validateIds(participationId, taskId);
        Optional<ParticipationTaskScore> locked = scoreCacheRepository.findForUpdate(participationId, taskId);
        if (locked.isEmpty()) {
            return false;
        }

        ParticipationTaskScore entry = locked.get();
        if (entry.isStale()) {
            rebuildScoreCache(participationId, taskId);
            return true;
        }

        ScoringConfig config = loadScoringConfig(taskId);
        ScoreTimeline timeline = replaySubmissions(participationId, taskId, config);
        replaceHistory(participationId, taskId, timeline);

        entry.setHistoryValid(true);
        entry.setLastUpdate(Instant.now());
        scoreCacheRepository.save(entry);

        logger.info("Rebuilt score history for participation {} task {}: historyPoints={}",
            participationId, taskId, timeline.getChanges().size());
        return true;
    }

    /**
     * Bring every cache entry of a contest to a state where its history can be
     * shown: stale entries are rebuilt, entries with invalid history get their
     * history regenerated. Pairs are processed in (participation, task) order
     * so concurrent callers lock rows in the same order.
     *
     * @return whether anything was rebuilt
     */
    @Transactional
    public boolean ensureValidHistory(Long contestId) {
        if (contestId == null) {
            throw new InvalidRequestException("ContestId cannot be null");
        }
        if (!contestRepository.existsById(contestId)) {
            throw ResourceNotFoundException.contest(contestId);
        }

        List<Long> participationIds = participationRepository.findIdsByContestId(contestId);
        List<ParticipationTaskScore> entries = scoreCacheRepository.findByParticipationIds(participationIds);
        List<ParticipationTaskScore> staleEntries = entries.stream()
            .filter(ParticipationTaskScore::isStale)
            .toList();
        List<ParticipationTaskScore> invalidHistoryEntries = entries.stream()
            .filter(entry -> !entry.isStale() && !entry.isHistoryValid())
            .toList();

        for (ParticipationTaskScore entry : staleEntries) {
            rebuildScoreCache(entry.getParticipationId(), entry.getTaskId());
        }
        for (ParticipationTaskScore entry : invalidHistoryEntries) {
            rebuildScoreHistory(entry.getParticipationId(), entry.getTaskId());
        }

        if (!staleEntries.isEmpty() || !invalidHistoryEntries.isEmpty()) {
            logger.info("Contest {}: rebuilt {} stale entries and {} histories",
                contestId, staleEntries.size(), invalidHistoryEntries.size());
            return true;
        }
        return false;
    }

    /**
     * History of a pair in timestamp order, regenerated first if it is not trustworthy.
     */
    @Transactional
    public List<ScoreHistory> getScoreHistory(Long participationId, Long taskId) {
        ParticipationTaskScore entry = getCachedScoreEntry(participationId, taskId);
        if (!entry.isHistoryValid()) {
            rebuildScoreHistory(participationId, taskId);
        }
        return scoreHistoryRepository.findByParticipationIdAndTaskId(participationId, taskId);
    }

    @Transactional
    public List<ScoreHistory> getContestScoreHistory(Long contestId) {
        ensureValidHistory(contestId);
        return scoreHistoryRepository.findByParticipationIds(participationRepository.findIdsByContestId(contestId));
    }

    @Transactional(readOnly = true)
    public List<ParticipationTaskScore> findEntriesWithInvalidHistory(int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        return scoreCacheRepository.findWithInvalidHistory(limit);
    }

    private void validateIds(Long participationId, Long taskId) {
        if (participationId == null) {
            throw new InvalidRequestException("ParticipationId cannot be null");
        }
        if (taskId == null) {
            throw new InvalidRequestException("TaskId cannot be null");
        }
    }

    private ScoringConfig loadScoringConfig(Long taskId) {
        Task task = taskRepository.findById(taskId)
            .orElseThrow(() -> ResourceNotFoundException.task(taskId));
        return ScoringConfig.of(task);
    }

    /**
     * Participations matched by the participation and contest filters; null
     * when neither is given (no restriction on participations).
     */
    private List<Long> resolveParticipationScope(Long participationId, Long contestId) {
        if (contestId == null) {
            return participationId == null ? null : List.of(participationId);
        }
        if (!contestRepository.existsById(contestId)) {
            throw ResourceNotFoundException.contest(contestId);
        }
        List<Long> contestParticipationIds = participationRepository.findIdsByContestId(contestId);
        if (participationId == null) {
            return contestParticipationIds;
        }
        return contestParticipationIds.contains(participationId) ? List.of(participationId) : List.of();
    }

    private ParticipationTaskScore lockEntry(Long participationId, Long taskId) {
        Optional<ParticipationTaskScore> existing = scoreCacheRepository.findForUpdate(participationId, taskId);
        if (existing.isPresent()) {
            return existing.get();
        }

        entryInitializer.createIfAbsent(participationId, taskId);
        return scoreCacheRepository.findForUpdate(participationId, taskId)
            .orElseThrow(() -> new ScoreCacheException(
                "Score cache entry for participation " + participationId + " task " + taskId + " could not be created"));
    }

    private ScoreTimeline replaySubmissions(Long participationId, Long taskId, ScoringConfig config) {
        List<ScoreFact> facts = submissionRepository.findScoredOfficialSubmissions(participationId, taskId).stream()
            .map(ScoreFact::fromSubmission)
            .toList();
        return ScoreAggregator.replay(facts, config.getMode(), config.getPrecision());
    }

    private void replaceHistory(Long participationId, Long taskId, ScoreTimeline timeline) {
        scoreHistoryRepository.deleteByParticipationIdAndTaskId(participationId, taskId);
        List<ScoreHistory> history = timeline.getChanges().stream()
            .map(point -> ScoreHistory.builder()
                .participationId(participationId)
                .taskId(taskId)
                .timestamp(point.getTimestamp())
                .score(point.getScore())
                .submissionId(point.getSubmissionId())
                .build())
            .toList();
        if (!history.isEmpty()) {
            scoreHistoryRepository.saveAll(history);
        }
    }

    private void appendHistoryIfChanged(ParticipationTaskScore entry, ScoreFact fact, double score) {
        double previous = scoreHistoryRepository.findLatest(entry.getParticipationId(), entry.getTaskId())
            .map(ScoreHistory::getScore)
            .orElse(0.0);
        if (Double.compare(previous, score) == 0) {
            return;
        }
        scoreHistoryRepository.save(ScoreHistory.builder()
            .participationId(entry.getParticipationId())
            .taskId(entry.getTaskId())
            .timestamp(fact.getTimestamp())
            .score(score)
            .submissionId(fact.getSubmissionId())
            .build());
    }

    private void applyState(ParticipationTaskScore entry, ScoreAccumulator state, double score, ScoreMode mode) {
        entry.setScore(score);
        entry.setSubtaskMaxScores(mode == ScoreMode.MAX_SUBTASK ? state.subtaskMaxScoresOrNull() : null);
        entry.setMaxTokenedScore(state.getMaxTokenedScore());
        entry.setLastSubmissionScore(state.getLastSubmissionScore());
        entry.setLastSubmissionTimestamp(state.getLastSubmissionTimestamp());
        entry.setLastSubmissionId(state.getLastSubmissionId());
        entry.setHasSubmissions(state.isHasSubmissions());
    }
}
