package com.contest.platform.service;

import com.contest.platform.event.SubmissionScoredEvent;
import com.contest.platform.exception.MalformedScoreDetailsException;
import com.contest.platform.model.Contest;
import com.contest.platform.model.Participation;
import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.model.ScoreHistory;
import com.contest.platform.model.Submission;
import com.contest.platform.model.Task;
import com.contest.platform.repository.impl.ContestJpaRepository;
import com.contest.platform.repository.impl.ParticipationJpaRepository;
import com.contest.platform.repository.impl.ParticipationTaskScoreJpaRepository;
import com.contest.platform.repository.impl.ScoreHistoryJpaRepository;
import com.contest.platform.repository.impl.SubmissionJpaRepository;
import com.contest.platform.repository.impl.TaskJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the cache against a real database, so locking, bulk invalidation and
 * the separate row-creation transaction are exercised for real. Not
 * transactional: every service call commits on its own.
 */
@SpringBootTest
@DisplayName("ScoreCacheService against H2")
class ScoreCacheServiceIntegrationTest {

    private static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private ScoreCacheService scoreCacheService;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ContestJpaRepository contestJpaRepository;

    @Autowired
    private ParticipationJpaRepository participationJpaRepository;

    @Autowired
    private TaskJpaRepository taskJpaRepository;

    @Autowired
    private SubmissionJpaRepository submissionJpaRepository;

    @Autowired
    private ParticipationTaskScoreJpaRepository scoreJpaRepository;

    @Autowired
    private ScoreHistoryJpaRepository historyJpaRepository;

    private Contest contest;
    private Participation participation;

    @BeforeEach
    void setUp() {
        historyJpaRepository.deleteAllInBatch();
        scoreJpaRepository.deleteAllInBatch();
        submissionJpaRepository.deleteAllInBatch();
        taskJpaRepository.deleteAllInBatch();
        participationJpaRepository.deleteAllInBatch();
        contestJpaRepository.deleteAllInBatch();

        contest = contestJpaRepository.save(Contest.builder().name("spring-round").build());
        participation = newParticipation(contest, 1L);
    }

    private Participation newParticipation(Contest owner, long userId) {
        return participationJpaRepository.save(Participation.builder()
            .contestId(owner.getId())
            .userId(userId)
            .build());
    }

    private Task newTask(String scoreMode, int precision) {
        return taskJpaRepository.save(Task.builder()
            .contestId(contest.getId())
            .name("task-" + scoreMode)
            .scoreMode(scoreMode)
            .scorePrecision(precision)
            .build());
    }

    private Submission submit(Participation owner, Task task, int second, Double score, boolean tokened,
                              List<Map<String, Object>> details) {
        return submissionJpaRepository.save(Submission.builder()
            .participationId(owner.getId())
            .taskId(task.getId())
            .timestamp(BASE.plusSeconds(second))
            .tokened(tokened)
            .score(score)
            .scoreDetails(details)
            .build());
    }

    private Submission submit(Task task, int second, double score) {
        return submit(participation, task, second, score, false, null);
    }

    private static List<Map<String, Object>> subtasks(double first, double second) {
        return List.of(
            Map.of("idx", 1, "score", first),
            Map.of("idx", 2, "score", second));
    }

    private static List<Double> scores(List<ScoreHistory> history) {
        return history.stream().map(ScoreHistory::getScore).toList();
    }

    @Test
    @DisplayName("lookup of a pair without entry builds it from the submissions")
    void getCachedScoreEntry_missingEntry_isBuiltLazily() {
        // Given
        Task task = newTask("max", 2);
        submit(task, 1, 50.0);
        submit(task, 2, 30.0);
        submit(task, 3, 75.666);

        // When
        ParticipationTaskScore entry = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());

        // Then
        assertThat(entry.getScore()).isEqualTo(75.67);
        assertThat(entry.isHasSubmissions()).isTrue();
        assertThat(entry.isStale()).isFalse();
        assertThat(scoreJpaRepository.count()).isEqualTo(1);
        assertThat(scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId())))
            .containsExactly(50.0, 75.67);
    }

    @Test
    @DisplayName("rebuilding twice yields the same score and history")
    void rebuildScoreCache_isIdempotent() {
        // Given
        Task task = newTask("max_tokened_last", 2);
        submit(participation, task, 1, 60.0, true, null);
        submit(participation, task, 2, 80.0, false, null);
        submit(participation, task, 3, 50.0, false, null);

        // When
        ParticipationTaskScore first = scoreCacheService.rebuildScoreCache(participation.getId(), task.getId());
        List<Double> firstHistory = scores(historyJpaRepository
            .findByParticipationIdAndTaskIdOrderByTimestampAscIdAsc(participation.getId(), task.getId()));
        ParticipationTaskScore second = scoreCacheService.rebuildScoreCache(participation.getId(), task.getId());
        List<Double> secondHistory = scores(historyJpaRepository
            .findByParticipationIdAndTaskIdOrderByTimestampAscIdAsc(participation.getId(), task.getId()));

        // Then
        assertThat(first.getScore()).isEqualTo(60.0);
        assertThat(second.getScore()).isEqualTo(first.getScore());
        assertThat(second.getMaxTokenedScore()).isEqualTo(60.0);
        assertThat(second.getLastSubmissionScore()).isEqualTo(50.0);
        assertThat(firstHistory).containsExactly(60.0, 80.0, 60.0);
        assertThat(secondHistory).isEqualTo(firstHistory);
    }

    @Test
    @DisplayName("in-order incremental updates match a full rebuild, history included")
    void updateScoreCache_inOrder_matchesRebuild() {
        // Given
        Task task = newTask("max_subtask", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        List<Submission> submissions = List.of(
            submit(participation, task, 1, 30.0, false, subtasks(30.0, 0.0)),
            submit(participation, task, 2, 25.0, false, subtasks(0.0, 25.0)),
            submit(participation, task, 3, 40.0, false, subtasks(20.0, 20.0)),
            submit(participation, task, 4, 0.0, false, null));

        // When
        submissions.forEach(scoreCacheService::updateScoreCache);
        ParticipationTaskScore incremental = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        List<Double> incrementalHistory = scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId()));
        ParticipationTaskScore rebuilt = scoreCacheService.rebuildScoreCache(participation.getId(), task.getId());
        List<Double> rebuiltHistory = scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId()));

        // Then
        assertThat(incremental.isHistoryValid()).isTrue();
        assertThat(incremental.getScore()).isEqualTo(55.0).isEqualTo(rebuilt.getScore());
        assertThat(incremental.getSubtaskMaxScores()).isEqualTo(Map.of("1", 30.0, "2", 25.0));
        assertThat(incrementalHistory).containsExactly(30.0, 55.0).isEqualTo(rebuiltHistory);
    }

    @Test
    @DisplayName("shuffled incremental updates give the rebuilt score in every mode")
    void updateScoreCache_anyOrder_matchesRebuild() {
        Random random = new Random(7);
        for (String mode : List.of("max", "max_subtask", "max_tokened_last")) {
            // Given
            Task task = newTask(mode, 1);
            scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
            List<Submission> submissions = new ArrayList<>(List.of(
                submit(participation, task, 1, 33.3, true, subtasks(33.3, 0.0)),
                submit(participation, task, 2, 50.0, false, subtasks(10.0, 40.0)),
                submit(participation, task, 3, 12.5, false, subtasks(12.5, 0.0)),
                submit(participation, task, 4, 20.0, true, subtasks(0.0, 20.0)),
                submit(participation, task, 5, 45.0, false, subtasks(5.0, 40.0))));
            Collections.shuffle(submissions, random);

            // When
            submissions.forEach(scoreCacheService::updateScoreCache);
            double incremental = scoreJpaRepository
                .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow().getScore();
            double rebuilt = scoreCacheService.rebuildScoreCache(participation.getId(), task.getId()).getScore();

            // Then
            assertThat(incremental).as("mode %s", mode).isEqualTo(rebuilt);
        }
    }

    @Test
    @DisplayName("an out-of-order submission invalidates the history until it is regenerated")
    void updateScoreCache_outOfOrder_marksHistoryInvalid() {
        // Given
        Task task = newTask("max", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        Submission early = submit(task, 1, 70.0);
        Submission late = submit(task, 2, 40.0);

        // When
        scoreCacheService.updateScoreCache(late);
        scoreCacheService.updateScoreCache(early);

        // Then
        ParticipationTaskScore entry = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(entry.getScore()).isEqualTo(70.0);
        assertThat(entry.isHistoryValid()).isFalse();
        assertThat(entry.getLastSubmissionId()).isEqualTo(late.getId());
        assertThat(scoreCacheService.findEntriesWithInvalidHistory(10)).hasSize(1);

        List<ScoreHistory> history = scoreCacheService.getScoreHistory(participation.getId(), task.getId());
        assertThat(scores(history)).containsExactly(70.0);
        assertThat(history.get(0).getSubmissionId()).isEqualTo(early.getId());
        assertThat(scoreJpaRepository.findByParticipationIdAndTaskId(participation.getId(), task.getId())
            .orElseThrow().isHistoryValid()).isTrue();
    }

    @Test
    @DisplayName("unofficial and unscored submissions leave the cache untouched")
    void updateScoreCache_ignoresUnofficialAndUnscored() {
        // Given
        Task task = newTask("max", 2);
        Submission unscored = submit(participation, task, 1, null, false, null);
        Submission unofficial = submissionJpaRepository.save(Submission.builder()
            .participationId(participation.getId())
            .taskId(task.getId())
            .timestamp(BASE.plusSeconds(2))
            .official(false)
            .score(100.0)
            .build());

        // When
        scoreCacheService.updateScoreCache(unscored);
        scoreCacheService.updateScoreCache(unofficial);

        // Then
        assertThat(scoreJpaRepository.count()).isZero();
        ParticipationTaskScore entry = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        assertThat(entry.getScore()).isZero();
        assertThat(entry.isHasSubmissions()).isFalse();
    }

    @Test
    @DisplayName("invalidation drops history and the next read picks up rescored submissions")
    void invalidateScoreCache_thenLookupRebuilds() {
        // Given
        Task task = newTask("max", 2);
        submit(task, 1, 40.0);
        Submission best = submit(task, 2, 90.0);
        assertThat(scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId()).getScore())
            .isEqualTo(90.0);
        best.setScore(null);
        submissionJpaRepository.save(best);

        // When
        int invalidated = scoreCacheService.invalidateScoreCache(participation.getId(), null, null);

        // Then
        assertThat(invalidated).isEqualTo(1);
        ParticipationTaskScore stale = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(stale.isStale()).isTrue();
        assertThat(stale.getInvalidatedAt()).isNotNull();
        assertThat(historyJpaRepository.count()).isZero();

        ParticipationTaskScore rebuilt = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        assertThat(rebuilt.getScore()).isEqualTo(40.0);
        assertThat(rebuilt.isStale()).isFalse();
        assertThat(scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId())))
            .containsExactly(40.0);
    }

    @Test
    @DisplayName("invalidation without underlying changes rebuilds to the same score")
    void invalidateScoreCache_unchangedSubmissions_sameScore() {
        // Given
        Task task = newTask("max_subtask", 2);
        submit(participation, task, 1, 30.0, false, subtasks(30.0, 0.0));
        submit(participation, task, 2, 25.0, false, subtasks(0.0, 25.0));
        ParticipationTaskScore before = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());

        // When
        scoreCacheService.invalidateScoreCache(participation.getId(), task.getId(), null);
        ParticipationTaskScore after = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());

        // Then
        assertThat(after.getScore()).isEqualTo(before.getScore()).isEqualTo(55.0);
        assertThat(after.getSubtaskMaxScores()).isEqualTo(Map.of("1", 30.0, "2", 25.0));
        assertThat(after.getInvalidatedAt()).isNull();
        assertThat(scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId())))
            .containsExactly(30.0, 55.0);
    }

    @Test
    @DisplayName("contest invalidation only reaches participations of that contest")
    void invalidateScoreCache_contestScope() {
        // Given
        Task task = newTask("max", 0);
        Participation teammate = newParticipation(contest, 2L);
        Contest other = contestJpaRepository.save(Contest.builder().name("other-round").build());
        Participation outsider = newParticipation(other, 3L);
        for (Participation p : List.of(participation, teammate, outsider)) {
            submit(p, task, 1, 10.0, false, null);
            scoreCacheService.getCachedScoreEntry(p.getId(), task.getId());
        }

        // When
        int invalidated = scoreCacheService.invalidateScoreCache(null, null, contest.getId());

        // Then
        assertThat(invalidated).isEqualTo(2);
        assertThat(scoreJpaRepository.findByParticipationIdAndTaskId(outsider.getId(), task.getId())
            .orElseThrow().isStale()).isFalse();
        assertThat(historyJpaRepository.findByParticipationIdAndTaskIdOrderByTimestampAscIdAsc(
            outsider.getId(), task.getId())).hasSize(1);
        assertThat(scoreJpaRepository.findByParticipationIdAndTaskId(teammate.getId(), task.getId())
            .orElseThrow().isStale()).isTrue();
    }

    @Test
    @DisplayName("ensureValidHistory repairs stale and invalid-history entries once")
    void ensureValidHistory_repairsContest() {
        // Given
        Task task = newTask("max", 2);
        Participation teammate = newParticipation(contest, 2L);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        Submission early = submit(participation, task, 1, 20.0, false, null);
        Submission late = submit(participation, task, 2, 10.0, false, null);
        scoreCacheService.updateScoreCache(late);
        scoreCacheService.updateScoreCache(early);
        submit(teammate, task, 1, 35.0, false, null);
        scoreCacheService.getCachedScoreEntry(teammate.getId(), task.getId());
        scoreCacheService.invalidateScoreCache(teammate.getId(), task.getId(), null);

        // When
        boolean firstPass = scoreCacheService.ensureValidHistory(contest.getId());
        boolean secondPass = scoreCacheService.ensureValidHistory(contest.getId());

        // Then
        assertThat(firstPass).isTrue();
        assertThat(secondPass).isFalse();
        assertThat(scoreJpaRepository.findAll())
            .allSatisfy(entry -> {
                assertThat(entry.isStale()).isFalse();
                assertThat(entry.isHistoryValid()).isTrue();
            });
        assertThat(scores(scoreCacheService.getContestScoreHistory(contest.getId())))
            .containsExactly(20.0, 35.0);
    }

    @Test
    @DisplayName("scored-submission events update the cache")
    void submissionScoredEvent_updatesCache() {
        // Given
        Task task = newTask("max", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        Submission submission = submit(task, 1, 64.0);

        // When
        eventPublisher.publishEvent(new SubmissionScoredEvent(submission.getId()));

        // Then
        ParticipationTaskScore entry = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(entry.getScore()).isEqualTo(64.0);
        assertThat(entry.getLastSubmissionId()).isEqualTo(submission.getId());
        assertThat(entry.isStale()).isFalse();
    }

    @Test
    @DisplayName("an event published inside a transaction is applied only after it commits")
    void submissionScoredEvent_insideTransaction_appliedAfterCommit() {
        // Given
        Task task = newTask("max", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        TransactionTemplate grading = new TransactionTemplate(transactionManager);

        // When
        Submission submission = grading.execute(status -> {
            Submission scored = submit(task, 1, 64.0);
            eventPublisher.publishEvent(new SubmissionScoredEvent(scored.getId()));
            assertThat(scoreJpaRepository.findByParticipationIdAndTaskId(participation.getId(), task.getId())
                .orElseThrow().getScore()).isZero();
            return scored;
        });

        // Then
        ParticipationTaskScore entry = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(entry.getScore()).isEqualTo(64.0);
        assertThat(entry.getLastSubmissionId()).isEqualTo(submission.getId());
        assertThat(scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId())))
            .containsExactly(64.0);
    }

    @Test
    @DisplayName("an event published inside a transaction that rolls back is never applied")
    void submissionScoredEvent_rolledBackTransaction_leavesCacheUntouched() {
        // Given
        Task task = newTask("max", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        TransactionTemplate grading = new TransactionTemplate(transactionManager);

        // When
        grading.executeWithoutResult(status -> {
            Submission scored = submit(task, 1, 64.0);
            eventPublisher.publishEvent(new SubmissionScoredEvent(scored.getId()));
            status.setRollbackOnly();
        });

        // Then
        assertThat(submissionJpaRepository.count()).isZero();
        ParticipationTaskScore entry = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(entry.getScore()).isZero();
        assertThat(entry.isHasSubmissions()).isFalse();
        assertThat(historyJpaRepository.count()).isZero();
    }

    @Test
    @DisplayName("an incremental update into a newly created row leaves it stale until a lookup rebuilds it")
    void updateScoreCache_newRow_isRebuiltOnLookup() {
        // Given
        Task task = newTask("max_subtask", 2);
        submit(participation, task, 1, 80.0, false, subtasks(80.0, 0.0));
        Submission latest = submit(participation, task, 2, 10.0, false, subtasks(0.0, 10.0));

        // When
        scoreCacheService.updateScoreCache(latest);

        // Then
        ParticipationTaskScore partial = scoreJpaRepository
            .findByParticipationIdAndTaskId(participation.getId(), task.getId()).orElseThrow();
        assertThat(partial.getScore()).isEqualTo(10.0);
        assertThat(partial.isStale()).isTrue();
        assertThat(historyJpaRepository.count()).isZero();

        ParticipationTaskScore entry = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        assertThat(entry.getScore()).isEqualTo(90.0);
        assertThat(entry.isStale()).isFalse();
        assertThat(scores(scoreCacheService.getScoreHistory(participation.getId(), task.getId())))
            .containsExactly(80.0, 90.0);
    }

    @Test
    @DisplayName("a rebuild aborted by malformed score details leaves no valid entry behind")
    void getCachedScoreEntry_malformedDetails_leavesEntryStale() {
        // Given
        Task task = newTask("max_subtask", 2);
        submit(participation, task, 1, 40.0, false, subtasks(40.0, 0.0));
        submit(participation, task, 2, 10.0, false, List.of(Map.of("score", 10.0)));

        // When & Then
        assertThatThrownBy(() -> scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId()))
            .isInstanceOf(MalformedScoreDetailsException.class);
        assertThat(scoreJpaRepository.findByParticipationIdAndTaskId(participation.getId(), task.getId()))
            .hasValueSatisfying(entry -> assertThat(entry.isStale()).isTrue());
        assertThat(historyJpaRepository.count()).isZero();
        assertThatThrownBy(() -> scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId()))
            .isInstanceOf(MalformedScoreDetailsException.class);
    }

    @Test
    @DisplayName("concurrent updates of one pair serialize on the row lock")
    void updateScoreCache_concurrentUpdates() throws Exception {
        // Given
        Task task = newTask("max_subtask", 2);
        scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        List<Submission> submissions = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            submissions.add(submit(participation, task, i + 1, i * 2.0, false, subtasks(i, i)));
        }

        // When
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> updates = new ArrayList<>();
            for (Submission submission : submissions) {
                updates.add(() -> {
                    eventPublisher.publishEvent(new SubmissionScoredEvent(submission.getId()));
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(updates)) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }

        // Then
        ParticipationTaskScore entry = scoreCacheService.getCachedScoreEntry(participation.getId(), task.getId());
        assertThat(entry.getScore()).isEqualTo(22.0);
        assertThat(entry.getLastSubmissionId()).isEqualTo(submissions.get(11).getId());
        assertThat(scoreCacheService.rebuildScoreCache(participation.getId(), task.getId()).getScore())
            .isEqualTo(22.0);
    }
}
