package com.contest.platform.repository;

import com.contest.platform.model.ParticipationTaskScore;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ScoreCacheRepository {
    Optional<ParticipationTaskScore> findByParticipationIdAndTaskId(Long participationId, Long taskId);

    /**
     * Load the entry holding a row-level write lock until the current transaction ends.
     */
    Optional<ParticipationTaskScore> findForUpdate(Long participationId, Long taskId);

    ParticipationTaskScore save(ParticipationTaskScore entry);

    /**
     * Insert and flush immediately so a concurrent duplicate surfaces as a
     * unique-constraint violation.
     */
    ParticipationTaskScore create(ParticipationTaskScore entry);

    List<ParticipationTaskScore> findByParticipationIds(Collection<Long> participationIds);
    List<ParticipationTaskScore> findWithInvalidHistory(int limit);

    int invalidateByParticipationIds(Collection<Long> participationIds, Instant invalidatedAt);
    int invalidateByParticipationIdsAndTaskId(Collection<Long> participationIds, Long taskId, Instant invalidatedAt);
    int invalidateByTaskId(Long taskId, Instant invalidatedAt);
}
