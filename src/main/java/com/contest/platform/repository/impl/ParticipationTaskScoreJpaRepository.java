package com.contest.platform.repository.impl;

import com.contest.platform.model.ParticipationTaskScore;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ParticipationTaskScoreJpaRepository extends JpaRepository<ParticipationTaskScore, Long> {
    Optional<ParticipationTaskScore> findByParticipationIdAndTaskId(Long participationId, Long taskId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ParticipationTaskScore s WHERE s.participationId = :participationId AND s.taskId = :taskId")
    Optional<ParticipationTaskScore> findByParticipationIdAndTaskIdForUpdate(
            @Param("participationId") Long participationId,
            @Param("taskId") Long taskId);

    List<ParticipationTaskScore> findByParticipationIdInOrderByParticipationIdAscTaskIdAsc(Collection<Long> participationIds);

    @Query("SELECT s FROM ParticipationTaskScore s WHERE s.historyValid = false "
            + "AND s.scoreValid = true AND s.invalidatedAt IS NULL "
            + "ORDER BY s.participationId, s.taskId")
    List<ParticipationTaskScore> findWithInvalidHistory(Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipationTaskScore s SET s.invalidatedAt = :invalidatedAt, s.scoreValid = false "
            + "WHERE s.participationId IN :participationIds")
    int invalidateByParticipationIds(
            @Param("participationIds") Collection<Long> participationIds,
            @Param("invalidatedAt") Instant invalidatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipationTaskScore s SET s.invalidatedAt = :invalidatedAt, s.scoreValid = false "
            + "WHERE s.participationId IN :participationIds AND s.taskId = :taskId")
    int invalidateByParticipationIdsAndTaskId(
            @Param("participationIds") Collection<Long> participationIds,
            @Param("taskId") Long taskId,
            @Param("invalidatedAt") Instant invalidatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipationTaskScore s SET s.invalidatedAt = :invalidatedAt, s.scoreValid = false "
            + "WHERE s.taskId = :taskId")
    int invalidateByTaskId(
            @Param("taskId") Long taskId,
            @Param("invalidatedAt") Instant invalidatedAt);
}
