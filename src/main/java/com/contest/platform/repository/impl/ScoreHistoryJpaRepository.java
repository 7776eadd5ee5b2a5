package com.contest.platform.repository.impl;

import com.contest.platform.model.ScoreHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScoreHistoryJpaRepository extends JpaRepository<ScoreHistory, Long> {
    List<ScoreHistory> findByParticipationIdAndTaskIdOrderByTimestampAscIdAsc(Long participationId, Long taskId);

    List<ScoreHistory> findByParticipationIdInOrderByParticipationIdAscTaskIdAscTimestampAscIdAsc(
            Collection<Long> participationIds);

    Optional<ScoreHistory> findFirstByParticipationIdAndTaskIdOrderByTimestampDescIdDesc(Long participationId, Long taskId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ScoreHistory h WHERE h.participationId = :participationId AND h.taskId = :taskId")
    int deleteByParticipationIdAndTaskId(
            @Param("participationId") Long participationId,
            @Param("taskId") Long taskId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ScoreHistory h WHERE h.participationId IN :participationIds")
    int deleteByParticipationIds(@Param("participationIds") Collection<Long> participationIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ScoreHistory h WHERE h.participationId IN :participationIds AND h.taskId = :taskId")
    int deleteByParticipationIdsAndTaskId(
            @Param("participationIds") Collection<Long> participationIds,
            @Param("taskId") Long taskId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ScoreHistory h WHERE h.taskId = :taskId")
    int deleteByTaskId(@Param("taskId") Long taskId);
}
