package com.contest.platform.repository;

import com.contest.platform.model.ScoreHistory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ScoreHistoryRepository {
    List<ScoreHistory> findByParticipationIdAndTaskId(Long participationId, Long taskId);
    List<ScoreHistory> findByParticipationIds(Collection<Long> participationIds);
    Optional<ScoreHistory> findLatest(Long participationId, Long taskId);
    ScoreHistory save(ScoreHistory scoreHistory);
    List<ScoreHistory> saveAll(List<ScoreHistory> scoreHistory);

    int deleteByParticipationIdAndTaskId(Long participationId, Long taskId);
    int deleteByParticipationIds(Collection<Long> participationIds);
    int deleteByParticipationIdsAndTaskId(Collection<Long> participationIds, Long taskId);
    int deleteByTaskId(Long taskId);
}
