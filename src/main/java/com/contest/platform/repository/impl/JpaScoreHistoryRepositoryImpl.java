package com.contest.platform.repository.impl;

import com.contest.platform.model.ScoreHistory;
import com.contest.platform.repository.ScoreHistoryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaScoreHistoryRepositoryImpl implements ScoreHistoryRepository {
    
    private final ScoreHistoryJpaRepository jpaRepository;
    
    @Autowired
    public JpaScoreHistoryRepositoryImpl(ScoreHistoryJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public List<ScoreHistory> findByParticipationIdAndTaskId(Long participationId, Long taskId) {
        return jpaRepository.findByParticipationIdAndTaskIdOrderByTimestampAscIdAsc(participationId, taskId);
    }
    
    @Override
    public List<ScoreHistory> findByParticipationIds(Collection<Long> participationIds) {
        if (participationIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findByParticipationIdInOrderByParticipationIdAscTaskIdAscTimestampAscIdAsc(participationIds);
    }
    
    @Override
    public Optional<ScoreHistory> findLatest(Long participationId, Long taskId) {
        return jpaRepository.findFirstByParticipationIdAndTaskIdOrderByTimestampDescIdDesc(participationId, taskId);
    }
    
    @Override
    public ScoreHistory save(ScoreHistory scoreHistory) {
        return jpaRepository.save(scoreHistory);
    }
    
    @Override
    public List<ScoreHistory> saveAll(List<ScoreHistory> scoreHistory) {
        return jpaRepository.saveAll(scoreHistory);
    }
    
    @Override
    public int deleteByParticipationIdAndTaskId(Long participationId, Long taskId) {
        return jpaRepository.deleteByParticipationIdAndTaskId(participationId, taskId);
    }
    
    @Override
    public int deleteByParticipationIds(Collection<Long> participationIds) {
        if (participationIds.isEmpty()) {
            return 0;
        }
        return jpaRepository.deleteByParticipationIds(participationIds);
    }
    
    @Override
    public int deleteByParticipationIdsAndTaskId(Collection<Long> participationIds, Long taskId) {
        if (participationIds.isEmpty()) {
            return 0;
        }
        return jpaRepository.deleteByParticipationIdsAndTaskId(participationIds, taskId);
    }
    
    @Override
    public int deleteByTaskId(Long taskId) {
        return jpaRepository.deleteByTaskId(taskId);
    }
}
