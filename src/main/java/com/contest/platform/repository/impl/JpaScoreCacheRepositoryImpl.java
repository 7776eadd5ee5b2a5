package com.contest.platform.repository.impl;

import com.contest.platform.model.ParticipationTaskScore;
import com.contest.platform.repository.ScoreCacheRepository;
import jakarta.persistence.EntityManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaScoreCacheRepositoryImpl implements ScoreCacheRepository {
    
    private final ParticipationTaskScoreJpaRepository jpaRepository;
    private final EntityManager entityManager;
    
    @Autowired
    public JpaScoreCacheRepositoryImpl(ParticipationTaskScoreJpaRepository jpaRepository, EntityManager entityManager) {
        this.jpaRepository = jpaRepository;
        this.entityManager = entityManager;
    }
    
    @Override
    public Optional<ParticipationTaskScore> findByParticipationIdAndTaskId(Long participationId, Long taskId) {
        return jpaRepository.findByParticipationIdAndTaskId(participationId, taskId);
    }
    
    @Override
    public Optional<ParticipationTaskScore> findForUpdate(Long participationId, Long taskId) {
        Optional<ParticipationTaskScore> locked = jpaRepository.findByParticipationIdAndTaskIdForUpdate(participationId, taskId);
        // An instance already managed by this transaction keeps the state it was read with.
        locked.ifPresent(entityManager::refresh);
        return locked;
    }
    
    @Override
    public ParticipationTaskScore save(ParticipationTaskScore entry) {
        return jpaRepository.save(entry);
    }
    
    @Override
    public ParticipationTaskScore create(ParticipationTaskScore entry) {
        return jpaRepository.saveAndFlush(entry);
    }
    
    @Override
    public List<ParticipationTaskScore> findByParticipationIds(Collection<Long> participationIds) {
        if (participationIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findByParticipationIdInOrderByParticipationIdAscTaskIdAsc(participationIds);
    }
    
    @Override
    public List<ParticipationTaskScore> findWithInvalidHistory(int limit) {
        return jpaRepository.findWithInvalidHistory(PageRequest.of(0, limit));
    }
    
    @Override
    public int invalidateByParticipationIds(Collection<Long> participationIds, Instant invalidatedAt) {
        if (participationIds.isEmpty()) {
            return 0;
        }
        return jpaRepository.invalidateByParticipationIds(participationIds, invalidatedAt);
    }
    
    @Override
    public int invalidateByParticipationIdsAndTaskId(Collection<Long> participationIds, Long taskId, Instant invalidatedAt) {
        if (participationIds.isEmpty()) {
            return 0;
        }
        return jpaRepository.invalidateByParticipationIdsAndTaskId(participationIds, taskId, invalidatedAt);
    }
    
    @Override
    public int invalidateByTaskId(Long taskId, Instant invalidatedAt) {
        return jpaRepository.invalidateByTaskId(taskId, invalidatedAt);
    }
}
