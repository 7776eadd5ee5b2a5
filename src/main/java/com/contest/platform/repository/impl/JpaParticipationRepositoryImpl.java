package com.contest.platform.repository.impl;

import com.contest.platform.model.Participation;
import com.contest.platform.repository.ParticipationRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaParticipationRepositoryImpl implements ParticipationRepository {
    
    private final ParticipationJpaRepository jpaRepository;
    
    @Autowired
    public JpaParticipationRepositoryImpl(ParticipationJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Participation save(Participation participation) {
        return jpaRepository.save(participation);
    }
    
    @Override
    public Optional<Participation> findById(Long participationId) {
        return jpaRepository.findById(participationId);
    }
    
    @Override
    public List<Long> findIdsByContestId(Long contestId) {
        return jpaRepository.findIdsByContestId(contestId);
    }
}
