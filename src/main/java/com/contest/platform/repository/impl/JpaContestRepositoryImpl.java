package com.contest.platform.repository.impl;

import com.contest.platform.model.Contest;
import com.contest.platform.repository.ContestRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JpaContestRepositoryImpl implements ContestRepository {
    
    private final ContestJpaRepository jpaRepository;
    
    @Autowired
    public JpaContestRepositoryImpl(ContestJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Contest save(Contest contest) {
        return jpaRepository.save(contest);
    }
    
    @Override
    public boolean existsById(Long contestId) {
        return jpaRepository.existsById(contestId);
    }
}
