package com.contest.platform.repository.impl;

import com.contest.platform.model.Submission;
import com.contest.platform.repository.SubmissionRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaSubmissionRepositoryImpl implements SubmissionRepository {
    
    private final SubmissionJpaRepository jpaRepository;
    
    @Autowired
    public JpaSubmissionRepositoryImpl(SubmissionJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Submission save(Submission submission) {
        return jpaRepository.save(submission);
    }
    
    @Override
    public Optional<Submission> findById(Long submissionId) {
        return jpaRepository.findById(submissionId);
    }
    
    @Override
    public List<Submission> findScoredOfficialSubmissions(Long participationId, Long taskId) {
        return jpaRepository.findByParticipationIdAndTaskIdAndOfficialTrueAndScoreIsNotNullOrderByTimestampAscIdAsc(
            participationId, taskId);
    }
}
