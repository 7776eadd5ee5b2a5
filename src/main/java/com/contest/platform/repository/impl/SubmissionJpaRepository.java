package com.contest.platform.repository.impl;

import com.contest.platform.model.Submission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubmissionJpaRepository extends JpaRepository<Submission, Long> {
    List<Submission> findByParticipationIdAndTaskIdAndOfficialTrueAndScoreIsNotNullOrderByTimestampAscIdAsc(
            Long participationId, Long taskId);
}
