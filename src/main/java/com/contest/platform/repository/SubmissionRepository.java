package com.contest.platform.repository;

import com.contest.platform.model.Submission;

import java.util.List;
import java.util.Optional;

public interface SubmissionRepository {
    Submission save(Submission submission);
    Optional<Submission> findById(Long submissionId);

    /**
     * Official submissions with a score, by timestamp then id.
     */
    List<Submission> findScoredOfficialSubmissions(Long participationId, Long taskId);
}
