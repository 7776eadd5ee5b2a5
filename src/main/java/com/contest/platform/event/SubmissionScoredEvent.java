package com.contest.platform.event;

import lombok.Value;

/**
 * Published by the evaluation pipeline once a submission result has been committed.
 */
@Value
public class SubmissionScoredEvent {
    Long submissionId;
}
