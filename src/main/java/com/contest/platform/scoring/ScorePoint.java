package com.contest.platform.scoring;

import lombok.Value;

import java.time.Instant;

/**
 * The rounded task score right after the given submission was folded in.
 */
@Value
public class ScorePoint {
    Long submissionId;
    Instant timestamp;
    double score;
}
