package com.contest.platform.scoring;

import lombok.Value;

import java.util.List;

/**
 * Result of replaying a full submission sequence: the final state plus the
 * points where the rounded score changed.
 */
@Value
public class ScoreTimeline {
    ScoreAccumulator state;
    double finalScore;
    List<ScorePoint> changes;
}
