package com.contest.platform.scoring;

import com.contest.platform.model.ScoreMode;
import com.contest.platform.model.Task;
import lombok.Value;

/**
 * Validated scoring configuration of a task.
 */
@Value
public class ScoringConfig {
    ScoreMode mode;
    int precision;

    public static ScoringConfig of(Task task) {
        return new ScoringConfig(
            ScoreMode.fromConfig(task.getScoreMode()),
            ScoreAggregator.validatePrecision(task.getScorePrecision()));
    }
}
