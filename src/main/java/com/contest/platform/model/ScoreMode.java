package com.contest.platform.model;

import com.contest.platform.exception.InvalidScoreConfigurationException;

import java.util.Locale;

/**
 * How the submissions of a participation on a task combine into the task score.
 */
public enum ScoreMode {
    /** Best score over all submissions. */
    MAX,
    /** Sum over subtasks of the best score obtained on each subtask. */
    MAX_SUBTASK,
    /** Best of the last submission and the best tokened submission. */
    MAX_TOKENED_LAST;

    /**
     * Resolve the score mode stored in task configuration ("max", "max_subtask",
     * "max_tokened_last", case-insensitive).
     */
    public static ScoreMode fromConfig(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidScoreConfigurationException("Score mode is not configured");
        }
        try {
            return ScoreMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidScoreConfigurationException("Unknown score mode: " + value);
        }
    }

    public String toConfig() {
        return name().toLowerCase(Locale.ROOT);
    }
}
