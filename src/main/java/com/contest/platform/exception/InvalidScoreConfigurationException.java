package com.contest.platform.exception;

/**
 * Task scoring configuration that cannot be interpreted (unknown score mode,
 * missing or negative precision).
 */
public class InvalidScoreConfigurationException extends ScoreCacheException {
    public InvalidScoreConfigurationException(String message) {
        super(message, "INVALID_SCORE_CONFIGURATION");
    }
}
