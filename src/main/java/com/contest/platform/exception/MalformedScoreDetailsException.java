package com.contest.platform.exception;

public class MalformedScoreDetailsException extends ScoreCacheException {
    public MalformedScoreDetailsException(String message) {
        super(message, "MALFORMED_SCORE_DETAILS");
    }
}
