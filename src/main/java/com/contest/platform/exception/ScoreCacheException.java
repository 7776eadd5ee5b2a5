package com.contest.platform.exception;

/**
 * Base of the score cache failures. {@code errorCode} is what the HTTP layer reports.
 */
public class ScoreCacheException extends RuntimeException {
    private final String errorCode;
    
    public ScoreCacheException(String message) {
        super(message);
        this.errorCode = "SCORE_CACHE_ERROR";
    }
    
    public ScoreCacheException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ScoreCacheException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCORE_CACHE_ERROR";
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
