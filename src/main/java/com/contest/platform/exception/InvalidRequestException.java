package com.contest.platform.exception;

public class InvalidRequestException extends ScoreCacheException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
