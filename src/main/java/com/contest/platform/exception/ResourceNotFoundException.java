package com.contest.platform.exception;

public class ResourceNotFoundException extends ScoreCacheException {
    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }

    public static ResourceNotFoundException contest(Long contestId) {
        return new ResourceNotFoundException("Contest not found with id: " + contestId, "CONTEST_NOT_FOUND");
    }

    public static ResourceNotFoundException participation(Long participationId) {
        return new ResourceNotFoundException("Participation not found with id: " + participationId, "PARTICIPATION_NOT_FOUND");
    }

    public static ResourceNotFoundException task(Long taskId) {
        return new ResourceNotFoundException("Task not found with id: " + taskId, "TASK_NOT_FOUND");
    }
}
