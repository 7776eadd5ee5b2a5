package com.contest.platform.repository;

import com.contest.platform.model.Task;

import java.util.Optional;

public interface TaskRepository {
    Task save(Task task);
    Optional<Task> findById(Long taskId);
}
