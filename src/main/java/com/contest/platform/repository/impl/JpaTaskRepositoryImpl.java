package com.contest.platform.repository.impl;

import com.contest.platform.model.Task;
import com.contest.platform.repository.TaskRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JpaTaskRepositoryImpl implements TaskRepository {
    
    private final TaskJpaRepository jpaRepository;
    
    @Autowired
    public JpaTaskRepositoryImpl(TaskJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Task save(Task task) {
        return jpaRepository.save(task);
    }
    
    @Override
    public Optional<Task> findById(Long taskId) {
        return jpaRepository.findById(taskId);
    }
}
