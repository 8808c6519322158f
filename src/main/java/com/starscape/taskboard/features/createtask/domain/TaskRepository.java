package com.starscape.taskboard.features.createtask.domain;

import java.util.Optional;

public interface TaskRepository {
    Task save(Task task);
    
    /**
     * Find a task that has not been soft-deleted.
     */
    Optional<Task> findByIdAndDeletedFalse(Long taskId);
}
