package com.starscape.taskboard.features.deletetask.app;

import com.starscape.taskboard.common.exception.NotFoundException;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for soft-deleting tasks.
 * Deleting a task that is already deleted is reported as not found.
 */
@Service
public class DeleteTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteTaskHandler.class);
    
    private final TaskRepository taskRepository;
    
    public DeleteTaskHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }
    
    @Transactional
    public void handle(Long taskId) {
        Task task = taskRepository.findByIdAndDeletedFalse(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        
        task.markDeleted();
        taskRepository.save(task);
        
        log.info("Soft-deleted task {}", taskId);
    }
}
