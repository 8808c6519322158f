package com.starscape.taskboard.features.gettask.app;

import com.starscape.taskboard.common.exception.NotFoundException;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.app.TaskResponseAssembler;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import com.starscape.taskboard.features.tags.app.TaskTagLoader;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for reading a single task with its tags.
 * Soft-deleted tasks are reported as not found.
 */
@Service
public class GetTaskHandler {
    
    private final TaskRepository taskRepository;
    private final TaskTagLoader taskTagLoader;
    private final TaskResponseAssembler assembler;
    
    public GetTaskHandler(
            TaskRepository taskRepository,
            TaskTagLoader taskTagLoader,
            TaskResponseAssembler assembler) {
        this.taskRepository = taskRepository;
        this.taskTagLoader = taskTagLoader;
        this.assembler = assembler;
    }
    
    @Transactional(readOnly = true)
    public TaskResponse handle(Long taskId) {
        Task task = taskRepository.findByIdAndDeletedFalse(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        
        return assembler.toResponse(task, taskTagLoader.loadTagsForTask(taskId));
    }
}
