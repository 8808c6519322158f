package com.starscape.taskboard.features.gettask.api;

import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.gettask.app.GetTaskHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for reading a single task.
 */
@RestController
@RequestMapping("/tasks")
public class TaskDetailController {
    
    private final GetTaskHandler getTaskHandler;
    
    public TaskDetailController(GetTaskHandler getTaskHandler) {
        this.getTaskHandler = getTaskHandler;
    }
    
    /**
     * GET /tasks/{taskId}
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable Long taskId) {
        return ResponseEntity.ok(getTaskHandler.handle(taskId));
    }
}
