package com.starscape.taskboard.features.updatetask.api;

import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.updatetask.api.dto.UpdateTaskRequest;
import com.starscape.taskboard.features.updatetask.app.UpdateTaskHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for partial task updates.
 * Only fields present in the body are changed; a tags list replaces the existing tags.
 */
@RestController
@RequestMapping("/tasks")
public class UpdateTaskController {
    
    private final UpdateTaskHandler updateTaskHandler;
    
    public UpdateTaskController(UpdateTaskHandler updateTaskHandler) {
        this.updateTaskHandler = updateTaskHandler;
    }
    
    /**
     * PATCH /tasks/{taskId}
     */
    @PatchMapping("/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @PathVariable Long taskId,
            @Valid @RequestBody UpdateTaskRequest request) {
        
        TaskResponse response = updateTaskHandler.handle(taskId, request.toPatch());
        return ResponseEntity.ok(response);
    }
}
