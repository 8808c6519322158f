package com.starscape.taskboard.features.deletetask.api;

import com.starscape.taskboard.features.deletetask.app.DeleteTaskHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/tasks")
public class DeleteTaskController {
    
    private final DeleteTaskHandler deleteTaskHandler;
    
    public DeleteTaskController(DeleteTaskHandler deleteTaskHandler) {
        this.deleteTaskHandler = deleteTaskHandler;
    }
    
    /**
     * Soft-delete a task.
     * DELETE /tasks/{taskId}
     */
    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable Long taskId) {
        deleteTaskHandler.handle(taskId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
