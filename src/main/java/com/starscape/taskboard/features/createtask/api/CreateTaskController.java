package com.starscape.taskboard.features.createtask.api;

import com.starscape.taskboard.features.createtask.api.dto.CreateTaskRequest;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.app.CreateTaskHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/tasks")
public class CreateTaskController {
    
    private final CreateTaskHandler createTaskHandler;
    
    public CreateTaskController(CreateTaskHandler createTaskHandler) {
        this.createTaskHandler = createTaskHandler;
    }
    
    /**
     * Create a task.
     * POST /tasks
     */
    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
        TaskResponse response = createTaskHandler.handle(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
