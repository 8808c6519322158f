package com.starscape.taskboard.features.listtasks.api;

import com.starscape.taskboard.features.listtasks.api.dto.TaskListResponse;
import com.starscape.taskboard.features.listtasks.app.ListTasksHandler;
import com.starscape.taskboard.features.tags.domain.TagNames;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for listing tasks with pagination and filtering.
 * Supports filtering by completion status, priority and tags (comma-separated, matches any).
 */
@RestController
@RequestMapping("/tasks")
public class TaskListController {
    
    private final ListTasksHandler listTasksHandler;
    
    public TaskListController(ListTasksHandler listTasksHandler) {
        this.listTasksHandler = listTasksHandler;
    }
    
    @GetMapping
    public ResponseEntity<TaskListResponse> listTasks(
            @RequestParam(name = "completed", required = false) Boolean completed,
            @RequestParam(name = "priority", required = false)
            @Min(value = 1, message = "Priority must be between 1 and 5")
            @Max(value = 5, message = "Priority must be between 1 and 5") Integer priority,
            @RequestParam(name = "tags", required = false) String tags,
            @RequestParam(name = "limit", required = false)
            @Min(value = 1, message = "Limit must be between 1 and 100")
            @Max(value = 100, message = "Limit must be between 1 and 100") Integer limit,
            @RequestParam(name = "offset", required = false)
            @Min(value = 0, message = "Offset must not be negative") Long offset) {
        
        TaskListResponse response = listTasksHandler.handle(
            completed, priority, TagNames.fromCsv(tags), limit, offset);
        return ResponseEntity.ok(response);
    }
}
