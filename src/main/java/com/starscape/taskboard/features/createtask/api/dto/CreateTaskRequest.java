package com.starscape.taskboard.features.createtask.api.dto;

import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for creating a task.
 * Tag names are normalized by the handler (trimmed, lowercased, blanks and duplicates dropped).
 */
public record CreateTaskRequest(
    @NotNull(message = "Title is required")
    @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
    String title,
    
    String description,
    
    @NotNull(message = "Priority is required")
    @Min(value = 1, message = "Priority must be between 1 and 5")
    @Max(value = 5, message = "Priority must be between 1 and 5")
    Integer priority,
    
    @NotNull(message = "Due date is required")
    @FutureOrPresent(message = "Due date must not be in the past")
    LocalDate dueDate,
    
    List<@NotNull(message = "Tag name cannot be null")
         @Size(max = 100, message = "Tag name must be 100 characters or less") String> tags
) {}
