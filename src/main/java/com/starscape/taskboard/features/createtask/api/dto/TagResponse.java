package com.starscape.taskboard.features.createtask.api.dto;

/**
 * DTO for a tag attached to a task.
 */
public record TagResponse(
    Long id,
    String name
) {}
