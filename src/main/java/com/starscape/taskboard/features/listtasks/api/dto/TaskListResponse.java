package com.starscape.taskboard.features.listtasks.api.dto;

import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;

import java.util.List;

/**
 * Response DTO for the task list query.
 * total counts every matching task, not just the ones on this page.
 */
public record TaskListResponse(
    long total,
    int limit,
    long offset,
    List<TaskResponse> tasks
) {}
