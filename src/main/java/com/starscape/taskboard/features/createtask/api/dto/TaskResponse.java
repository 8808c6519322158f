package com.starscape.taskboard.features.createtask.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Full task representation returned by every task endpoint.
 * Soft-deleted tasks are never returned, so deleted is always false in practice.
 */
public record TaskResponse(
    Long id,
    String title,
    String description,
    int priority,
    LocalDate dueDate,
    boolean completed,
    @JsonProperty("is_deleted") boolean deleted,
    Instant createdAt,
    Instant updatedAt,
    List<TagResponse> tags
) {}
