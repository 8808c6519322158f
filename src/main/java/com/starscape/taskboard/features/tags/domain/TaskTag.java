package com.starscape.taskboard.features.tags.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Junction entity for the many-to-many relationship between tasks and tags.
 */
@Entity
@Table(name = "task_tags")
@IdClass(TaskTagId.class)
public class TaskTag {
    
    @Id
    @Column(name = "task_id", nullable = false)
    private Long taskId;
    
    @Id
    @Column(name = "tag_id", nullable = false)
    private Long tagId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected TaskTag() {
        // JPA constructor
    }
    
    public TaskTag(Long taskId, Long tagId) {
        if (taskId == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (tagId == null) {
            throw new IllegalArgumentException("Tag ID cannot be null");
        }
        
        this.taskId = taskId;
        this.tagId = tagId;
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
    
    // Getters
    public Long getTaskId() { return taskId; }
    public Long getTagId() { return tagId; }
    public Instant getCreatedAt() { return createdAt; }
}
