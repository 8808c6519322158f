package com.starscape.taskboard.features.tags.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for TaskTag entity.
 */
public class TaskTagId implements Serializable {
    
    private Long taskId;
    private Long tagId;
    
    public TaskTagId() {
        // JPA constructor
    }
    
    public TaskTagId(Long taskId, Long tagId) {
        this.taskId = taskId;
        this.tagId = tagId;
    }
    
    public Long getTaskId() { return taskId; }
    public void setTaskId(Long taskId) { this.taskId = taskId; }
    
    public Long getTagId() { return tagId; }
    public void setTagId(Long tagId) { this.tagId = tagId; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskTagId that = (TaskTagId) o;
        return Objects.equals(taskId, that.taskId) && Objects.equals(tagId, that.tagId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(taskId, tagId);
    }
}
