package com.starscape.taskboard.features.updatetask.api.dto;

import com.starscape.taskboard.common.exception.InvalidRequestException;
import com.starscape.taskboard.features.tags.domain.TagNames;
import com.starscape.taskboard.features.updatetask.domain.FieldUpdate;
import com.starscape.taskboard.features.updatetask.domain.TaskPatch;
import jakarta.validation.constraints.FutureOrPresent;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for partially updating a task.
 * Jackson only calls the setters of properties present in the body, which lets
 * {@link #toPatch()} tell an omitted field from an explicit null.
 */
public class UpdateTaskRequest {
    
    @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
    private String title;
    
    private String description;
    
    @Min(value = 1, message = "Priority must be between 1 and 5")
    @Max(value = 5, message = "Priority must be between 1 and 5")
    private Integer priority;
    
    @FutureOrPresent(message = "Due date must not be in the past")
    private LocalDate dueDate;
    
    private Boolean completed;
    
    private List<@NotNull(message = "Tag name cannot be null")
                 @Size(max = 100, message = "Tag name must be 100 characters or less") String> tags;
    
    private final Set<String> presentFields = new HashSet<>();
    
    public void setTitle(String title) {
        this.title = title;
        presentFields.add("title");
    }
    
    public void setDescription(String description) {
        this.description = description;
        presentFields.add("description");
    }
    
    public void setPriority(Integer priority) {
        this.priority = priority;
        presentFields.add("priority");
    }
    
    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
        presentFields.add("dueDate");
    }
    
    public void setCompleted(Boolean completed) {
        this.completed = completed;
        presentFields.add("completed");
    }
    
    public void setTags(List<String> tags) {
        this.tags = tags;
        presentFields.add("tags");
    }
    
    /**
     * Convert the request into a patch.
     * description: null clears it. tags: null leaves them untouched, a list that is empty
     * after normalization clears them. Other fields cannot be null.
     *
     * @throws InvalidRequestException if a required field is explicitly null
     */
    public TaskPatch toPatch() {
        return TaskPatch.empty()
                .withTitle(required("title", title))
                .withDescription(nullable("description", description))
                .withPriority(required("priority", priority))
                .withDueDate(required("dueDate", dueDate))
                .withCompleted(required("completed", completed))
                .withTags(tagUpdate());
    }
    
    private <T> FieldUpdate<T> required(String field, T value) {
        if (!presentFields.contains(field)) {
            return FieldUpdate.absent();
        }
        if (value == null) {
            throw new InvalidRequestException(field, field + " cannot be null");
        }
        return FieldUpdate.set(value);
    }
    
    private <T> FieldUpdate<T> nullable(String field, T value) {
        if (!presentFields.contains(field)) {
            return FieldUpdate.absent();
        }
        return value == null ? FieldUpdate.clear() : FieldUpdate.set(value);
    }
    
    private FieldUpdate<List<String>> tagUpdate() {
        if (!presentFields.contains("tags") || tags == null) {
            return FieldUpdate.absent();
        }
        List<String> normalized = TagNames.normalize(tags);
        return normalized.isEmpty() ? FieldUpdate.clear() : FieldUpdate.set(normalized);
    }
}
