package com.starscape.taskboard.features.updatetask.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update of a task.
 * For tags, CLEAR removes every tag and SET replaces the whole set with the given
 * normalized names.
 */
public record TaskPatch(
    FieldUpdate<String> title,
    FieldUpdate<String> description,
    FieldUpdate<Integer> priority,
    FieldUpdate<LocalDate> dueDate,
    FieldUpdate<Boolean> completed,
    FieldUpdate<List<String>> tags
) {
    
    public static TaskPatch empty() {
        return new TaskPatch(
            FieldUpdate.absent(),
            FieldUpdate.absent(),
            FieldUpdate.absent(),
            FieldUpdate.absent(),
            FieldUpdate.absent(),
            FieldUpdate.absent()
        );
    }
    
    public TaskPatch withTitle(FieldUpdate<String> title) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
    
    public TaskPatch withDescription(FieldUpdate<String> description) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
    
    public TaskPatch withPriority(FieldUpdate<Integer> priority) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
    
    public TaskPatch withDueDate(FieldUpdate<LocalDate> dueDate) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
    
    public TaskPatch withCompleted(FieldUpdate<Boolean> completed) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
    
    public TaskPatch withTags(FieldUpdate<List<String>> tags) {
        return new TaskPatch(title, description, priority, dueDate, completed, tags);
    }
}
