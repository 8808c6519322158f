package com.starscape.taskboard.features.createtask.app;

import com.starscape.taskboard.features.createtask.api.dto.TagResponse;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.listtasks.api.dto.TaskListResponse;
import com.starscape.taskboard.features.tags.domain.Tag;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps task entities and their tags to API responses.
 */
@Component
public class TaskResponseAssembler {
    
    public TaskResponse toResponse(Task task, List<Tag> tags) {
        List<TagResponse> tagResponses = tags.stream()
                .map(tag -> new TagResponse(tag.getId(), tag.getName()))
                .toList();
        
        return new TaskResponse(
            task.getId(),
            task.getTitle(),
            task.getDescription(),
            task.getPriority(),
            task.getDueDate(),
            task.isCompleted(),
            task.isDeleted(),
            task.getCreatedAt(),
            task.getUpdatedAt(),
            tagResponses
        );
    }
    
    public TaskListResponse toListResponse(
            List<Task> tasks,
            Map<Long, List<Tag>> tagsByTaskId,
            long total,
            int limit,
            long offset) {
        List<TaskResponse> items = tasks.stream()
                .map(task -> toResponse(task, tagsByTaskId.getOrDefault(task.getId(), List.of())))
                .toList();
        
        return new TaskListResponse(total, limit, offset, items);
    }
}
