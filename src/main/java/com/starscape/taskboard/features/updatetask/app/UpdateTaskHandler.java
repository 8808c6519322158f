package com.starscape.taskboard.features.updatetask.app;

import com.starscape.taskboard.common.exception.InvalidRequestException;
import com.starscape.taskboard.common.exception.NotFoundException;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.app.TaskResponseAssembler;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import com.starscape.taskboard.features.tags.app.TagResolver;
import com.starscape.taskboard.features.tags.app.TaskTagAssigner;
import com.starscape.taskboard.features.tags.app.TaskTagLoader;
import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.updatetask.domain.FieldUpdate;
import com.starscape.taskboard.features.updatetask.domain.TaskPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * Handler for partial task updates.
 * Field changes and the tag set replacement commit together; updatedAt is stamped on every
 * successful update, even when no value actually changed.
 */
@Service
public class UpdateTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(UpdateTaskHandler.class);
    
    private final TaskRepository taskRepository;
    private final TagResolver tagResolver;
    private final TaskTagAssigner taskTagAssigner;
    private final TaskTagLoader taskTagLoader;
    private final TaskResponseAssembler assembler;
    
    public UpdateTaskHandler(
            TaskRepository taskRepository,
            TagResolver tagResolver,
            TaskTagAssigner taskTagAssigner,
            TaskTagLoader taskTagLoader,
            TaskResponseAssembler assembler) {
        this.taskRepository = taskRepository;
        this.tagResolver = tagResolver;
        this.taskTagAssigner = taskTagAssigner;
        this.taskTagLoader = taskTagLoader;
        this.assembler = assembler;
    }
    
    @Transactional
    public TaskResponse handle(Long taskId, TaskPatch patch) {
        Task task = taskRepository.findByIdAndDeletedFalse(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        
        requireNotCleared("title", patch.title());
        requireNotCleared("priority", patch.priority());
        requireNotCleared("dueDate", patch.dueDate());
        requireNotCleared("completed", patch.completed());
        
        patch.title().ifSet(task::rename);
        if (patch.description().isClear()) {
            task.describe(null);
        } else {
            patch.description().ifSet(task::describe);
        }
        patch.priority().ifSet(task::changePriority);
        patch.dueDate().ifSet(task::reschedule);
        patch.completed().ifSet(task::setCompleted);
        
        List<Tag> tags;
        if (patch.tags().isAbsent()) {
            tags = taskTagLoader.loadTagsForTask(taskId);
        } else {
            tags = patch.tags().isSet()
                    ? tagResolver.resolve(patch.tags().value()).stream()
                        .sorted(Comparator.comparing(Tag::getName))
                        .toList()
                    : List.of();
            taskTagAssigner.replaceTags(taskId, tags);
        }
        
        task.touch();
        taskRepository.save(task);
        
        log.info("Updated task {}: {}", taskId, patch);
        return assembler.toResponse(task, tags);
    }
    
    private static void requireNotCleared(String field, FieldUpdate<?> update) {
        if (update.isClear()) {
            throw new InvalidRequestException(field, field + " cannot be null");
        }
    }
}
