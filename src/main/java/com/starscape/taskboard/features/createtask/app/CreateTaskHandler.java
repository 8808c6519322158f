package com.starscape.taskboard.features.createtask.app;

import com.starscape.taskboard.features.createtask.api.dto.CreateTaskRequest;
import com.starscape.taskboard.features.createtask.api.dto.TaskResponse;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import com.starscape.taskboard.features.tags.app.TagResolver;
import com.starscape.taskboard.features.tags.app.TaskTagAssigner;
import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TagNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * Handler for creating tasks.
 * The task row, any new tags and the task-tag associations are written in one transaction.
 */
@Service
public class CreateTaskHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateTaskHandler.class);
    
    private final TaskRepository taskRepository;
    private final TagResolver tagResolver;
    private final TaskTagAssigner taskTagAssigner;
    private final TaskResponseAssembler assembler;
    
    public CreateTaskHandler(
            TaskRepository taskRepository,
            TagResolver tagResolver,
            TaskTagAssigner taskTagAssigner,
            TaskResponseAssembler assembler) {
        this.taskRepository = taskRepository;
        this.tagResolver = tagResolver;
        this.taskTagAssigner = taskTagAssigner;
        this.assembler = assembler;
    }
    
    @Transactional
    public TaskResponse handle(CreateTaskRequest request) {
        Task task = taskRepository.save(new Task(
            request.title(),
            request.description(),
            request.priority(),
            request.dueDate()
        ));
        
        List<String> tagNames = TagNames.normalize(request.tags());
        List<Tag> tags = List.of();
        if (!tagNames.isEmpty()) {
            tags = tagResolver.resolve(tagNames).stream()
                    .sorted(Comparator.comparing(Tag::getName))
                    .toList();
            taskTagAssigner.replaceTags(task.getId(), tags);
        }
        
        log.info("Created task {} with {} tags", task.getId(), tags.size());
        return assembler.toResponse(task, tags);
    }
}
