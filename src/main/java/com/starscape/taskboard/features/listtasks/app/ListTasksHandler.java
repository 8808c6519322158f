package com.starscape.taskboard.features.listtasks.app;

import com.starscape.taskboard.common.config.TaskPaginationProperties;
import com.starscape.taskboard.common.pagination.OffsetLimitRequest;
import com.starscape.taskboard.features.createtask.app.TaskResponseAssembler;
import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.listtasks.api.dto.TaskListResponse;
import com.starscape.taskboard.features.listtasks.infra.TaskQueryRepository;
import com.starscape.taskboard.features.listtasks.infra.TaskSpecifications;
import com.starscape.taskboard.features.tags.app.TaskTagLoader;
import com.starscape.taskboard.features.tags.domain.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Handler for listing tasks with filtering and offset pagination.
 * Soft-deleted tasks are always excluded. Newest tasks come first; ties on createdAt are
 * broken by id so pages stay stable.
 */
@Service
public class ListTasksHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ListTasksHandler.class);
    
    public static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
    
    private final TaskQueryRepository taskQueryRepository;
    private final TaskTagLoader taskTagLoader;
    private final TaskResponseAssembler assembler;
    private final TaskPaginationProperties paginationProperties;
    
    public ListTasksHandler(
            TaskQueryRepository taskQueryRepository,
            TaskTagLoader taskTagLoader,
            TaskResponseAssembler assembler,
            TaskPaginationProperties paginationProperties) {
        this.taskQueryRepository = taskQueryRepository;
        this.taskTagLoader = taskTagLoader;
        this.assembler = assembler;
        this.paginationProperties = paginationProperties;
    }
    
    /**
     * @param completed exact completion status, or null for any
     * @param priority exact priority, or null for any
     * @param tagNames normalized tag names; a task matches if it has any of them. Empty means no tag filter
     * @param limit page size, or null for the configured default
     * @param offset rows to skip, or null for 0
     */
    @Transactional(readOnly = true)
    public TaskListResponse handle(
            Boolean completed,
            Integer priority,
            List<String> tagNames,
            Integer limit,
            Long offset) {
        
        int effectiveLimit = paginationProperties.resolveLimit(limit);
        long effectiveOffset = offset != null ? Math.max(0, offset) : 0;
        
        Specification<Task> spec = TaskSpecifications.notDeleted();
        if (completed != null) {
            spec = spec.and(TaskSpecifications.completedEquals(completed));
        }
        if (priority != null) {
            spec = spec.and(TaskSpecifications.priorityEquals(priority));
        }
        if (tagNames != null && !tagNames.isEmpty()) {
            spec = spec.and(TaskSpecifications.hasAnyTag(tagNames));
        }
        
        Page<Task> taskPage = taskQueryRepository.findAll(
            spec, OffsetLimitRequest.of(effectiveOffset, effectiveLimit, NEWEST_FIRST));
        
        log.debug("Listed tasks: completed={}, priority={}, tags={}, limit={}, offset={} -> {} of {}",
            completed, priority, tagNames, effectiveLimit, effectiveOffset,
            taskPage.getNumberOfElements(), taskPage.getTotalElements());
        
        List<Long> taskIds = taskPage.getContent().stream()
                .map(Task::getId)
                .toList();
        Map<Long, List<Tag>> tagsByTaskId = taskTagLoader.loadTagsForTasks(taskIds);
        
        return assembler.toListResponse(
            taskPage.getContent(),
            tagsByTaskId,
            taskPage.getTotalElements(),
            effectiveLimit,
            effectiveOffset
        );
    }
}
