package com.starscape.taskboard.features.tags.app;

import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TagRepository;
import com.starscape.taskboard.features.tags.domain.TaskTag;
import com.starscape.taskboard.features.tags.domain.TaskTagRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads the tag sets of tasks.
 * Tags within a task are sorted by name.
 */
@Service
public class TaskTagLoader {
    
    private final TaskTagRepository taskTagRepository;
    private final TagRepository tagRepository;
    
    public TaskTagLoader(TaskTagRepository taskTagRepository, TagRepository tagRepository) {
        this.taskTagRepository = taskTagRepository;
        this.tagRepository = tagRepository;
    }
    
    public List<Tag> loadTagsForTask(Long taskId) {
        return loadTagsForTasks(List.of(taskId)).getOrDefault(taskId, List.of());
    }
    
    /**
     * Load tags for multiple tasks with two queries.
     * Returns a map of taskId -> tags; tasks without tags have no entry.
     */
    public Map<Long, List<Tag>> loadTagsForTasks(Collection<Long> taskIds) {
        if (taskIds.isEmpty()) {
            return Map.of();
        }
        
        List<TaskTag> taskTags = taskTagRepository.findByTaskIdIn(taskIds);
        if (taskTags.isEmpty()) {
            return Map.of();
        }
        
        List<Long> tagIds = taskTags.stream()
                .map(TaskTag::getTagId)
                .distinct()
                .toList();
        Map<Long, Tag> tagsById = tagRepository.findAllById(tagIds).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));
        
        return taskTags.stream()
                .filter(tt -> tagsById.containsKey(tt.getTagId()))
                .collect(Collectors.groupingBy(
                    TaskTag::getTaskId,
                    Collectors.collectingAndThen(
                        Collectors.mapping(tt -> tagsById.get(tt.getTagId()), Collectors.toList()),
                        tags -> tags.stream()
                                .sorted(Comparator.comparing(Tag::getName))
                                .toList()
                    )
                ));
    }
}
