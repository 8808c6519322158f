package com.starscape.taskboard.features.tags.app;

import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TaskTag;
import com.starscape.taskboard.features.tags.domain.TaskTagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the task-tag associations for a task.
 */
@Service
public class TaskTagAssigner {
    
    private static final Logger log = LoggerFactory.getLogger(TaskTagAssigner.class);
    
    private final TaskTagRepository taskTagRepository;
    
    public TaskTagAssigner(TaskTagRepository taskTagRepository) {
        this.taskTagRepository = taskTagRepository;
    }
    
    /**
     * Replace the tag set of a task so it ends with exactly the given tags.
     * Associations already present are kept, missing ones are added and the rest removed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void replaceTags(Long taskId, Collection<Tag> tags) {
        Set<Long> desired = tags.stream()
                .map(Tag::getId)
                .collect(Collectors.toSet());
        Set<Long> current = taskTagRepository.findByTaskId(taskId).stream()
                .map(TaskTag::getTagId)
                .collect(Collectors.toSet());
        
        List<Long> toRemove = current.stream()
                .filter(tagId -> !desired.contains(tagId))
                .toList();
        List<Long> toAdd = desired.stream()
                .filter(tagId -> !current.contains(tagId))
                .toList();
        
        if (!toRemove.isEmpty()) {
            taskTagRepository.deleteByTaskIdAndTagIdIn(taskId, toRemove);
        }
        for (Long tagId : toAdd) {
            taskTagRepository.save(new TaskTag(taskId, tagId));
        }
        
        log.debug("Replaced tags of task {}: added={}, removed={}", taskId, toAdd.size(), toRemove.size());
    }
}
