package com.starscape.taskboard.features.listtasks.infra;

import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TaskTag;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;

/**
 * Filter building blocks for task list queries.
 */
public final class TaskSpecifications {
    
    private TaskSpecifications() {
    }
    
    public static Specification<Task> notDeleted() {
        return (root, query, cb) -> cb.isFalse(root.get("deleted"));
    }
    
    public static Specification<Task> completedEquals(boolean completed) {
        return (root, query, cb) -> cb.equal(root.get("completed"), completed);
    }
    
    public static Specification<Task> priorityEquals(int priority) {
        return (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }
    
    /**
     * Task has at least one of the given tags.
     * Uses an IN subquery rather than a join, so a task matching several tags is returned once
     * and the count query needs no DISTINCT.
     */
    public static Specification<Task> hasAnyTag(Collection<String> tagNames) {
        return (root, query, cb) -> {
            Subquery<Long> taggedTaskIds = query.subquery(Long.class);
            Root<TaskTag> taskTag = taggedTaskIds.from(TaskTag.class);
            Root<Tag> tag = taggedTaskIds.from(Tag.class);
            taggedTaskIds.select(taskTag.get("taskId"))
                    .where(
                        cb.equal(taskTag.get("tagId"), tag.get("id")),
                        tag.get("name").in(tagNames)
                    );
            return root.get("id").in(taggedTaskIds);
        };
    }
}
