package com.starscape.taskboard.features.tags.domain;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for TaskTag junction entity.
 */
public interface TaskTagRepository {
    TaskTag save(TaskTag taskTag);
    List<TaskTag> findByTaskId(Long taskId);
    List<TaskTag> findByTaskIdIn(Collection<Long> taskIds);
    void deleteByTaskIdAndTagIdIn(Long taskId, Collection<Long> tagIds);
}
