package com.starscape.taskboard.features.tags.infra;

import com.starscape.taskboard.features.tags.domain.TaskTag;
import com.starscape.taskboard.features.tags.domain.TaskTagId;
import com.starscape.taskboard.features.tags.domain.TaskTagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA repository implementation for TaskTag junction entity.
 * Spring Data JPA automatically provides implementations for methods declared in TaskTagRepository
 * that match JpaRepository methods (save).
 */
@Repository
public interface JpaTaskTagRepository extends JpaRepository<TaskTag, TaskTagId>, TaskTagRepository {
    
    @Override
    List<TaskTag> findByTaskId(Long taskId);
    
    @Override
    List<TaskTag> findByTaskIdIn(Collection<Long> taskIds);
    
    @Override
    @Modifying
    @Query("DELETE FROM TaskTag tt WHERE tt.taskId = :taskId AND tt.tagId IN :tagIds")
    void deleteByTaskIdAndTagIdIn(@Param("taskId") Long taskId, @Param("tagIds") Collection<Long> tagIds);
}
