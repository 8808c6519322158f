package com.starscape.taskboard.features.listtasks.infra;

import com.starscape.taskboard.features.createtask.domain.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

/**
 * Read-optimized repository for task list queries.
 * Filters are composed from {@link TaskSpecifications}; callers always include notDeleted().
 */
@Repository
public interface TaskQueryRepository extends JpaRepository<Task, Long>, JpaSpecificationExecutor<Task> {
}
