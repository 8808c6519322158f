package com.starscape.taskboard.features.createtask.infra;

import com.starscape.taskboard.features.createtask.domain.Task;
import com.starscape.taskboard.features.createtask.domain.TaskRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaTaskRepository extends JpaRepository<Task, Long>, TaskRepository {
    
    @Override
    Task save(Task task);
    
    @Override
    Optional<Task> findByIdAndDeletedFalse(Long taskId);
}
