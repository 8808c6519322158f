package com.starscape.taskboard.features.tags.infra;

import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TagRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA repository implementation for Tag entity.
 * Spring Data JPA automatically provides implementations for methods declared in TagRepository
 * that match JpaRepository methods (findAllById).
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, Long>, TagRepository {
    
    @Override
    List<Tag> findByNameIn(Collection<String> names);
    
    /**
     * Atomic insert-if-absent backed by the unique index on tags.name.
     * A concurrent insert of the same name blocks until the other transaction finishes,
     * then either inserts (other side rolled back) or does nothing.
     */
    @Override
    @Modifying
    @Query(value = "INSERT INTO tags (name, created_at) VALUES (:name, CURRENT_TIMESTAMP) " +
                   "ON CONFLICT (name) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("name") String name);
}
