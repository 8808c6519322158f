package com.starscape.taskboard.features.tags.domain;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    List<Tag> findByNameIn(Collection<String> names);
    List<Tag> findAllById(Iterable<Long> tagIds);
    
    /**
     * Insert a tag unless one with the same name already exists.
     * @return number of rows inserted, 0 when the name was already taken
     */
    int insertIfAbsent(String name);
}
