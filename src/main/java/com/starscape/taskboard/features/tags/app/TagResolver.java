package com.starscape.taskboard.features.tags.app;

import com.starscape.taskboard.common.exception.ConflictException;
import com.starscape.taskboard.features.tags.domain.Tag;
import com.starscape.taskboard.features.tags.domain.TagNames;
import com.starscape.taskboard.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves tag names to persisted tags, creating the ones that do not exist yet.
 * Runs inside the caller's transaction so new tags commit or roll back with the task write.
 */
@Service
public class TagResolver {
    
    private static final Logger log = LoggerFactory.getLogger(TagResolver.class);
    
    private final TagRepository tagRepository;
    
    public TagResolver(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    /**
     * Resolve normalized tag names to tags.
     * The order of the returned list does not follow the input order.
     *
     * @param names trimmed, lowercase, de-duplicated names
     * @return one tag per name
     * @throws ConflictException if a name cannot be resolved after the insert and re-fetch
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Tag> resolve(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        names.forEach(this::requireNormalized);
        
        List<Tag> resolved = new ArrayList<>(tagRepository.findByNameIn(names));
        Set<String> found = resolved.stream()
                .map(Tag::getName)
                .collect(Collectors.toSet());
        
        List<String> missing = names.stream()
                .filter(name -> !found.contains(name))
                .distinct()
                .toList();
        if (missing.isEmpty()) {
            return resolved;
        }
        
        for (String name : missing) {
            int inserted = tagRepository.insertIfAbsent(name);
            log.debug("Tag '{}' {}", name, inserted > 0 ? "created" : "created concurrently, reusing it");
        }
        
        // Single re-fetch: rows inserted by us or by a concurrent transaction are both visible now
        List<Tag> created = tagRepository.findByNameIn(missing);
        if (created.size() < missing.size()) {
            Set<String> createdNames = created.stream()
                    .map(Tag::getName)
                    .collect(Collectors.toSet());
            List<String> unresolved = missing.stream()
                    .filter(name -> !createdNames.contains(name))
                    .toList();
            throw new ConflictException("Could not resolve tags: " + unresolved);
        }
        
        resolved.addAll(created);
        return resolved;
    }
    
    private void requireNormalized(String name) {
        String normalized = TagNames.normalize(name);
        if (normalized == null || !normalized.equals(name)) {
            throw new IllegalArgumentException("Tag name must be trimmed, lowercase and non-blank: '" + name + "'");
        }
        if (name.length() > Tag.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Tag name must be " + Tag.MAX_NAME_LENGTH + " characters or less");
        }
    }
}
