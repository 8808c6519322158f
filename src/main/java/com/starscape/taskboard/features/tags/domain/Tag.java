package com.starscape.taskboard.features.tags.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Tag entity shared by all tasks.
 * Names are stored trimmed and lowercase and are globally unique.
 */
@Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_name_unique", columnNames = {"name"})
})
public class Tag extends com.starscape.taskboard.common.domain.Entity<Long> {
    
    public static final int MAX_NAME_LENGTH = 100;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;
    
    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String name) {
        String normalized = TagNames.normalize(name);
        if (normalized == null) {
            throw new IllegalArgumentException("Tag name cannot be blank");
        }
        if (normalized.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Tag name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        
        this.name = normalized;
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    // Getters
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
