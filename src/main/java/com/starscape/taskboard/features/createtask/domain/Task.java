package com.starscape.taskboard.features.createtask.domain;

import com.starscape.taskboard.common.domain.Entity;
import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

@jakarta.persistence.Entity
@Table(name = "tasks")
public class Task extends Entity<Long> {
    
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;
    
    @Column(nullable = false, length = MAX_TITLE_LENGTH)
    private String title;
    
    @Column(columnDefinition = "text")
    private String description;
    
    @Column(nullable = false)
    private int priority;
    
    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;
    
    @Column(nullable = false)
    private boolean completed;
    
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Task() {
        // JPA constructor
    }
    
    public Task(String title, String description, int priority, LocalDate dueDate) {
        validateTitle(title);
        validatePriority(priority);
        validateDueDate(dueDate);
        
        this.title = title;
        this.description = description;
        this.priority = priority;
        this.dueDate = dueDate;
        this.completed = false;
        this.deleted = false;
        this.createdAt = now();
        this.updatedAt = this.createdAt;
    }
    
    private static void validateTitle(String title) {
        if (title == null || title.isEmpty()) {
            throw new IllegalArgumentException("Title cannot be empty");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title must be " + MAX_TITLE_LENGTH + " characters or less");
        }
    }
    
    private static void validatePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
    }
    
    private static void validateDueDate(LocalDate dueDate) {
        if (dueDate == null) {
            throw new IllegalArgumentException("Due date is required");
        }
    }
    
    // PostgreSQL keeps microseconds; truncating keeps loaded and in-memory values equal
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    // Getters
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public int getPriority() { return priority; }
    public LocalDate getDueDate() { return dueDate; }
    public boolean isCompleted() { return completed; }
    public boolean isDeleted() { return deleted; }
    public Instant getDeletedAt() { return deletedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    public void rename(String title) {
        validateTitle(title);
        this.title = title;
    }
    
    public void describe(String description) {
        this.description = description;
    }
    
    public void changePriority(int priority) {
        validatePriority(priority);
        this.priority = priority;
    }
    
    public void reschedule(LocalDate dueDate) {
        validateDueDate(dueDate);
        this.dueDate = dueDate;
    }
    
    public void setCompleted(boolean completed) {
        this.completed = completed;
    }
    
    /**
     * Stamp updatedAt with the current time.
     * Never moves it backwards, so updatedAt stays >= createdAt.
     * Handlers call this once per mutation before saving; the stamped value is the one stored.
     */
    public void touch() {
        Instant now = now();
        if (updatedAt == null || now.isAfter(updatedAt)) {
            this.updatedAt = now;
        }
    }
    
    /**
     * Mark task as soft-deleted.
     * Sets the deleted flag and deletedAt together; the row is kept.
     */
    public void markDeleted() {
        if (!this.deleted) {
            this.deleted = true;
            this.deletedAt = now();
            touch();
        }
    }
}
