package com.starscape.taskboard.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for persistent domain entities.
 * Identity is the database-generated id; two transient instances are never equal.
 */
public abstract class Entity<ID extends Serializable> {
    
    public abstract ID getId();
    
    public boolean isTransient() {
        return getId() == null;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
