package com.starscape.taskboard.features.updatetask.domain;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One field of a partial update: left untouched, cleared, or set to a value.
 */
public final class FieldUpdate<T> {
    
    public enum Kind { ABSENT, CLEAR, SET }
    
    private static final FieldUpdate<?> ABSENT = new FieldUpdate<>(Kind.ABSENT, null);
    private static final FieldUpdate<?> CLEAR = new FieldUpdate<>(Kind.CLEAR, null);
    
    private final Kind kind;
    private final T value;
    
    private FieldUpdate(Kind kind, T value) {
        this.kind = kind;
        this.value = value;
    }
    
    @SuppressWarnings("unchecked")
    public static <T> FieldUpdate<T> absent() {
        return (FieldUpdate<T>) ABSENT;
    }
    
    @SuppressWarnings("unchecked")
    public static <T> FieldUpdate<T> clear() {
        return (FieldUpdate<T>) CLEAR;
    }
    
    public static <T> FieldUpdate<T> set(T value) {
        return new FieldUpdate<>(Kind.SET, Objects.requireNonNull(value, "value"));
    }
    
    public Kind kind() {
        return kind;
    }
    
    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }
    
    public boolean isClear() {
        return kind == Kind.CLEAR;
    }
    
    public boolean isSet() {
        return kind == Kind.SET;
    }
    
    /**
     * @throws IllegalStateException unless this update is SET
     */
    public T value() {
        if (kind != Kind.SET) {
            throw new IllegalStateException("No value for a " + kind + " update");
        }
        return value;
    }
    
    public void ifSet(Consumer<? super T> action) {
        if (kind == Kind.SET) {
            action.accept(value);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldUpdate<?> that = (FieldUpdate<?>) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }
    
    @Override
    public String toString() {
        return kind == Kind.SET ? "SET(" + value + ")" : kind.name();
    }
}
