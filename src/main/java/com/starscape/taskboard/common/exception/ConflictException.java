package com.starscape.taskboard.common.exception;

/**
 * Raised when a write loses a race against a concurrent transaction.
 * Callers may retry the request.
 */
public class ConflictException extends RuntimeException {
    
    public ConflictException(String message) {
        super(message);
    }
}
