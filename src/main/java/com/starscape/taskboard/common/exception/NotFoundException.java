package com.starscape.taskboard.common.exception;

/**
 * Raised when an id does not reference a live resource.
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
}
