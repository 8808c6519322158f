package com.starscape.taskboard.common.exception;

/**
 * Raised for request input that passes Bean Validation but is still unusable,
 * such as an explicit null for a field that cannot be cleared.
 */
public class InvalidRequestException extends RuntimeException {
    
    private final String field;
    
    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
