package com.admissionsrag.exception;

public class IngestionException extends RagException {
    
    public IngestionException(String message) {
        super(message);
    }
    
    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
