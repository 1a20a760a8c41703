package com.admissionsrag.exception;

public class GenerationException extends RagException {
    
    public GenerationException(String message) {
        super(message);
    }
    
    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
