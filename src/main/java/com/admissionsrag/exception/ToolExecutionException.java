package com.admissionsrag.exception;

public class ToolExecutionException extends RagException {
    
    public ToolExecutionException(String message) {
        super(message);
    }
    
    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
