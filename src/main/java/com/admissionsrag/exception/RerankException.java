package com.admissionsrag.exception;

public class RerankException extends RagException {
    
    public RerankException(String message) {
        super(message);
    }
    
    public RerankException(String message, Throwable cause) {
        super(message, cause);
    }
}
