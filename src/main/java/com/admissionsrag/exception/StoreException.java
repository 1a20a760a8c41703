package com.admissionsrag.exception;

public class StoreException extends RagException {
    
    public StoreException(String message) {
        super(message);
    }
    
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
