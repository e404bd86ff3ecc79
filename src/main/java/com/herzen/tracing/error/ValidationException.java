package com.herzen.tracing.error;

public class ValidationException extends TracingException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
