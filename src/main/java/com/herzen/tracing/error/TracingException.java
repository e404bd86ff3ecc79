package com.herzen.tracing.error;

public abstract class TracingException extends RuntimeException {
    private final String code;

    protected TracingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
