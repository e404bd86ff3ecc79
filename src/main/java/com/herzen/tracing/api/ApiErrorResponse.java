package com.herzen.tracing.api;

public record ApiErrorResponse(int status, String code, String message) {}
