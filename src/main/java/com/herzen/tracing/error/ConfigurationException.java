package com.herzen.tracing.error;

public class ConfigurationException extends TracingException {
    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
