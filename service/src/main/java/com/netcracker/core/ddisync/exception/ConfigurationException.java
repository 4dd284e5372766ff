package com.netcracker.core.ddisync.exception;

public class ConfigurationException extends DdiSyncException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
