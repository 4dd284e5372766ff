package com.netcracker.core.ddisync.exception;

/**
 * Base type for every failure raised by the sync manager.
 */
public class DdiSyncException extends RuntimeException {

    public DdiSyncException(String message) {
        super(message);
    }

    public DdiSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
