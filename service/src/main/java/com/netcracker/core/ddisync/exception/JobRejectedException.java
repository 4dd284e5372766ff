package com.netcracker.core.ddisync.exception;

/**
 * A sync job could not be admitted: the network view is busy or the job queue is full.
 */
public class JobRejectedException extends DdiSyncException {

    public JobRejectedException(String message) {
        super(message);
    }

    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
