package com.netcracker.core.ddisync.exception;

/**
 * The target store answered 401. Never retried.
 */
public class AuthenticationException extends DdiSyncException {

    public AuthenticationException(String message) {
        super(message);
    }
}
