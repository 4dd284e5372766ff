package com.netcracker.core.ddisync.exception;

import java.util.List;

/**
 * Malformed input: missing columns, invalid subnets, bad attribute definitions.
 * Carries every problem found, not only the first one.
 */
public class ValidationException extends DdiSyncException {
    private final List<String> errors;

    public ValidationException(String error) {
        this(List.of(error));
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
