package com.netcracker.core.ddisync.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Attribute types accepted by the target store, each with its value check.
 */
public enum ExtensibleAttributeType {
    STRING,
    INTEGER,
    EMAIL,
    URL,
    DATE,
    ENUM;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[\\w.-]+@[\\w.-]+\\.\\w+$");
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://[\\w.-]+");

    public Optional<String> validateValue(String value) {
        return switch (this) {
            case INTEGER -> isInteger(value)
                    ? Optional.empty()
                    : Optional.of("Value '%s' is not a valid integer".formatted(value));
            case EMAIL -> value != null && EMAIL_PATTERN.matcher(value).matches()
                    ? Optional.empty()
                    : Optional.of("Value '%s' is not a valid email address".formatted(value));
            case URL -> value != null && URL_PATTERN.matcher(value).lookingAt()
                    ? Optional.empty()
                    : Optional.of("Value '%s' is not a valid URL".formatted(value));
            default -> Optional.empty();
        };
    }

    private static boolean isInteger(String value) {
        if (value == null) {
            return false;
        }
        try {
            Long.parseLong(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
