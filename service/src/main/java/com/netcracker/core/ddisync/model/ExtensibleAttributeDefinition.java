package com.netcracker.core.ddisync.model;

import com.netcracker.core.ddisync.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public record ExtensibleAttributeDefinition(String name, String type, String comment) {
    public static final int MAX_NAME_LENGTH = 64;
    public static final int MAX_COMMENT_LENGTH = 500;
    static final Set<String> RESERVED_NAMES = Set.of("network", "network_view", "comment", "_ref");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");

    /**
     * Builds a definition that is safe to send to the store, or fails listing every problem.
     */
    public static ExtensibleAttributeDefinition validated(String name, String type, String comment) {
        List<String> errors = new ArrayList<>();
        String effectiveType = type == null || type.isBlank() ? ExtensibleAttributeType.STRING.name() : type.trim();
        String effectiveComment = comment == null ? "" : comment;

        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            errors.add("Attribute name length must be between 1 and " + MAX_NAME_LENGTH);
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            errors.add("Name must start with letter and contain only letters, numbers, and underscores");
        }
        if (name != null && RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
            errors.add(name + " is a reserved attribute name");
        }
        try {
            ExtensibleAttributeType.valueOf(effectiveType.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Unsupported attribute type: " + effectiveType);
        }
        if (effectiveComment.length() > MAX_COMMENT_LENGTH) {
            errors.add("Comment must not exceed " + MAX_COMMENT_LENGTH + " characters");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new ExtensibleAttributeDefinition(name, effectiveType.toUpperCase(Locale.ROOT), effectiveComment);
    }
}
