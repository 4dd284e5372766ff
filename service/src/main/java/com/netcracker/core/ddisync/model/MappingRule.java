package com.netcracker.core.ddisync.model;

/**
 * Chosen target for one source tag key. A blank {@code targetKey} means the tag is skipped.
 */
public record MappingRule(String targetKey, ValueTransform transform) {

    public MappingRule {
        transform = transform == null ? ValueTransform.NONE : transform;
    }

    public static MappingRule to(String targetKey) {
        return new MappingRule(targetKey, ValueTransform.NONE);
    }

    public boolean isSkipped() {
        return targetKey == null || targetKey.isBlank();
    }
}
