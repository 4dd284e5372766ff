package com.netcracker.core.ddisync.model;

public record AttributeConflict(String attribute, String sourceValue, String targetValue) {
}
