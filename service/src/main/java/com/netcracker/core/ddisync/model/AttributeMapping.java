package com.netcracker.core.ddisync.model;

/**
 * Suggested correspondence between a source tag key and a target attribute name.
 */
public record AttributeMapping(String sourceKey, String targetKey, double confidence, boolean exactMatch) {

    public double confidencePercent() {
        return Math.round(confidence * 1000.0) / 10.0;
    }
}
