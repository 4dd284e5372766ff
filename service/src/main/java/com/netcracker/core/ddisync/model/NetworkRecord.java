package com.netcracker.core.ddisync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One network parsed from the external inventory export.
 * {@code mappedAttributes} stays {@code null} until attribute mappings are applied.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkRecord(String subnet,
                            String account,
                            String region,
                            Map<String, String> tags,
                            Map<String, String> rawFields,
                            Map<String, AttributeValue> mappedAttributes) {
    private static final String COMMENT_TEMPLATE = "AWS Account: %s, Region: %s";

    public NetworkRecord {
        tags = copy(tags);
        rawFields = copy(rawFields);
        mappedAttributes = mappedAttributes == null ? null : copy(mappedAttributes);
    }

    public NetworkRecord(String subnet, String account, String region, Map<String, String> tags) {
        this(subnet, account, region, tags, Map.of(), null);
    }

    public NetworkRecord withMappedAttributes(Map<String, AttributeValue> attributes) {
        return new NetworkRecord(subnet, account, region, tags, rawFields, attributes);
    }

    @JsonIgnore
    public boolean isMapped() {
        return mappedAttributes != null;
    }

    /**
     * Attribute values used when comparing against the store: the mapped attributes once mapping
     * was applied, otherwise the raw tags.
     */
    @JsonIgnore
    public Map<String, String> comparableAttributes() {
        if (!isMapped()) {
            return tags;
        }
        Map<String, String> plain = new LinkedHashMap<>();
        mappedAttributes.forEach((key, value) -> plain.put(key, value.value()));
        return plain;
    }

    @JsonIgnore
    public String generatedComment() {
        return COMMENT_TEMPLATE.formatted(account, region);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
