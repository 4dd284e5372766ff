package com.netcracker.core.ddisync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Network as held by the target store. {@code ref} is the store handle required for updates.
 */
public record TargetNetwork(String cidr, String ref, Map<String, Object> extendedAttributes, String comment) {

    public TargetNetwork {
        extendedAttributes = extendedAttributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extendedAttributes));
    }

    public boolean hasAttribute(String name) {
        return extendedAttributes.containsKey(name);
    }

    public String attributeValue(String name) {
        return AttributeValue.unwrap(extendedAttributes.get(name));
    }
}
