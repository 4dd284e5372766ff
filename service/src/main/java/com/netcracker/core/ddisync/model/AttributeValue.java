package com.netcracker.core.ddisync.model;

import java.util.Map;

/**
 * Extensible attribute value envelope, serialized as {@code {"value": "..."}}.
 */
public record AttributeValue(String value) {

    /**
     * Extracts the plain string from a value read back from the store. Enveloped values
     * ({@code {"value": 10, "inheritance_source": ...}}) are unwrapped; anything else is rendered as is.
     */
    public static String unwrap(Object raw) {
        if (raw instanceof AttributeValue attributeValue) {
            return attributeValue.value();
        }
        if (raw instanceof Map<?, ?> map && map.containsKey("value")) {
            return String.valueOf(map.get("value"));
        }
        return raw == null ? null : String.valueOf(raw);
    }
}
