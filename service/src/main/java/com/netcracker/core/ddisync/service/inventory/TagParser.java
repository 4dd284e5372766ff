package com.netcracker.core.ddisync.service.inventory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the tag cell of an inventory row. Accepted forms, tried in order:
 * <ul>
 *     <li>JSON object: {@code {"Environment":"prod","Owner":"ops"}}</li>
 *     <li>{@code key=value} pairs separated by {@code ,} or {@code ;}</li>
 *     <li>{@code key:value} pairs separated by {@code ,} or {@code ;}</li>
 * </ul>
 * A cell that fits none of them yields no tags.
 */
@Slf4j
public final class TagParser {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Pattern PAIR_SEPARATOR = Pattern.compile("[,;]");

    private TagParser() {
    }

    public static Map<String, String> parse(String cell) {
        if (cell == null || cell.isBlank()) {
            return Collections.emptyMap();
        }
        String value = cell.trim();
        if (value.startsWith("{")) {
            Map<String, String> json = parseJson(value);
            if (json != null) {
                return json;
            }
        }
        if (value.indexOf('=') >= 0) {
            return parsePairs(value, '=');
        }
        if (value.indexOf(':') >= 0) {
            return parsePairs(value, ':');
        }
        log.debug("Tag cell '{}' matches no known format, ignoring", value);
        return Collections.emptyMap();
    }

    private static Map<String, String> parseJson(String value) {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            log.debug("Tag cell is not valid JSON, trying pair formats: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, String> tags = new LinkedHashMap<>();
        node.fields().forEachRemaining(field -> {
            JsonNode fieldValue = field.getValue();
            tags.put(field.getKey(), fieldValue.isValueNode() ? fieldValue.asText() : fieldValue.toString());
        });
        return tags;
    }

    private static Map<String, String> parsePairs(String value, char separator) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (String pair : PAIR_SEPARATOR.split(value)) {
            int idx = pair.indexOf(separator);
            if (idx < 0) {
                continue;
            }
            String key = pair.substring(0, idx).trim();
            if (!key.isEmpty()) {
                tags.put(key, pair.substring(idx + 1).trim());
            }
        }
        return tags;
    }
}
