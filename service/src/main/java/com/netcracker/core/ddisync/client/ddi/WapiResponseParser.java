package com.netcracker.core.ddisync.client.ddi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.netcracker.core.ddisync.model.ExtensibleAttributeDefinition;
import com.netcracker.core.ddisync.model.NetworkView;
import com.netcracker.core.ddisync.model.TargetNetwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads WAPI JSON bodies into the model.
 */
final class WapiResponseParser {
    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private WapiResponseParser() {
    }

    static JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    static String readRef(String location, String body) {
        if (location != null && !location.isBlank()) {
            return location;
        }
        JsonNode node = readBody(body);
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.hasNonNull("_ref")) {
            return node.get("_ref").asText();
        }
        return "";
    }

    /**
     * One page of networks. A plain array is a complete, unpaged result; an object carries
     * {@code result} and optionally {@code next_page_id}.
     */
    static Page page(JsonNode body) {
        if (body != null && body.isObject()) {
            String next = body.hasNonNull("next_page_id") ? body.get("next_page_id").asText() : null;
            return new Page(networks(body.get("result")), next == null || next.isBlank() ? null : next);
        }
        return new Page(networks(body), null);
    }

    static List<TargetNetwork> networks(JsonNode body) {
        if (body == null || !body.isArray()) {
            return Collections.emptyList();
        }
        List<TargetNetwork> networks = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            networks.add(network(node));
        }
        return networks;
    }

    static TargetNetwork network(JsonNode node) {
        Map<String, Object> extattrs = node.hasNonNull("extattrs")
                ? OBJECT_MAPPER.convertValue(node.get("extattrs"), ATTRIBUTES_TYPE)
                : Map.of();
        return new TargetNetwork(
                text(node, "network"),
                text(node, "_ref"),
                extattrs,
                text(node, "comment"));
    }

    static List<NetworkView> networkViews(JsonNode body) {
        List<NetworkView> views = new ArrayList<>();
        if (body != null && body.isArray()) {
            body.forEach(node -> views.add(new NetworkView(text(node, "name"), text(node, "comment"))));
        }
        return views;
    }

    static List<ExtensibleAttributeDefinition> attributeDefinitions(JsonNode body) {
        List<ExtensibleAttributeDefinition> definitions = new ArrayList<>();
        if (body != null && body.isArray()) {
            body.forEach(node -> definitions.add(new ExtensibleAttributeDefinition(
                    text(node, "name"), text(node, "type"), text(node, "comment"))));
        }
        return definitions;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    record Page(List<TargetNetwork> networks, String nextPageId) {
    }
}
