package com.netcracker.core.ddisync.service.mapping;

import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.model.ExtensibleAttributeDefinition;
import com.netcracker.core.ddisync.model.ExtensibleAttributeType;
import com.netcracker.core.ddisync.model.MappingSuggestions;
import com.netcracker.core.ddisync.model.NetworkRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Attribute definitions of the target store: listing, validated creation, mapping suggestions
 * and value checks against the declared types.
 */
@ApplicationScoped
@Slf4j
public class ExtensibleAttributeService {
    private final DdiTargetRegistry targetRegistry;
    private final AttributeMapper attributeMapper;

    @Inject
    public ExtensibleAttributeService(DdiTargetRegistry targetRegistry, AttributeMapper attributeMapper) {
        this.targetRegistry = targetRegistry;
        this.attributeMapper = attributeMapper;
    }

    public CompletableFuture<List<ExtensibleAttributeDefinition>> listAttributes() {
        return targetRegistry.requireClient().getExtensibleAttributes();
    }

    /**
     * Validates the definition locally, then creates it in the store.
     *
     * @throws com.netcracker.core.ddisync.exception.ValidationException before any remote call
     */
    public CompletableFuture<String> createAttribute(String name, String type, String comment) {
        ExtensibleAttributeDefinition definition = ExtensibleAttributeDefinition.validated(name, type, comment);
        log.info("Creating extensible attribute '{}' of type {}", definition.name(), definition.type());
        return targetRegistry.requireClient().createExtensibleAttribute(definition);
    }

    public CompletableFuture<Map<String, MappingSuggestions>> suggestMappings(List<String> sourceKeys) {
        return listAttributes().thenApply(definitions -> attributeMapper.suggestMappings(
                sourceKeys,
                definitions.stream().map(ExtensibleAttributeDefinition::name).toList()));
    }

    /**
     * Checks a value against an attribute type. Unknown types are treated as {@code STRING}.
     */
    public Optional<String> validateValue(String value, String type) {
        return resolveType(type).validateValue(value);
    }

    /**
     * Checks every mapped attribute of the records against the store definitions and returns one message
     * per offending value. Attributes without a definition are not checked.
     */
    public List<String> validateMappedValues(List<NetworkRecord> networks, List<ExtensibleAttributeDefinition> definitions) {
        Map<String, ExtensibleAttributeDefinition> byName = definitions.stream()
                .collect(Collectors.toMap(ExtensibleAttributeDefinition::name, Function.identity(), (a, b) -> b));
        List<String> errors = new ArrayList<>();
        for (NetworkRecord network : networks) {
            if (!network.isMapped()) {
                continue;
            }
            network.mappedAttributes().forEach((name, value) -> {
                ExtensibleAttributeDefinition definition = byName.get(name);
                if (definition != null) {
                    validateValue(value.value(), definition.type())
                            .ifPresent(error -> errors.add("%s, attribute %s: %s".formatted(network.subnet(), name, error)));
                }
            });
        }
        return errors;
    }

    private static ExtensibleAttributeType resolveType(String type) {
        if (type == null || type.isBlank()) {
            return ExtensibleAttributeType.STRING;
        }
        try {
            return ExtensibleAttributeType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown attribute type '{}', validating as STRING", type);
            return ExtensibleAttributeType.STRING;
        }
    }
}
