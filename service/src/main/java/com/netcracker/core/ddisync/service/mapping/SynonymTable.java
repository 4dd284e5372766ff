package com.netcracker.core.ddisync.service.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known spellings of common tag names. The first entry of a group is its canonical name.
 */
public final class SynonymTable {
    static final List<List<String>> DEFAULT_GROUPS = List.of(
            List.of("created_by", "createdby", "created-by", "creator", "created_user"),
            List.of("created_date", "createddate", "created-date", "creation_date", "created_at"),
            List.of("modified_by", "modifiedby", "modified-by", "updated_by", "updatedby"),
            List.of("modified_date", "modifieddate", "modified-date", "updated_date", "updated_at"),
            List.of("environment", "env", "Environment", "ENV"),
            List.of("application", "app", "Application", "APP"),
            List.of("owner", "Owner", "owned_by", "ownedby"),
            List.of("cost_center", "costcenter", "cost-center", "cc"),
            List.of("project", "Project", "project_name", "projectname"),
            List.of("department", "dept", "Department", "DEPT"));

    private final Map<String, String> canonicalByVariant;

    public SynonymTable(List<List<String>> groups) {
        Map<String, String> index = new HashMap<>();
        for (List<String> group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            String canonical = AttributeMapper.normalize(group.get(0));
            group.forEach(variant -> index.putIfAbsent(AttributeMapper.normalize(variant), canonical));
        }
        this.canonicalByVariant = Collections.unmodifiableMap(index);
    }

    public static SynonymTable defaults() {
        return new SynonymTable(DEFAULT_GROUPS);
    }

    /**
     * @param normalizedKey key already passed through {@link AttributeMapper#normalize(String)}
     */
    public Optional<String> canonicalOf(String normalizedKey) {
        return Optional.ofNullable(canonicalByVariant.get(normalizedKey));
    }

    public boolean areSynonyms(String normalizedA, String normalizedB) {
        Optional<String> canonical = canonicalOf(normalizedA);
        return canonical.isPresent() && canonical.equals(canonicalOf(normalizedB));
    }
}
