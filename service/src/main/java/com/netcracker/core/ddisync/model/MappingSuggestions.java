package com.netcracker.core.ddisync.model;

import java.util.List;

public record MappingSuggestions(String sourceKey, List<AttributeMapping> suggestions, boolean canCreateNew) {

    public MappingSuggestions {
        suggestions = List.copyOf(suggestions);
    }
}
