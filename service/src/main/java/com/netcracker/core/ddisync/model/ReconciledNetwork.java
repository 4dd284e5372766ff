package com.netcracker.core.ddisync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Source record decorated with what reconciliation found: the store reference when the subnet
 * already exists, and the attribute conflicts when values differ.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciledNetwork(NetworkRecord network, String targetRef, List<AttributeConflict> attributeConflicts) {

    public ReconciledNetwork {
        attributeConflicts = attributeConflicts == null ? List.of() : List.copyOf(attributeConflicts);
    }

    public static ReconciledNetwork unmatched(NetworkRecord network) {
        return new ReconciledNetwork(network, null, List.of());
    }

    public String subnet() {
        return network.subnet();
    }
}
