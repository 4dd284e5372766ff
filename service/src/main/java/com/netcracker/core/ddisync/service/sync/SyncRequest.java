package com.netcracker.core.ddisync.service.sync;

import com.netcracker.core.ddisync.model.MappingRule;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.ReconciliationResult;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Input of an apply run. An empty {@code mappingRules} means the records are taken as they are,
 * already mapped or not.
 */
public record SyncRequest(List<NetworkRecord> networks,
                          String networkView,
                          Map<String, MappingRule> mappingRules,
                          Duration timeout) {
    public static final String DEFAULT_NETWORK_VIEW = "default";

    public SyncRequest {
        networks = List.copyOf(networks);
        networkView = networkView == null || networkView.isBlank() ? DEFAULT_NETWORK_VIEW : networkView;
        mappingRules = mappingRules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(mappingRules));
    }

    public static SyncRequest of(List<NetworkRecord> networks, String networkView, Map<String, String> mappings) {
        Map<String, MappingRule> rules = new LinkedHashMap<>();
        if (mappings != null) {
            mappings.forEach((source, target) -> rules.put(source, MappingRule.to(target)));
        }
        return new SyncRequest(networks, networkView, rules, null);
    }

    /**
     * Every reconciled record, new ones first. The store is queried again per item, so a record
     * reconciled as new may still end up updated.
     */
    public static SyncRequest fromReconciliation(ReconciliationResult result, String networkView) {
        return new SyncRequest(result.allNetworks(), networkView, Map.of(), null);
    }

    public SyncRequest withTimeout(Duration timeout) {
        return new SyncRequest(networks, networkView, mappingRules, timeout);
    }

    public Optional<Duration> maybeTimeout() {
        return Optional.ofNullable(timeout);
    }
}
