package com.netcracker.core.ddisync.service.inventory;

import com.netcracker.core.ddisync.model.NetworkRecord;

import java.util.List;

/**
 * Parsed export: records in row order and the sorted distinct tag keys seen across them.
 */
public record InventoryParseResult(List<NetworkRecord> networks, List<String> uniqueTagKeys) {

    public InventoryParseResult {
        networks = List.copyOf(networks);
        uniqueTagKeys = List.copyOf(uniqueTagKeys);
    }
}
