package com.netcracker.core.ddisync.service.sync;

import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.configuration.SyncSettings;
import com.netcracker.core.ddisync.exception.ValidationException;
import com.netcracker.core.ddisync.model.BatchCreateResult;
import com.netcracker.core.ddisync.model.NetworkCreateRequest;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.service.mapping.AttributeMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bulk creation of networks through the batched client path. No per-item progress, no update of
 * networks that already exist.
 */
@ApplicationScoped
@Slf4j
public class NetworkImportService {
    private final DdiTargetRegistry targetRegistry;
    private final AttributeMapper attributeMapper;
    private final SyncSettings settings;

    @Inject
    public NetworkImportService(DdiTargetRegistry targetRegistry, AttributeMapper attributeMapper, SyncSettings settings) {
        this.targetRegistry = targetRegistry;
        this.attributeMapper = attributeMapper;
        this.settings = settings;
    }

    public CompletableFuture<BatchCreateResult> bulkImport(List<NetworkRecord> networks,
                                                           String networkView,
                                                           Map<String, String> mappings) {
        if (networks.size() > settings.getMaxNetworksPerRequest()) {
            throw new ValidationException("Too many networks in one request: %d, maximum is %d"
                    .formatted(networks.size(), settings.getMaxNetworksPerRequest()));
        }
        String view = networkView == null || networkView.isBlank() ? SyncRequest.DEFAULT_NETWORK_VIEW : networkView;
        List<NetworkCreateRequest> requests = attributeMapper.applyMappings(networks, mappings).stream()
                .map(NetworkCreateRequest::from)
                .toList();
        log.info("Bulk import of {} networks into view '{}'", requests.size(), view);
        return targetRegistry.requireClient().createNetworksBatch(requests, view);
    }
}
