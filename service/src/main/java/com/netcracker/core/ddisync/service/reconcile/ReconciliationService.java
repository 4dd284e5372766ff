package com.netcracker.core.ddisync.service.reconcile;

import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.ReconciliationResult;
import com.netcracker.core.ddisync.service.mapping.AttributeMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dry run: shows what an apply run would do without writing to the store.
 */
@ApplicationScoped
@Slf4j
public class ReconciliationService {
    private final DdiTargetRegistry targetRegistry;
    private final AttributeMapper attributeMapper;
    private final ReconciliationEngine engine;

    @Inject
    public ReconciliationService(DdiTargetRegistry targetRegistry,
                                 AttributeMapper attributeMapper,
                                 ReconciliationEngine engine) {
        this.targetRegistry = targetRegistry;
        this.attributeMapper = attributeMapper;
        this.engine = engine;
    }

    /**
     * Applies the mappings, reads every network of the view and reconciles.
     *
     * @throws com.netcracker.core.ddisync.exception.ConfigurationException when no target store is configured
     */
    public CompletableFuture<ReconciliationResult> dryRun(List<NetworkRecord> networks,
                                                          String networkView,
                                                          Map<String, String> mappings) {
        List<NetworkRecord> mapped = attributeMapper.applyMappings(networks, mappings);
        log.info("Dry run of {} networks against view '{}'", mapped.size(), networkView);
        return targetRegistry.requireClient()
                .listNetworksBatched(networkView)
                .thenApply(targetNetworks -> engine.reconcile(mapped, targetNetworks));
    }
}
