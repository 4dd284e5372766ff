package com.netcracker.core.ddisync.service.reconcile;

import com.netcracker.core.ddisync.client.ddi.DdiClient;
import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.exception.ConfigurationException;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.ReconciliationResult;
import com.netcracker.core.ddisync.model.TargetNetwork;
import com.netcracker.core.ddisync.service.mapping.AttributeMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ReconciliationServiceTest {

    @Test
    void dryRunShouldMapThenReconcileAgainstWholeView() throws Exception {
        DdiClient client = mock(DdiClient.class);
        DdiTargetRegistry registry = mock(DdiTargetRegistry.class);
        doReturn(client).when(registry).requireClient();
        doReturn(CompletableFuture.completedFuture(List.of(
                new TargetNetwork("10.0.0.0/24", "network/a", Map.of("environment", Map.of("value", "staging")), ""))))
                .when(client).listNetworksBatched("prod-view");
        ReconciliationService service = new ReconciliationService(registry, new AttributeMapper(), new ReconciliationEngine());
        List<NetworkRecord> networks = List.of(
                new NetworkRecord("10.0.0.0/24", "123", "us-east-1", Map.of("Environment", "prod")),
                new NetworkRecord("10.0.1.0/24", "123", "us-east-1", Map.of("Environment", "prod")));

        ReconciliationResult result = service.dryRun(networks, "prod-view", Map.of("Environment", "environment"))
                .get(1, TimeUnit.SECONDS);

        assertThat(result.conflicting()).singleElement().satisfies(r -> {
            assertThat(r.subnet()).isEqualTo("10.0.0.0/24");
            assertThat(r.network().isMapped()).isTrue();
        });
        assertThat(result.newNetworks()).extracting(r -> r.subnet()).containsExactly("10.0.1.0/24");
    }

    @Test
    void dryRunShouldFailWhenStoreIsNotConfigured() {
        DdiTargetRegistry registry = mock(DdiTargetRegistry.class);
        doThrow(new ConfigurationException("DDI target store is not configured")).when(registry).requireClient();
        ReconciliationService service = new ReconciliationService(registry, new AttributeMapper(), new ReconciliationEngine());

        assertThatThrownBy(() -> service.dryRun(List.of(), "default", Map.of()))
                .isInstanceOf(ConfigurationException.class);
    }
}
