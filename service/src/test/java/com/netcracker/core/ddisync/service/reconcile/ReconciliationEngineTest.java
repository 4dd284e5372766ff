package com.netcracker.core.ddisync.service.reconcile;

import com.netcracker.core.ddisync.model.AttributeConflict;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.ReconciledNetwork;
import com.netcracker.core.ddisync.model.ReconciliationResult;
import com.netcracker.core.ddisync.model.TargetNetwork;
import com.netcracker.core.ddisync.service.mapping.AttributeMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationEngineTest {
    private static final String REF = "network/ZG5z:10.0.0.0/24/default";

    private final ReconciliationEngine engine = new ReconciliationEngine();
    private final AttributeMapper mapper = new AttributeMapper();

    @Test
    void recordMissingFromStoreShouldBeNew() {
        NetworkRecord network = sample();

        ReconciliationResult result = engine.reconcile(List.of(network), List.of());

        assertThat(result.newNetworks()).extracting(ReconciledNetwork::network).containsExactly(network);
        assertThat(result.existing()).isEmpty();
        assertThat(result.conflicting()).isEmpty();
    }

    @Test
    void matchingAttributesShouldBeExisting() {
        NetworkRecord network = mapped(sample());
        TargetNetwork target = new TargetNetwork("10.0.0.0/24", REF,
                Map.of("environment", Map.of("value", "prod")), "");

        ReconciliationResult result = engine.reconcile(List.of(network), List.of(target));

        assertThat(result.existing()).singleElement().satisfies(r -> {
            assertThat(r.network()).isEqualTo(network);
            assertThat(r.targetRef()).isEqualTo(REF);
            assertThat(r.attributeConflicts()).isEmpty();
        });
        assertThat(result.newNetworks()).isEmpty();
        assertThat(result.conflicting()).isEmpty();
    }

    @Test
    void differingAttributeShouldBeConflicting() {
        NetworkRecord network = mapped(sample());
        TargetNetwork target = new TargetNetwork("10.0.0.0/24", REF,
                Map.of("environment", Map.of("value", "staging")), "");

        ReconciliationResult result = engine.reconcile(List.of(network), List.of(target));

        assertThat(result.conflicting()).singleElement().satisfies(r -> {
            assertThat(r.targetRef()).isEqualTo(REF);
            assertThat(r.attributeConflicts())
                    .containsExactly(new AttributeConflict("environment", "prod", "staging"));
        });
        assertThat(result.newNetworks()).isEmpty();
        assertThat(result.existing()).isEmpty();
    }

    @Test
    void attributesPresentOnOneSideOnlyShouldNotConflict() {
        NetworkRecord network = mapped(sample());
        TargetNetwork target = new TargetNetwork("10.0.0.0/24", REF, Map.of("owner", Map.of("value", "ops")), "");

        assertThat(engine.reconcile(List.of(network), List.of(target)).existing()).hasSize(1);
    }

    @Test
    void valuesShouldCompareAsStrings() {
        NetworkRecord network = new NetworkRecord("10.0.0.0/24", "1", "r", Map.of("vlan", "10"));
        TargetNetwork target = new TargetNetwork("10.0.0.0/24", REF, Map.of("vlan", Map.of("value", 10)), "");

        assertThat(engine.reconcile(List.of(network), List.of(target)).existing()).hasSize(1);
    }

    @Test
    void unmappedRecordShouldCompareRawTags() {
        NetworkRecord network = sample();
        TargetNetwork target = new TargetNetwork("10.0.0.0/24", REF,
                Map.of("Environment", Map.of("value", "dev")), "");

        assertThat(engine.reconcile(List.of(network), List.of(target)).conflicting()).hasSize(1);
    }

    @Test
    void duplicateTargetCidrShouldUseLastOne() {
        NetworkRecord network = mapped(sample());
        TargetNetwork stale = new TargetNetwork("10.0.0.0/24", "network/old", Map.of("environment", "staging"), "");
        TargetNetwork latest = new TargetNetwork("10.0.0.0/24", "network/new", Map.of("environment", "prod"), "");

        ReconciliationResult result = engine.reconcile(List.of(network), List.of(stale, latest));

        assertThat(result.existing()).extracting(ReconciledNetwork::targetRef).containsExactly("network/new");
    }

    @Test
    void everyRecordShouldLandInExactlyOnePartition() {
        List<NetworkRecord> networks = new ArrayList<>();
        List<TargetNetwork> targets = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String subnet = "10.%d.0.0/16".formatted(i);
            String value = i % 2 == 0 ? "prod" : "dev";
            networks.add(mapped(new NetworkRecord(subnet, "1", "r", Map.of("Environment", value))));
            if (i % 3 == 1) {
                targets.add(new TargetNetwork(subnet, "network/" + i, Map.of("environment", Map.of("value", "prod")), ""));
            } else if (i % 3 == 2) {
                targets.add(new TargetNetwork(subnet, "network/" + i, Map.of(), ""));
            }
        }

        ReconciliationResult result = engine.reconcile(networks, targets);

        assertThat(result.total()).isEqualTo(networks.size());
        Set<String> seen = new HashSet<>();
        result.newNetworks().forEach(r -> assertThat(seen.add(r.subnet())).isTrue());
        result.existing().forEach(r -> assertThat(seen.add(r.subnet())).isTrue());
        result.conflicting().forEach(r -> assertThat(seen.add(r.subnet())).isTrue());
        assertThat(seen).hasSize(networks.size());
        assertThat(result.newNetworks()).hasSize(10);
        assertThat(result.allNetworks()).containsExactlyInAnyOrderElementsOf(networks);
    }

    private NetworkRecord mapped(NetworkRecord network) {
        return mapper.applyMappings(List.of(network), Map.of("Environment", "environment")).get(0);
    }

    private static NetworkRecord sample() {
        return new NetworkRecord("10.0.0.0/24", "123", "us-east-1", Map.of("Environment", "prod"));
    }
}
