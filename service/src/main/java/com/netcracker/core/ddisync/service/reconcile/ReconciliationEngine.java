package com.netcracker.core.ddisync.service.reconcile;

import com.netcracker.core.ddisync.model.AttributeConflict;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.ReconciledNetwork;
import com.netcracker.core.ddisync.model.ReconciliationResult;
import com.netcracker.core.ddisync.model.TargetNetwork;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits source records into new, existing and conflicting against the networks of one view.
 * <p>
 * A record is compared only on the attributes both sides carry; values are compared as strings after the
 * target envelope is unwrapped. The result depends on the inputs alone.
 */
@ApplicationScoped
@Slf4j
public class ReconciliationEngine {

    public ReconciliationResult reconcile(List<NetworkRecord> networks, Collection<TargetNetwork> targetNetworks) {
        Map<String, TargetNetwork> byCidr = new HashMap<>();
        for (TargetNetwork target : targetNetworks) {
            TargetNetwork previous = byCidr.put(target.cidr(), target);
            if (previous != null) {
                log.warn("Target store holds {} more than once ({} and {}), using the latter",
                        target.cidr(), previous.ref(), target.ref());
            }
        }

        List<ReconciledNetwork> created = new ArrayList<>();
        List<ReconciledNetwork> existing = new ArrayList<>();
        List<ReconciledNetwork> conflicting = new ArrayList<>();
        for (NetworkRecord network : networks) {
            TargetNetwork target = byCidr.get(network.subnet());
            if (target == null) {
                created.add(ReconciledNetwork.unmatched(network));
                continue;
            }
            List<AttributeConflict> conflicts = compare(network, target);
            if (conflicts.isEmpty()) {
                existing.add(new ReconciledNetwork(network, target.ref(), List.of()));
            } else {
                conflicting.add(new ReconciledNetwork(network, target.ref(), conflicts));
            }
        }
        log.debug("Reconciled {} networks against {} target networks: new={}, existing={}, conflicting={}",
                networks.size(), byCidr.size(), created.size(), existing.size(), conflicting.size());
        return new ReconciliationResult(created, existing, conflicting);
    }

    static List<AttributeConflict> compare(NetworkRecord network, TargetNetwork target) {
        List<AttributeConflict> conflicts = new ArrayList<>();
        network.comparableAttributes().forEach((name, sourceValue) -> {
            if (!target.hasAttribute(name)) {
                return;
            }
            String targetValue = target.attributeValue(name);
            if (!Objects.equals(sourceValue, targetValue)) {
                conflicts.add(new AttributeConflict(name, sourceValue, targetValue));
            }
        });
        return conflicts;
    }
}
