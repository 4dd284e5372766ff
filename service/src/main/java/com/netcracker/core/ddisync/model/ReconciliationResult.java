package com.netcracker.core.ddisync.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Disjoint partition of the reconciled records. Every input record lands in exactly one list.
 */
public record ReconciliationResult(List<ReconciledNetwork> newNetworks,
                                   List<ReconciledNetwork> existing,
                                   List<ReconciledNetwork> conflicting) {

    public ReconciliationResult {
        newNetworks = List.copyOf(newNetworks);
        existing = List.copyOf(existing);
        conflicting = List.copyOf(conflicting);
    }

    public int total() {
        return newNetworks.size() + existing.size() + conflicting.size();
    }

    /**
     * All records in partition order (new, existing, conflicting), as candidates for an apply run.
     */
    public List<NetworkRecord> allNetworks() {
        List<NetworkRecord> networks = new ArrayList<>(total());
        newNetworks.forEach(n -> networks.add(n.network()));
        existing.forEach(n -> networks.add(n.network()));
        conflicting.forEach(n -> networks.add(n.network()));
        return networks;
    }
}
