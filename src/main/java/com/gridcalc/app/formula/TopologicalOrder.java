package com.gridcalc.app.formula;

import java.util.List;
import java.util.Set;

/**
 * Result of sorting a dependency map. When the map has a cycle the order is
 * partial and {@link #getUnresolved()} lists the nodes that could not be placed.
 */
public final class TopologicalOrder {
    private final List<String> order;
    private final Set<String> unresolved;

    TopologicalOrder(List<String> order, Set<String> unresolved) {
        this.order = List.copyOf(order);
        this.unresolved = Set.copyOf(unresolved);
    }

    /**
     * Nodes with every dependency placed before them.
     */
    public List<String> getOrder() {
        return order;
    }

    /**
     * Nodes on a cycle or depending on one; empty when the sort succeeded.
     */
    public Set<String> getUnresolved() {
        return unresolved;
    }

    public boolean hasCycle() {
        return !unresolved.isEmpty();
    }
}
