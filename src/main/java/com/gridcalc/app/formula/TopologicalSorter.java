package com.gridcalc.app.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn's algorithm over a dependency map (dependent -> dependencies).
 * Nodes only named as dependencies are treated as having none.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {
    }

    public static TopologicalOrder sort(Map<String, Set<String>> dependencies) {
        // dependency -> dependents, plus indegree = number of dependencies
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> indegree = new LinkedHashMap<>();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String node = entry.getKey();
            indegree.put(node, entry.getValue().size());
            dependents.computeIfAbsent(node, k -> new ArrayList<>());
            for (String dependency : entry.getValue()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node);
                indegree.putIfAbsent(dependency, 0);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : indegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.add(entry.getKey());
            }
        }

        List<String> order = new ArrayList<>(indegree.size());
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (String dependent : dependents.getOrDefault(node, Collections.emptyList())) {
                int remaining = indegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        Set<String> unresolved = new LinkedHashSet<>();
        if (order.size() < indegree.size()) {
            Set<String> placed = new LinkedHashSet<>(order);
            for (String node : indegree.keySet()) {
                if (!placed.contains(node)) {
                    unresolved.add(node);
                }
            }
        }
        return new TopologicalOrder(order, unresolved);
    }
}
