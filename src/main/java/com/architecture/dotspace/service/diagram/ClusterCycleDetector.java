package com.architecture.dotspace.service.diagram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Detects cycles in the cluster parent relation.
 *
 * Every cluster has at most one parent, so a cycle is found by walking parent links until the walk
 * reaches a root, a cluster already known to be acyclic, or a cluster already on the current path.
 */
@Component
@Slf4j
public class ClusterCycleDetector {

    /**
     * Find all distinct cycles. Each cycle lists the cluster ids in parent order with the first id
     * repeated at the end, rotated so the smallest id comes first.
     *
     * @param parents cluster id to parent id (null for a root), iteration order decides walk order
     */
    public List<List<String>> findCycles(Map<String, String> parents) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> settled = new HashSet<>();
        Set<String> reported = new HashSet<>();

        for (String start : parents.keySet()) {
            if (settled.contains(start)) continue;

            List<String> path = new ArrayList<>();
            Map<String, Integer> onPath = new HashMap<>();
            String current = start;
            while (current != null && parents.containsKey(current) && !settled.contains(current)) {
                Integer seenAt = onPath.get(current);
                if (seenAt != null) {
                    List<String> cycle = normalize(path.subList(seenAt, path.size()));
                    if (reported.add(String.join("\u0000", cycle))) {
                        cycles.add(cycle);
                    }
                    break;
                }
                onPath.put(current, path.size());
                path.add(current);
                current = parents.get(current);
            }
            settled.addAll(path);
        }

        if (!cycles.isEmpty()) {
            log.debug("[graph-builder] Found {} cluster parent cycle(s)", cycles.size());
        }
        return cycles;
    }

    public boolean hasCycle(Map<String, String> parents) {
        return !findCycles(parents).isEmpty();
    }

    /**
     * Rotate so the same cycle found from different starting points yields the same list.
     */
    private List<String> normalize(List<String> core) {
        String min = Collections.min(core);
        int minIdx = core.indexOf(min);
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        normalized.add(min);
        return normalized;
    }
}
