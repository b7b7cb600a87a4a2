package com.architecture.dotspace.service.diagram.layout;

import com.architecture.dotspace.model.diagram.DiagramCluster;
import com.architecture.dotspace.model.diagram.DiagramEdge;
import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.model.diagram.DiagramNode;
import com.architecture.dotspace.model.diagram.StructuralMode;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Computes the vertical level of every node. An explicit level on a node always wins.
 *
 * Edge mode: longest path from a root after removing back edges. Back edges are found by a
 * depth-first pass that starts at nodes without incoming edges (declaration order), then at any
 * node still unvisited. Containment mode: {@code (deepest cluster nesting + 1) - enclosing clusters}.
 */
@Component
public class LevelAssigner {

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    public LevelAssignment assign(DiagramGraph graph) {
        if (graph.getStructuralMode() == StructuralMode.CONTAINMENT) {
            return new LevelAssignment(withExplicit(graph, containmentLevels(graph)), Collections.emptySet());
        }

        List<String> order = new ArrayList<>(graph.getNodes().keySet());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }

        // outgoing[i] holds edge positions leaving node i, in edge order
        List<List<Integer>> outgoing = new ArrayList<>();
        order.forEach(key -> outgoing.add(new ArrayList<>()));
        int[] incoming = new int[order.size()];
        List<DiagramEdge> edges = graph.getEdges();
        for (int e = 0; e < edges.size(); e++) {
            DiagramEdge edge = edges.get(e);
            outgoing.get(index.get(edge.getSource())).add(e);
            incoming[index.get(edge.getTarget())]++;
        }

        Set<Integer> backEdges = findBackEdges(edges, index, outgoing, incoming);
        int[] derived = longestPath(edges, index, outgoing, backEdges);

        Map<String, Integer> levels = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            levels.put(order.get(i), derived[i]);
        }
        return new LevelAssignment(withExplicit(graph, levels), Collections.unmodifiableSet(backEdges));
    }

    private Set<Integer> findBackEdges(List<DiagramEdge> edges, Map<String, Integer> index,
                                       List<List<Integer>> outgoing, int[] incoming) {
        int n = incoming.length;
        int[] color = new int[n];
        Set<Integer> backEdges = new TreeSet<>();

        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (incoming[i] == 0) starts.add(i);
        }
        for (int i = 0; i < n; i++) {
            if (incoming[i] != 0) starts.add(i);
        }

        // frame = {node, next outgoing position}
        Deque<int[]> stack = new ArrayDeque<>();
        for (int start : starts) {
            if (color[start] != WHITE) continue;
            color[start] = GREY;
            stack.push(new int[]{start, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> out = outgoing.get(frame[0]);
                if (frame[1] == out.size()) {
                    color[frame[0]] = BLACK;
                    stack.pop();
                    continue;
                }
                int edge = out.get(frame[1]++);
                int target = index.get(edges.get(edge).getTarget());
                if (color[target] == GREY) {
                    backEdges.add(edge);
                } else if (color[target] == WHITE) {
                    color[target] = GREY;
                    stack.push(new int[]{target, 0});
                }
            }
        }
        return backEdges;
    }

    /**
     * Kahn's algorithm over the acyclic remainder; each node gets the longest distance from a root.
     */
    private int[] longestPath(List<DiagramEdge> edges, Map<String, Integer> index,
                              List<List<Integer>> outgoing, Set<Integer> backEdges) {
        int n = outgoing.size();
        int[] indegree = new int[n];
        for (int e = 0; e < edges.size(); e++) {
            if (!backEdges.contains(e)) {
                indegree[index.get(edges.get(e).getTarget())]++;
            }
        }

        int[] level = new int[n];
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (indegree[i] == 0) ready.add(i);
        }
        while (!ready.isEmpty()) {
            int node = ready.poll();
            for (int e : outgoing.get(node)) {
                if (backEdges.contains(e)) continue;
                int target = index.get(edges.get(e).getTarget());
                level[target] = Math.max(level[target], level[node] + 1);
                if (--indegree[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return level;
    }

    private Map<String, Integer> containmentLevels(DiagramGraph graph) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        if (!graph.hasClusters()) {
            graph.getNodes().keySet().forEach(key -> levels.put(key, 0));
            return levels;
        }

        Map<String, Integer> depths = clusterDepths(graph.getClusters());
        int ground = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        graph.getNodes().values().forEach(node -> {
            int enclosing = node.getClusterId() == null ? 0 : depths.getOrDefault(node.getClusterId(), 0);
            levels.put(node.getKey(), ground - enclosing);
        });
        return levels;
    }

    /**
     * Nesting depth per cluster, 1 for roots. The forest is acyclic by the time it reaches layout.
     */
    static Map<String, Integer> clusterDepths(Map<String, DiagramCluster> clusters) {
        Map<String, Integer> depths = new HashMap<>();
        for (String id : clusters.keySet()) {
            Deque<String> chain = new ArrayDeque<>();
            String current = id;
            while (current != null && !depths.containsKey(current) && clusters.containsKey(current)) {
                chain.push(current);
                current = clusters.get(current).getParentId();
            }
            int depth = current == null || !depths.containsKey(current) ? 0 : depths.get(current);
            while (!chain.isEmpty()) {
                depths.put(chain.pop(), ++depth);
            }
        }
        return depths;
    }

    private Map<String, Integer> withExplicit(DiagramGraph graph, Map<String, Integer> derived) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (DiagramNode node : graph.getNodes().values()) {
            levels.put(node.getKey(), node.hasExplicitLevel() ? node.getLevel() : derived.get(node.getKey()));
        }
        return Collections.unmodifiableMap(levels);
    }
}
