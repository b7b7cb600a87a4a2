package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.*;
import com.architecture.dotspace.service.diagram.parser.ParsedCluster;
import com.architecture.dotspace.service.diagram.parser.ParsedDiagram;
import com.architecture.dotspace.service.diagram.parser.ParsedEdge;
import com.architecture.dotspace.service.diagram.parser.ParsedNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts a ParsedDiagram (output of either dialect parser) into the canonical {@link DiagramGraph}.
 *
 * Merge policy for repeated node declarations:
 *   1. type: the first declaration that states a type wins, otherwise {@link NodeType#DEFAULT}
 *   2. label, level: last declared value wins
 *   3. attributes: merged key by key, later values overwrite earlier ones
 *   4. cluster: the subgraph of the first declaration
 *
 * Edge endpoints that were never declared are created with the default type and a derived level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagramGraphBuilder {

    static final String ACTIVATION_DEPTH_ATTRIBUTE = "activationDepth";

    private final ClusterCycleDetector clusterCycleDetector;

    public DiagramGraph build(ParsedDiagram parsed) {
        log.info("[graph-builder] Building graph from {} input: declarations={}, edges={}, subgraphs={}",
                parsed.getFormat(), parsed.getNodes().size(), parsed.getEdges().size(), parsed.getClusters().size());

        NodeKeys keys = new NodeKeys();
        Map<String, NodeDraft> drafts = new LinkedHashMap<>();
        List<DiagramEdge> edges = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        boolean containment = parsed.getStructuralMode() == StructuralMode.CONTAINMENT;

        // Step 1: Walk declarations and edges in source order so auto-created nodes keep their position
        for (Object element : inSourceOrder(parsed)) {
            if (element instanceof ParsedNode) {
                ParsedNode node = (ParsedNode) element;
                String key = keys.resolve(node.getName());
                drafts.computeIfAbsent(key, k -> new NodeDraft(k, node.getOrdinal())).declare(node, containment);
            } else {
                ParsedEdge edge = (ParsedEdge) element;
                String source = reference(keys, drafts, edge.getSource(), edge.getOrdinal());
                String target = reference(keys, drafts, edge.getTarget(), edge.getOrdinal());
                edges.add(toEdge(edge, source, target));
            }
        }

        // Step 2: Attach sequence activation metadata
        parsed.getActivationDepths().forEach((name, depth) -> {
            String key = keys.lookup(name);
            if (key == null) {
                log.debug("[graph-builder] Activation of unknown participant '{}' ignored", name);
            } else if (depth > 0) {
                drafts.get(key).attributes.put(ACTIVATION_DEPTH_ATTRIBUTE, String.valueOf(depth));
            }
        });

        // Step 3: Build the cluster forest (containment mode only)
        Map<String, DiagramCluster> clusters = containment
                ? buildClusters(parsed.getClusters(), drafts, diagnostics)
                : Collections.emptyMap();
        if (!containment && !parsed.getClusters().isEmpty()) {
            log.debug("[graph-builder] Edge mode: {} subgraph block(s) treated as visual grouping only",
                    parsed.getClusters().size());
        }
        if (clusters.isEmpty()) {
            drafts.values().forEach(draft -> draft.clusterId = null);
        }

        Map<String, DiagramNode> nodes = new LinkedHashMap<>();
        drafts.forEach((key, draft) -> nodes.put(key, draft.toNode()));

        DiagramGraph graph = DiagramGraph.builder()
                .nodes(Collections.unmodifiableMap(nodes))
                .edges(List.copyOf(edges))
                .clusters(clusters)
                .topLevel(topLevel(parsed.getClusters(), drafts, clusters))
                .graphAttributes(Collections.unmodifiableMap(new LinkedHashMap<>(parsed.getGraphAttributes())))
                .originFormat(parsed.getFormat())
                .structuralMode(parsed.getStructuralMode())
                .diagnostics(List.copyOf(diagnostics))
                .build();

        log.info("[graph-builder] Graph built: mode={}, nodes={}, edges={}, clusters={}, autoCreated={}",
                graph.getStructuralMode(), nodes.size(), edges.size(), clusters.size(),
                drafts.values().stream().filter(draft -> !draft.declared).count());
        return graph;
    }

    private List<Object> inSourceOrder(ParsedDiagram parsed) {
        List<Object> elements = new ArrayList<>(parsed.getNodes().size() + parsed.getEdges().size());
        elements.addAll(parsed.getNodes());
        elements.addAll(parsed.getEdges());
        elements.sort(Comparator.comparingInt(element -> element instanceof ParsedNode
                ? ((ParsedNode) element).getOrdinal()
                : ((ParsedEdge) element).getOrdinal()));
        return elements;
    }

    private String reference(NodeKeys keys, Map<String, NodeDraft> drafts, String name, int ordinal) {
        String key = keys.resolve(name);
        drafts.computeIfAbsent(key, k -> {
            log.debug("[graph-builder] Auto-creating node '{}' referenced by an edge", k);
            return new NodeDraft(k, ordinal);
        });
        return key;
    }

    private DiagramEdge toEdge(ParsedEdge edge, String source, String target) {
        return DiagramEdge.builder()
                .source(source)
                .target(target)
                .label(edge.getLabel())
                .style(edge.getStyle())
                .direction(edge.getDirection())
                .messageKind(edge.getMessageKind())
                .sequence(edge.getSequence())
                .attributes(Collections.unmodifiableMap(new LinkedHashMap<>(edge.getAttributes())))
                .build();
    }

    // ========================= CLUSTERS =========================

    private Map<String, DiagramCluster> buildClusters(List<ParsedCluster> occurrences,
                                                      Map<String, NodeDraft> drafts,
                                                      List<String> diagnostics) {
        if (occurrences.isEmpty()) {
            return Collections.emptyMap();
        }

        // Reopened ids merge into one cluster; the last occurrence decides the parent
        Map<String, Integer> firstOrdinal = new LinkedHashMap<>();
        Map<String, String> parents = new LinkedHashMap<>();
        Map<String, String> labels = new HashMap<>();
        for (ParsedCluster occurrence : occurrences) {
            firstOrdinal.putIfAbsent(occurrence.getId(), occurrence.getOrdinal());
            parents.put(occurrence.getId(), occurrence.getParentId());
            if (occurrence.getLabel() != null) {
                labels.put(occurrence.getId(), occurrence.getLabel());
            }
        }

        List<List<String>> cycles = clusterCycleDetector.findCycles(parents);
        if (!cycles.isEmpty()) {
            String description = cycles.stream()
                    .map(cycle -> String.join(" -> ", cycle))
                    .collect(Collectors.joining("; "));
            log.warn("[graph-builder] Cluster parent cycle detected ({}); discarding the cluster forest", description);
            diagnostics.add("Cluster forest discarded: cyclic parent relation " + description);
            return Collections.emptyMap();
        }

        // Children of each cluster: child clusters by first occurrence, nodes by first declaration
        Map<String, List<Ordered>> children = new HashMap<>();
        parents.forEach((id, parentId) -> {
            if (parentId != null) {
                children.computeIfAbsent(parentId, k -> new ArrayList<>())
                        .add(new Ordered(firstOrdinal.get(id), ClusterChild.cluster(id)));
            }
        });
        drafts.values().stream()
                .filter(draft -> draft.clusterId != null)
                .forEach(draft -> children.computeIfAbsent(draft.clusterId, k -> new ArrayList<>())
                        .add(new Ordered(draft.ordinal, ClusterChild.node(draft.key))));

        Map<String, DiagramCluster> clusters = new LinkedHashMap<>();
        for (String id : firstOrdinal.keySet()) {
            clusters.put(id, DiagramCluster.builder()
                    .id(id)
                    .label(labels.getOrDefault(id, id))
                    .parentId(parents.get(id))
                    .children(sorted(children.getOrDefault(id, Collections.emptyList())))
                    .build());
        }
        return Collections.unmodifiableMap(clusters);
    }

    private List<ClusterChild> topLevel(List<ParsedCluster> occurrences, Map<String, NodeDraft> drafts,
                                        Map<String, DiagramCluster> clusters) {
        List<Ordered> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ParsedCluster occurrence : occurrences) {
            DiagramCluster cluster = clusters.get(occurrence.getId());
            if (cluster != null && cluster.getParentId() == null && seen.add(cluster.getId())) {
                entries.add(new Ordered(occurrence.getOrdinal(), ClusterChild.cluster(cluster.getId())));
            }
        }
        drafts.values().stream()
                .filter(draft -> draft.clusterId == null)
                .forEach(draft -> entries.add(new Ordered(draft.ordinal, ClusterChild.node(draft.key))));
        return sorted(entries);
    }

    private static List<ClusterChild> sorted(List<Ordered> entries) {
        return entries.stream()
                .sorted(Comparator.comparingInt(Ordered::ordinal))
                .map(Ordered::child)
                .collect(Collectors.toUnmodifiableList());
    }

    private static final class Ordered {
        private final int ordinal;
        private final ClusterChild child;

        Ordered(int ordinal, ClusterChild child) {
            this.ordinal = ordinal;
            this.child = child;
        }

        int ordinal() {
            return ordinal;
        }

        ClusterChild child() {
            return child;
        }
    }

    /**
     * Mutable accumulator for one node while declarations are merged.
     */
    private static final class NodeDraft {
        private final String key;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String label;
        private NodeType type;
        private Integer level;
        private String clusterId;
        private final int ordinal;      // first appearance, declaration or edge reference
        private boolean declared;

        NodeDraft(String key, int ordinal) {
            this.key = key;
            this.ordinal = ordinal;
        }

        void declare(ParsedNode node, boolean containment) {
            if (!declared) {
                clusterId = containment ? node.getClusterId() : null;
                declared = true;
            }
            if (type == null && node.getType() != null) {
                type = node.getType();
            }
            if (node.getLabel() != null) {
                label = node.getLabel();
            }
            if (node.getLevel() != null) {
                level = node.getLevel();
            }
            attributes.putAll(node.getAttributes());
        }

        DiagramNode toNode() {
            return DiagramNode.builder()
                    .key(key)
                    .label(label != null ? label : key)
                    .type(type != null ? type : NodeType.DEFAULT)
                    .level(level)
                    .attributes(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)))
                    .clusterId(clusterId)
                    .build();
        }
    }
}
