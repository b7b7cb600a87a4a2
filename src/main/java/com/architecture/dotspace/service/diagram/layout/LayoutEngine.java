package com.architecture.dotspace.service.diagram.layout;

import com.architecture.dotspace.exception.DanglingReferenceException;
import com.architecture.dotspace.model.diagram.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Assigns every node a 3D position and an appearance. Stateless: the same graph and settings
 * always give the same layout.
 *
 * Nodes of one level share a ring of radius {@code base + k * sqrt(siblingCount)} at height
 * {@code level * verticalSpacing}. In edge mode a node's angle is its index on the ring by
 * declaration order. In containment mode every cluster owns an equal slice of its parent's sector
 * and a node sits at the start of its own slice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LayoutEngine {

    private static final double FULL_CIRCLE = 2 * Math.PI;

    private final LayoutSettings settings;
    private final LevelAssigner levelAssigner;

    public DiagramLayout layout(DiagramGraph graph) {
        verifyEndpoints(graph);

        LevelAssignment assignment = levelAssigner.assign(graph);
        Map<String, Integer> levels = assignment.getLevels();

        Map<Integer, Integer> ringSizes = new HashMap<>();
        levels.values().forEach(level -> ringSizes.merge(level, 1, Integer::sum));

        Map<String, Double> angles;
        Map<String, AngularSector> sectors;
        if (graph.getStructuralMode() == StructuralMode.CONTAINMENT && graph.hasClusters()) {
            sectors = new LinkedHashMap<>();
            angles = sectorAngles(graph, sectors);
        } else {
            sectors = Collections.emptyMap();
            angles = ringAngles(levels, ringSizes);
        }

        Map<String, NodePosition> positions = new LinkedHashMap<>();
        Map<String, NodeAppearance> appearances = new LinkedHashMap<>();
        for (DiagramNode node : graph.getNodes().values()) {
            int level = levels.get(node.getKey());
            double radius = settings.radiusFor(ringSizes.get(level));
            double angle = angles.get(node.getKey());
            positions.put(node.getKey(), new NodePosition(
                    radius * Math.cos(angle),
                    level * settings.getVerticalSpacing(),
                    radius * Math.sin(angle)));
            appearances.put(node.getKey(), AppearanceCatalog.forType(node.getType()));
        }

        List<EdgeAppearance> edgeAppearances = new ArrayList<>();
        graph.getEdges().forEach(edge -> edgeAppearances.add(AppearanceCatalog.forMessageKind(edge.getMessageKind())));

        DiagramLayout layout = DiagramLayout.builder()
                .positions(Collections.unmodifiableMap(positions))
                .levels(levels)
                .nodeAppearances(Collections.unmodifiableMap(appearances))
                .edgeAppearances(Collections.unmodifiableList(edgeAppearances))
                .clusterSectors(Collections.unmodifiableMap(sectors))
                .backEdgeIndexes(assignment.getBackEdgeIndexes())
                .build();

        log.info("[layout] Placed {} nodes on {} level(s), maxLevel={}, backEdges={}",
                positions.size(), ringSizes.size(), layout.maxLevel(), layout.getBackEdgeCount());
        return layout;
    }

    private void verifyEndpoints(DiagramGraph graph) {
        for (DiagramEdge edge : graph.getEdges()) {
            if (graph.getNode(edge.getSource()) == null) {
                throw new DanglingReferenceException(edge.getSource(), edge.getSource(), edge.getTarget());
            }
            if (graph.getNode(edge.getTarget()) == null) {
                throw new DanglingReferenceException(edge.getTarget(), edge.getSource(), edge.getTarget());
            }
        }
    }

    private Map<String, Double> ringAngles(Map<String, Integer> levels, Map<Integer, Integer> ringSizes) {
        Map<Integer, Integer> nextIndex = new HashMap<>();
        Map<String, Double> angles = new HashMap<>();
        levels.forEach((key, level) -> {
            int index = nextIndex.merge(level, 1, Integer::sum) - 1;
            angles.put(key, FULL_CIRCLE * index / ringSizes.get(level));
        });
        return angles;
    }

    /**
     * Walks the cluster forest top-down with an explicit stack, splitting each sector equally among
     * the ordered children of its owner.
     */
    private Map<String, Double> sectorAngles(DiagramGraph graph, Map<String, AngularSector> sectors) {
        Map<String, Double> angles = new HashMap<>();
        Deque<Map.Entry<List<ClusterChild>, AngularSector>> pending = new ArrayDeque<>();
        pending.push(Map.entry(graph.getTopLevel(), new AngularSector(0, FULL_CIRCLE)));

        while (!pending.isEmpty()) {
            Map.Entry<List<ClusterChild>, AngularSector> entry = pending.pop();
            List<ClusterChild> children = entry.getKey();
            for (int i = 0; i < children.size(); i++) {
                ClusterChild child = children.get(i);
                AngularSector slot = entry.getValue().slice(i, children.size());
                if (child.isCluster()) {
                    sectors.put(child.getId(), slot);
                    pending.push(Map.entry(graph.getClusters().get(child.getId()).getChildren(), slot));
                } else {
                    angles.put(child.getId(), slot.getStartAngle());
                }
            }
        }
        return angles;
    }
}
