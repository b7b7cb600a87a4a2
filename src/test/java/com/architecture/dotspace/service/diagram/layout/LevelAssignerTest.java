package com.architecture.dotspace.service.diagram.layout;

import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.service.diagram.ClusterCycleDetector;
import com.architecture.dotspace.service.diagram.DiagramGraphBuilder;
import com.architecture.dotspace.service.diagram.parser.DotDiagramParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LevelAssignerTest {

    private final DotDiagramParser parser = new DotDiagramParser(256);
    private final DiagramGraphBuilder builder = new DiagramGraphBuilder(new ClusterCycleDetector());
    private final LevelAssigner assigner = new LevelAssigner();

    @Test
    void assignsLongestPathFromRoots() {
        LevelAssignment levels = assign("digraph { A -> B -> C; B -> D; }");

        assertThat(levels.getLevels()).containsExactly(
                entry("A", 0), entry("B", 1), entry("C", 2), entry("D", 2));
        assertThat(levels.getBackEdgeIndexes()).isEmpty();
    }

    @Test
    void usesTheLongestOfSeveralPaths() {
        LevelAssignment levels = assign("digraph { a -> d; a -> b; b -> c; c -> d; }");

        assertThat(levels.levelOf("d")).isEqualTo(3);
    }

    @Test
    void terminatesOnAFullCycle_excludingTheClosingEdge() {
        LevelAssignment levels = assign("digraph { A -> B -> C -> A; }");

        assertThat(levels.getLevels()).containsExactly(entry("A", 0), entry("B", 1), entry("C", 2));
        assertThat(levels.getBackEdgeIndexes()).containsExactly(2);
    }

    @Test
    void startsCycleBreakingFromRoots() {
        LevelAssignment levels = assign("digraph { b -> c; c -> b; root -> b; }");

        assertThat(levels.levelOf("root")).isZero();
        assertThat(levels.levelOf("b")).isEqualTo(1);
        assertThat(levels.levelOf("c")).isEqualTo(2);
        assertThat(levels.getBackEdgeIndexes()).containsExactly(1);
    }

    @Test
    void treatsSelfLoopAsBackEdge() {
        LevelAssignment levels = assign("digraph { a -> a; a -> b; }");

        assertThat(levels.levelOf("a")).isZero();
        assertThat(levels.levelOf("b")).isEqualTo(1);
        assertThat(levels.getBackEdgeIndexes()).containsExactly(0);
    }

    @Test
    void explicitLevelWins_withoutShiftingSuccessors() {
        LevelAssignment levels = assign("digraph { a [level=5]; a -> b; c [level=0]; b -> c; }");

        assertThat(levels.levelOf("a")).isEqualTo(5);
        assertThat(levels.levelOf("b")).isEqualTo(1);
        assertThat(levels.levelOf("c")).isZero();
    }

    @Test
    void givesIsolatedNodesLevelZero_inEdgeMode() {
        LevelAssignment levels = assign("digraph { lonely; a -> b; }");

        assertThat(levels.levelOf("lonely")).isZero();
    }

    @Test
    void derivesContainmentLevels_fromNestingDepth() {
        LevelAssignment levels = assign("digraph {"
                + " outside;"
                + " subgraph cluster_root { r1; subgraph cluster_a { \"X\"; \"Y\"; } }"
                + " }");

        assertThat(levels.levelOf("X")).isEqualTo(1);
        assertThat(levels.levelOf("Y")).isEqualTo(1);
        assertThat(levels.levelOf("r1")).isEqualTo(2);
        assertThat(levels.levelOf("outside")).isEqualTo(3);
    }

    @Test
    void keepsExplicitLevel_inContainmentMode() {
        LevelAssignment levels = assign("digraph { subgraph s { a [level=7]; b; } }");

        assertThat(levels.levelOf("a")).isEqualTo(7);
        assertThat(levels.levelOf("b")).isEqualTo(1);
    }

    @Test
    void fallsBackToLevelZero_whenContainmentHasNoClusters() {
        assertThat(assign("digraph { a; b; }").getLevels().values()).containsOnly(0);
        assertThat(assign("digraph { subgraph a { subgraph b { subgraph a { x; } } } y; }").getLevels().values())
                .containsOnly(0);
    }

    @Test
    void computesClusterDepthsFromRoots() {
        DiagramGraph graph = build("digraph { subgraph r { subgraph m { subgraph l { x; } } } subgraph other { y; } }");

        assertThat(LevelAssigner.clusterDepths(graph.getClusters()))
                .containsEntry("r", 1)
                .containsEntry("m", 2)
                .containsEntry("l", 3)
                .containsEntry("other", 1);
    }

    private LevelAssignment assign(String source) {
        return assigner.assign(build(source));
    }

    private DiagramGraph build(String source) {
        return builder.build(parser.parse(source));
    }

    private static java.util.Map.Entry<String, Integer> entry(String key, int value) {
        return java.util.Map.entry(key, value);
    }
}
