package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.service.diagram.parser.DotDiagramParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeSearchServiceTest {

    private final NodeSearchService searchService = new NodeSearchService();

    private final DiagramGraph graph = new DiagramGraphBuilder(new ClusterCycleDetector()).build(
            new DotDiagramParser(256).parse("digraph {"
                    + " api [label=\"Payments API\"];"
                    + " ledger [label=\"Ledger Store\"];"
                    + " api -> ledger; api -> paymentQueue;"
                    + " }"));

    @Test
    void matchesLabelsIgnoringCase() {
        assertThat(searchService.search(graph, "store")).containsExactly("ledger");
    }

    @Test
    void matchesKeysAsWell() {
        assertThat(searchService.search(graph, "PAYMENT")).containsExactly("api", "paymentQueue");
    }

    @Test
    void returnsNothing_forBlankQuery() {
        assertThat(searchService.search(graph, "  ")).isEmpty();
        assertThat(searchService.search(graph, null)).isEmpty();
    }

    @Test
    void returnsNothing_whenNoNodeMatches() {
        assertThat(searchService.search(graph, "warehouse")).isEmpty();
    }
}
