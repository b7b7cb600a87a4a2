package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.dto.graph.GraphMetadata;
import com.architecture.dotspace.dto.graph.GraphNode;
import com.architecture.dotspace.dto.graph.GraphVisualizationResponse;
import com.architecture.dotspace.dto.graph.NodeStyle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramArtifactExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DiagramArtifactExporter exporter = new DiagramArtifactExporter(objectMapper);

    @Test
    void serializesNodesAndMetadata() throws Exception {
        JsonNode json = objectMapper.readTree(exporter.toJson(sampleResponse()));

        assertThat(json.get("nodes").get(0).get("id").asText()).isEqualTo("api");
        assertThat(json.get("nodes").get(0).get("y").asDouble()).isEqualTo(2.0);
        assertThat(json.get("nodes").get(0).get("style").get("shape").asText()).isEqualTo("cube");
        assertThat(json.get("metadata").get("structuralMode").asText()).isEqualTo("EDGE");
    }

    @Test
    void writesArtifact_creatingParentDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out").resolve("nested").resolve("diagram.json");

        exporter.write(sampleResponse(), target);

        assertThat(target).exists();
        GraphVisualizationResponse read = objectMapper.readValue(Files.readString(target), GraphVisualizationResponse.class);
        assertThat(read.getNodes()).extracting(GraphNode::getId).containsExactly("api");
        assertThat(read.getMetadata().getNodeCount()).isEqualTo(1);
    }

    private static GraphVisualizationResponse sampleResponse() {
        GraphNode node = GraphNode.builder()
                .id("api")
                .label("api")
                .type("service")
                .level(1)
                .x(6.5)
                .y(2.0)
                .z(0.0)
                .properties(Map.of())
                .style(NodeStyle.builder().color("#4DB34D").size(0.8).shape("cube").build())
                .build();
        return GraphVisualizationResponse.builder()
                .nodes(List.of(node))
                .edges(List.of())
                .clusters(List.of())
                .metadata(GraphMetadata.builder()
                        .nodeCount(1)
                        .structuralMode("EDGE")
                        .originFormat("DOT")
                        .sourceName("DOT")
                        .diagnostics(List.of())
                        .build())
                .build();
    }
}
