package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.dto.graph.GraphVisualizationResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes the visualization artifact as pretty-printed JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiagramArtifactExporter {

    private final ObjectMapper objectMapper;

    public String toJson(GraphVisualizationResponse response) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagram artifact", e);
        }
    }

    public void write(GraphVisualizationResponse response, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                parent.toFile().mkdirs();
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), response);
            log.info("[pipeline] Wrote artifact with {} nodes to {}", response.getNodes().size(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write diagram artifact to " + target, e);
        }
    }
}
