package com.architecture.dotspace.service;

import com.architecture.dotspace.dto.graph.GraphMetadata;
import com.architecture.dotspace.dto.graph.GraphVisualizationResponse;
import com.architecture.dotspace.service.diagram.DiagramArtifactExporter;
import com.architecture.dotspace.service.diagram.DiagramPipelineService;
import com.architecture.dotspace.service.diagram.DiagramResult;
import com.architecture.dotspace.service.diagram.DiagramVisualizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Processes {@code dotspace.input.file} on startup when it is configured. The artifact goes to
 * {@code dotspace.output.file}, or only a summary is logged when no output file is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiagramFileRunner implements CommandLineRunner {

    private final DiagramPipelineService pipelineService;
    private final DiagramVisualizationService visualizationService;
    private final DiagramArtifactExporter artifactExporter;

    @Value("${dotspace.input.file:}")
    private String inputFile;

    @Value("${dotspace.output.file:}")
    private String outputFile;

    @Override
    public void run(String... args) throws Exception {
        if (inputFile == null || inputFile.isBlank()) {
            log.debug("[pipeline] No input file configured, skipping startup run");
            return;
        }

        DiagramResult result = pipelineService.processFile(Path.of(inputFile));
        GraphVisualizationResponse response = visualizationService.toResponse(result);

        if (outputFile != null && !outputFile.isBlank()) {
            artifactExporter.write(response, Path.of(outputFile));
            return;
        }

        GraphMetadata metadata = response.getMetadata();
        log.info("[pipeline] {} ({} mode): {} nodes, {} edges, {} clusters, max level {}",
                inputFile, metadata.getStructuralMode(), metadata.getNodeCount(), metadata.getEdgeCount(),
                metadata.getClusterCount(), metadata.getMaxLevel());
        metadata.getDiagnostics().forEach(note -> log.info("[pipeline] Note: {}", note));
    }
}
