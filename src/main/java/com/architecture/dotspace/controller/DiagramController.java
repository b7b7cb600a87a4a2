package com.architecture.dotspace.controller;

import com.architecture.dotspace.dto.DiagramRequest;
import com.architecture.dotspace.dto.FormatDetectionResponse;
import com.architecture.dotspace.dto.NodeSearchRequest;
import com.architecture.dotspace.dto.NodeSearchResponse;
import com.architecture.dotspace.dto.graph.GraphVisualizationResponse;
import com.architecture.dotspace.service.diagram.DiagramPipelineService;
import com.architecture.dotspace.service.diagram.DiagramResult;
import com.architecture.dotspace.service.diagram.DiagramVisualizationService;
import com.architecture.dotspace.service.diagram.FormatDetection;
import com.architecture.dotspace.service.diagram.NodeSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for laying out diagram text.
 */
@RestController
@RequestMapping("/api/diagrams")
@RequiredArgsConstructor
@Slf4j
public class DiagramController {

    private final DiagramPipelineService pipelineService;
    private final DiagramVisualizationService visualizationService;
    private final NodeSearchService nodeSearchService;

    /**
     * Parse and lay out a diagram. Returns nodes with positions, edges, clusters and metadata.
     */
    @PostMapping("/layout")
    public ResponseEntity<GraphVisualizationResponse> layout(@Valid @RequestBody DiagramRequest request) {
        log.info("Layout request for {} characters of diagram text", request.getContent().length());
        DiagramResult result = pipelineService.process(request.getContent());
        return ResponseEntity.ok(visualizationService.toResponse(result));
    }

    @PostMapping("/detect")
    public ResponseEntity<FormatDetectionResponse> detect(@Valid @RequestBody DiagramRequest request) {
        FormatDetection detection = pipelineService.detect(request.getContent());
        return ResponseEntity.ok(FormatDetectionResponse.builder()
                .format(detection.getFormat().name())
                .sourceName(detection.getSourceName())
                .positiveMatch(detection.isPositiveMatch())
                .reason(detection.getReason())
                .build());
    }

    /**
     * Find nodes whose label or key contains the query, ignoring case.
     */
    @PostMapping("/search")
    public ResponseEntity<NodeSearchResponse> search(@Valid @RequestBody NodeSearchRequest request) {
        log.info("Search request: query='{}'", request.getQuery());
        DiagramResult result = pipelineService.process(request.getContent());
        List<String> matches = nodeSearchService.search(result.getGraph(), request.getQuery());
        return ResponseEntity.ok(NodeSearchResponse.builder()
                .query(request.getQuery())
                .matchCount(matches.size())
                .matches(matches)
                .build());
    }
}
