package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.exception.UnknownFormatException;
import com.architecture.dotspace.model.diagram.DiagramFormat;
import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.service.diagram.layout.DiagramLayout;
import com.architecture.dotspace.service.diagram.layout.LayoutEngine;
import com.architecture.dotspace.service.diagram.parser.DiagramParser;
import com.architecture.dotspace.service.diagram.parser.DotDiagramParser;
import com.architecture.dotspace.service.diagram.parser.ParsedDiagram;
import com.architecture.dotspace.service.diagram.parser.SequenceDiagramParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Runs detect, parse, build and layout over one complete input. The first failing stage aborts the
 * run; nothing partial is returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagramPipelineService {

    private final FormatDetector formatDetector;
    private final DotDiagramParser dotDiagramParser;
    private final SequenceDiagramParser sequenceDiagramParser;
    private final DiagramGraphBuilder graphBuilder;
    private final LayoutEngine layoutEngine;
    private final DiagramSourceReader sourceReader;

    public DiagramResult process(String content) {
        FormatDetection detection = formatDetector.detect(content);
        DiagramParser parser = parserFor(detection.getFormat());

        ParsedDiagram parsed;
        try {
            parsed = parser.parse(content);
        } catch (DiagramSyntaxException e) {
            if (!detection.isPositiveMatch()) {
                log.info("[pipeline] Fallback {} parse failed: {}", parser.sourceName(), e.getMessage());
                throw new UnknownFormatException(e);
            }
            throw e;
        }

        DiagramGraph graph = graphBuilder.build(parsed);
        DiagramLayout layout = layoutEngine.layout(graph);

        log.info("[pipeline] Processed {} diagram: nodes={}, edges={}",
                parser.sourceName(), graph.getNodes().size(), graph.getEdges().size());
        return new DiagramResult(detection, graph, layout);
    }

    public DiagramResult processFile(Path file) {
        log.info("[pipeline] Processing file {}", file);
        return process(sourceReader.read(file));
    }

    public DiagramResult processStream(InputStream input) {
        return process(sourceReader.read(input));
    }

    public FormatDetection detect(String content) {
        return formatDetector.detect(content);
    }

    private DiagramParser parserFor(DiagramFormat format) {
        return format == DiagramFormat.SEQUENCE ? sequenceDiagramParser : dotDiagramParser;
    }
}
