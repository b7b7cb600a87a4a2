package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Classifies raw input text as a sequence diagram or a DOT graph. Never fails: text that carries no
 * signal for either dialect is reported as DOT without a positive match.
 */
@Service
@Slf4j
public class FormatDetector {

    private static final Pattern SEQUENCE_DELIMITER = Pattern.compile("@startuml\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GRAPH_KEYWORD = Pattern.compile("\\b(?:di)?graph\\b", Pattern.CASE_INSENSITIVE);

    public FormatDetection detect(String content) {
        String text = content == null ? "" : content;
        FormatDetection detection;

        if (SEQUENCE_DELIMITER.matcher(text).find()) {
            detection = new FormatDetection(DiagramFormat.SEQUENCE, true, "found @startuml delimiter");
        } else if (GRAPH_KEYWORD.matcher(text).find()) {
            detection = new FormatDetection(DiagramFormat.DOT, true, "found graph declaration keyword");
        } else if (text.contains("->") || text.contains("--")) {
            detection = new FormatDetection(DiagramFormat.DOT, true, "found edge token");
        } else {
            detection = new FormatDetection(DiagramFormat.DOT, false, "no dialect marker, assuming DOT");
        }

        log.info("[detector] Detected {} ({})", detection.getSourceName(), detection.getReason());
        return detection;
    }
}
