package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormatDetectorTest {

    private final FormatDetector detector = new FormatDetector();

    @Test
    void detectsSequenceDiagrams_evenWhenTheyMentionGraphs() {
        FormatDetection detection = detector.detect("@startuml\nA -> B: draw graph\n@enduml");

        assertThat(detection.getFormat()).isEqualTo(DiagramFormat.SEQUENCE);
        assertThat(detection.isPositiveMatch()).isTrue();
        assertThat(detection.getSourceName()).isEqualTo("PlantUML");
    }

    @Test
    void detectsDotByHeaderKeyword() {
        FormatDetection detection = detector.detect("strict digraph G { }");

        assertThat(detection.getFormat()).isEqualTo(DiagramFormat.DOT);
        assertThat(detection.isPositiveMatch()).isTrue();
        assertThat(detection.getSourceName()).isEqualTo("DOT");
    }

    @Test
    void detectsDotByEdgeToken() {
        assertThat(detector.detect("a -> b").isPositiveMatch()).isTrue();
        assertThat(detector.detect("a -- b").isPositiveMatch()).isTrue();
    }

    @Test
    void fallsBackToDot_whenNothingMatches() {
        FormatDetection detection = detector.detect("a paragraph of prose");

        assertThat(detection.getFormat()).isEqualTo(DiagramFormat.DOT);
        assertThat(detection.isPositiveMatch()).isFalse();
    }

    @Test
    void neverFailsOnEmptyInput() {
        assertThat(detector.detect(null).getFormat()).isEqualTo(DiagramFormat.DOT);
        assertThat(detector.detect("").isPositiveMatch()).isFalse();
    }
}
