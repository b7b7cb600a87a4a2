package com.architecture.dotspace.controller;

import com.architecture.dotspace.dto.graph.GraphMetadata;
import com.architecture.dotspace.dto.graph.GraphVisualizationResponse;
import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.exception.UnknownFormatException;
import com.architecture.dotspace.model.diagram.DiagramFormat;
import com.architecture.dotspace.service.diagram.DiagramPipelineService;
import com.architecture.dotspace.service.diagram.DiagramResult;
import com.architecture.dotspace.service.diagram.DiagramVisualizationService;
import com.architecture.dotspace.service.diagram.FormatDetection;
import com.architecture.dotspace.service.diagram.NodeSearchService;
import com.architecture.dotspace.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DiagramControllerTest {

    @Mock
    private DiagramPipelineService pipelineService;

    @Mock
    private DiagramVisualizationService visualizationService;

    @Mock
    private NodeSearchService nodeSearchService;

    @InjectMocks
    private DiagramController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsLayout_forValidDiagram() throws Exception {
        DiagramResult result = new DiagramResult(null, null, null);
        when(pipelineService.process("digraph { a -> b; }")).thenReturn(result);
        when(visualizationService.toResponse(result)).thenReturn(GraphVisualizationResponse.builder()
                .nodes(List.of())
                .edges(List.of())
                .clusters(List.of())
                .metadata(GraphMetadata.builder().nodeCount(2).edgeCount(1).structuralMode("EDGE").build())
                .build());

        mockMvc.perform(post("/api/diagrams/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"digraph { a -> b; }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.nodeCount").value(2))
                .andExpect(jsonPath("$.metadata.structuralMode").value("EDGE"));
    }

    @Test
    void rejectsBlankContent() throws Exception {
        mockMvc.perform(post("/api/diagrams/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(pipelineService);
    }

    @Test
    void rejectsUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/diagrams/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void reportsSyntaxErrorWithPosition() throws Exception {
        when(pipelineService.process(anyString()))
                .thenThrow(new DiagramSyntaxException("Unterminated block: missing '}'", 1, 9));

        mockMvc.perform(post("/api/diagrams/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"digraph {\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SYNTAX_ERROR"))
                .andExpect(jsonPath("$.details.line").value(1))
                .andExpect(jsonPath("$.details.column").value(9))
                .andExpect(jsonPath("$.details.reason").value("Unterminated block: missing '}'"));
    }

    @Test
    void reportsUnknownFormat() throws Exception {
        when(pipelineService.process("hello"))
                .thenThrow(new UnknownFormatException(new DiagramSyntaxException("Expected 'graph' or 'digraph'", 1, 1)));

        mockMvc.perform(post("/api/diagrams/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_FORMAT"));
    }

    @Test
    void detectsFormat() throws Exception {
        when(pipelineService.detect("@startuml\n@enduml"))
                .thenReturn(new FormatDetection(DiagramFormat.SEQUENCE, true, "found @startuml delimiter"));

        mockMvc.perform(post("/api/diagrams/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"@startuml\\n@enduml\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("SEQUENCE"))
                .andExpect(jsonPath("$.sourceName").value("PlantUML"))
                .andExpect(jsonPath("$.positiveMatch").value(true));
    }

    @Test
    void searchesNodes() throws Exception {
        DiagramResult result = new DiagramResult(null, null, null);
        when(pipelineService.process("digraph { api -> db; }")).thenReturn(result);
        when(nodeSearchService.search(any(), eq("API"))).thenReturn(List.of("api"));

        mockMvc.perform(post("/api/diagrams/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"digraph { api -> db; }\",\"query\":\"API\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchCount").value(1))
                .andExpect(jsonPath("$.matches[0]").value("api"));
    }

    @Test
    void rejectsSearchWithoutQuery() throws Exception {
        mockMvc.perform(post("/api/diagrams/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"digraph { a; }\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }
}
