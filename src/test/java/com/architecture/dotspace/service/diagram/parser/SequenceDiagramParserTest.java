package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.model.diagram.LineStyle;
import com.architecture.dotspace.model.diagram.MessageKind;
import com.architecture.dotspace.model.diagram.NodeType;
import com.architecture.dotspace.model.diagram.StructuralMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceDiagramParserTest {

    private final SequenceDiagramParser parser = new SequenceDiagramParser();

    @Test
    void parsesParticipantsAndMessages() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "actor Client",
                "participant \"Load Balancer\" as LB",
                "Client -> LB: Request",
                "@enduml"));

        assertThat(diagram.getStructuralMode()).isEqualTo(StructuralMode.EDGE);
        assertThat(diagram.getNodes()).extracting(ParsedNode::getName).containsExactly("Client", "LB");
        assertThat(diagram.getNodes()).extracting(ParsedNode::getType).containsExactly(NodeType.USER, NodeType.SERVICE);
        assertThat(diagram.getNodes().get(1).getLabel()).isEqualTo("Load Balancer");

        ParsedEdge edge = diagram.getEdges().get(0);
        assertThat(edge.getSource()).isEqualTo("Client");
        assertThat(edge.getTarget()).isEqualTo("LB");
        assertThat(edge.getLabel()).isEqualTo("Request");
        assertThat(edge.getStyle()).isEqualTo(LineStyle.SOLID);
        assertThat(edge.getMessageKind()).isEqualTo(MessageKind.SYNC);
        assertThat(edge.getSequence()).isEqualTo(1);
    }

    @Test
    void mapsParticipantKindsToNodeTypes() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "actor User",
                "participant Api",
                "database Store",
                "entity Order",
                "@enduml"));

        assertThat(diagram.getNodes()).extracting(ParsedNode::getType).containsExactly(
                NodeType.USER, NodeType.SERVICE, NodeType.DATABASE, NodeType.SERVICE);
    }

    @Test
    void resolvesAliasesAndLabels() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "participant Frontend as FE",
                "participant LB as \"Load Balancer\"",
                "participant \"Auth Service\"",
                "@enduml"));

        assertThat(diagram.getNodes()).extracting(ParsedNode::getName).containsExactly("FE", "LB", "Auth Service");
        assertThat(diagram.getNodes()).extracting(ParsedNode::getLabel)
                .containsExactly("Frontend", "Load Balancer", "Auth Service");
    }

    @Test
    void distinguishesMessageKinds_andNumbersMessagesInOrder() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "A -> B: call",
                "A ->> C: fire and forget",
                "B --> A: result",
                "@enduml"));

        assertThat(diagram.getEdges()).extracting(ParsedEdge::getMessageKind)
                .containsExactly(MessageKind.SYNC, MessageKind.ASYNC, MessageKind.RETURN);
        assertThat(diagram.getEdges()).extracting(ParsedEdge::getStyle)
                .containsExactly(LineStyle.SOLID, LineStyle.SOLID, LineStyle.DASHED);
        assertThat(diagram.getEdges()).extracting(ParsedEdge::getSequence).containsExactly(1, 2, 3);
    }

    @Test
    void acceptsQuotedEndpoints_andMessagesWithoutLabel() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "\"Web App\" -> DB : query",
                "DB --> \"Web App\"",
                "@enduml"));

        assertThat(diagram.getEdges().get(0).getSource()).isEqualTo("Web App");
        assertThat(diagram.getEdges().get(0).getLabel()).isEqualTo("query");
        assertThat(diagram.getEdges().get(1).getTarget()).isEqualTo("Web App");
        assertThat(diagram.getEdges().get(1).getLabel()).isNull();
    }

    @Test
    void tracksPeakActivationDepth_andIgnoresUnbalancedDeactivate() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "@startuml",
                "participant A",
                "participant B",
                "deactivate A",
                "activate A",
                "activate A",
                "deactivate A",
                "deactivate A",
                "deactivate A",
                "A -> B ++ : start",
                "B -> A -- : done",
                "@enduml"));

        assertThat(diagram.getActivationDepths())
                .containsEntry("A", 2)
                .containsEntry("B", 1);
        assertThat(diagram.getEdges()).hasSize(2);
    }

    @Test
    void skipsCommentsAndPresentationStatements() {
        ParsedDiagram diagram = parser.parse(String.join("\n",
                "' header comment",
                "@startuml checkout",
                "title Checkout flow",
                "skinparam monochrome true",
                "autonumber",
                "/' block",
                "   comment '/",
                "== Init ==",
                "note over A",
                "  spans several lines",
                "  A -> B: not a message",
                "end note",
                "note left of A : single line",
                "alt success",
                "  A -> B: pay",
                "else failure",
                "  A -> C: refund",
                "end",
                "...",
                "|||",
                "@enduml",
                "ignored trailing text"));

        assertThat(diagram.getName()).isEqualTo("checkout");
        assertThat(diagram.getEdges()).extracting(ParsedEdge::getLabel).containsExactly("pay", "refund");
    }

    @Test
    void failsWithoutStartDelimiter() {
        assertThatThrownBy(() -> parser.parse("A -> B: hi\n@enduml"))
                .isInstanceOf(DiagramSyntaxException.class)
                .hasMessageContaining("Missing @startuml");
    }

    @Test
    void failsWithoutEndDelimiter_pointingAtStart() {
        assertThatThrownBy(() -> parser.parse("\n@startuml\nA -> B: hi\n"))
                .isInstanceOf(DiagramSyntaxException.class)
                .hasMessageContaining("missing @enduml")
                .extracting(e -> ((DiagramSyntaxException) e).getLine())
                .isEqualTo(2);
    }

    @Test
    void failsOnUnknownArrowToken() {
        assertThatThrownBy(() -> parser.parse("@startuml\nA <-> B: both ways\n@enduml"))
                .isInstanceOf(DiagramSyntaxException.class)
                .hasMessageContaining("Unknown arrow token '<->'")
                .satisfies(e -> {
                    DiagramSyntaxException error = (DiagramSyntaxException) e;
                    assertThat(error.getLine()).isEqualTo(2);
                    assertThat(error.getColumn()).isEqualTo(3);
                });
    }

    @Test
    void failsOnUnrecognizedStatement() {
        assertThatThrownBy(() -> parser.parse("@startuml\nthis is not plantuml\n@enduml"))
                .isInstanceOf(DiagramSyntaxException.class)
                .hasMessageContaining("Unrecognized statement")
                .extracting(e -> ((DiagramSyntaxException) e).getLine())
                .isEqualTo(2);
    }

    @Test
    void failsOnUnterminatedNote() {
        assertThatThrownBy(() -> parser.parse("@startuml\nnote over A\nstill open\n@enduml"))
                .isInstanceOf(DiagramSyntaxException.class)
                .hasMessageContaining("Unterminated note block");
    }
}
