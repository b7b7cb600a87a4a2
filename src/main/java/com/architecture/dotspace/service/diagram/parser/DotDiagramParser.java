package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.model.diagram.DiagramFormat;
import com.architecture.dotspace.model.diagram.EdgeDirection;
import com.architecture.dotspace.model.diagram.LineStyle;
import com.architecture.dotspace.model.diagram.NodeType;
import com.architecture.dotspace.model.diagram.StructuralMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for the supported DOT subset.
 *
 * Grammar:
 * <pre>
 *   graph     : ['strict'] ('digraph' | 'graph') [ID] '{' stmt_list '}'
 *   stmt      : attr_stmt | ID '=' ID | subgraph | node_id (edge_rhs)+ [attr_list] | node_id [attr_list]
 *   attr_stmt : ('graph' | 'node' | 'edge') attr_list
 *   subgraph  : ['subgraph' [ID]] '{' stmt_list '}'
 *   attr_list : ('[' (ID '=' ID [',' | ';'])* ']')+
 * </pre>
 *
 * After parsing, the file is in edge mode if it holds at least one edge statement and in
 * containment mode otherwise.
 */
@Component
@Slf4j
public class DotDiagramParser implements DiagramParser {

    static final String ATTR_TYPE = "type";
    static final String ATTR_LEVEL = "level";
    static final String ATTR_LABEL = "label";
    static final String ATTR_STYLE = "style";
    static final String ATTR_DIR = "dir";

    private final int maxNestingDepth;

    public DotDiagramParser(@Value("${dotspace.parser.max-nesting-depth:256}") int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public DiagramFormat format() {
        return DiagramFormat.DOT;
    }

    @Override
    public ParsedDiagram parse(String content) {
        List<DotToken> tokens = new DotLexer(content == null ? "" : content).tokenize();
        ParsedDiagram diagram = new Session(tokens).parseGraph();
        log.info("[dot-parser] Parsed graph '{}': nodes={}, edges={}, subgraphs={}, mode={}",
                diagram.getName(), diagram.getNodes().size(), diagram.getEdges().size(),
                diagram.getClusters().size(), diagram.getStructuralMode());
        return diagram;
    }

    /**
     * Attribute defaults and cluster membership of one block.
     */
    private static final class Scope {
        final String clusterId;
        final int depth;
        final Map<String, String> nodeDefaults;
        final Map<String, String> edgeDefaults;

        Scope(String clusterId, int depth, Map<String, String> nodeDefaults, Map<String, String> edgeDefaults) {
            this.clusterId = clusterId;
            this.depth = depth;
            this.nodeDefaults = new LinkedHashMap<>(nodeDefaults);
            this.edgeDefaults = new LinkedHashMap<>(edgeDefaults);
        }

        Scope child(String childClusterId) {
            return new Scope(childClusterId, depth + 1, nodeDefaults, edgeDefaults);
        }
    }

    /**
     * State of a single parse run.
     */
    private final class Session {
        private final List<DotToken> tokens;
        private final ParsedDiagram diagram = ParsedDiagram.builder().format(DiagramFormat.DOT).build();
        private final Map<String, ParsedCluster> latestOccurrence = new LinkedHashMap<>();
        private int pos;
        private int ordinal;
        private int anonymousSubgraphs;

        Session(List<DotToken> tokens) {
            this.tokens = tokens;
        }

        ParsedDiagram parseGraph() {
            if (peek().isKeyword("strict")) {
                next();
            }
            DotToken header = next();
            if (!header.isKeyword("digraph") && !header.isKeyword("graph")) {
                throw error("Expected 'digraph' or 'graph' but found " + header.describe(), header);
            }
            if (peek().isIdentifier()) {
                diagram.setName(next().getText());
            }
            parseBlock(new Scope(null, 0, Map.of(), Map.of()));

            DotToken trailing = peek();
            if (!trailing.is(DotToken.Type.EOF)) {
                throw error("Unexpected " + trailing.describe() + " after the graph body", trailing);
            }
            diagram.setStructuralMode(diagram.getEdges().isEmpty() ? StructuralMode.CONTAINMENT : StructuralMode.EDGE);
            return diagram;
        }

        private void parseBlock(Scope scope) {
            DotToken open = expect(DotToken.Type.LBRACE, "'{'");
            while (true) {
                DotToken token = peek();
                if (token.is(DotToken.Type.RBRACE)) {
                    next();
                    return;
                }
                if (token.is(DotToken.Type.EOF)) {
                    throw error("Unterminated block: missing '}' for the '{' opened here", open);
                }
                parseStatement(scope);
                if (peek().is(DotToken.Type.SEMICOLON)) {
                    next();
                }
            }
        }

        private void parseStatement(Scope scope) {
            DotToken token = peek();

            if (token.isKeyword("graph") && peekAt(1).is(DotToken.Type.LBRACKET)) {
                next();
                Map<String, String> attrs = parseAttributeLists();
                attrs.forEach((key, value) -> applyGraphAttribute(scope, key, value));
                return;
            }
            if (token.isKeyword("node") && peekAt(1).is(DotToken.Type.LBRACKET)) {
                next();
                scope.nodeDefaults.putAll(parseAttributeLists());
                return;
            }
            if (token.isKeyword("edge") && peekAt(1).is(DotToken.Type.LBRACKET)) {
                next();
                scope.edgeDefaults.putAll(parseAttributeLists());
                return;
            }
            if (token.isKeyword("subgraph") || token.is(DotToken.Type.LBRACE)) {
                parseSubgraph(scope);
                if (peek().isEdgeOperator()) {
                    throw error("Subgraphs cannot be used as edge endpoints", peek());
                }
                return;
            }
            if (token.isIdentifier() && peekAt(1).is(DotToken.Type.EQUALS)) {
                String key = next().getText();
                next();
                String value = expectIdentifier("attribute value").getText();
                applyGraphAttribute(scope, key, value);
                return;
            }
            if (token.isIdentifier()) {
                parseNodeOrEdge(scope);
                return;
            }
            throw error("Unexpected " + token.describe(), token);
        }

        private void parseSubgraph(Scope scope) {
            DotToken start = peek();
            String id = null;
            if (start.isKeyword("subgraph")) {
                next();
                if (peek().isIdentifier()) {
                    id = next().getText();
                }
            }
            if (id == null) {
                id = "subgraph_" + (++anonymousSubgraphs);
            }
            if (scope.depth + 1 > maxNestingDepth) {
                throw error("Subgraph nesting exceeds the maximum depth of " + maxNestingDepth, start);
            }

            ParsedCluster cluster = ParsedCluster.builder()
                    .id(id)
                    .parentId(scope.clusterId)
                    .depth(scope.depth + 1)
                    .ordinal(ordinal++)
                    .line(start.getLine())
                    .build();
            diagram.getClusters().add(cluster);
            latestOccurrence.put(id, cluster);

            parseBlock(scope.child(id));
        }

        private void parseNodeOrEdge(Scope scope) {
            DotToken first = peek();
            List<String> chain = new ArrayList<>();
            chain.add(parseNodeId());

            List<DotToken> operators = new ArrayList<>();
            while (peek().isEdgeOperator()) {
                operators.add(next());
                if (peek().is(DotToken.Type.LBRACE) || peek().isKeyword("subgraph")) {
                    throw error("Subgraphs cannot be used as edge endpoints", peek());
                }
                chain.add(parseNodeId());
            }

            Map<String, String> attrs = peek().is(DotToken.Type.LBRACKET) ? parseAttributeLists() : new LinkedHashMap<>();

            if (operators.isEmpty()) {
                addNode(scope, chain.get(0), attrs, first.getLine());
                return;
            }
            for (int i = 0; i < operators.size(); i++) {
                addEdge(scope, chain.get(i), chain.get(i + 1), operators.get(i), attrs);
            }
        }

        private String parseNodeId() {
            String id = expectIdentifier("node identifier").getText();
            // ports (node:port:compass) only affect rendering
            while (peek().is(DotToken.Type.COLON)) {
                next();
                expectIdentifier("port name");
            }
            return id;
        }

        private void addNode(Scope scope, String name, Map<String, String> declared, int line) {
            Map<String, String> attrs = new LinkedHashMap<>(scope.nodeDefaults);
            attrs.putAll(declared);

            ParsedNode node = ParsedNode.builder()
                    .name(name)
                    .clusterId(scope.clusterId)
                    .ordinal(ordinal++)
                    .line(line)
                    .build();

            attrs.forEach((key, value) -> {
                switch (key) {
                    case ATTR_LABEL:
                        node.setLabel(value);
                        break;
                    case ATTR_TYPE:
                        node.setType(NodeType.fromString(value));
                        break;
                    case ATTR_LEVEL:
                        node.setLevel(parseLevel(name, value, line));
                        break;
                    default:
                        node.getAttributes().put(key, value);
                }
            });

            log.debug("[dot-parser] Node '{}' at line {} (cluster={})", name, line, scope.clusterId);
            diagram.getNodes().add(node);
        }

        private void addEdge(Scope scope, String source, String target, DotToken operator, Map<String, String> declared) {
            Map<String, String> attrs = new LinkedHashMap<>(scope.edgeDefaults);
            attrs.putAll(declared);

            EdgeDirection defaultDirection = operator.is(DotToken.Type.UNDIRECTED)
                    ? EdgeDirection.NONE
                    : EdgeDirection.FORWARD;

            ParsedEdge edge = ParsedEdge.builder()
                    .source(source)
                    .target(target)
                    .direction(defaultDirection)
                    .ordinal(ordinal++)
                    .line(operator.getLine())
                    .build();

            attrs.forEach((key, value) -> {
                switch (key) {
                    case ATTR_LABEL:
                        edge.setLabel(value);
                        break;
                    case ATTR_STYLE:
                        edge.setStyle(LineStyle.fromString(value));
                        break;
                    case ATTR_DIR:
                        edge.setDirection(EdgeDirection.fromDotAttribute(value, defaultDirection));
                        break;
                    default:
                        edge.getAttributes().put(key, value);
                }
            });

            log.debug("[dot-parser] Edge '{}' {} '{}' at line {}", source, operator.getText(), target, operator.getLine());
            diagram.getEdges().add(edge);
        }

        private Integer parseLevel(String nodeName, String value, int line) {
            int level;
            try {
                level = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("[dot-parser] Ignoring non-numeric level '{}' on node '{}' at line {}", value, nodeName, line);
                return null;
            }
            if (level < 0) {
                log.warn("[dot-parser] Ignoring negative level {} on node '{}' at line {}", level, nodeName, line);
                return null;
            }
            return level;
        }

        private void applyGraphAttribute(Scope scope, String key, String value) {
            if (scope.clusterId == null) {
                diagram.getGraphAttributes().put(key, value);
            } else if (ATTR_LABEL.equals(key)) {
                latestOccurrence.get(scope.clusterId).setLabel(value);
            } else {
                log.debug("[dot-parser] Ignoring subgraph attribute {}={} in '{}'", key, value, scope.clusterId);
            }
        }

        private Map<String, String> parseAttributeLists() {
            Map<String, String> attrs = new LinkedHashMap<>();
            while (peek().is(DotToken.Type.LBRACKET)) {
                DotToken open = next();
                while (!peek().is(DotToken.Type.RBRACKET)) {
                    if (peek().is(DotToken.Type.EOF)) {
                        throw error("Unterminated attribute list", open);
                    }
                    String key = expectIdentifier("attribute name").getText();
                    expect(DotToken.Type.EQUALS, "'=' after attribute '" + key + "'");
                    String value = expectIdentifier("value for attribute '" + key + "'").getText();
                    attrs.put(key, value);
                    if (peek().is(DotToken.Type.COMMA) || peek().is(DotToken.Type.SEMICOLON)) {
                        next();
                    }
                }
                next();
            }
            return attrs;
        }

        private DotToken expect(DotToken.Type type, String what) {
            DotToken token = peek();
            if (!token.is(type)) {
                throw error("Expected " + what + " but found " + token.describe(), token);
            }
            return next();
        }

        private DotToken expectIdentifier(String what) {
            DotToken token = peek();
            if (!token.isIdentifier()) {
                throw error("Expected " + what + " but found " + token.describe(), token);
            }
            return next();
        }

        private DotToken peek() {
            return peekAt(0);
        }

        private DotToken peekAt(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private DotToken next() {
            DotToken token = peek();
            if (!token.is(DotToken.Type.EOF)) {
                pos++;
            }
            return token;
        }

        private DiagramSyntaxException error(String reason, DotToken at) {
            return new DiagramSyntaxException(reason, at.getLine(), at.getColumn());
        }
    }
}
