package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.model.diagram.DiagramFormat;
import com.architecture.dotspace.model.diagram.MessageKind;
import com.architecture.dotspace.model.diagram.NodeType;
import com.architecture.dotspace.model.diagram.StructuralMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for PlantUML sequence diagrams.
 *
 * Participants become nodes ({@code actor} is a user, {@code database} a database, everything
 * else a service), messages become edges in the order they are written. Statements that only
 * affect presentation (notes, groups, dividers, skin parameters) are skipped.
 */
@Component
@Slf4j
public class SequenceDiagramParser implements DiagramParser {

    // quoted name, or a bare name that does not start with '.'
    private static final String NAME = "(?:\"([^\"]*)\"|([\\w$][\\w.$]*))";

    private static final Pattern START = Pattern.compile("^@startuml\\b\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern END = Pattern.compile("^@enduml\\b.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PARTICIPANT = Pattern.compile(
            "^(?:create\\s+)?(participant|actor|database|entity)\\s+" + NAME
                    + "(?:\\s+as\\s+" + NAME + ")?(?:\\s+.*)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ACTIVATION = Pattern.compile(
            "^(activate|deactivate)\\s+" + NAME + "(?:\\s+.*)?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern MESSAGE = Pattern.compile(
            "^" + NAME + "\\s*([-<>\\\\/.*]+)\\s*" + NAME + "\\s*(\\+\\+|--)?\\s*(?::\\s*(.*))?$");

    private static final Pattern BLOCK_START = Pattern.compile(
            "^(note|rnote|hnote|ref|legend)\\b([^:]*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCK_END = Pattern.compile(
            "^end\\s*(note|rnote|hnote|ref|legend)\\b.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern IGNORED = Pattern.compile(
            "^(?:(?:title|autonumber|skinparam|hide|show|header|footer|newpage|return|caption|scale"
                    + "|note|rnote|hnote|ref|box|alt|else|opt|loop|par|break|critical|group|end|destroy)\\b.*"
                    + "|!.*|==.*|\\.\\.\\..*|\\|\\|\\|.*|\\|\\|\\d+\\|\\|.*)$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public DiagramFormat format() {
        return DiagramFormat.SEQUENCE;
    }

    @Override
    public ParsedDiagram parse(String content) {
        ParsedDiagram diagram = ParsedDiagram.builder()
                .format(DiagramFormat.SEQUENCE)
                .structuralMode(StructuralMode.EDGE)
                .build();

        String[] lines = (content == null ? "" : content).split("\\R", -1);
        Map<String, Integer> activeDepth = new HashMap<>();
        int ordinal = 0;
        int startLine = 0;
        boolean ended = false;
        boolean inBlockComment = false;
        String openBlock = null;
        int openBlockLine = 0;

        for (int i = 0; i < lines.length && !ended; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();

            if (inBlockComment) {
                inBlockComment = !line.contains("'/");
                continue;
            }
            if (line.startsWith("/'")) {
                inBlockComment = !line.substring(2).contains("'/");
                continue;
            }
            if (line.isEmpty() || line.startsWith("'")) {
                continue;
            }

            if (startLine == 0) {
                Matcher start = START.matcher(line);
                if (start.matches()) {
                    startLine = lineNo;
                    if (!start.group(1).isBlank()) {
                        diagram.setName(start.group(1).trim());
                    }
                }
                continue;
            }

            if (openBlock != null) {
                if (BLOCK_END.matcher(line).matches()) {
                    openBlock = null;
                }
                continue;
            }

            if (END.matcher(line).matches()) {
                ended = true;
                continue;
            }

            Matcher participant = PARTICIPANT.matcher(line);
            if (participant.matches()) {
                diagram.getNodes().add(participantNode(participant, ordinal++, lineNo));
                continue;
            }

            Matcher activation = ACTIVATION.matcher(line);
            if (activation.matches()) {
                String name = name(activation, 2);
                if (activation.group(1).equalsIgnoreCase("activate")) {
                    activate(diagram, activeDepth, name);
                } else {
                    deactivate(activeDepth, name, lineNo);
                }
                continue;
            }

            Matcher message = MESSAGE.matcher(line);
            if (message.matches()) {
                ParsedEdge edge = messageEdge(message, diagram.getEdges().size() + 1, ordinal++, lineNo);
                diagram.getEdges().add(edge);
                String shorthand = message.group(6);
                if ("++".equals(shorthand)) {
                    activate(diagram, activeDepth, edge.getTarget());
                } else if ("--".equals(shorthand)) {
                    deactivate(activeDepth, edge.getSource(), lineNo);
                }
                continue;
            }

            Matcher block = BLOCK_START.matcher(line);
            if (block.matches()) {
                openBlock = block.group(1).toLowerCase(Locale.ROOT);
                openBlockLine = lineNo;
                continue;
            }

            if (IGNORED.matcher(line).matches()) {
                log.debug("[sequence-parser] Skipping presentation statement at line {}: {}", lineNo, line);
                continue;
            }

            throw new DiagramSyntaxException("Unrecognized statement '" + line + "'", lineNo);
        }

        if (startLine == 0) {
            throw new DiagramSyntaxException("Missing @startuml delimiter", 0);
        }
        if (openBlock != null) {
            throw new DiagramSyntaxException("Unterminated " + openBlock + " block: missing 'end " + openBlock + "'", openBlockLine);
        }
        if (!ended) {
            throw new DiagramSyntaxException("Unterminated diagram: missing @enduml for @startuml", startLine);
        }

        log.info("[sequence-parser] Parsed sequence diagram: participants={}, messages={}",
                diagram.getNodes().size(), diagram.getEdges().size());
        return diagram;
    }

    private ParsedNode participantNode(Matcher matcher, int ordinal, int line) {
        String kind = matcher.group(1).toLowerCase(Locale.ROOT);
        boolean nameQuoted = matcher.group(2) != null;
        String name = name(matcher, 2);
        String alias = matcher.group(4) != null || matcher.group(5) != null ? name(matcher, 4) : null;
        boolean aliasQuoted = matcher.group(4) != null;

        String key = name;
        String label = name;
        if (alias != null) {
            if (aliasQuoted && !nameQuoted) {
                // participant LB as "Load Balancer"
                label = alias;
            } else {
                key = alias;
            }
        }

        return ParsedNode.builder()
                .name(key)
                .label(label)
                .type(participantType(kind))
                .ordinal(ordinal)
                .line(line)
                .build();
    }

    private ParsedEdge messageEdge(Matcher matcher, int sequence, int ordinal, int line) {
        String arrow = matcher.group(3);
        MessageKind kind = MessageKind.fromArrow(arrow);
        if (kind == null) {
            throw new DiagramSyntaxException("Unknown arrow token '" + arrow + "'", line, matcher.start(3) + 1);
        }
        String label = matcher.group(7);
        return ParsedEdge.builder()
                .source(name(matcher, 1))
                .target(name(matcher, 4))
                .label(label == null || label.isBlank() ? null : label.trim())
                .style(kind.getLineStyle())
                .messageKind(kind)
                .sequence(sequence)
                .ordinal(ordinal)
                .line(line)
                .build();
    }

    private void activate(ParsedDiagram diagram, Map<String, Integer> activeDepth, String name) {
        int depth = activeDepth.merge(name, 1, Integer::sum);
        diagram.getActivationDepths().merge(name, depth, Math::max);
    }

    private void deactivate(Map<String, Integer> activeDepth, String name, int line) {
        int depth = activeDepth.getOrDefault(name, 0);
        if (depth == 0) {
            log.debug("[sequence-parser] Ignoring unbalanced deactivate of '{}' at line {}", name, line);
            return;
        }
        activeDepth.put(name, depth - 1);
    }

    private static NodeType participantType(String kind) {
        switch (kind) {
            case "actor":
                return NodeType.USER;
            case "database":
                return NodeType.DATABASE;
            default:
                return NodeType.SERVICE;
        }
    }

    /**
     * Value of a {@link #NAME} pair whose quoted group is {@code quotedGroup} and bare group the one after it.
     */
    private static String name(Matcher matcher, int quotedGroup) {
        String quoted = matcher.group(quotedGroup);
        return quoted != null ? quoted : matcher.group(quotedGroup + 1);
    }
}
