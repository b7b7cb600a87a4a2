package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.model.diagram.DiagramNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Case-insensitive substring search over node labels and keys.
 */
@Service
@Slf4j
public class NodeSearchService {

    /**
     * @return keys of matching nodes in declaration order; a blank query matches nothing
     */
    public List<String> search(DiagramGraph graph, String query) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<String> matches = graph.getNodes().values().stream()
                .filter(node -> matches(node, needle))
                .map(DiagramNode::getKey)
                .collect(Collectors.toList());
        log.debug("[search] Query '{}' matched {} node(s)", query, matches.size());
        return matches;
    }

    private boolean matches(DiagramNode node, String needle) {
        return node.getLabel().toLowerCase(Locale.ROOT).contains(needle)
                || node.getKey().toLowerCase(Locale.ROOT).contains(needle);
    }
}
