package dev.automata.render;

import dev.automata.model.CanonicalAutomaton;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the automaton as a Mermaid state diagram embedded in a Markdown code block.
 *
 * <p>Parallel edges between the same two states are merged into one edge whose label lists
 * every symbol, in alphabet order. Final states get the {@code accepting} class and the dead
 * state, if any, the {@code dead} class.
 *
 * @see <a href="https://mermaid.js.org/syntax/stateDiagram.html">Mermaid state diagrams</a>
 */
public class MermaidRenderer implements AutomatonRenderer {

    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String STATE_DIAGRAM = "stateDiagram-v2\n";
    private static final String INDENT = "    ";

    private static final String ACCEPTING_CLASS = "accepting";
    private static final String DEAD_CLASS = "dead";
    private static final String ACCEPTING_STYLE = "stroke-width:4px,font-weight:bold";
    private static final String DEAD_STYLE = "fill:#374151,stroke:#6b7280,color:#f9fafb";

    @Override
    public String render(CanonicalAutomaton automaton) {
        var sb = new StringBuilder(CODE_BLOCK_START);
        sb.append(STATE_DIAGRAM);
        sb.append(INDENT).append("direction LR\n");
        sb.append(INDENT).append("[*] --> ").append(automaton.startState()).append('\n');

        for (String from : automaton.states()) {
            for (var edge : groupEdges(automaton, from).entrySet()) {
                sb.append(INDENT).append(from).append(" --> ").append(edge.getKey())
                  .append(" : ").append(String.join(", ", edge.getValue())).append('\n');
            }
        }

        if (!automaton.finalStates().isEmpty()) {
            sb.append(INDENT).append("classDef ").append(ACCEPTING_CLASS).append(' ').append(ACCEPTING_STYLE).append('\n');
            sb.append(INDENT).append("class ").append(String.join(",", automaton.finalStates()))
              .append(' ').append(ACCEPTING_CLASS).append('\n');
        }
        automaton.dead().ifPresent(dead -> {
            sb.append(INDENT).append("classDef ").append(DEAD_CLASS).append(' ').append(DEAD_STYLE).append('\n');
            sb.append(INDENT).append("class ").append(dead).append(' ').append(DEAD_CLASS).append('\n');
        });

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private static Map<String, List<String>> groupEdges(CanonicalAutomaton automaton, String from) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (char symbol : automaton.alphabet().symbols()) {
            for (String to : automaton.next(from, symbol)) {
                edges.computeIfAbsent(to, k -> new ArrayList<>()).add(String.valueOf(symbol));
            }
        }
        return edges;
    }
}
