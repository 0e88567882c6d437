package dev.automata.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.automata.model.CanonicalAutomaton;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders the automaton's logical fields as pretty-printed JSON.
 */
public class JsonRenderer implements AutomatonRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String render(CanonicalAutomaton automaton) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(automaton)) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize automaton", e);
        }
    }

    static ObjectNode toTree(CanonicalAutomaton automaton) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("states", stringArray(automaton.states()));

        ArrayNode alphabet = root.putArray("alphabet");
        automaton.alphabet().symbols().forEach(symbol -> alphabet.add(String.valueOf(symbol)));

        ObjectNode transitions = root.putObject("transitions");
        for (var row : automaton.transitions().entrySet()) {
            ObjectNode byState = transitions.putObject(row.getKey());
            for (var cell : row.getValue().entrySet()) {
                byState.set(String.valueOf(cell.getKey()), stringArray(cell.getValue()));
            }
        }

        root.put("startState", automaton.startState());
        root.set("finalStates", stringArray(automaton.finalStates()));
        if (automaton.deadState() != null) {
            root.put("deadState", automaton.deadState());
        } else {
            root.putNull("deadState");
        }
        return root;
    }

    private static ArrayNode stringArray(List<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }
}
