package dev.automata.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relabelled automaton handed to presentation code. State names are dense ({@code Q0, Q1, ...})
 * and the start state is always listed first.
 *
 * <p>Transitions are list-shaped for uniformity with non-deterministic automata; every list
 * built by this engine holds exactly one state.
 */
public record CanonicalAutomaton(
    List<String> states,
    Alphabet alphabet,
    Map<String, Map<Character, List<String>>> transitions,
    String startState,
    List<String> finalStates,
    String deadState // nullable, informational only
) {
    public CanonicalAutomaton {
        states = List.copyOf(states);
        finalStates = List.copyOf(finalStates);
        var copy = new LinkedHashMap<String, Map<Character, List<String>>>();
        for (String state : states) {
            var row = new LinkedHashMap<Character, List<String>>();
            Map<Character, List<String>> source = transitions.getOrDefault(state, Map.of());
            for (char symbol : alphabet.symbols()) {
                row.put(symbol, List.copyOf(source.getOrDefault(symbol, List.of())));
            }
            copy.put(state, Collections.unmodifiableMap(row));
        }
        transitions = Collections.unmodifiableMap(copy);
    }

    public Optional<String> dead() {
        return Optional.ofNullable(deadState);
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public List<String> next(String state, char symbol) {
        Map<Character, List<String>> row = transitions.get(state);
        if (row == null) {
            return List.of();
        }
        return row.getOrDefault(symbol, List.of());
    }

    public boolean accepts(String word) {
        String state = startState;
        for (char symbol : word.toCharArray()) {
            List<String> targets = next(state, symbol);
            if (targets.isEmpty()) {
                return false;
            }
            state = targets.get(0);
        }
        return isFinal(state);
    }
}
