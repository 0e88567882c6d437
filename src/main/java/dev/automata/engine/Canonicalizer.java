package dev.automata.engine;

import dev.automata.model.Alphabet;
import dev.automata.model.Automaton;
import dev.automata.model.CanonicalAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames states to {@code Q0, Q1, ...} and detects the dead state.
 *
 * <p>The start state always becomes {@code Q0}; the remaining states keep their relative
 * index order, which makes the output reproducible.
 */
public final class Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    static final String STATE_PREFIX = "Q";

    private Canonicalizer() {}

    public static CanonicalAutomaton canonicalize(Automaton automaton) {
        int count = automaton.stateCount();
        int[] order = new int[count];
        int[] position = new int[count];
        order[0] = automaton.start();
        int next = 1;
        for (int s = 0; s < count; s++) {
            if (s != automaton.start()) {
                order[next++] = s;
            }
        }
        for (int p = 0; p < count; p++) {
            position[order[p]] = p;
        }

        Alphabet alphabet = automaton.alphabet();
        var states = new ArrayList<String>(count);
        var finals = new ArrayList<String>();
        var transitions = new LinkedHashMap<String, Map<Character, List<String>>>();
        for (int p = 0; p < count; p++) {
            int old = order[p];
            String name = STATE_PREFIX + p;
            states.add(name);
            if (automaton.isAccepting(old)) {
                finals.add(name);
            }
            var row = new LinkedHashMap<Character, List<String>>();
            for (int c = 0; c < alphabet.size(); c++) {
                row.put(alphabet.symbolAt(c), List.of(STATE_PREFIX + position[automaton.target(old, c)]));
            }
            transitions.put(name, row);
        }

        String dead = findDeadState(automaton, order);
        log.debug("Renamed {} state(s), start {} -> Q0, dead state {}",
            count, automaton.label(automaton.start()), dead == null ? "none" : dead);
        return new CanonicalAutomaton(states, alphabet, transitions, STATE_PREFIX + 0, finals, dead);
    }

    /**
     * First non-accepting state, in display order, whose every transition loops back to itself.
     */
    private static String findDeadState(Automaton automaton, int[] order) {
        for (int p = 0; p < order.length; p++) {
            int s = order[p];
            if (automaton.isAccepting(s)) {
                continue;
            }
            boolean absorbing = true;
            for (int c = 0; c < automaton.alphabet().size() && absorbing; c++) {
                absorbing = automaton.target(s, c) == s;
            }
            if (absorbing) {
                return STATE_PREFIX + p;
            }
        }
        return null;
    }
}
