package dev.automata.model;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Complete deterministic automaton used during construction.
 *
 * <p>States are dense indices {@code 0..stateCount()-1}. The transition table holds exactly
 * one destination per state and alphabet position, so totality is a property of the shape
 * rather than a convention. Labels are only kept for logging and never used for identity.
 */
public final class Automaton {

    private final Alphabet alphabet;
    private final int[][] transitions;
    private final int start;
    private final BitSet accepting;
    private final List<String> labels;

    public Automaton(Alphabet alphabet, int[][] transitions, int start, BitSet accepting, List<String> labels) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        int stateCount = transitions.length;
        if (start < 0 || start >= stateCount) {
            throw new IllegalArgumentException("Start state %d out of range".formatted(start));
        }
        if (labels.size() != stateCount) {
            throw new IllegalArgumentException("Expected %d labels, got %d".formatted(stateCount, labels.size()));
        }
        if (accepting.length() > stateCount) {
            throw new IllegalArgumentException("Accepting state out of range: " + accepting);
        }
        this.transitions = new int[stateCount][];
        for (int s = 0; s < stateCount; s++) {
            int[] row = transitions[s];
            if (row.length != alphabet.size()) {
                throw new IllegalArgumentException(
                    "State %d has %d transitions for %d symbols".formatted(s, row.length, alphabet.size()));
            }
            for (int target : row) {
                if (target < 0 || target >= stateCount) {
                    throw new IllegalArgumentException("State %d transitions to unknown state %d".formatted(s, target));
                }
            }
            this.transitions[s] = row.clone();
        }
        this.start = start;
        this.accepting = (BitSet) accepting.clone();
        this.labels = List.copyOf(labels);
    }

    /**
     * Single state that is both start and accepting and loops on every symbol.
     */
    public static Automaton universal(Alphabet alphabet) {
        int[][] table = {new int[alphabet.size()]};
        var accepting = new BitSet(1);
        accepting.set(0);
        return new Automaton(alphabet, table, 0, accepting, List.of("*"));
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public int stateCount() {
        return transitions.length;
    }

    public int start() {
        return start;
    }

    public boolean isAccepting(int state) {
        return accepting.get(state);
    }

    public int acceptingCount() {
        return accepting.cardinality();
    }

    /** Destination of {@code state} on the symbol at {@code symbolIndex}. */
    public int target(int state, int symbolIndex) {
        return transitions[state][symbolIndex];
    }

    public String label(int state) {
        return labels.get(state);
    }

    public boolean accepts(String word) {
        int state = start;
        for (int i = 0; i < word.length(); i++) {
            int symbol = alphabet.indexOf(word.charAt(i));
            if (symbol < 0) {
                return false;
            }
            state = transitions[state][symbol];
        }
        return accepting.get(state);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("Automaton[start=").append(labels.get(start)).append(']');
        for (int s = 0; s < transitions.length; s++) {
            sb.append("\n  ").append(accepting.get(s) ? '*' : ' ').append(labels.get(s)).append(" ->");
            for (int target : transitions[s]) {
                sb.append(' ').append(labels.get(target));
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Automaton other)) return false;
        return start == other.start
            && alphabet.equals(other.alphabet)
            && accepting.equals(other.accepting)
            && Arrays.deepEquals(transitions, other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, start, accepting, Arrays.deepHashCode(transitions));
    }
}
