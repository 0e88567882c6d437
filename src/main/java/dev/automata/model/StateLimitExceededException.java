package dev.automata.model;

/**
 * Construction would materialize more states than {@link GeneratorLimits#maxStates()} allows.
 */
public class StateLimitExceededException extends AutomatonException {

    private final int limit;

    public StateLimitExceededException(int limit) {
        super("Automaton exceeds the limit of %d states".formatted(limit));
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
