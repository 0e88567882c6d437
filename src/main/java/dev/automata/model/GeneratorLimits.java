package dev.automata.model;

/**
 * Safety limits to stop pathological quality combinations from exhausting memory.
 */
public record GeneratorLimits(int maxStates) {

    public static final int DEFAULT_MAX_STATES = 10_000;

    public GeneratorLimits {
        if (maxStates < 1) {
            throw new IllegalArgumentException("maxStates must be positive, got " + maxStates);
        }
    }

    public static GeneratorLimits defaults() {
        return new GeneratorLimits(DEFAULT_MAX_STATES);
    }
}
