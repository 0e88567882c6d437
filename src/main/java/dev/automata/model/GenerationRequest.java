package dev.automata.model;

import java.util.List;

/**
 * Everything needed to generate one automaton: the raw alphabet text, the qualities to
 * conjoin, and the limits to build under.
 */
public record GenerationRequest(
    String alphabet,
    List<Quality> qualities,
    GeneratorLimits limits
) {
    public GenerationRequest {
        qualities = qualities == null ? List.of() : List.copyOf(qualities);
        limits = limits == null ? GeneratorLimits.defaults() : limits;
    }
}
