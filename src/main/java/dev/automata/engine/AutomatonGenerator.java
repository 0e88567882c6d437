package dev.automata.engine;

import dev.automata.model.Alphabet;
import dev.automata.model.Automaton;
import dev.automata.model.CanonicalAutomaton;
import dev.automata.model.GenerationRequest;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.InvalidQualityException;
import dev.automata.model.Quality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Generates the automaton accepting exactly the strings that satisfy every quality.
 *
 * <p>Qualities are folded left: the first quality's automaton seeds the accumulator and each
 * later one is intersected into it. The result is canonicalized once at the end.
 */
public final class AutomatonGenerator {

    private static final Logger log = LoggerFactory.getLogger(AutomatonGenerator.class);

    private AutomatonGenerator() {}

    /**
     * Generate from a request whose alphabet is raw text. Repeated characters are dropped,
     * keeping first-seen order.
     *
     * @throws dev.automata.model.InvalidAlphabetException if the alphabet is empty
     */
    public static CanonicalAutomaton generate(GenerationRequest request) {
        return generate(Alphabet.deduplicated(request.alphabet()), request.qualities(), request.limits());
    }

    public static CanonicalAutomaton generate(Alphabet alphabet, List<Quality> qualities) {
        return generate(alphabet, qualities, GeneratorLimits.defaults());
    }

    public static CanonicalAutomaton generate(Alphabet alphabet, List<Quality> qualities, GeneratorLimits limits) {
        Automaton combined = intersectAll(alphabet, qualities, limits);
        CanonicalAutomaton result = Canonicalizer.canonicalize(combined);
        log.info("Generated {} state(s) ({} final) for {} quality(ies) over '{}'",
            result.states().size(), result.finalStates().size(), qualities.size(), alphabet.asString());
        return result;
    }

    /**
     * Build and intersect the per-quality automata without canonicalizing. An empty list
     * yields the single-state automaton accepting every word.
     */
    public static Automaton intersectAll(Alphabet alphabet, List<Quality> qualities, GeneratorLimits limits) {
        Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(qualities, "qualities");
        for (int i = 0; i < qualities.size(); i++) {
            Quality quality = qualities.get(i);
            if (quality == null) {
                throw new InvalidQualityException("Quality %d is missing".formatted(i + 1));
            }
            if (quality.pattern().isEmpty()) {
                throw new InvalidQualityException("Quality %d (%s) has an empty pattern"
                    .formatted(i + 1, quality.type().displayName()));
            }
        }

        if (qualities.isEmpty()) {
            return Automaton.universal(alphabet);
        }

        Automaton combined = QualityAutomatonBuilder.build(alphabet, qualities.get(0), limits);
        for (Quality quality : qualities.subList(1, qualities.size())) {
            Automaton next = QualityAutomatonBuilder.build(alphabet, quality, limits);
            combined = ProductComposer.intersect(combined, next, limits);
        }
        return combined;
    }
}
