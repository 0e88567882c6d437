package dev.automata.engine;

import dev.automata.model.Alphabet;
import dev.automata.model.Automaton;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.InvalidQualityException;
import dev.automata.model.Quality;
import dev.automata.model.QualityType;
import dev.automata.model.StateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Builds the complete deterministic automaton for a single quality.
 *
 * <p>Starts-with uses a linear chain with a dead state. Ends-with and contains use the
 * classic substring-matching automaton driven by the pattern's border (failure) table: state
 * {@code qi} means the longest suffix of the input read so far that is a prefix of the
 * pattern has length {@code i}.
 */
public final class QualityAutomatonBuilder {

    private static final Logger log = LoggerFactory.getLogger(QualityAutomatonBuilder.class);

    private QualityAutomatonBuilder() {}

    public static Automaton build(Alphabet alphabet, Quality quality) {
        return build(alphabet, quality, GeneratorLimits.defaults());
    }

    /**
     * Build the automaton recognizing the language of {@code quality} over {@code alphabet}.
     *
     * @throws InvalidQualityException if the pattern is empty
     * @throws StateLimitExceededException if the automaton would exceed {@code limits}
     */
    public static Automaton build(Alphabet alphabet, Quality quality, GeneratorLimits limits) {
        String pattern = quality.pattern();
        if (pattern.isEmpty()) {
            throw new InvalidQualityException("Quality '%s' has an empty pattern".formatted(quality.type().displayName()));
        }
        warnOnForeignSymbols(alphabet, quality);

        Automaton automaton = quality.type() == QualityType.STARTS_WITH
            ? buildPrefixChain(alphabet, pattern, limits)
            : buildSubstringMatcher(alphabet, pattern, quality.type() == QualityType.CONTAINS, limits);

        log.debug("Built {} state(s) for {}", automaton.stateCount(), quality);
        return automaton;
    }

    private static Automaton buildPrefixChain(Alphabet alphabet, String pattern, GeneratorLimits limits) {
        int n = pattern.length();
        int dead = n + 1;
        checkLimit(n + 2, limits);

        int[][] table = new int[n + 2][alphabet.size()];
        for (int i = 0; i < n; i++) {
            for (int c = 0; c < alphabet.size(); c++) {
                table[i][c] = alphabet.symbolAt(c) == pattern.charAt(i) ? i + 1 : dead;
            }
        }
        for (int c = 0; c < alphabet.size(); c++) {
            table[n][c] = n;
            table[dead][c] = dead;
        }

        List<String> labels = chainLabels(n);
        labels.add("D");
        return new Automaton(alphabet, table, 0, acceptingOnly(n), labels);
    }

    private static Automaton buildSubstringMatcher(Alphabet alphabet, String pattern, boolean absorbing,
                                                   GeneratorLimits limits) {
        int n = pattern.length();
        checkLimit(n + 1, limits);

        int[] borders = borders(pattern);
        int[][] table = new int[n + 1][alphabet.size()];
        for (int i = 0; i <= n; i++) {
            for (int c = 0; c < alphabet.size(); c++) {
                table[i][c] = absorbing && i == n
                    ? n
                    : advance(pattern, borders, i, alphabet.symbolAt(c));
            }
        }
        return new Automaton(alphabet, table, 0, acceptingOnly(n), chainLabels(n));
    }

    /**
     * Next matched-prefix length after reading {@code symbol} with {@code matched} symbols of
     * the pattern currently matched. Also used for the accepting state, so an ends-with
     * automaton loses acceptance as soon as the suffix breaks.
     */
    static int advance(String pattern, int[] borders, int matched, char symbol) {
        int n = pattern.length();
        if (matched < n && pattern.charAt(matched) == symbol) {
            return matched + 1;
        }
        int j = matched;
        while (j > 0 && (j == n || pattern.charAt(j) != symbol)) {
            j = borders[j - 1];
        }
        if (pattern.charAt(j) == symbol) {
            j++;
        }
        return j;
    }

    /**
     * Border table: {@code borders[i]} is the length of the longest proper prefix of
     * {@code pattern[0..i]} that is also its suffix.
     */
    static int[] borders(String pattern) {
        int[] borders = new int[pattern.length()];
        int length = 0;
        int i = 1;
        while (i < pattern.length()) {
            if (pattern.charAt(i) == pattern.charAt(length)) {
                borders[i++] = ++length;
            } else if (length != 0) {
                length = borders[length - 1];
            } else {
                borders[i++] = 0;
            }
        }
        return borders;
    }

    private static void checkLimit(int states, GeneratorLimits limits) {
        if (states > limits.maxStates()) {
            throw new StateLimitExceededException(limits.maxStates());
        }
    }

    private static BitSet acceptingOnly(int state) {
        var accepting = new BitSet();
        accepting.set(state);
        return accepting;
    }

    private static List<String> chainLabels(int n) {
        var labels = new ArrayList<String>(n + 2);
        for (int i = 0; i <= n; i++) {
            labels.add("q" + i);
        }
        return labels;
    }

    private static void warnOnForeignSymbols(Alphabet alphabet, Quality quality) {
        for (char c : quality.pattern().toCharArray()) {
            if (!alphabet.contains(c)) {
                log.warn("Pattern of {} uses '{}' which is not in alphabet '{}'; it can never match",
                    quality, c, alphabet.asString());
                return;
            }
        }
    }
}
