package dev.automata.engine;

import dev.automata.Words;
import dev.automata.model.Alphabet;
import dev.automata.model.Automaton;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.InvalidQualityException;
import dev.automata.model.Quality;
import dev.automata.model.StateLimitExceededException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityAutomatonBuilderTest {

    private static final List<String> AB_PATTERNS = List.of("a", "b", "ab", "ba", "aa", "aba", "abab", "aab", "abba", "aaab");
    private static final List<String> ABC_PATTERNS = List.of("abc", "abcab", "cab", "acac", "bcb");

    @Test
    void bordersMatchLongestProperPrefixSuffix() {
        assertThat(QualityAutomatonBuilder.borders("abab")).containsExactly(0, 0, 1, 2);
        assertThat(QualityAutomatonBuilder.borders("aabaaab")).containsExactly(0, 1, 0, 1, 2, 2, 3);
        assertThat(QualityAutomatonBuilder.borders("abc")).containsExactly(0, 0, 0);
    }

    @Test
    void startsWithAcceptsExactlyWordsWithPrefix() {
        checkAll("ab", AB_PATTERNS, Quality::startsWith, String::startsWith, 7);
        checkAll("abc", ABC_PATTERNS, Quality::startsWith, String::startsWith, 6);
    }

    @Test
    void endsWithAcceptsExactlyWordsWithSuffix() {
        checkAll("ab", AB_PATTERNS, Quality::endsWith, String::endsWith, 7);
        checkAll("abc", ABC_PATTERNS, Quality::endsWith, String::endsWith, 6);
    }

    @Test
    void containsAcceptsExactlyWordsWithSubstring() {
        checkAll("ab", AB_PATTERNS, Quality::contains, String::contains, 7);
        checkAll("abc", ABC_PATTERNS, Quality::contains, String::contains, 6);
    }

    @Test
    void startsWithHasChainPlusDeadState() {
        Automaton automaton = QualityAutomatonBuilder.build(Alphabet.of("ab"), Quality.startsWith("ab"));

        assertThat(automaton.stateCount()).isEqualTo(4);
        assertThat(automaton.acceptingCount()).isEqualTo(1);
        assertThat(automaton.isAccepting(2)).isTrue();
        // dead state loops on every symbol
        assertThat(automaton.target(3, 0)).isEqualTo(3);
        assertThat(automaton.target(3, 1)).isEqualTo(3);
    }

    @Test
    void containsAcceptingStateAbsorbs() {
        Automaton automaton = QualityAutomatonBuilder.build(Alphabet.of("ab"), Quality.contains("ab"));

        assertThat(automaton.stateCount()).isEqualTo(3);
        assertThat(automaton.target(2, 0)).isEqualTo(2);
        assertThat(automaton.target(2, 1)).isEqualTo(2);
    }

    @Test
    void endsWithAcceptingStateFallsBackOnMismatch() {
        Automaton automaton = QualityAutomatonBuilder.build(Alphabet.of("ab"), Quality.endsWith("ab"));

        // after "ab", reading "a" keeps one matched symbol, reading "b" loses everything
        assertThat(automaton.target(2, 0)).isEqualTo(1);
        assertThat(automaton.target(2, 1)).isEqualTo(0);
    }

    @Test
    void endsWithStaysAcceptingOnOverlappingSuffix() {
        Automaton automaton = QualityAutomatonBuilder.build(Alphabet.of("01"), Quality.endsWith("11"));

        assertThat(automaton.target(2, 1)).isEqualTo(2);
        assertThat(automaton.accepts("111")).isTrue();
        assertThat(automaton.accepts("1110")).isFalse();
    }

    @Test
    void patternOutsideAlphabetNeverMatches() {
        Alphabet alphabet = Alphabet.of("ab");
        for (Quality quality : List.of(Quality.startsWith("ax"), Quality.endsWith("xb"), Quality.contains("x"))) {
            Automaton automaton = QualityAutomatonBuilder.build(alphabet, quality);
            assertThat(Words.upTo("ab", 6)).noneMatch(automaton::accepts);
        }
    }

    @Test
    void rejectsEmptyPattern() {
        assertThatThrownBy(() -> QualityAutomatonBuilder.build(Alphabet.of("ab"), Quality.contains("")))
            .isInstanceOf(InvalidQualityException.class)
            .hasMessageContaining("empty pattern");
    }

    @Test
    void enforcesStateLimit() {
        assertThatThrownBy(() -> QualityAutomatonBuilder.build(
                Alphabet.of("ab"), Quality.startsWith("abab"), new GeneratorLimits(5)))
            .isInstanceOf(StateLimitExceededException.class);

        assertThat(QualityAutomatonBuilder.build(Alphabet.of("ab"), Quality.contains("abab"), new GeneratorLimits(5))
            .stateCount()).isEqualTo(5);
    }

    interface QualityFactory {
        Quality create(String pattern);
    }

    interface Predicate {
        boolean test(String word, String pattern);
    }

    private static void checkAll(String symbols, List<String> patterns, QualityFactory factory,
                                 Predicate expected, int maxLength) {
        Alphabet alphabet = Alphabet.of(symbols);
        List<String> words = Words.upTo(symbols, maxLength);
        for (String pattern : patterns) {
            Quality quality = factory.create(pattern);
            Automaton automaton = QualityAutomatonBuilder.build(alphabet, quality);
            for (String word : words) {
                assertThat(automaton.accepts(word))
                    .as("%s on \"%s\"", quality, word)
                    .isEqualTo(expected.test(word, pattern));
            }
        }
    }
}
