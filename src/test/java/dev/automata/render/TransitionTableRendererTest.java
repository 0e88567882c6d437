package dev.automata.render;

import dev.automata.engine.AutomatonGenerator;
import dev.automata.model.Alphabet;
import dev.automata.model.CanonicalAutomaton;
import dev.automata.model.Quality;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionTableRendererTest {

    private final TransitionTableRenderer renderer = new TransitionTableRenderer();

    @Test
    void rendersUniversalAutomaton() {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("ab"), List.of());

        assertThat(renderer.render(automaton)).isEqualTo("""
            Start State: Q0
            Final States: {Q0}

            State  | a    | b
            -------+------+-----
            → * Q0 | {Q0} | {Q0}

            Note: '→' indicates the start state. '*' indicates a final (accepting) state.
            """);
    }

    @Test
    void marksStartFinalAndDeadStates() {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("ab"), List.of(Quality.startsWith("ab")));

        String table = renderer.render(automaton);

        assertThat(table).contains("Final States: {Q2}");
        assertThat(table).contains("Dead State: Q3");
        assertThat(table).contains("→ Q0  | {Q1} | {Q3}");
        assertThat(table).contains("* Q2  | {Q2} | {Q2}");
        assertThat(table).contains("Q3    | {Q3} | {Q3}");
    }

    @Test
    void omitsDeadStateLineWhenThereIsNone() {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("ab"), List.of(Quality.contains("aba")));

        assertThat(renderer.render(automaton)).doesNotContain("Dead State");
    }

    @Test
    void listsOneRowPerState() {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("01"), List.of(Quality.endsWith("11")));

        long rows = renderer.render(automaton).lines().filter(line -> line.matches(".*Q\\d+ +\\|.*")).count();

        assertThat(rows).isEqualTo(automaton.states().size());
    }
}
