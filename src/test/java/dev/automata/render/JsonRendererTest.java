package dev.automata.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.automata.engine.AutomatonGenerator;
import dev.automata.model.Alphabet;
import dev.automata.model.CanonicalAutomaton;
import dev.automata.model.Quality;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRendererTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void writesLogicalFields() throws IOException {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("ab"), List.of(Quality.startsWith("ab")));

        JsonNode root = MAPPER.readTree(new JsonRenderer().render(automaton));

        assertThat(root.get("states").size()).isEqualTo(4);
        assertThat(root.get("alphabet").get(0).asText()).isEqualTo("a");
        assertThat(root.get("alphabet").get(1).asText()).isEqualTo("b");
        assertThat(root.get("startState").asText()).isEqualTo("Q0");
        assertThat(root.get("finalStates").get(0).asText()).isEqualTo("Q2");
        assertThat(root.get("deadState").asText()).isEqualTo("Q3");
        assertThat(root.at("/transitions/Q0/a/0").asText()).isEqualTo("Q1");
        assertThat(root.at("/transitions/Q1/b/0").asText()).isEqualTo("Q2");
    }

    @Test
    void writesNullDeadStateWhenAbsent() throws IOException {
        CanonicalAutomaton automaton = AutomatonGenerator.generate(Alphabet.of("ab"), List.of());

        JsonNode root = MAPPER.readTree(new JsonRenderer().render(automaton));

        assertThat(root.get("deadState").isNull()).isTrue();
    }
}
