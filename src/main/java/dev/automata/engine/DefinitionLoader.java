package dev.automata.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.automata.model.GenerationRequest;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.Quality;
import dev.automata.model.QualityType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads generation requests from JSON definitions.
 *
 * <pre>{@code
 * { "alphabet": "ab",
 *   "qualities": [ { "type": "contains", "value": "aba" } ],
 *   "limits": { "maxStates": 5000 } }
 * }</pre>
 */
public final class DefinitionLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DefinitionLoader() {}

    public static GenerationRequest loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseRequest(root);
    }

    public static GenerationRequest loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseRequest(root);
    }

    private static GenerationRequest parseRequest(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Definition must be a JSON object");
        }
        String alphabet = parseAlphabet(root.get("alphabet"));
        List<Quality> qualities = parseQualities(root.get("qualities"));
        GeneratorLimits limits = parseLimits(root.get("limits"));
        return new GenerationRequest(alphabet, qualities, limits);
    }

    // Either "ab" or ["a", "b"]
    private static String parseAlphabet(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing required field 'alphabet'");
        }
        if (node.isArray()) {
            var sb = new StringBuilder();
            for (JsonNode symbol : node) {
                if (!symbol.isTextual() || symbol.asText().length() != 1) {
                    throw new IllegalArgumentException("Alphabet symbols must be single characters: " + symbol);
                }
                sb.append(symbol.asText());
            }
            return sb.toString();
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("'alphabet' must be a string or an array of symbols: " + node);
        }
        return node.asText();
    }

    private static List<Quality> parseQualities(JsonNode node) {
        var qualities = new ArrayList<Quality>();
        if (node == null || node.isNull()) {
            return qualities;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'qualities' must be an array: " + node);
        }
        for (JsonNode entry : node) {
            qualities.add(parseQuality(entry));
        }
        return qualities;
    }

    private static Quality parseQuality(JsonNode node) {
        if (!hasText(node, "type") || !hasText(node, "value")) {
            throw new IllegalArgumentException("Quality requires 'type' and 'value': " + node);
        }
        QualityType type = QualityType.fromString(node.get("type").asText());
        return new Quality(type, node.get("value").asText());
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual();
    }

    private static GeneratorLimits parseLimits(JsonNode node) {
        if (node == null) {
            return GeneratorLimits.defaults();
        }
        int maxStates = node.has("maxStates")
            ? node.get("maxStates").asInt() : GeneratorLimits.DEFAULT_MAX_STATES;
        return new GeneratorLimits(maxStates);
    }
}
