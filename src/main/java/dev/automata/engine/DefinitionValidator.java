package dev.automata.engine;

import dev.automata.model.GenerationRequest;
import dev.automata.model.Quality;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates user-supplied generation input before any automaton is built.
 */
public final class DefinitionValidator {

    private static final Pattern ALPHANUMERIC = Pattern.compile("[a-zA-Z0-9]*");

    private DefinitionValidator() {}

    /**
     * Validate a whole request. Returns an empty list if valid, or a list of error messages.
     */
    public static List<String> validate(GenerationRequest request) {
        var errors = new ArrayList<String>(validateAlphabet(request.alphabet()));
        errors.addAll(validateQualities(request.qualities()));
        return errors;
    }

    public static List<String> validateAlphabet(String alphabet) {
        var errors = new ArrayList<String>();
        if (alphabet == null || alphabet.isEmpty()) {
            errors.add("Alphabet cannot be empty.");
            return errors;
        }
        if (!ALPHANUMERIC.matcher(alphabet).matches()) {
            errors.add("Alphabet can only contain alphanumeric characters.");
        }
        var seen = new HashSet<Character>();
        for (char c : alphabet.toCharArray()) {
            if (!seen.add(c)) {
                errors.add("Alphabet cannot contain duplicate characters.");
                break;
            }
        }
        return errors;
    }

    public static List<String> validateQualities(List<Quality> qualities) {
        var errors = new ArrayList<String>();
        for (int i = 0; i < qualities.size(); i++) {
            Quality quality = qualities.get(i);
            if (quality == null) {
                errors.add("Quality %d is missing".formatted(i + 1));
            } else if (quality.pattern().isBlank()) {
                errors.add("Quality %d (%s) has an empty pattern".formatted(i + 1, quality.type().displayName()));
            }
        }
        return errors;
    }
}
