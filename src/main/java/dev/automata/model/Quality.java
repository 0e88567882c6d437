package dev.automata.model;

import java.util.Objects;

/**
 * A single constraint on accepted strings: an operator applied to a literal pattern.
 */
public record Quality(QualityType type, String pattern) {

    public Quality {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(pattern, "pattern");
    }

    public static Quality startsWith(String pattern) {
        return new Quality(QualityType.STARTS_WITH, pattern);
    }

    public static Quality endsWith(String pattern) {
        return new Quality(QualityType.ENDS_WITH, pattern);
    }

    public static Quality contains(String pattern) {
        return new Quality(QualityType.CONTAINS, pattern);
    }

    @Override
    public String toString() {
        return "%s \"%s\"".formatted(type.displayName(), pattern);
    }
}
