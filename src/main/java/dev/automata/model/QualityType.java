package dev.automata.model;

import java.util.Locale;

/**
 * The literal-pattern operators a quality can use.
 */
public enum QualityType {
    STARTS_WITH("starts with"),
    ENDS_WITH("ends with"),
    CONTAINS("contains");

    private final String displayName;

    QualityType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolve either the enum name ({@code ENDS_WITH}) or the display name ({@code ends with}),
     * ignoring case.
     */
    public static QualityType fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
            for (QualityType type : values()) {
                if (type.displayName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown quality type: " + value);
    }
}
