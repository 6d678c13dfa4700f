package com.vidnyan.classlint.domain.rule;

import java.util.Locale;

/**
 * Text that replaces a redundant {@code class} modifier when correcting.
 */
public enum FinalClassModifier {
    FINAL_CLASS("final class"),
    STATIC("static");

    private final String replacement;

    FinalClassModifier(String replacement) {
        this.replacement = replacement;
    }

    public String replacement() {
        return replacement;
    }

    /**
     * Accepts {@code final class}, its short form {@code final}, and {@code static}.
     */
    public static FinalClassModifier fromConfigValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return switch (normalized) {
            case "final class", "final" -> FINAL_CLASS;
            case "static" -> STATIC;
            default -> throw new InvalidConfigurationException(
                    "final_class_modifier", value, "expected one of: final class, final, static");
        };
    }
}
