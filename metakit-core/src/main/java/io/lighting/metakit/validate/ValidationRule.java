package io.lighting.metakit.validate;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed form of the rule mini-language: {@code max:<int>}, {@code min:<int>} and
 * {@code in:<comma-separated values>}.
 */
public sealed interface ValidationRule permits ValidationRule.Max, ValidationRule.Min, ValidationRule.In {

    /**
     * @throws IllegalArgumentException when the text is not a well-formed rule
     */
    static ValidationRule parse(String text) {
        Objects.requireNonNull(text, "text");
        int colon = text.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Rule must look like <kind>:<argument>: " + text);
        }
        String kind = text.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String argument = text.substring(colon + 1).trim();
        return switch (kind) {
            case "max" -> new Max(parseInt(argument, text));
            case "min" -> new Min(parseInt(argument, text));
            case "in" -> new In(parseValues(argument, text));
            default -> throw new IllegalArgumentException("Unknown rule kind '" + kind + "': " + text);
        };
    }

    private static int parseInt(String argument, String text) {
        try {
            return Integer.parseInt(argument);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Rule argument must be an integer: " + text, ex);
        }
    }

    private static Set<String> parseValues(String argument, String text) {
        Set<String> values = new LinkedHashSet<>();
        for (String value : argument.split(",")) {
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Rule needs at least one allowed value: " + text);
        }
        return values;
    }

    record Max(int limit) implements ValidationRule {
    }

    record Min(int limit) implements ValidationRule {
    }

    record In(Set<String> allowed) implements ValidationRule {
        public In {
            allowed = Set.copyOf(allowed);
        }

        public boolean allows(String value) {
            return allowed.contains(value);
        }
    }
}
