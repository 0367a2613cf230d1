package io.lighting.metakit.query;

import java.util.regex.Pattern;

/**
 * Guards for names that are spliced into SQL text rather than bound.
 */
public final class SqlIdentifiers {
    private static final Pattern IDENTIFIER = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*"
    );

    private SqlIdentifiers() {
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * @throws IllegalArgumentException unless the name is a plain, optionally dot-qualified identifier
     */
    public static String requireIdentifier(String name, String label) {
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException(label + " must be a plain identifier: " + name);
        }
        return name;
    }

    /**
     * Like {@link #requireIdentifier(String, String)} but also accepts {@code *}.
     */
    public static String requireSelectable(String name) {
        if ("*".equals(name)) {
            return name;
        }
        return requireIdentifier(name, "field");
    }
}
