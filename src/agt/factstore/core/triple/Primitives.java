package factstore.core.triple;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalization and variable handling for the string tokens that occupy a triple slot.
 * A primitive is either an opaque, case-insensitive value or a variable carrying
 * the {@link #VARIABLE_PREFIX}.
 */
public final class Primitives {

    /** Reserved prefix marking a primitive as a variable */
    public static final String VARIABLE_PREFIX = "?";

    // Matches tokens made only of non-word characters, e.g. "..." or "?"
    private static final Pattern INVALID = Pattern.compile("^\\W*$", Pattern.UNICODE_CHARACTER_CLASS);

    private Primitives() {}

    /**
     * Normalize a raw token: trim, strip one pair of matching quotes, lowercase.
     *
     * @param raw Raw token as written by the caller
     * @return The normalized primitive
     * @throws TripleFormatException if the token is blank, badly quoted, or only punctuation
     */
    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "Primitive cannot be null");
        if (raw.isBlank()) {
            throw new TripleFormatException("Primitive must be a non-empty string");
        }

        String normalized = raw.trim();
        char first = normalized.charAt(0);
        if (first == '"' || first == '\'') {
            if (normalized.length() > 2 && normalized.charAt(normalized.length() - 1) == first) {
                normalized = normalized.substring(1, normalized.length() - 1).trim();
            } else {
                throw new TripleFormatException("Malformed quoted primitive: " + raw);
            }
        }

        normalized = normalized.toLowerCase(Locale.ROOT);
        if (INVALID.matcher(normalized).matches()) {
            throw new TripleFormatException(
                "Invalid primitive, must not contain only special characters: " + raw);
        }
        return normalized;
    }

    /**
     * Check whether a token is a variable.
     */
    public static boolean isVariable(String token) {
        Objects.requireNonNull(token, "Token cannot be null");
        return token.trim().startsWith(VARIABLE_PREFIX);
    }

    /**
     * Canonicalize a variable name so it carries the prefix exactly once.
     * {@code "a"} and {@code "?a"} both become {@code "?a"}.
     *
     * @param name Variable name, with or without prefix
     * @return The prefixed name
     */
    public static String asVariable(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new TripleFormatException("Variable name must be a non-empty string");
        }
        return trimmed.startsWith(VARIABLE_PREFIX) ? trimmed : VARIABLE_PREFIX + trimmed;
    }

    /**
     * Strip the prefix from a variable, e.g. {@code "?who"} becomes {@code "who"}.
     */
    public static String variableName(String variable) {
        String canonical = asVariable(variable);
        return canonical.substring(VARIABLE_PREFIX.length());
    }
}
