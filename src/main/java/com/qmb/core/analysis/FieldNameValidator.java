package com.qmb.core.analysis;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Flags field names the script generator must bracket or cannot use as-is.
 */
public final class FieldNameValidator {

    static final int MAX_LENGTH = 128;

    private static final String INVALID_CHARS = "/\\:*?\"<>|";

    private static final Set<String> RESERVED_WORDS = Set.of(
            "AND", "AS", "BY", "CALL", "CONCATENATE", "DISTINCT", "DROP", "ELSE", "END", "FIELD", "FROM",
            "GROUP", "IF", "INNER", "INTO", "JOIN", "KEEP", "LEFT", "LET", "LOAD", "MAPPING", "NOT", "OR",
            "ORDER", "OUTER", "RESIDENT", "RIGHT", "SELECT", "SET", "STORE", "SUB", "TABLE", "THEN", "WHERE");

    private FieldNameValidator() {} // utility class

    /**
     * @return a description of the problem, or empty when the name is usable unchanged
     */
    public static Optional<String> validate(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return Optional.of("field name is empty");
        }
        if (fieldName.length() > MAX_LENGTH) {
            return Optional.of("field name '" + fieldName.substring(0, 20) + "...' exceeds " + MAX_LENGTH + " characters");
        }
        for (char c : fieldName.toCharArray()) {
            if (INVALID_CHARS.indexOf(c) >= 0) {
                return Optional.of("field name '" + fieldName + "' contains invalid character '" + c + "'");
            }
        }
        if (RESERVED_WORDS.contains(fieldName.toUpperCase(Locale.ROOT))) {
            return Optional.of("field name '" + fieldName + "' is a reserved word and will be written as ["
                    + fieldName + "]");
        }
        return Optional.empty();
    }
}
