package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Modeling pattern applied to the generated script.
 */
public enum ModelType {
    STAR_SCHEMA("star_schema", "Star schema"),
    SNOWFLAKE("snowflake", "Snowflake schema"),
    LINK_TABLE("link_table", "Link table"),
    NORMALIZED("normalized", "Normalized");

    private final String wireName;
    private final String displayName;

    ModelType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a wire name such as {@code "star_schema"}; matching ignores case and
     * accepts dashes in place of underscores.
     */
    public static Optional<ModelType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst();
    }

    /** Comma separated list of accepted wire names. */
    public static String choices() {
        return Arrays.stream(values()).map(ModelType::wireName).collect(Collectors.joining(", "));
    }
}
