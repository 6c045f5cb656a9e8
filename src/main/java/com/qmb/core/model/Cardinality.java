package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Cardinality of a relationship. {@link #MANY_TO_ONE} only appears in input hints and is
 * normalized to {@link #ONE_TO_MANY} once the edge is oriented child to parent.
 */
public enum Cardinality {
    ONE_TO_ONE("one-to-one"),
    ONE_TO_MANY("one-to-many"),
    MANY_TO_ONE("many-to-one"),
    MANY_TO_MANY("many-to-many");

    private final String wireName;

    Cardinality(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Cardinality normalized() {
        return this == MANY_TO_ONE ? ONE_TO_MANY : this;
    }

    @JsonCreator
    public static Cardinality fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(c -> c.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cardinality: " + value));
    }
}
