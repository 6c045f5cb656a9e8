package com.qmb.core.model;

import com.qmb.core.error.ValidationException;

import java.util.Locale;

/**
 * The six ordered stages of the script build pipeline.
 */
public enum StageId {
    A("Configuration"),
    B("Dimensions"),
    C("Facts"),
    D("Calendar"),
    E("Bridge Tables"),
    F("Final Assembly");

    private final String title;

    StageId(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    public boolean isLast() {
        return this == F;
    }

    public StageId next() {
        return isLast() ? this : values()[ordinal() + 1];
    }

    public boolean isAfter(StageId other) {
        return ordinal() > other.ordinal();
    }

    public String label() {
        return name() + " (" + title + ")";
    }

    public static StageId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Stage id is required (one of A-F)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid stage: " + value + ". Use one of A, B, C, D, E, F");
        }
    }
}
