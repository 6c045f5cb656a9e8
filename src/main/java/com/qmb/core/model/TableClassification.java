package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role inferred for a source table.
 */
public enum TableClassification {
    FACT("fact", "FACT_"),
    DIMENSION("dimension", "DIM_"),
    BRIDGE("bridge", "BRIDGE_"),
    LOOKUP("lookup", "LKP_"),
    CALENDAR("calendar", "CAL_");

    private final String wireName;
    private final String tablePrefix;

    TableClassification(String wireName, String tablePrefix) {
        this.wireName = wireName;
        this.tablePrefix = tablePrefix;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Prefix used for the table name in generated script. */
    public String tablePrefix() {
        return tablePrefix;
    }

    /** Dimension, lookup and calendar tables are all loaded by the dimensions stage. */
    public boolean isDimensionFamily() {
        return this == DIMENSION || this == LOOKUP || this == CALENDAR;
    }
}
