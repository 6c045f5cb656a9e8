package com.qmb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Script generation parameters of a session, seeded from configuration defaults and
 * changed through {@code updateConfig}.
 */
public record BuildConfig(
        @JsonProperty("qvd_path") String qvdPath,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("db_path") String dbPath,
        @JsonProperty("calendar_language") CalendarLanguage calendarLanguage,
        @JsonProperty("use_autonumber") boolean useAutonumber
) {
    public BuildConfig withQvdPath(String value) {
        return new BuildConfig(value, outputPath, dbPath, calendarLanguage, useAutonumber);
    }

    public BuildConfig withOutputPath(String value) {
        return new BuildConfig(qvdPath, value, dbPath, calendarLanguage, useAutonumber);
    }

    public BuildConfig withDbPath(String value) {
        return new BuildConfig(qvdPath, outputPath, value, calendarLanguage, useAutonumber);
    }

    public BuildConfig withCalendarLanguage(CalendarLanguage value) {
        return new BuildConfig(qvdPath, outputPath, dbPath, value, useAutonumber);
    }

    public BuildConfig withUseAutonumber(boolean value) {
        return new BuildConfig(qvdPath, outputPath, dbPath, calendarLanguage, value);
    }
}
