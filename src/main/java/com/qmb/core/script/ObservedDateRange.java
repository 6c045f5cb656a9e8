package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.TableAnalysis;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Date range observed in sampled statistics, from explicit min/max values or, failing that,
 * from sample values that parse as ISO dates.
 */
public record ObservedDateRange(LocalDate min, LocalDate max) {

    public static final LocalDate FALLBACK_MIN = LocalDate.of(2020, 1, 1);
    public static final LocalDate FALLBACK_MAX = LocalDate.of(2030, 12, 31);

    /**
     * Range spanning every field of the analysis whose name is in {@code fieldNames}.
     */
    public static Optional<ObservedDateRange> of(AnalysisResult analysis, List<String> fieldNames) {
        List<LocalDate> dates = new ArrayList<>();
        for (TableAnalysis table : analysis.tables()) {
            for (FieldProfile field : table.fields()) {
                if (field.dateField() && fieldNames.stream().anyMatch(n -> n.equalsIgnoreCase(field.name()))) {
                    collect(field, dates);
                }
            }
        }
        if (dates.isEmpty()) {
            return Optional.empty();
        }
        LocalDate min = dates.stream().min(LocalDate::compareTo).orElseThrow();
        LocalDate max = dates.stream().max(LocalDate::compareTo).orElseThrow();
        return Optional.of(new ObservedDateRange(min, max));
    }

    public static ObservedDateRange orFallback(Optional<ObservedDateRange> range) {
        return range.orElse(new ObservedDateRange(FALLBACK_MIN, FALLBACK_MAX));
    }

    private static void collect(FieldProfile field, List<LocalDate> dates) {
        int before = dates.size();
        parse(field.minValue()).ifPresent(dates::add);
        parse(field.maxValue()).ifPresent(dates::add);
        if (dates.size() == before) {
            for (String sample : field.sampleValues()) {
                parse(sample).ifPresent(dates::add);
            }
        }
    }

    static Optional<LocalDate> parse(String value) {
        if (value == null || value.length() < 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.substring(0, 10)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
