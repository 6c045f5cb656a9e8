package com.qmb.core.analysis;

import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.FieldSpec;
import com.qmb.core.model.FieldStats;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name and type heuristics that decide which fields are keys, dates or calendar parts.
 */
public final class FieldProfiler {

    private static final List<Pattern> KEY_PATTERNS = List.of(
            Pattern.compile("_?id$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_?key$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_?code$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^pk_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^fk_", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("date$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^date_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_at$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("timestamp", Pattern.CASE_INSENSITIVE),
            Pattern.compile("time$", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> DATE_TYPES = Set.of("date", "datetime", "timestamp");

    private static final Pattern CALENDAR_PART =
            Pattern.compile("^(fiscal_?)?(year|month|day|quarter|week)\\w*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern KEY_AFFIX = Pattern.compile("(^(pk|fk)_)|(_?(id|key|code)$)", Pattern.CASE_INSENSITIVE);

    private FieldProfiler() {} // utility class

    public static boolean isKeyLike(String fieldName) {
        return fieldName != null && KEY_PATTERNS.stream().anyMatch(p -> p.matcher(fieldName).find());
    }

    public static boolean isDateField(String fieldName, String type) {
        if (type != null && DATE_TYPES.contains(type.trim().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return fieldName != null && DATE_PATTERNS.stream().anyMatch(p -> p.matcher(fieldName).find());
    }

    public static boolean isCalendarPart(String fieldName) {
        return fieldName != null && CALENDAR_PART.matcher(fieldName).matches();
    }

    /**
     * Strips key affixes: {@code CustomerID -> Customer}, {@code fk_region -> region}.
     * Returns the name unchanged when nothing is left after stripping.
     */
    public static String keyStem(String fieldName) {
        String stem = KEY_AFFIX.matcher(fieldName).replaceAll("");
        return stem.isEmpty() ? fieldName : stem;
    }

    /**
     * True when the field's key stem names the table, e.g. {@code CustomerID} in {@code Customers}.
     */
    public static boolean stemMatchesTable(String fieldName, String tableName) {
        String stem = keyStem(fieldName).toLowerCase(Locale.ROOT);
        String table = tableName.toLowerCase(Locale.ROOT);
        return stem.equals(table) || stem.equals(singular(table));
    }

    /**
     * Merges a declared field with its statistics.
     *
     * @param stats    statistics for the field, or {@code null} if the table or field was not sampled
     * @param rowCount row count of the owning table, 0 when unknown
     */
    public static FieldProfile profile(FieldSpec spec, FieldStats stats, long rowCount) {
        String type = spec.type() != null ? spec.type() : (stats != null ? stats.type() : null);
        long cardinality = stats != null ? stats.cardinality() : 0;
        double nullPercent = stats != null ? stats.nullPercent() : 0.0;
        double uniqueness = rowCount > 0 ? Math.min(1.0, cardinality / (double) rowCount) : 0.0;
        return new FieldProfile(
                spec.name(),
                type,
                cardinality,
                nullPercent,
                uniqueness,
                isKeyLike(spec.name()),
                isDateField(spec.name(), type),
                stats != null ? stats.minValue() : null,
                stats != null ? stats.maxValue() : null,
                stats != null ? stats.sampleValues() : List.of());
    }

    static String singular(String name) {
        if (name.endsWith("ies") && name.length() > 3) {
            return name.substring(0, name.length() - 3) + "y";
        }
        if (name.endsWith("s") && !name.endsWith("ss")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }
}
