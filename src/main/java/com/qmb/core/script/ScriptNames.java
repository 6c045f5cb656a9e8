package com.qmb.core.script;

import com.qmb.core.analysis.FieldProfiler;
import com.qmb.core.model.TableAnalysis;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Naming and quoting rules for generated load script.
 */
public final class ScriptNames {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9_]+");

    private static final Set<String> RESERVED = Set.of(
            "AND", "AS", "BY", "CALL", "CONCATENATE", "DISTINCT", "DROP", "ELSE", "END", "FIELD", "FROM",
            "GROUP", "IF", "INNER", "INTO", "JOIN", "KEEP", "LEFT", "LET", "LOAD", "MAPPING", "NOT", "OR",
            "ORDER", "OUTER", "RESIDENT", "RIGHT", "SELECT", "SET", "STORE", "SUB", "TABLE", "THEN", "WHERE");

    private ScriptNames() {} // utility class

    /** {@code DIM_Customers}, {@code FACT_Order_Lines}, ... */
    public static String tableName(TableAnalysis table) {
        return table.classification().tablePrefix() + sanitize(table.name());
    }

    /** Wraps a field name in brackets when it is not a plain identifier or collides with a keyword. */
    public static String field(String name) {
        if (PLAIN_IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name.toUpperCase(Locale.ROOT))) {
            return name;
        }
        return "[" + name.replace("]", "]]") + "]";
    }

    /**
     * Name of the association key for a key field: {@code CustomerID -> CustomerKey}.
     */
    public static String keyName(String fieldName, String tableName) {
        String stem = FieldProfiler.keyStem(fieldName);
        if (stem.equalsIgnoreCase(fieldName)) {
            stem = sanitize(tableName);
        }
        return sanitize(capitalize(stem)) + "Key";
    }

    /**
     * Key expression for a load statement, optionally wrapped in {@code AUTONUMBER} so all
     * loads of the same key share one integer sequence.
     */
    public static String keyExpression(String sourceField, String keyName, boolean autonumber) {
        if (autonumber) {
            return "AUTONUMBER(" + field(sourceField) + ", '" + keyName + "') AS " + keyName;
        }
        return field(sourceField) + " AS " + keyName;
    }

    public static String qvdSource(String sourceName) {
        return "FROM [$(vPathQVD)" + sourceName + "] (qvd);";
    }

    public static String sectionHeader(String title) {
        return "//-------------------------------------------------------------\n"
                + "// " + title + "\n"
                + "//-------------------------------------------------------------";
    }

    /** Name of the master calendar generated for a date field. */
    public static String masterCalendarName(String dateField) {
        return "DIM_" + sanitize(dateField);
    }

    static String sanitize(String name) {
        String cleaned = NON_WORD.matcher(name.trim()).replaceAll("_");
        return cleaned.replaceAll("^_+|_+$", "");
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
