package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.Cardinality;
import com.qmb.core.model.EdgeSource;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides which source fields become association keys and what they are renamed to.
 * <p>
 * Primary keys of dimension, lookup and calendar tables get a {@code <Stem>Key} name; every
 * field that references them through a resolved edge is renamed to the same key. Fields on
 * either side of a declared many-to-many hint share the referenced side's key name. Date
 * fields that a calendar links to keep their names but stay unqualified.
 */
public final class KeyPlan {

    private final Map<String, String> renames = new HashMap<>();
    private final Map<String, String> keyOwners = new HashMap<>();
    private final Set<String> dateKeys = new TreeSet<>();

    private KeyPlan() {}

    public static KeyPlan of(AnalysisResult analysis) {
        KeyPlan plan = new KeyPlan();
        for (TableAnalysis table : analysis.tables()) {
            if (table.classification().isDimensionFamily() && table.primaryKey() != null) {
                String key = ScriptNames.keyName(table.primaryKey(), table.name());
                plan.put(table.name(), table.primaryKey(), key);
                plan.keyOwners.putIfAbsent(key, ScriptNames.tableName(table));
            }
        }
        for (RelationshipEdge edge : analysis.relationships()) {
            if (edge.source() == EdgeSource.BRIDGE) {
                continue;
            }
            String key = plan.rename(edge.toTable(), edge.toField())
                    .orElseGet(() -> ScriptNames.keyName(edge.toField(), edge.toTable()));
            plan.put(edge.toTable(), edge.toField(), key);
            plan.put(edge.fromTable(), edge.fromField(), key);
            if (edge.cardinality() != Cardinality.MANY_TO_MANY) {
                analysis.table(edge.toTable())
                        .ifPresent(parent -> plan.keyOwners.putIfAbsent(key, ScriptNames.tableName(parent)));
            }
        }
        plan.dateKeys.addAll(calendarDateFields(analysis));
        return plan;
    }

    /**
     * Date fields a calendar is keyed on: the first date field of every calendar table, or,
     * when there is none, every date field of the fact tables.
     */
    public static List<String> calendarDateFields(AnalysisResult analysis) {
        List<TableAnalysis> calendars = analysis.tablesOf(TableClassification.CALENDAR);
        Set<String> fields = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (!calendars.isEmpty()) {
            for (TableAnalysis calendar : calendars) {
                calendar.dateFields().stream().findFirst().map(FieldProfile::name).ifPresent(fields::add);
            }
        } else {
            for (TableAnalysis fact : analysis.tablesOf(TableClassification.FACT)) {
                fact.dateFields().forEach(f -> fields.add(f.name()));
            }
        }
        return List.copyOf(fields);
    }

    public Optional<String> rename(String table, String field) {
        return Optional.ofNullable(renames.get(fieldKey(table, field)));
    }

    /** Script table that owns the key, for {@code // FK -> DIM_X} comments. */
    public Optional<String> owner(String keyName) {
        return Optional.ofNullable(keyOwners.get(keyName));
    }

    /** All names that must stay unqualified: association keys followed by calendar date keys. */
    public List<String> unqualifiedNames() {
        Set<String> names = new TreeSet<>(renames.values());
        names.addAll(dateKeys);
        return List.copyOf(names);
    }

    private void put(String table, String field, String key) {
        renames.putIfAbsent(fieldKey(table, field), key);
    }

    private static String fieldKey(String table, String field) {
        return (table + "." + field).toLowerCase(Locale.ROOT);
    }
}
