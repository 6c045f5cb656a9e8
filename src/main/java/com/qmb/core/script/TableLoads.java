package com.qmb.core.script;

import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.TableAnalysis;

import java.util.Locale;
import java.util.Optional;

/**
 * Load block for a source table with its key fields renamed according to the {@link KeyPlan}.
 */
final class TableLoads {

    private TableLoads() {}

    static String describe(TableAnalysis table) {
        return String.format(Locale.ROOT, "// %s: %s (confidence %.2f)",
                table.name(), table.classification().wireName(), table.confidence());
    }

    static LoadStatement sourceLoad(TableAnalysis table, KeyPlan keys, boolean autonumber) {
        String scriptName = ScriptNames.tableName(table);
        LoadStatement load = LoadStatement.into(scriptName);
        for (FieldProfile field : table.fields()) {
            Optional<String> key = keys.rename(table.name(), field.name());
            if (key.isEmpty()) {
                load.column(ScriptNames.field(field.name()));
                continue;
            }
            String comment = null;
            if (field.name().equalsIgnoreCase(table.primaryKey()) && table.classification().isDimensionFamily()) {
                comment = "PK";
            } else {
                Optional<String> owner = keys.owner(key.get());
                if (owner.isPresent() && !owner.get().equals(scriptName)) {
                    comment = "FK -> " + owner.get();
                }
            }
            load.column(ScriptNames.keyExpression(field.name(), key.get(), autonumber), comment);
        }
        return load.from(ScriptNames.qvdSource(table.sourceName()));
    }
}
