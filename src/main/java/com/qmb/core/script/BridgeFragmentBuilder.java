package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.EdgeSource;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.StageId;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stage E: association tables. Bridge tables are loaded from source, declared many-to-many
 * relationships get a distinct key table, and {@code link_table} models with several fact
 * tables get a {@code LINK_Facts} table over the keys the facts share.
 */
@Component
public class BridgeFragmentBuilder implements ScriptFragmentBuilder {

    static final String FACT_LINK_TABLE = "LINK_Facts";

    @Override
    public StageId stage() {
        return StageId.E;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        AnalysisResult analysis = context.analysis();
        KeyPlan keys = context.keys();
        List<String> tables = new ArrayList<>();
        StringBuilder sb = new StringBuilder(ScriptNames.sectionHeader("STAGE E: BRIDGE TABLES"));

        for (TableAnalysis bridge : analysis.tablesOf(TableClassification.BRIDGE)) {
            sb.append("\n\n").append(TableLoads.describe(bridge)).append('\n');
            analysis.manyToManyEdges().stream()
                    .filter(e -> bridge.name().equalsIgnoreCase(e.via()))
                    .findFirst()
                    .ifPresent(e -> sb.append("// Resolves ").append(e.fromTable()).append(" <-> ")
                            .append(e.toTable()).append(" (many-to-many)\n"));
            sb.append(TableLoads.sourceLoad(bridge, keys, context.config().useAutonumber()).render());
            tables.add(ScriptNames.tableName(bridge));
        }

        for (RelationshipEdge edge : analysis.manyToManyEdges()) {
            if (edge.source() == EdgeSource.BRIDGE) {
                continue;
            }
            Optional<TableAnalysis> left = analysis.table(edge.fromTable());
            Optional<TableAnalysis> right = analysis.table(edge.toTable());
            Optional<String> key = keys.rename(edge.fromTable(), edge.fromField());
            if (left.isEmpty() || right.isEmpty() || key.isEmpty()) {
                continue;
            }
            String linkName = "LINK_" + ScriptNames.sanitize(left.get().name()) + "_" + ScriptNames.sanitize(right.get().name());
            sb.append("\n\n// ").append(edge.describe()).append('\n');
            sb.append(LoadStatement.into(linkName).distinct()
                    .column(key.get())
                    .resident(ScriptNames.tableName(left.get()))
                    .render()).append('\n');
            sb.append(LoadStatement.into(linkName).prefix("CONCATENATE ([" + linkName + "])").distinct()
                    .column(key.get())
                    .resident(ScriptNames.tableName(right.get()))
                    .render());
            tables.add(linkName);
        }

        if (context.modelType() == ModelType.LINK_TABLE) {
            factLinkTable(analysis, keys, context.config().useAutonumber()).ifPresent(block -> {
                sb.append("\n\n").append(block);
                tables.add(FACT_LINK_TABLE);
            });
        }

        if (tables.isEmpty()) {
            sb.append("\n// No many-to-many relationships; no association tables required");
        }
        return new ScriptFragment(StageId.E, sb.toString(), tables);
    }

    /**
     * Link table over the keys shared by two or more fact tables, with a composite
     * {@code LinkKey}. Facts lacking one of the keys contribute {@code Null()} for it.
     */
    private static Optional<String> factLinkTable(AnalysisResult analysis, KeyPlan keys, boolean autonumber) {
        List<TableAnalysis> facts = analysis.tablesOf(TableClassification.FACT);
        if (facts.size() < 2) {
            return Optional.empty();
        }
        Map<TableAnalysis, Set<String>> keysByFact = new LinkedHashMap<>();
        Map<String, Integer> usage = new LinkedHashMap<>();
        for (TableAnalysis fact : facts) {
            Set<String> factKeys = new LinkedHashSet<>();
            for (FieldProfile field : fact.fields()) {
                keys.rename(fact.name(), field.name()).ifPresent(factKeys::add);
            }
            keysByFact.put(fact, factKeys);
            factKeys.forEach(k -> usage.merge(k, 1, Integer::sum));
        }
        List<String> shared = usage.entrySet().stream().filter(e -> e.getValue() > 1).map(Map.Entry::getKey).toList();
        if (shared.isEmpty()) {
            return Optional.empty();
        }

        String composite = String.join(" & '|' & ", shared);
        String linkKey = autonumber ? "AUTONUMBER(" + composite + ") AS LinkKey" : composite + " AS LinkKey";
        StringBuilder sb = new StringBuilder("// Fact link table over shared keys: ").append(String.join(", ", shared));
        boolean first = true;
        for (Map.Entry<TableAnalysis, Set<String>> entry : keysByFact.entrySet()) {
            LoadStatement load = LoadStatement.into(FACT_LINK_TABLE).distinct();
            if (!first) {
                load.prefix("CONCATENATE ([" + FACT_LINK_TABLE + "])");
            }
            for (String key : shared) {
                load.column(entry.getValue().contains(key) ? key : "Null() AS " + key);
            }
            load.column(linkKey);
            sb.append('\n').append(load.resident(ScriptNames.tableName(entry.getKey())).render());
            first = false;
        }
        return Optional.of(sb.toString());
    }
}
