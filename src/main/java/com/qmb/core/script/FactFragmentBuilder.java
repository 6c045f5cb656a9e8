package com.qmb.core.script;

import com.qmb.core.model.StageId;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage C: one load block per fact table. Resolved foreign keys are renamed to the keys
 * established by the dimensions stage.
 */
@Component
public class FactFragmentBuilder implements ScriptFragmentBuilder {

    @Override
    public StageId stage() {
        return StageId.C;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        KeyPlan keys = context.keys();
        List<String> tables = new ArrayList<>();
        StringBuilder sb = new StringBuilder(ScriptNames.sectionHeader("STAGE C: FACTS"));

        for (TableAnalysis table : context.analysis().tablesOf(TableClassification.FACT)) {
            sb.append("\n\n").append(TableLoads.describe(table)).append('\n');
            sb.append(TableLoads.sourceLoad(table, keys, context.config().useAutonumber()).render());
            tables.add(ScriptNames.tableName(table));
        }
        if (tables.isEmpty()) {
            sb.append("\n// No fact tables in the analysis");
        }
        return new ScriptFragment(StageId.C, sb.toString(), tables);
    }
}
