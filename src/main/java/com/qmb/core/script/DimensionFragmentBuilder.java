package com.qmb.core.script;

import com.qmb.core.model.StageId;
import com.qmb.core.model.TableAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage B: one load block per dimension, lookup and calendar table.
 */
@Component
public class DimensionFragmentBuilder implements ScriptFragmentBuilder {

    @Override
    public StageId stage() {
        return StageId.B;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        KeyPlan keys = context.keys();
        List<String> tables = new ArrayList<>();
        StringBuilder sb = new StringBuilder(ScriptNames.sectionHeader("STAGE B: DIMENSIONS"));

        for (TableAnalysis table : context.analysis().tables()) {
            if (!table.classification().isDimensionFamily()) {
                continue;
            }
            sb.append("\n\n").append(TableLoads.describe(table)).append('\n');
            sb.append(TableLoads.sourceLoad(table, keys, context.config().useAutonumber()).render());
            tables.add(ScriptNames.tableName(table));
        }
        if (tables.isEmpty()) {
            sb.append("\n// No dimension, lookup or calendar tables in the analysis");
        }
        return new ScriptFragment(StageId.B, sb.toString(), tables);
    }
}
