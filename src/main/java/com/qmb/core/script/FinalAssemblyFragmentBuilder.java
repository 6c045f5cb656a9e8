package com.qmb.core.script;

import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage F: consistency report over the approved fragments followed by a {@code STORE} for
 * every table they load. The fragment does not repeat the approved text; the pipeline
 * assembles it on read.
 */
@Component
public class FinalAssemblyFragmentBuilder implements ScriptFragmentBuilder {

    @Override
    public StageId stage() {
        return StageId.F;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        List<StageArtifact> approved = context.approvedStages().stream()
                .filter(a -> a.stageId() != StageId.F)
                .toList();
        List<ScriptChecks.Issue> issues = ScriptChecks.check(context.analysis(), approved, context.keys());

        StringBuilder sb = new StringBuilder(ScriptNames.sectionHeader("STAGE F: FINAL ASSEMBLY"));
        sb.append("\n// Assembled from stages ");
        sb.append(approved.isEmpty() ? "(none approved)"
                : String.join(", ", approved.stream().map(a -> a.stageId().name()).toList()));
        sb.append("\n// Consistency checks: ");
        if (issues.isEmpty()) {
            sb.append("no issues");
        } else {
            sb.append(issues.size()).append(" issue(s)");
            for (ScriptChecks.Issue issue : issues) {
                sb.append("\n//   [").append(issue.type()).append("] ").append(issue.message());
            }
        }

        Set<String> loaded = new LinkedHashSet<>();
        approved.forEach(a -> loaded.addAll(a.tables()));
        sb.append("\n\n// Store final tables\n");
        if (loaded.isEmpty()) {
            sb.append("// Nothing to store");
        } else {
            for (String table : loaded) {
                sb.append("STORE [").append(table).append("] INTO [$(vPathOutput)").append(table).append(".qvd] (qvd);\n");
            }
            sb.setLength(sb.length() - 1);
        }
        return new ScriptFragment(StageId.F, sb.toString(), List.of());
    }
}
