package com.qmb.core.script;

import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.StageId;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Stage A: script header, number and date formats, the {@code QUALIFY *} directive with its
 * key exemptions, and the path and locale variables.
 */
@Component
public class ConfigurationFragmentBuilder implements ScriptFragmentBuilder {

    static final String QUALIFY_DIRECTIVE = "QUALIFY *;";

    @Override
    public StageId stage() {
        return StageId.A;
    }

    @Override
    public ScriptFragment build(BuildContext context) {
        BuildConfig config = context.config();
        String generated = DateTimeFormatter.ISO_LOCAL_DATE.format(context.now().atZone(ZoneOffset.UTC));
        List<String> unqualified = context.keys().unqualifiedNames();

        StringBuilder sb = new StringBuilder();
        sb.append("//=============================================================\n");
        sb.append("// Project: ").append(context.projectName()).append('\n');
        sb.append("// Model type: ").append(context.modelType().displayName()).append('\n');
        sb.append("// Generated: ").append(generated).append('\n');
        sb.append("//=============================================================\n\n");
        sb.append(ScriptNames.sectionHeader("STAGE A: " + StageId.A.title().toUpperCase())).append('\n');
        sb.append("SET ThousandSep=',';\n");
        sb.append("SET DecimalSep='.';\n");
        sb.append("SET DateFormat='YYYY-MM-DD';\n");
        sb.append("SET TimestampFormat='YYYY-MM-DD hh:mm:ss';\n\n");
        sb.append("// Prefix every field with its table name\n");
        sb.append(QUALIFY_DIRECTIVE).append('\n');
        if (!unqualified.isEmpty()) {
            sb.append("// Association keys\n");
            sb.append("UNQUALIFY ").append(String.join(", ", unqualified.stream().map(ScriptNames::field).toList()))
                    .append(";\n");
        }
        sb.append('\n');
        sb.append("SET vPathQVD = '").append(config.qvdPath()).append("';\n");
        sb.append("SET vPathOutput = '").append(config.outputPath()).append("';\n");
        sb.append("SET vPathDB = '").append(config.dbPath()).append("';\n");
        sb.append("SET vCalendarLanguage = '").append(config.calendarLanguage().name()).append("';\n");
        sb.append("LET vReloadTime = Now();");
        return new ScriptFragment(StageId.A, sb.toString(), List.of());
    }
}
