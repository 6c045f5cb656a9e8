package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.TableAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Consistency checks run over the approved fragments before final assembly.
 */
public final class ScriptChecks {

    public enum IssueType {
        UNREFERENCED_TABLE,
        DUPLICATE_FIELD,
        UNBALANCED_BRACKETS,
        LOAD_STAR
    }

    public record Issue(IssueType type, String message) {}

    private static final Pattern LOAD_STAR = Pattern.compile("\\bLOAD\\s+(DISTINCT\\s+)?\\*", Pattern.CASE_INSENSITIVE);

    private ScriptChecks() {} // utility class

    public static List<Issue> check(AnalysisResult analysis, List<StageArtifact> approved, KeyPlan keys) {
        List<Issue> issues = new ArrayList<>();
        Set<String> loaded = new LinkedHashSet<>();
        approved.forEach(a -> loaded.addAll(a.tables()));

        for (TableAnalysis table : analysis.tables()) {
            String scriptName = ScriptNames.tableName(table);
            if (!loaded.contains(scriptName)) {
                issues.add(new Issue(IssueType.UNREFERENCED_TABLE,
                        "Table " + table.name() + " (" + scriptName + ") is not loaded by any approved stage"));
            }
        }

        Map<String, List<String>> owners = new LinkedHashMap<>();
        for (TableAnalysis table : analysis.tables()) {
            String scriptName = ScriptNames.tableName(table);
            if (!loaded.contains(scriptName)) {
                continue;
            }
            for (FieldProfile field : table.fields()) {
                if (keys.rename(table.name(), field.name()).isEmpty()) {
                    owners.computeIfAbsent(field.name().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(scriptName);
                }
            }
        }
        owners.forEach((field, tables) -> {
            if (tables.size() > 1) {
                issues.add(new Issue(IssueType.DUPLICATE_FIELD,
                        "Field " + field + " appears in " + String.join(", ", tables) + " (kept apart by QUALIFY)"));
            }
        });

        String script = ScriptAssembler.assemble(approved);
        checkBalance(script, issues);
        if (LOAD_STAR.matcher(script).find()) {
            issues.add(new Issue(IssueType.LOAD_STAR, "LOAD * found; list fields explicitly"));
        }
        return issues;
    }

    /**
     * Square brackets quote identifiers and never nest; inside them {@code ]]} is an escaped
     * {@code ]} and parentheses are part of the name. Parentheses are counted across lines.
     */
    private static void checkBalance(String script, List<Issue> issues) {
        boolean squareBroken = false;
        int parenDepth = 0;
        boolean parenNegative = false;
        for (String line : script.split("\n")) {
            if (line.trim().startsWith("//")) {
                continue;
            }
            boolean quoted = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quoted) {
                    if (c == ']') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == ']') {
                            i++;
                        } else {
                            quoted = false;
                        }
                    }
                } else if (c == '[') {
                    quoted = true;
                } else if (c == ']') {
                    squareBroken = true;
                } else if (c == '(') {
                    parenDepth++;
                } else if (c == ')') {
                    parenDepth--;
                    parenNegative |= parenDepth < 0;
                }
            }
            squareBroken |= quoted;
        }
        if (squareBroken) {
            issues.add(new Issue(IssueType.UNBALANCED_BRACKETS, "Unbalanced '[]' in approved script"));
        }
        if (parenDepth != 0 || parenNegative) {
            issues.add(new Issue(IssueType.UNBALANCED_BRACKETS, "Unbalanced '()' in approved script"));
        }
    }
}
