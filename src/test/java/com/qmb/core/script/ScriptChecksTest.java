package com.qmb.core.script;

import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.ModelRecommendation;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ScriptChecks}.
 */
class ScriptChecksTest {

    private final AnalysisResult empty = new AnalysisResult(List.of(), List.of(),
            new ModelRecommendation(ModelType.NORMALIZED, 0.5, "none", List.of()), List.of(), List.of());

    private List<ScriptChecks.Issue> check(String script) {
        StageArtifact artifact = StageArtifact.built(StageId.B, script, List.of(), Instant.now()).approve(Instant.now());
        return ScriptChecks.check(empty, List.of(artifact), KeyPlan.of(empty));
    }

    @Test
    @DisplayName("accepts balanced explicit loads")
    void acceptsCleanScript() {
        assertTrue(check("[T]:\nLOAD\n    A,\n    B\nFROM [$(vPathQVD)t.qvd] (qvd);").isEmpty());
    }

    @Test
    @DisplayName("flags LOAD * with or without DISTINCT")
    void flagsLoadStar() {
        assertEquals(ScriptChecks.IssueType.LOAD_STAR, check("T:\nLOAD *\nRESIDENT [X];").get(0).type());
        assertEquals(ScriptChecks.IssueType.LOAD_STAR, check("T:\nLOAD DISTINCT *\nRESIDENT [X];").get(0).type());
    }

    @Test
    @DisplayName("flags unbalanced brackets outside comments")
    void flagsUnbalancedBrackets() {
        List<ScriptChecks.Issue> issues = check("T:\nLOAD\n    Year(D AS Y\nRESIDENT [X];");

        assertEquals(1, issues.size());
        assertEquals(ScriptChecks.IssueType.UNBALANCED_BRACKETS, issues.get(0).type());
        assertTrue(check("// ignore ( in comments\nT:\nLOAD\n    A\nRESIDENT [X];").isEmpty());
    }

    @Test
    @DisplayName("escaped ] and parentheses inside bracketed names are balanced")
    void bracketedNamesAreOpaque() {
        String field = ScriptNames.field("Net]Amount (USD");

        assertEquals("[Net]]Amount (USD]", field);
        assertTrue(check("T:\nLOAD\n    " + field + ",\n    [Rate]]]\nRESIDENT [X];").isEmpty());
    }

    @Test
    @DisplayName("flags a bracketed name left open or a stray closing bracket")
    void flagsBrokenSquareBrackets() {
        List<ScriptChecks.Issue> open = check("T:\nLOAD\n    [Amount\nRESIDENT [X];");
        List<ScriptChecks.Issue> stray = check("T:\nLOAD\n    Amount]\nRESIDENT [X];");

        assertEquals(List.of("Unbalanced '[]' in approved script"), open.stream().map(ScriptChecks.Issue::message).toList());
        assertEquals(List.of("Unbalanced '[]' in approved script"), stray.stream().map(ScriptChecks.Issue::message).toList());
    }
}
