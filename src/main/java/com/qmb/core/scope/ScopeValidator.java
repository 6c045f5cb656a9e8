package com.qmb.core.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a natural-language request belongs to the model builder's domain.
 * <p>
 * A fixed rule set applied in order: an explicit mention of Qlik is always allowed, known
 * off-topic patterns are blocked, and otherwise the request needs at least one domain
 * keyword. Keeps no state.
 */
public final class ScopeValidator {

    static final String CAPABILITIES = "I can only help with building Qlik data models: analysing source tables, "
            + "choosing a model type, generating and reviewing load script stages, calendars and link tables.";

    private record IntentRule(String intent, Pattern pattern) {}

    private static final List<String> DOMAIN_KEYWORDS = List.of(
            "model", "script", "table", "field", "dimension", "fact",
            "qvd", "load", "calendar", "qualify", "store",
            "star", "snowflake", "link", "concatenate", "key",
            "relationship", "join", "mapping", "autonumber",
            "schema", "data", "measure", "master", "variable",
            "set", "analysis", "resident", "where", "inner");

    /** Short tokens that only count as whole words; "set" should not match "settle". */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of(
            "key", "set", "star", "link", "join", "data", "where", "inner", "load", "store", "fact");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("write.*email", Pattern.CASE_INSENSITIVE),
            Pattern.compile("send.*message", Pattern.CASE_INSENSITIVE),
            Pattern.compile("translate.*to", Pattern.CASE_INSENSITIVE),
            Pattern.compile("weather", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(python|javascript|java)\\s+code", Pattern.CASE_INSENSITIVE),
            Pattern.compile("cook.*recipe", Pattern.CASE_INSENSITIVE),
            Pattern.compile("tell.*joke", Pattern.CASE_INSENSITIVE),
            Pattern.compile("write.*story", Pattern.CASE_INSENSITIVE),
            Pattern.compile("summari[sz]e.*article", Pattern.CASE_INSENSITIVE),
            Pattern.compile("search.*web", Pattern.CASE_INSENSITIVE),
            Pattern.compile("book.*flight", Pattern.CASE_INSENSITIVE),
            Pattern.compile("order.*food", Pattern.CASE_INSENSITIVE),
            Pattern.compile("play.*music", Pattern.CASE_INSENSITIVE));

    private static final List<IntentRule> INTENT_RULES = List.of(
            new IntentRule("build_model", Pattern.compile("build|create|generate", Pattern.CASE_INSENSITIVE)),
            new IntentRule("add_field", Pattern.compile("(add|new).*field", Pattern.CASE_INSENSITIVE)),
            new IntentRule("remove_field", Pattern.compile("(remove|delete).*field", Pattern.CASE_INSENSITIVE)),
            new IntentRule("add_table", Pattern.compile("(add|new).*table", Pattern.CASE_INSENSITIVE)),
            new IntentRule("modify_stage", Pattern.compile("modify|change|update.*script", Pattern.CASE_INSENSITIVE)),
            new IntentRule("explain", Pattern.compile("explain|what.*is|how.*does", Pattern.CASE_INSENSITIVE)),
            new IntentRule("fix_issue", Pattern.compile("fix|correct|repair", Pattern.CASE_INSENSITIVE)),
            new IntentRule("review_script", Pattern.compile("review|check|validate", Pattern.CASE_INSENSITIVE)),
            new IntentRule("approve_stage", Pattern.compile("approve|accept|confirm", Pattern.CASE_INSENSITIVE)),
            new IntentRule("go_back", Pattern.compile("back|previous|undo", Pattern.CASE_INSENSITIVE)),
            new IntentRule("show_progress", Pattern.compile("progress|status", Pattern.CASE_INSENSITIVE)),
            new IntentRule("configure_calendar", Pattern.compile("calendar|date.*dimension", Pattern.CASE_INSENSITIVE)),
            new IntentRule("change_model_type", Pattern.compile("star|snowflake|model.*type", Pattern.CASE_INSENSITIVE)));

    private ScopeValidator() {} // utility class

    public static ScopeDecision validate(String request) {
        if (request == null || request.isBlank()) {
            return new ScopeDecision(false, null, 0.0, List.of(), "no_keywords", CAPABILITIES);
        }
        String lower = request.toLowerCase(Locale.ROOT);
        if (lower.contains("qlik")) {
            return new ScopeDecision(true, "qlik_explicit", 1.0, List.of("qlik"), "qlik_explicit",
                    "Request mentions Qlik explicitly");
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(request).find()) {
                return new ScopeDecision(false, null, 0.0, List.of(), "blocked_pattern",
                        "Request is outside the model builder's scope. " + CAPABILITIES);
            }
        }

        List<String> matched = matchKeywords(lower);
        if (matched.isEmpty()) {
            return new ScopeDecision(false, null, 0.0, List.of(), "no_keywords",
                    "No data modeling terms found in the request. " + CAPABILITIES);
        }
        double confidence = Math.min(1.0, matched.size() / 3.0);
        String intent = classifyIntent(request);
        return new ScopeDecision(true, intent, confidence, matched, "keywords",
                "Matched " + String.join(", ", matched));
    }

    static List<String> matchKeywords(String lowerText) {
        List<String> matched = new ArrayList<>();
        for (String keyword : DOMAIN_KEYWORDS) {
            boolean found = WORD_BOUNDARY_KEYWORDS.contains(keyword)
                    ? Pattern.compile("\\b" + keyword + "s?\\b").matcher(lowerText).find()
                    : lowerText.contains(keyword);
            if (found) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    private static String classifyIntent(String request) {
        for (IntentRule rule : INTENT_RULES) {
            if (rule.pattern().matcher(request).find()) {
                return rule.intent();
            }
        }
        return "question";
    }
}
