package com.qmb.core.scope;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of {@link ScopeValidator#validate(String)}.
 *
 * @param intent  classified intent, {@code null} when blocked by a pattern
 * @param reason  {@code qlik_explicit}, {@code keywords}, {@code blocked_pattern} or {@code no_keywords}
 * @param message explanation for the caller, including what the builder can do when blocked
 */
public record ScopeDecision(
        @JsonProperty("allowed") boolean allowed,
        @JsonProperty("intent") String intent,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("matched_keywords") List<String> matchedKeywords,
        @JsonProperty("reason") String reason,
        @JsonProperty("message") String message
) {
    public ScopeDecision {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }
}
