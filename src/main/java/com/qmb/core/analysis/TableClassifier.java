package com.qmb.core.analysis;

import com.qmb.core.model.TableClassification;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs every scoring rule against a table and picks the winner. Confidence is the
 * winner's share of the summed scores.
 */
public class TableClassifier {

    /** Evaluation order; on equal scores the earlier rule wins. */
    private static final List<TableClassification> RULE_ORDER = List.of(
            TableClassification.CALENDAR,
            TableClassification.BRIDGE,
            TableClassification.FACT,
            TableClassification.DIMENSION,
            TableClassification.LOOKUP);

    public record Verdict(
            TableClassification classification,
            double confidence,
            Map<TableClassification, Double> scores,
            List<String> reasoning
    ) {}

    private final ClassificationThresholds thresholds;

    public TableClassifier(ClassificationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param sampled false when the table has no statistics; the verdict then carries zero confidence
     */
    public Verdict classify(TableMetrics m, boolean sampled) {
        Map<TableClassification, Double> scores = new EnumMap<>(TableClassification.class);
        scores.put(TableClassification.CALENDAR, TableScoring.calendarScore(m, thresholds));
        scores.put(TableClassification.BRIDGE, TableScoring.bridgeScore(m));
        double fact = TableScoring.factScore(m, thresholds);
        scores.put(TableClassification.FACT,
                Math.min(1.0, fact + TableScoring.nameBonus(m.tableName(), TableClassification.FACT, fact, thresholds)));
        double dimension = TableScoring.dimensionScore(m, thresholds);
        scores.put(TableClassification.DIMENSION, Math.min(1.0, dimension
                + TableScoring.nameBonus(m.tableName(), TableClassification.DIMENSION, dimension, thresholds)));
        scores.put(TableClassification.LOOKUP, TableScoring.lookupScore(thresholds));

        TableClassification winner = TableClassification.LOOKUP;
        double best = -1.0;
        double total = 0.0;
        for (TableClassification candidate : RULE_ORDER) {
            double score = scores.get(candidate);
            total += score;
            if (score > best) {
                best = score;
                winner = candidate;
            }
        }

        double confidence = total > 0 ? best / total : 0.0;
        if (winner == TableClassification.LOOKUP) {
            confidence = Math.min(confidence, thresholds.lookupFallbackConfidence());
        }
        if (!sampled) {
            confidence = 0.0;
        }

        Map<TableClassification, Double> rounded = new EnumMap<>(TableClassification.class);
        scores.forEach((k, v) -> rounded.put(k, round(v)));
        return new Verdict(winner, round(confidence), rounded, reasoning(m, winner, sampled));
    }

    private List<String> reasoning(TableMetrics m, TableClassification winner, boolean sampled) {
        List<String> reasons = new ArrayList<>();
        if (!sampled) {
            reasons.add("no sampled statistics; classification is structural only");
        }
        switch (winner) {
            case CALENDAR -> {
                reasons.add(String.format(Locale.ROOT, "date-field ratio %.2f", m.dateFieldRatio()));
                if (m.calendarParts() >= 3) {
                    reasons.add(m.calendarParts() + " calendar part fields");
                }
                reasons.add(m.rowCount() + " rows");
            }
            case BRIDGE -> reasons.add("exactly two foreign keys and no independent attributes");
            case FACT -> {
                reasons.add(String.format(Locale.ROOT, "relative size %.2f of the largest table", m.relativeSize()));
                reasons.add(m.foreignKeyCount() + " foreign key(s)");
            }
            case DIMENSION -> {
                reasons.add(String.format(Locale.ROOT, "unique-key ratio %.2f", m.uniqueKeyRatio()));
                reasons.add(m.foreignKeyCount() + " foreign key(s)");
            }
            case LOOKUP -> reasons.add("no calendar, bridge, fact or dimension rule applied");
        }
        return reasons;
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
