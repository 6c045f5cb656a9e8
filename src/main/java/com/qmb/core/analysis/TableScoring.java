package com.qmb.core.analysis;

import com.qmb.core.model.TableClassification;

import java.util.regex.Pattern;

/**
 * Pure scoring functions, one per classification rule. Each returns a score in {@code [0, 1]};
 * zero means the rule does not apply.
 */
public final class TableScoring {

    private static final Pattern FACT_NAMES = Pattern.compile(
            "fact|sales|orders?|transactions?|events?|logs?|invoices?|payments?|shipments?|lines",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DIMENSION_NAMES = Pattern.compile(
            "dim|customers?|products?|employees?|stores?|regions?|categor(y|ies)|suppliers?|vendors?"
                    + "|accounts?|locations?|geograph(y|ies)",
            Pattern.CASE_INSENSITIVE);

    private TableScoring() {} // utility class

    public static double calendarScore(TableMetrics m, ClassificationThresholds t) {
        if (m.rowCount() > t.calendarMaxRows()) {
            return 0.0;
        }
        double score = m.dateFieldRatio() >= t.calendarDateRatio() ? m.dateFieldRatio() : 0.0;
        if (m.calendarParts() >= 3) {
            score = Math.max(score, 0.9);
        }
        return score;
    }

    /**
     * High unique-key ratio, penalised by foreign keys, by size relative to the largest table
     * and by the share of date fields.
     */
    public static double dimensionScore(TableMetrics m, ClassificationThresholds t) {
        if (m.uniqueKeyRatio() < t.dimensionUniqueRatio()) {
            return 0.0;
        }
        double fkPenalty = Math.min(1.0, m.foreignKeyCount() / (double) (t.dimensionMaxForeignKeys() + 1));
        return m.uniqueKeyRatio() * (1.0 - fkPenalty) * (1.0 - 0.5 * m.relativeSize()) * (1.0 - m.dateFieldRatio());
    }

    public static double factScore(TableMetrics m, ClassificationThresholds t) {
        if (m.relativeSize() < t.factRelativeSize() || m.foreignKeyCount() < t.factMinForeignKeys()) {
            return 0.0;
        }
        return 0.5 * m.relativeSize() + 0.5 * Math.min(1.0, m.foreignKeyCount() / 2.0);
    }

    public static double bridgeScore(TableMetrics m) {
        return m.foreignKeyCount() == 2 && m.independentAttributes() == 0 ? 1.0 : 0.0;
    }

    public static double lookupScore(ClassificationThresholds t) {
        return t.lookupBaseline();
    }

    /**
     * Bonus for a table name typical of the classification. Only applies to a rule that
     * already scored.
     */
    public static double nameBonus(String tableName, TableClassification classification, double baseScore,
                                   ClassificationThresholds t) {
        if (baseScore <= 0.0 || tableName == null) {
            return 0.0;
        }
        Pattern pattern = switch (classification) {
            case FACT -> FACT_NAMES;
            case DIMENSION -> DIMENSION_NAMES;
            default -> null;
        };
        return pattern != null && pattern.matcher(tableName).find() ? t.nameBonus() : 0.0;
    }
}
