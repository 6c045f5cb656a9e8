package com.qmb.core.analysis;

/**
 * Numeric thresholds of the table classifier and model-type recommender.
 *
 * @param primaryKeyUniqueness     minimum cardinality/rows for a key-like field to be a primary key
 * @param calendarDateRatio        minimum share of date fields for a calendar table
 * @param calendarMaxRows          largest row count still considered a calendar
 * @param dimensionUniqueRatio     minimum unique-key ratio for a dimension
 * @param dimensionMaxForeignKeys  foreign keys a dimension tolerates before its score reaches zero
 * @param factRelativeSize         minimum rows relative to the largest table for a fact
 * @param factMinForeignKeys       minimum foreign keys for a fact
 * @param lookupBaseline           constant score of the lookup fallback rule
 * @param lookupFallbackConfidence confidence cap when lookup wins
 * @param nameBonus                score added for a matching fact/dimension table name
 * @param oneToOneUniqueness       uniqueness both sides need for a one-to-one edge
 * @param confidenceFloor          mean confidence under which the model is {@code normalized}
 * @param lowConfidenceWarning     per-table confidence under which a warning is raised
 */
public record ClassificationThresholds(
        double primaryKeyUniqueness,
        double calendarDateRatio,
        long calendarMaxRows,
        double dimensionUniqueRatio,
        int dimensionMaxForeignKeys,
        double factRelativeSize,
        int factMinForeignKeys,
        double lookupBaseline,
        double lookupFallbackConfidence,
        double nameBonus,
        double oneToOneUniqueness,
        double confidenceFloor,
        double lowConfidenceWarning
) {
    public static ClassificationThresholds defaults() {
        return new ClassificationThresholds(0.95, 0.5, 10_000, 0.9, 1, 0.5, 1,
                0.25, 0.4, 0.1, 0.99, 0.4, 0.5);
    }
}
