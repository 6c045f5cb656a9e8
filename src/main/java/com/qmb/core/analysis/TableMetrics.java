package com.qmb.core.analysis;

/**
 * Inputs of the classification scoring functions for one table.
 *
 * @param relativeSize          row count divided by the largest row count in the input
 * @param uniqueKeyRatio        distinct count of the most selective field divided by row count
 * @param dateFieldRatio        date fields divided by all fields
 * @param foreignKeyCount       fields named after another table's primary key
 * @param independentAttributes fields that are neither key-like nor foreign keys
 * @param calendarParts         fields named year, month, day, quarter or week
 */
public record TableMetrics(
        String tableName,
        long rowCount,
        double relativeSize,
        double uniqueKeyRatio,
        double dateFieldRatio,
        int foreignKeyCount,
        int independentAttributes,
        int calendarParts
) {}
