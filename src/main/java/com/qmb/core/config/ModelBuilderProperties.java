package com.qmb.core.config;

import com.qmb.core.analysis.ClassificationThresholds;
import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.CalendarLanguage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Model builder configuration bound from {@code qmb.*}.
 * <p>
 * Example:
 * <pre>
 * qmb:
 *   defaults:
 *     qvd-path: lib://QVD/
 *     calendar-language: HE
 *   classification:
 *     dimension-unique-ratio: 0.85
 *   sessions:
 *     max-known: 20
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "qmb")
public class ModelBuilderProperties {

    private Defaults defaults = new Defaults();
    private Classification classification = new Classification();
    private Sessions sessions = new Sessions();

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Classification getClassification() {
        return classification;
    }

    public void setClassification(Classification classification) {
        this.classification = classification;
    }

    public Sessions getSessions() {
        return sessions;
    }

    public void setSessions(Sessions sessions) {
        this.sessions = sessions;
    }

    /** Seed values for every new session's {@link BuildConfig}. */
    public static class Defaults {
        private String qvdPath = "lib://QVD/";
        private String outputPath = "lib://QVD/Final/";
        private String dbPath = "lib://DB/";
        private CalendarLanguage calendarLanguage = CalendarLanguage.EN;
        private boolean useAutonumber = true;

        public String getQvdPath() { return qvdPath; }
        public void setQvdPath(String qvdPath) { this.qvdPath = qvdPath; }
        public String getOutputPath() { return outputPath; }
        public void setOutputPath(String outputPath) { this.outputPath = outputPath; }
        public String getDbPath() { return dbPath; }
        public void setDbPath(String dbPath) { this.dbPath = dbPath; }
        public CalendarLanguage getCalendarLanguage() { return calendarLanguage; }
        public void setCalendarLanguage(CalendarLanguage calendarLanguage) { this.calendarLanguage = calendarLanguage; }
        public boolean isUseAutonumber() { return useAutonumber; }
        public void setUseAutonumber(boolean useAutonumber) { this.useAutonumber = useAutonumber; }

        public BuildConfig toBuildConfig() {
            return new BuildConfig(qvdPath, outputPath, dbPath, calendarLanguage, useAutonumber);
        }
    }

    /** Tunable thresholds of the table classifier and model-type recommender. */
    public static class Classification {
        private double primaryKeyUniqueness = 0.95;
        private double calendarDateRatio = 0.5;
        private long calendarMaxRows = 10_000;
        private double dimensionUniqueRatio = 0.9;
        private int dimensionMaxForeignKeys = 1;
        private double factRelativeSize = 0.5;
        private int factMinForeignKeys = 1;
        private double lookupBaseline = 0.25;
        private double lookupFallbackConfidence = 0.4;
        private double nameBonus = 0.1;
        private double oneToOneUniqueness = 0.99;
        private double confidenceFloor = 0.4;
        private double lowConfidenceWarning = 0.5;

        public double getPrimaryKeyUniqueness() { return primaryKeyUniqueness; }
        public void setPrimaryKeyUniqueness(double v) { this.primaryKeyUniqueness = v; }
        public double getCalendarDateRatio() { return calendarDateRatio; }
        public void setCalendarDateRatio(double v) { this.calendarDateRatio = v; }
        public long getCalendarMaxRows() { return calendarMaxRows; }
        public void setCalendarMaxRows(long v) { this.calendarMaxRows = v; }
        public double getDimensionUniqueRatio() { return dimensionUniqueRatio; }
        public void setDimensionUniqueRatio(double v) { this.dimensionUniqueRatio = v; }
        public int getDimensionMaxForeignKeys() { return dimensionMaxForeignKeys; }
        public void setDimensionMaxForeignKeys(int v) { this.dimensionMaxForeignKeys = v; }
        public double getFactRelativeSize() { return factRelativeSize; }
        public void setFactRelativeSize(double v) { this.factRelativeSize = v; }
        public int getFactMinForeignKeys() { return factMinForeignKeys; }
        public void setFactMinForeignKeys(int v) { this.factMinForeignKeys = v; }
        public double getLookupBaseline() { return lookupBaseline; }
        public void setLookupBaseline(double v) { this.lookupBaseline = v; }
        public double getLookupFallbackConfidence() { return lookupFallbackConfidence; }
        public void setLookupFallbackConfidence(double v) { this.lookupFallbackConfidence = v; }
        public double getNameBonus() { return nameBonus; }
        public void setNameBonus(double v) { this.nameBonus = v; }
        public double getOneToOneUniqueness() { return oneToOneUniqueness; }
        public void setOneToOneUniqueness(double v) { this.oneToOneUniqueness = v; }
        public double getConfidenceFloor() { return confidenceFloor; }
        public void setConfidenceFloor(double v) { this.confidenceFloor = v; }
        public double getLowConfidenceWarning() { return lowConfidenceWarning; }
        public void setLowConfidenceWarning(double v) { this.lowConfidenceWarning = v; }

        public ClassificationThresholds toThresholds() {
            return new ClassificationThresholds(primaryKeyUniqueness, calendarDateRatio, calendarMaxRows,
                    dimensionUniqueRatio, dimensionMaxForeignKeys, factRelativeSize, factMinForeignKeys,
                    lookupBaseline, lookupFallbackConfidence, nameBonus, oneToOneUniqueness,
                    confidenceFloor, lowConfidenceWarning);
        }
    }

    public static class Sessions {
        /** Upper bound on remembered session summaries; the oldest are forgotten first. */
        private int maxKnown = 50;
        /** How long after its last update a session is still offered by find. */
        private int resumeWindowHours = 24;

        public int getMaxKnown() { return maxKnown; }
        public void setMaxKnown(int maxKnown) { this.maxKnown = maxKnown; }
        public int getResumeWindowHours() { return resumeWindowHours; }
        public void setResumeWindowHours(int resumeWindowHours) { this.resumeWindowHours = resumeWindowHours; }
    }
}
