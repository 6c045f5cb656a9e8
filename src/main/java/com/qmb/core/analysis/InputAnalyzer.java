package com.qmb.core.analysis;

import com.qmb.core.config.ModelBuilderProperties;
import com.qmb.core.error.ValidationException;
import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.logging.MdcContext;
import com.qmb.core.metrics.ModelBuilderMetrics;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.AnalysisWarning;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.FieldSpec;
import com.qmb.core.model.FieldStats;
import com.qmb.core.model.ModelRecommendation;
import com.qmb.core.model.RawTableSpec;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.SampledStats;
import com.qmb.core.model.SourceSpec;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import com.qmb.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a structural table spec plus sampled statistics into a classified,
 * relationship-resolved {@link AnalysisResult}.
 * <p>
 * {@link #analyze} is a pure function of its inputs and the configured thresholds;
 * {@link #processInput} stores its result in the active session.
 */
@Service
public class InputAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(InputAnalyzer.class);

    private final SessionStore sessionStore;
    private final EventBus eventBus;
    private final ModelBuilderMetrics metrics;
    private final ClassificationThresholds thresholds;
    private final TableClassifier classifier;
    private final RelationshipResolver resolver;
    private final ModelTypeRecommender recommender;

    public InputAnalyzer(SessionStore sessionStore, ModelBuilderProperties properties,
                         EventBus eventBus, ModelBuilderMetrics metrics) {
        this.sessionStore = sessionStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.thresholds = properties.getClassification().toThresholds();
        this.classifier = new TableClassifier(thresholds);
        this.resolver = new RelationshipResolver(thresholds);
        this.recommender = new ModelTypeRecommender(thresholds);
    }

    /**
     * Analyses the input and replaces the active session's analysis. Stage artifacts built
     * from an earlier analysis are discarded.
     *
     * @throws ValidationException if either argument is absent or the input is malformed
     * @throws com.qmb.core.error.SessionException if no session is active
     */
    public AnalysisResult processInput(SourceSpec spec, List<SampledStats> samples) {
        if (spec == null) {
            throw new ValidationException("Input spec is required");
        }
        if (samples == null) {
            throw new ValidationException("Sampled statistics are required");
        }
        return sessionStore.withActiveSession(session -> {
            MdcContext.setSession(session.getId(), session.getProjectName());
            try {
                long start = System.currentTimeMillis();
                AnalysisResult result = analyze(spec, samples);
                session.replaceState(session.state().withAnalysis(spec, result, Instant.now()));
                metrics.recordAnalysisDuration(System.currentTimeMillis() - start);
                log.info("Analysed {} table(s): {} relationship(s), recommended {} ({} warning(s))",
                        result.tables().size(), result.relationships().size(),
                        result.recommendation().modelType().wireName(), result.warnings().size());
                eventBus.publish(ModelBuilderEvent.of("input.processed", session.getId(), null, Map.of(
                        "tables", result.tables().size(),
                        "recommendedModelType", result.recommendation().modelType().wireName())));
                return result;
            } finally {
                MdcContext.clear();
            }
        });
    }

    public AnalysisResult analyze(SourceSpec spec, List<SampledStats> samples) {
        validateSpec(spec);
        Map<String, SampledStats> statsByTable = indexStats(spec, samples);
        List<AnalysisWarning> warnings = new ArrayList<>();

        // profile fields and pick primary keys
        Map<String, List<FieldProfile>> profiles = new LinkedHashMap<>();
        Map<String, String> primaryKeys = new HashMap<>();
        for (RawTableSpec table : spec.tables()) {
            SampledStats stats = statsByTable.get(key(table.name()));
            if (stats == null) {
                warnings.add(new AnalysisWarning(AnalysisWarning.Type.UNMATCHED_TABLE, table.name(),
                        "No sampled statistics for table " + table.name() + "; classified with zero confidence"));
                log.warn("No sample data for table {}", table.name());
            }
            List<FieldProfile> fields = profileFields(table, stats, warnings);
            profiles.put(key(table.name()), fields);
            primaryKey(table.name(), fields, stats != null).ifPresent(pk -> primaryKeys.put(key(table.name()), pk));
        }

        long maxRows = statsByTable.values().stream().mapToLong(SampledStats::rowCount).max().orElse(0);

        List<TableAnalysis> tables = new ArrayList<>();
        for (RawTableSpec table : spec.tables()) {
            String tableKey = key(table.name());
            SampledStats stats = statsByTable.get(tableKey);
            List<FieldProfile> fields = profiles.get(tableKey);
            String pk = primaryKeys.get(tableKey);
            List<String> foreignKeys = foreignKeys(tableKey, fields, primaryKeys);
            TableMetrics tableMetrics = measure(table.name(), stats, fields, pk, foreignKeys, maxRows);
            TableClassifier.Verdict verdict = classifier.classify(tableMetrics, stats != null);
            tables.add(new TableAnalysis(table.name(), table.sourceName(), tableMetrics.rowCount(), stats != null,
                    fields, pk, foreignKeys, verdict.classification(), verdict.confidence(), verdict.scores(),
                    verdict.reasoning()));
        }

        RelationshipResolver.Resolution resolution = resolver.resolve(tables, spec.relationshipHints());
        ModelRecommendation recommendation = recommender.recommend(tables, resolution.edges());
        warnings.addAll(graphWarnings(tables, resolution));

        return new AnalysisResult(tables, resolution.edges(), recommendation, warnings, resolution.unresolved());
    }

    private void validateSpec(SourceSpec spec) {
        if (spec.tables().isEmpty()) {
            throw new ValidationException("Input spec must declare at least one table");
        }
        Set<String> seen = new HashSet<>();
        for (RawTableSpec table : spec.tables()) {
            if (table.name() == null || table.name().isBlank()) {
                throw new ValidationException("Every table needs a name");
            }
            if (table.sourceName() == null || table.sourceName().isBlank()) {
                throw new ValidationException("Table " + table.name() + " needs a source_name");
            }
            if (table.fields().isEmpty()) {
                throw new ValidationException("Table " + table.name() + " needs at least one field");
            }
            if (table.fields().stream().anyMatch(f -> f.name() == null || f.name().isBlank())) {
                throw new ValidationException("Table " + table.name() + " has a field without a name");
            }
            if (!seen.add(key(table.name()))) {
                throw new ValidationException("Duplicate table name: " + table.name());
            }
        }
    }

    private Map<String, SampledStats> indexStats(SourceSpec spec, List<SampledStats> samples) {
        Set<String> declared = spec.tables().stream().map(t -> key(t.name())).collect(Collectors.toSet());
        Map<String, SampledStats> byTable = new HashMap<>();
        List<String> unknown = new ArrayList<>();
        for (SampledStats stats : samples) {
            if (stats == null || stats.tableName() == null || stats.tableName().isBlank()) {
                throw new ValidationException("Every sampled statistics entry needs a table_name");
            }
            if (stats.rowCount() < 0) {
                throw new ValidationException("Negative row_count for table " + stats.tableName());
            }
            String tableKey = key(stats.tableName());
            if (!declared.contains(tableKey)) {
                unknown.add(stats.tableName());
            } else if (byTable.putIfAbsent(tableKey, stats) != null) {
                throw new ValidationException("Duplicate sampled statistics for table " + stats.tableName());
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Sampled statistics reference table(s) missing from the spec: "
                    + String.join(", ", unknown));
        }
        return byTable;
    }

    private List<FieldProfile> profileFields(RawTableSpec table, SampledStats stats, List<AnalysisWarning> warnings) {
        Map<String, FieldStats> statsByField = new HashMap<>();
        if (stats != null) {
            for (FieldStats fieldStats : stats.fields()) {
                if (fieldStats.name() != null) {
                    statsByField.putIfAbsent(key(fieldStats.name()), fieldStats);
                }
            }
        }
        List<FieldProfile> fields = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        for (FieldSpec field : table.fields()) {
            declared.add(key(field.name()));
            FieldNameValidator.validate(field.name()).ifPresent(problem ->
                    warnings.add(new AnalysisWarning(AnalysisWarning.Type.INVALID_FIELD_NAME, table.name(), problem)));
            fields.add(FieldProfiler.profile(field, statsByField.get(key(field.name())),
                    stats != null ? stats.rowCount() : 0));
        }
        statsByField.values().stream()
                .filter(s -> !declared.contains(key(s.name())))
                .sorted(Comparator.comparing(FieldStats::name))
                .forEach(s -> warnings.add(new AnalysisWarning(AnalysisWarning.Type.MISSING_SAMPLE_FIELD, table.name(),
                        "Sampled field " + s.name() + " is not declared in table " + table.name())));
        return fields;
    }

    /**
     * With statistics: the key-like field with the highest uniqueness at or above the threshold.
     * Without: the key-like field whose stem names the table.
     */
    private Optional<String> primaryKey(String tableName, List<FieldProfile> fields, boolean sampled) {
        if (sampled) {
            return fields.stream()
                    .filter(FieldProfile::keyLike)
                    .filter(f -> f.nullPercent() < 1.0)
                    .filter(f -> f.uniqueness() >= thresholds.primaryKeyUniqueness())
                    .max(Comparator.comparingDouble(FieldProfile::uniqueness)
                            .thenComparing(f -> FieldProfiler.stemMatchesTable(f.name(), tableName)))
                    .map(FieldProfile::name);
        }
        return fields.stream()
                .filter(FieldProfile::keyLike)
                .filter(f -> FieldProfiler.stemMatchesTable(f.name(), tableName))
                .findFirst()
                .map(FieldProfile::name);
    }

    private static List<String> foreignKeys(String tableKey, List<FieldProfile> fields, Map<String, String> primaryKeys) {
        List<String> foreignKeys = new ArrayList<>();
        for (FieldProfile field : fields) {
            boolean referencesOther = primaryKeys.entrySet().stream()
                    .anyMatch(e -> !e.getKey().equals(tableKey) && e.getValue().equalsIgnoreCase(field.name()));
            if (referencesOther) {
                foreignKeys.add(field.name());
            }
        }
        return foreignKeys;
    }

    private static TableMetrics measure(String tableName, SampledStats stats, List<FieldProfile> fields, String pk,
                                        List<String> foreignKeys, long maxRows) {
        long rows = stats != null ? stats.rowCount() : 0;
        double relativeSize = maxRows > 0 ? rows / (double) maxRows : 0.0;
        double uniqueKeyRatio = fields.stream().mapToDouble(FieldProfile::uniqueness).max().orElse(0.0);
        double dateRatio = fields.stream().filter(FieldProfile::dateField).count() / (double) fields.size();
        int independent = (int) fields.stream()
                .filter(f -> !f.keyLike())
                .filter(f -> !f.name().equalsIgnoreCase(pk))
                .filter(f -> foreignKeys.stream().noneMatch(fk -> fk.equalsIgnoreCase(f.name())))
                .count();
        int calendarParts = (int) fields.stream().filter(f -> FieldProfiler.isCalendarPart(f.name())).count();
        return new TableMetrics(tableName, rows, relativeSize, uniqueKeyRatio, dateRatio, foreignKeys.size(),
                independent, calendarParts);
    }

    private List<AnalysisWarning> graphWarnings(List<TableAnalysis> tables, RelationshipResolver.Resolution resolution) {
        List<AnalysisWarning> warnings = new ArrayList<>();
        for (TableAnalysis table : tables) {
            if (table.hasStats() && table.confidence() < thresholds.lowConfidenceWarning()) {
                warnings.add(new AnalysisWarning(AnalysisWarning.Type.LOW_CONFIDENCE, table.name(),
                        String.format(Locale.ROOT, "%s classified as %s with low confidence %.2f",
                                table.name(), table.classification().wireName(), table.confidence())));
            }
        }

        List<String> names = tables.stream().map(TableAnalysis::name).toList();
        RelationshipGraph graph = new RelationshipGraph(names, resolution.edges());
        if (tables.size() > 1) {
            for (TableAnalysis table : tables) {
                if (table.classification() != TableClassification.CALENDAR && !graph.hasEdges(table.name())) {
                    warnings.add(new AnalysisWarning(AnalysisWarning.Type.ORPHAN_TABLE, table.name(),
                            table.name() + " has no relationships to other tables"));
                }
            }
        }
        if (tables.stream().noneMatch(t -> t.classification() == TableClassification.FACT)) {
            warnings.add(new AnalysisWarning(AnalysisWarning.Type.NO_FACT_TABLES, null,
                    "No fact tables identified; review the classifications"));
        }
        for (RelationshipEdge edge : graph.cycleEdges()) {
            warnings.add(new AnalysisWarning(AnalysisWarning.Type.CIRCULAR_RELATIONSHIP, edge.fromTable(),
                    "Relationship " + edge.describe() + " closes a loop; Qlik will create synthetic keys"));
        }
        for (String reason : resolution.unresolved()) {
            warnings.add(new AnalysisWarning(AnalysisWarning.Type.UNRESOLVED_RELATIONSHIP, null, reason));
        }
        return warnings;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
