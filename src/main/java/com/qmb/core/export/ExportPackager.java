package com.qmb.core.export;

import com.qmb.core.error.WorkflowException;
import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.logging.MdcContext;
import com.qmb.core.metrics.ModelBuilderMetrics;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import com.qmb.core.script.KeyPlan;
import com.qmb.core.script.ObservedDateRange;
import com.qmb.core.script.ScriptAssembler;
import com.qmb.core.script.ScriptNames;
import com.qmb.core.session.BuildSession;
import com.qmb.core.session.SessionState;
import com.qmb.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Packages the approved script and a summary of the analysis for deployment. Reads a
 * single session snapshot and never changes pipeline state.
 */
@Service
public class ExportPackager {

    private static final Logger log = LoggerFactory.getLogger(ExportPackager.class);

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "int", "integer", "bigint", "smallint", "decimal", "numeric", "number",
            "float", "double", "real", "money", "currency");

    private final SessionStore sessionStore;
    private final EventBus eventBus;
    private final ModelBuilderMetrics metrics;

    public ExportPackager(SessionStore sessionStore, EventBus eventBus, ModelBuilderMetrics metrics) {
        this.sessionStore = sessionStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws WorkflowException if no model type is selected or no stage is approved
     */
    public ExportSnapshot export() {
        BuildSession session = sessionStore.requireActive();
        SessionState state = session.state();
        if (state.modelType() == null) {
            throw new WorkflowException("Model type not selected. Nothing to export.");
        }
        List<StageArtifact> approved = state.approvedStages();
        if (approved.isEmpty()) {
            throw new WorkflowException("No approved stages to export. Approve at least stage A first.");
        }

        AnalysisResult analysis = state.analysis();
        KeyPlan keys = KeyPlan.of(analysis);
        ExportSnapshot snapshot = new ExportSnapshot(
                ExportSnapshot.FORMAT_VERSION,
                session.getProjectName(),
                state.modelType().wireName(),
                ScriptAssembler.assemble(approved),
                summarize(analysis),
                facts(analysis, keys),
                dimensions(analysis, keys),
                calendars(analysis),
                approved.stream().map(a -> a.stageId().name()).toList(),
                state.complete(),
                Instant.now());

        MdcContext.setSession(session.getId(), session.getProjectName());
        try {
            log.info("Exported {} approved stage(s) as {}", approved.size(), snapshot.modelType());
            metrics.incrementExports();
            eventBus.publish(ModelBuilderEvent.of("export.created", session.getId(), null, Map.of(
                    "approvedStages", snapshot.approvedStages(),
                    "scriptHash", ScriptAssembler.fingerprint(snapshot.assembledScript()))));
        } finally {
            MdcContext.clear();
        }
        return snapshot;
    }

    private static ExportSnapshot.AnalysisSummary summarize(AnalysisResult analysis) {
        return new ExportSnapshot.AnalysisSummary(
                analysis.tables().size(),
                analysis.tablesOf(TableClassification.FACT).size(),
                analysis.tablesOf(TableClassification.DIMENSION).size(),
                analysis.tablesOf(TableClassification.BRIDGE).size(),
                analysis.tablesOf(TableClassification.LOOKUP).size(),
                analysis.tablesOf(TableClassification.CALENDAR).size(),
                analysis.relationships().size(),
                analysis.recommendation().modelType().wireName(),
                analysis.recommendation().confidence());
    }

    private static List<ExportSnapshot.FactEntry> facts(AnalysisResult analysis, KeyPlan keys) {
        List<ExportSnapshot.FactEntry> entries = new ArrayList<>();
        for (TableAnalysis table : analysis.tablesOf(TableClassification.FACT)) {
            List<String> keyNames = new ArrayList<>();
            List<String> measures = new ArrayList<>();
            for (FieldProfile field : table.fields()) {
                Optional<String> key = keys.rename(table.name(), field.name());
                if (key.isPresent()) {
                    keyNames.add(key.get());
                } else if (field.keyLike()) {
                    keyNames.add(field.name());
                } else if (!field.dateField() && isNumeric(field.type())) {
                    measures.add(field.name());
                }
            }
            entries.add(new ExportSnapshot.FactEntry(ScriptNames.tableName(table), keyNames, measures));
        }
        return entries;
    }

    private static List<ExportSnapshot.DimensionEntry> dimensions(AnalysisResult analysis, KeyPlan keys) {
        List<ExportSnapshot.DimensionEntry> entries = new ArrayList<>();
        for (TableAnalysis table : analysis.tables()) {
            if (table.classification() != TableClassification.DIMENSION
                    && table.classification() != TableClassification.LOOKUP) {
                continue;
            }
            String primaryKey = table.primaryKey() == null ? null
                    : keys.rename(table.name(), table.primaryKey()).orElse(table.primaryKey());
            List<String> attributes = table.fields().stream()
                    .filter(f -> keys.rename(table.name(), f.name()).isEmpty())
                    .filter(f -> !f.name().equalsIgnoreCase(table.primaryKey()))
                    .map(FieldProfile::name)
                    .toList();
            entries.add(new ExportSnapshot.DimensionEntry(ScriptNames.tableName(table), primaryKey, attributes));
        }
        return entries;
    }

    private static List<ExportSnapshot.CalendarEntry> calendars(AnalysisResult analysis) {
        List<ExportSnapshot.CalendarEntry> entries = new ArrayList<>();
        List<TableAnalysis> calendarTables = analysis.tablesOf(TableClassification.CALENDAR);
        if (!calendarTables.isEmpty()) {
            for (TableAnalysis table : calendarTables) {
                String dateField = table.dateFields().isEmpty() ? null : table.dateFields().get(0).name();
                ObservedDateRange range = ObservedDateRange.orFallback(dateField == null
                        ? Optional.empty() : ObservedDateRange.of(analysis, List.of(dateField)));
                entries.add(new ExportSnapshot.CalendarEntry(ScriptNames.tableName(table), dateField,
                        range.min().toString(), range.max().toString()));
            }
            return entries;
        }
        for (String dateField : KeyPlan.calendarDateFields(analysis)) {
            ObservedDateRange range = ObservedDateRange.orFallback(ObservedDateRange.of(analysis, List.of(dateField)));
            entries.add(new ExportSnapshot.CalendarEntry(ScriptNames.masterCalendarName(dateField), dateField,
                    range.min().toString(), range.max().toString()));
        }
        return entries;
    }

    private static boolean isNumeric(String type) {
        return type != null && NUMERIC_TYPES.contains(type.toLowerCase(Locale.ROOT).replaceAll("\\(.*\\)", "").trim());
    }
}
