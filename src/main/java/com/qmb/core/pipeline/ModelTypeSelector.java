package com.qmb.core.pipeline;

import com.qmb.core.error.ValidationException;
import com.qmb.core.error.WorkflowException;
import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.logging.MdcContext;
import com.qmb.core.model.BuildConfig;
import com.qmb.core.model.CalendarLanguage;
import com.qmb.core.model.ModelType;
import com.qmb.core.model.StageArtifact;
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

/**
 * Stores the chosen model type and the script generation options of the active session.
 */
@Service
public class ModelTypeSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelTypeSelector.class);

    private final SessionStore sessionStore;
    private final EventBus eventBus;

    public ModelTypeSelector(SessionStore sessionStore, EventBus eventBus) {
        this.sessionStore = sessionStore;
        this.eventBus = eventBus;
    }

    /**
     * Selects the model type. Any built or approved stage is discarded, since every
     * fragment depends on the model type.
     *
     * @throws WorkflowException if the type is unknown or no input has been processed
     */
    public ModelTypeSelection selectModelType(String type) {
        ModelType chosen = ModelType.fromWire(type).orElseThrow(() -> new WorkflowException(
                "Invalid model type: " + type + ". Choose one of: " + ModelType.choices()));
        return sessionStore.withActiveSession(session -> {
            SessionState state = session.state();
            if (state.analysis() == null) {
                throw new WorkflowException("No analysis available. Call qmb_process_input before selecting a model type.");
            }
            MdcContext.setSession(session.getId(), session.getProjectName());
            try {
                int invalidated = (int) state.stages().values().stream().filter(StageArtifact::isBuilt).count();
                session.replaceState(state.withModelType(chosen, Instant.now()));
                ModelType recommended = state.analysis().recommendation().modelType();
                if (chosen != recommended) {
                    log.info("Selected model type {} (recommended {})", chosen.wireName(), recommended.wireName());
                } else {
                    log.info("Selected recommended model type {}", chosen.wireName());
                }
                if (invalidated > 0) {
                    log.info("Model type change discarded {} stage(s)", invalidated);
                }
                eventBus.publish(ModelBuilderEvent.of("model_type.selected", session.getId(), null,
                        Map.of("modelType", chosen.wireName(), "invalidatedStages", invalidated)));
                return new ModelTypeSelection(chosen, recommended, invalidated);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Merges recognised options into the session configuration. Keys match regardless of
     * case, underscores and dashes, so {@code calendar_language} and {@code calendarLanguage}
     * are the same option. Analysis and stages are left as they are.
     *
     * @throws ValidationException if a recognised option has an unusable value
     */
    public ConfigUpdate updateConfig(Map<String, ?> options) {
        Map<String, ?> given = options != null ? options : Map.of();
        return sessionStore.withActiveSession(session -> {
            SessionState state = session.state();
            BuildConfig config = state.config();
            List<String> applied = new ArrayList<>();
            List<String> ignored = new ArrayList<>();
            for (Map.Entry<String, ?> entry : given.entrySet()) {
                Object value = entry.getValue();
                switch (normalizeKey(entry.getKey())) {
                    case "qvdpath" -> config = config.withQvdPath(requirePath(entry.getKey(), value));
                    case "outputpath", "destinationpath" -> config = config.withOutputPath(requirePath(entry.getKey(), value));
                    case "dbpath" -> config = config.withDbPath(requirePath(entry.getKey(), value));
                    case "calendarlanguage" -> config = config.withCalendarLanguage(parseLanguage(value));
                    case "useautonumber" -> config = config.withUseAutonumber(parseBoolean(entry.getKey(), value));
                    default -> {
                        ignored.add(entry.getKey());
                        continue;
                    }
                }
                applied.add(entry.getKey());
            }
            session.replaceState(state.withConfig(config, Instant.now()));
            if (!ignored.isEmpty()) {
                log.debug("Ignored unrecognised config option(s) {}", ignored);
            }
            if (!applied.isEmpty()) {
                log.info("Updated config option(s) {} for session {}", applied, session.getId());
                eventBus.publish(ModelBuilderEvent.of("config.updated", session.getId(), null,
                        Map.of("applied", List.copyOf(applied))));
            }
            return new ConfigUpdate(config, List.copyOf(applied), List.copyOf(ignored));
        });
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }

    private static String requirePath(String key, Object value) {
        if (value == null || value.toString().isBlank()) {
            throw new ValidationException("Option " + key + " needs a non-empty path");
        }
        return value.toString().trim();
    }

    private static CalendarLanguage parseLanguage(Object value) {
        String text = value == null ? "" : value.toString().trim().toUpperCase(Locale.ROOT);
        try {
            return CalendarLanguage.valueOf(text);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported calendar language: " + value + ". Use EN or HE");
        }
    }

    private static boolean parseBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value == null ? "" : value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ValidationException("Option " + key + " must be true or false, got: " + value);
    }
}
