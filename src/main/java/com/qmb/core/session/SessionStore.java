package com.qmb.core.session;

import com.qmb.core.config.ModelBuilderProperties;
import com.qmb.core.error.SessionException;
import com.qmb.core.error.ValidationException;
import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.logging.MdcContext;
import com.qmb.core.metrics.ModelBuilderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Holds the build sessions, one per project name, of which at most one is active.
 * <p>
 * Every state-mutating operation in the core runs through {@link #withActiveSession}, which
 * holds the session's lock for the whole read-check-write sequence. Reads go through
 * {@link BuildSession#state()} and see a complete snapshot.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ModelBuilderProperties properties;
    private final EventBus eventBus;
    private final ModelBuilderMetrics metrics;
    private final AtomicInteger sessionCounter = new AtomicInteger(0);

    /** Known sessions keyed by lower-cased project name, oldest first. Guarded by {@code this}. */
    private final Map<String, BuildSession> sessionsByProject = new LinkedHashMap<>();

    private volatile BuildSession active;

    public SessionStore(ModelBuilderProperties properties, EventBus eventBus, ModelBuilderMetrics metrics) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Creates a new active session for the project. Whichever session was active is suspended
     * with its state intact, so it can be picked up again with {@link #resume}.
     *
     * @throws ValidationException if the project name is missing or blank
     */
    public BuildSession start(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            throw new ValidationException("Project name is required to start a session");
        }
        String name = projectName.trim();
        Instant now = Instant.now();
        BuildSession session = new BuildSession(generateSessionId(), name, now,
                SessionState.initial(properties.getDefaults().toBuildConfig(), now));

        synchronized (this) {
            BuildSession previous = active;
            if (previous != null) {
                suspend(previous);
            }
            String key = name.toLowerCase();
            sessionsByProject.remove(key);
            sessionsByProject.put(key, session);
            evictOldest();
            active = session;
        }

        MdcContext.setSession(session.getId(), name);
        try {
            log.info("Started session {} for project '{}'", session.getId(), name);
            metrics.incrementSessionsStarted();
            eventBus.publish(ModelBuilderEvent.of("session.started", session.getId(), null,
                    Map.of("projectName", name)));
        } finally {
            MdcContext.clear();
        }
        return session;
    }

    public Optional<BuildSession> active() {
        return Optional.ofNullable(active);
    }

    /**
     * @throws SessionException if no session is active
     */
    public BuildSession requireActive() {
        BuildSession session = active;
        if (session == null) {
            throw SessionException.noActiveSession();
        }
        return session;
    }

    /**
     * Runs {@code action} against the active session while holding its lock. The session is
     * re-checked after the lock is acquired, so an action never runs against a session that
     * was reset while it waited.
     */
    public <T> T withActiveSession(Function<BuildSession, T> action) {
        BuildSession session = requireActive();
        session.lock().lock();
        try {
            if (session.getStatus() != SessionStatus.ACTIVE || session != active) {
                throw SessionException.noActiveSession();
            }
            return action.apply(session);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Human-readable summary of the active session.
     */
    public String status() {
        BuildSession session = active;
        if (session == null) {
            return "No active session. Start one with qmb_start_session.";
        }
        SessionState state = session.state();
        StringBuilder sb = new StringBuilder();
        sb.append("Project: ").append(session.getProjectName())
                .append(" (").append(session.getId()).append(")\n");
        if (state.analysis() == null) {
            sb.append("Input: not processed yet\n");
        } else {
            sb.append("Input: ").append(state.analysis().tables().size()).append(" table(s) analysed, recommended ")
                    .append(state.analysis().recommendation().modelType().wireName()).append('\n');
        }
        sb.append("Model type: ")
                .append(state.modelType() != null ? state.modelType().wireName() : "not selected").append('\n');
        sb.append("Stages: ").append(state.stageBar()).append('\n');
        sb.append("Progress: ").append(state.progressPercent()).append('%');
        if (state.complete()) {
            sb.append(" (complete)");
        }
        return sb.toString();
    }

    /**
     * Known sessions, most recently updated first. Sessions are kept in memory only.
     */
    public synchronized List<SessionSummary> list() {
        List<SessionSummary> summaries = new ArrayList<>();
        for (BuildSession session : sessionsByProject.values()) {
            summaries.add(session.summary());
        }
        summaries.sort(Comparator.comparing(SessionSummary::updatedAt).reversed());
        return summaries;
    }

    /**
     * Makes a known session active again, suspending the one that was active. Resuming the
     * active session is a no-op.
     *
     * @throws ValidationException if the id is missing or blank
     * @throws SessionException if no known session has that id
     */
    public BuildSession resume(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required to resume a session");
        }
        String id = sessionId.trim();
        BuildSession session;
        synchronized (this) {
            session = sessionsByProject.values().stream()
                    .filter(candidate -> candidate.getId().equalsIgnoreCase(id))
                    .findFirst()
                    .orElseThrow(() -> new SessionException("Session not found: " + id));
            if (session == active) {
                return session;
            }
            if (active != null) {
                suspend(active);
            }
            session.lock().lock();
            try {
                session.markActive();
            } finally {
                session.lock().unlock();
            }
            active = session;
        }

        MdcContext.setSession(session.getId(), session.getProjectName());
        try {
            log.info("Resumed session {} for project '{}' at stage {}", session.getId(),
                    session.getProjectName(), session.state().currentStage());
            eventBus.publish(ModelBuilderEvent.of("session.resumed", session.getId(), null,
                    Map.of("projectName", session.getProjectName())));
        } finally {
            MdcContext.clear();
        }
        return session;
    }

    /**
     * The known session for a project, matched case-insensitively, if it was updated within the
     * configured resume window.
     *
     * @throws ValidationException if the project name is missing or blank
     */
    public Optional<SessionSummary> findRecent(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            throw new ValidationException("Project name is required to find a session");
        }
        BuildSession session;
        synchronized (this) {
            session = sessionsByProject.get(projectName.trim().toLowerCase());
        }
        if (session == null) {
            return Optional.empty();
        }
        SessionSummary summary = session.summary();
        Duration window = Duration.ofHours(properties.getSessions().getResumeWindowHours());
        if (!summary.updatedAt().isAfter(Instant.now().minus(window))) {
            log.debug("Session {} for project '{}' is older than the resume window", summary.sessionId(),
                    summary.projectName());
            return Optional.empty();
        }
        return Optional.of(summary);
    }

    /**
     * Tears down the active session together with its analysis, model type and stages.
     *
     * @throws SessionException if no session is active
     */
    public SessionSummary reset() {
        BuildSession session;
        synchronized (this) {
            session = requireActive();
            discard(session);
            active = null;
        }
        log.info("Reset session {} for project '{}'", session.getId(), session.getProjectName());
        eventBus.publish(ModelBuilderEvent.of("session.reset", session.getId(), null,
                Map.of("projectName", session.getProjectName())));
        return session.summary();
    }

    private void suspend(BuildSession session) {
        session.lock().lock();
        try {
            session.markSuspended();
        } finally {
            session.lock().unlock();
        }
    }

    private void discard(BuildSession session) {
        session.lock().lock();
        try {
            session.markReset(SessionState.initial(session.state().config(), Instant.now()));
        } finally {
            session.lock().unlock();
        }
    }

    private void evictOldest() {
        int max = Math.max(1, properties.getSessions().getMaxKnown());
        Iterator<BuildSession> it = sessionsByProject.values().iterator();
        while (sessionsByProject.size() > max && it.hasNext()) {
            BuildSession candidate = it.next();
            if (candidate != active) {
                it.remove();
            }
        }
    }

    private String generateSessionId() {
        return String.format("QMB-%d-%04d", Year.now().getValue(), sessionCounter.incrementAndGet());
    }
}
