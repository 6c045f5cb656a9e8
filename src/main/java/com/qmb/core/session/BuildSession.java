package com.qmb.core.session;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One build session. State is held as an immutable {@link SessionState} snapshot that is
 * replaced wholesale, and only while the session's lock is held.
 */
public class BuildSession {

    private final String id;
    private final String projectName;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SessionState state;
    private volatile SessionStatus status = SessionStatus.ACTIVE;

    public BuildSession(String id, String projectName, Instant createdAt, SessionState initialState) {
        this.id = id;
        this.projectName = projectName;
        this.createdAt = createdAt;
        this.state = initialState;
    }

    public String getId() {
        return id;
    }

    public String getProjectName() {
        return projectName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public SessionStatus getStatus() {
        return status;
    }

    /** Current snapshot; safe to read without the lock. */
    public SessionState state() {
        return state;
    }

    public void replaceState(SessionState next) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session " + id + " state replaced without holding its lock");
        }
        this.state = next;
    }

    ReentrantLock lock() {
        return lock;
    }

    void markReset(SessionState cleared) {
        this.state = cleared;
        this.status = SessionStatus.RESET;
    }

    void markSuspended() {
        this.status = SessionStatus.SUSPENDED;
    }

    void markActive() {
        this.status = SessionStatus.ACTIVE;
    }

    public SessionSummary summary() {
        SessionState snapshot = state;
        return new SessionSummary(
                id,
                projectName,
                status,
                snapshot.modelType() != null ? snapshot.modelType().wireName() : null,
                snapshot.complete() ? "complete" : snapshot.currentStage().name(),
                snapshot.progressPercent(),
                createdAt,
                snapshot.updatedAt());
    }
}
