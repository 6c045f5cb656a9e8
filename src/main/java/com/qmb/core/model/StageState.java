package com.qmb.core.model;

/**
 * Lifecycle of a single stage: {@code UNBUILT -> BUILT -> APPROVED}.
 */
public enum StageState {
    UNBUILT,
    BUILT,
    APPROVED
}
