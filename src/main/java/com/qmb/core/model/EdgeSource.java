package com.qmb.core.model;

/**
 * How a relationship edge was established.
 */
public enum EdgeSource {
    HINT,
    INFERRED,
    BRIDGE
}
