package com.qmb.core.model;

/**
 * A declared field of a source table.
 */
public record FieldSpec(String name, String type) {}
