package com.qmb.core.script;

import java.util.ArrayList;
import java.util.List;

/**
 * A single {@code LOAD} block, rendered as
 * <pre>
 * TableName:
 * LOAD
 *     expr1,  // comment
 *     expr2
 * FROM [...] (qvd);
 * </pre>
 */
final class LoadStatement {

    private record Column(String expression, String comment) {}

    private final String tableName;
    private final List<Column> columns = new ArrayList<>();
    private String prefix;
    private boolean distinct;
    private String source;

    private LoadStatement(String tableName) {
        this.tableName = tableName;
    }

    static LoadStatement into(String tableName) {
        return new LoadStatement(tableName);
    }

    /** Statement prefix placed before {@code LOAD}, e.g. {@code CONCATENATE (T)}. */
    LoadStatement prefix(String value) {
        this.prefix = value;
        return this;
    }

    LoadStatement distinct() {
        this.distinct = true;
        return this;
    }

    LoadStatement column(String expression) {
        return column(expression, null);
    }

    LoadStatement column(String expression, String comment) {
        columns.add(new Column(expression, comment));
        return this;
    }

    LoadStatement from(String clause) {
        this.source = clause;
        return this;
    }

    LoadStatement resident(String table) {
        this.source = "RESIDENT [" + table + "];";
        return this;
    }

    String render() {
        StringBuilder sb = new StringBuilder();
        if (prefix == null) {
            sb.append('[').append(tableName).append("]:\n");
        } else {
            sb.append(prefix).append('\n');
        }
        sb.append(distinct ? "LOAD DISTINCT\n" : "LOAD\n");
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            sb.append("    ").append(column.expression());
            if (i < columns.size() - 1) {
                sb.append(',');
            }
            if (column.comment() != null) {
                sb.append("  // ").append(column.comment());
            }
            sb.append('\n');
        }
        sb.append(source);
        return sb.toString();
    }
}
