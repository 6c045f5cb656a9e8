package com.qmb.core.analysis;

import com.qmb.core.model.Cardinality;
import com.qmb.core.model.EdgeSource;
import com.qmb.core.model.FieldProfile;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.RelationshipHint;
import com.qmb.core.model.TableAnalysis;
import com.qmb.core.model.TableClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the relationship graph from declared hints and foreign-key-like field names.
 */
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    static final double INFERRED_CONFIDENCE = 0.8;

    public record Resolution(List<RelationshipEdge> edges, List<String> unresolved) {}

    private final ClassificationThresholds thresholds;

    public RelationshipResolver(ClassificationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Resolution resolve(List<TableAnalysis> tables, List<RelationshipHint> hints) {
        List<RelationshipEdge> edges = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        Set<String> covered = new HashSet<>();

        for (RelationshipHint hint : hints) {
            resolveHint(tables, hint, unresolved).ifPresent(edge -> {
                edges.add(edge);
                covered.add(fieldKey(edge.fromTable(), edge.fromField()));
                covered.add(fieldKey(edge.toTable(), edge.toField()));
            });
        }

        for (TableAnalysis child : tables) {
            for (String fk : child.foreignKeys()) {
                if (covered.contains(fieldKey(child.name(), fk))) {
                    continue;
                }
                inferEdge(tables, child, fk, unresolved).ifPresent(edges::add);
            }
        }

        edges.addAll(bridgeEdges(tables, edges));
        return new Resolution(edges, unresolved);
    }

    private Optional<RelationshipEdge> resolveHint(List<TableAnalysis> tables, RelationshipHint hint,
                                                   List<String> unresolved) {
        String[] from = splitQualified(hint.from());
        String[] to = splitQualified(hint.to());
        if (from == null || to == null) {
            unresolved.add("Hint " + hint.from() + " -> " + hint.to() + ": expected Table.Field on both sides");
            return Optional.empty();
        }
        Optional<TableAnalysis> fromTable = find(tables, from[0]);
        Optional<TableAnalysis> toTable = find(tables, to[0]);
        if (fromTable.isEmpty() || toTable.isEmpty()) {
            unresolved.add("Hint " + hint.from() + " -> " + hint.to() + ": table '"
                    + (fromTable.isEmpty() ? from[0] : to[0]) + "' not found");
            return Optional.empty();
        }
        Optional<FieldProfile> fromField = fromTable.get().field(from[1]);
        Optional<FieldProfile> toField = toTable.get().field(to[1]);
        if (fromField.isEmpty() || toField.isEmpty()) {
            unresolved.add("Hint " + hint.from() + " -> " + hint.to() + ": field '"
                    + (fromField.isEmpty() ? hint.from() : hint.to()) + "' not found");
            return Optional.empty();
        }

        Cardinality declared = hint.type() != null ? hint.type() : Cardinality.MANY_TO_ONE;
        if (declared == Cardinality.ONE_TO_MANY) {
            // referenced side first in the hint; orient child -> parent
            return Optional.of(new RelationshipEdge(toTable.get().name(), toField.get().name(),
                    fromTable.get().name(), fromField.get().name(), Cardinality.ONE_TO_MANY, 1.0, EdgeSource.HINT, null));
        }
        return Optional.of(new RelationshipEdge(fromTable.get().name(), fromField.get().name(),
                toTable.get().name(), toField.get().name(), declared.normalized(), 1.0, EdgeSource.HINT, null));
    }

    private Optional<RelationshipEdge> inferEdge(List<TableAnalysis> tables, TableAnalysis child, String fk,
                                                 List<String> unresolved) {
        FieldProfile childField = child.field(fk).orElseThrow();
        Optional<TableAnalysis> candidate = tables.stream()
                .filter(t -> t != child)
                .filter(t -> t.classification() == TableClassification.DIMENSION
                        || t.classification() == TableClassification.LOOKUP)
                .filter(t -> t.primaryKey() != null && t.primaryKey().equalsIgnoreCase(fk))
                .findFirst();
        if (candidate.isEmpty()) {
            String reason = child.name() + "." + fk + ": no dimension or lookup table has primary key " + fk;
            log.info("Unresolved relationship {}", reason);
            unresolved.add(reason);
            return Optional.empty();
        }

        TableAnalysis parent = candidate.get();
        if (child.hasStats() && parent.hasStats() && childField.cardinality() > parent.rowCount()) {
            String reason = child.name() + "." + fk + ": cardinality " + childField.cardinality()
                    + " exceeds " + parent.name() + " row count " + parent.rowCount();
            log.info("Dropped relationship {}", reason);
            unresolved.add(reason);
            return Optional.empty();
        }

        boolean oneToOne = childField.uniqueness() >= thresholds.oneToOneUniqueness()
                && parent.primaryKeyUniqueness() >= thresholds.oneToOneUniqueness();
        return Optional.of(new RelationshipEdge(child.name(), childField.name(), parent.name(), parent.primaryKey(),
                oneToOne ? Cardinality.ONE_TO_ONE : Cardinality.ONE_TO_MANY,
                INFERRED_CONFIDENCE, EdgeSource.INFERRED, null));
    }

    /**
     * A bridge table joining two parents yields a many-to-many edge between those parents.
     */
    private List<RelationshipEdge> bridgeEdges(List<TableAnalysis> tables, List<RelationshipEdge> edges) {
        List<RelationshipEdge> derived = new ArrayList<>();
        for (TableAnalysis bridge : tables) {
            if (bridge.classification() != TableClassification.BRIDGE) {
                continue;
            }
            Map<String, RelationshipEdge> byParent = new LinkedHashMap<>();
            for (RelationshipEdge edge : edges) {
                if (edge.fromTable().equalsIgnoreCase(bridge.name()) && edge.cardinality() != Cardinality.MANY_TO_MANY) {
                    byParent.putIfAbsent(edge.toTable().toLowerCase(Locale.ROOT), edge);
                }
            }
            if (byParent.size() != 2) {
                continue;
            }
            List<RelationshipEdge> pair = new ArrayList<>(byParent.values());
            RelationshipEdge left = pair.get(0);
            RelationshipEdge right = pair.get(1);
            derived.add(new RelationshipEdge(left.toTable(), left.toField(), right.toTable(), right.toField(),
                    Cardinality.MANY_TO_MANY, Math.min(left.confidence(), right.confidence()),
                    EdgeSource.BRIDGE, bridge.name()));
        }
        return derived;
    }

    private static Optional<TableAnalysis> find(List<TableAnalysis> tables, String name) {
        return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    private static String[] splitQualified(String qualified) {
        if (qualified == null) {
            return null;
        }
        int dot = qualified.indexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1) {
            return null;
        }
        return new String[]{qualified.substring(0, dot).trim(), qualified.substring(dot + 1).trim()};
    }

    private static String fieldKey(String table, String field) {
        return (table + "." + field).toLowerCase(Locale.ROOT);
    }
}
