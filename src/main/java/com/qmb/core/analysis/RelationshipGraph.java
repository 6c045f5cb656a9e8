package com.qmb.core.analysis;

import com.qmb.core.model.EdgeSource;
import com.qmb.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Undirected view of the resolved relationships, used for connectivity, orphan and cycle checks.
 * Many-to-many edges derived from a bridge table are skipped since the bridge's own edges
 * already connect the same tables.
 */
public class RelationshipGraph {

    private final Map<String, String> parent = new HashMap<>();
    private final Set<String> connected = new HashSet<>();
    private final List<RelationshipEdge> cycleEdges = new ArrayList<>();

    public RelationshipGraph(Collection<String> tables, List<RelationshipEdge> edges) {
        for (String table : tables) {
            parent.put(key(table), key(table));
        }
        for (RelationshipEdge edge : edges) {
            if (edge.source() == EdgeSource.BRIDGE) {
                continue;
            }
            String a = key(edge.fromTable());
            String b = key(edge.toTable());
            connected.add(a);
            connected.add(b);
            parent.putIfAbsent(a, a);
            parent.putIfAbsent(b, b);
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                cycleEdges.add(edge);
            } else {
                parent.put(rootA, rootB);
            }
        }
    }

    /** True when all the given tables fall in one component. Empty or single-table input is connected. */
    public boolean isConnected(Collection<String> tables) {
        String root = null;
        for (String table : tables) {
            String r = find(key(table));
            if (root == null) {
                root = r;
            } else if (!root.equals(r)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasEdges(String table) {
        return connected.contains(key(table));
    }

    /** Edges that closed a cycle when added. */
    public List<RelationshipEdge> cycleEdges() {
        return List.copyOf(cycleEdges);
    }

    private String find(String node) {
        String current = parent.getOrDefault(node, node);
        while (!current.equals(parent.getOrDefault(current, current))) {
            current = parent.get(current);
        }
        return current;
    }

    private static String key(String table) {
        return table.toLowerCase(Locale.ROOT);
    }
}
