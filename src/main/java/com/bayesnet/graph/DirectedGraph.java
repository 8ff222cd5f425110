package com.bayesnet.graph;

import com.bayesnet.api.NodeNotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A directed graph of named vertices.
 *
 * Edges run from parent to child; the child is recorded as a neighbor of the
 * parent but not the other way around. Parents are derived on demand by
 * scanning every vertex's neighbor set, which is O(|V|). Graphs built here
 * are small and structural lookups are not on any hot path, so no reverse
 * index is kept.
 *
 * Vertices and edges are kept in insertion order. That order is what
 * callers see from nodes() and edges().
 */
public final class DirectedGraph {
    private final Map<String, Vertex> vertices = new LinkedHashMap<>();
    private final Map<List<String>, Edge> edges = new LinkedHashMap<>();

    /**
     * Adds a vertex with the given name if it does not exist.
     *
     * @return The existing or newly created vertex.
     */
    public Vertex addNode(String name) {
        if (name == null)
            throw new IllegalArgumentException("Node name must not be null");
        return vertices.computeIfAbsent(name, Vertex::new);
    }

    /** Adds an edge of weight 1. */
    public Edge addEdge(String parentName, String childName) {
        return addEdge(parentName, childName, 1.0);
    }

    /**
     * Adds an edge from parent to child if the ordered pair has no edge yet,
     * creating missing endpoints. An existing edge is returned unchanged,
     * even if the weight differs.
     */
    public Edge addEdge(String parentName, String childName, double weight) {
        List<String> key = List.of(parentName, childName);
        Edge existing = edges.get(key);
        if (existing != null)
            return existing;

        Vertex p = addNode(parentName);
        Vertex c = addNode(childName);
        p.addNeighbor(c);
        Edge edge = new Edge(p, c, weight);
        edges.put(key, edge);
        return edge;
    }

    public Collection<Vertex> nodes() {
        return Collections.unmodifiableCollection(vertices.values());
    }

    public Collection<Edge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int nodeCount() {
        return vertices.size();
    }

    public boolean containsNode(String name) {
        return vertices.containsKey(name);
    }

    /**
     * @throws NodeNotFoundException if no vertex has that name.
     */
    public Vertex nodeByName(String name) {
        Vertex v = vertices.get(name);
        if (v == null)
            throw new NodeNotFoundException(name);
        return v;
    }

    /**
     * Every vertex whose neighbor set contains the named vertex.
     *
     * @throws NodeNotFoundException if no vertex has that name.
     */
    public Set<Vertex> parentsOf(String name) {
        Vertex target = nodeByName(name);
        Set<Vertex> parents = new LinkedHashSet<>();
        for (Vertex v : vertices.values())
            if (v.neighbors().contains(target))
                parents.add(v);
        return parents;
    }

    /**
     * Sorts the current structure topologically.
     *
     * @throws IllegalStateException if the graph contains a cycle.
     */
    public TopologicalOrder topologicalOrder() {
        TopologicalOrder.Builder builder = TopologicalOrder.builder();
        for (Vertex v : vertices.values())
            builder.addNode(v.name());
        for (Edge e : edges.values())
            builder.addEdge(e.parent().name(), e.child().name());
        return builder.build();
    }

    @Override
    public String toString() {
        return "DirectedGraph" + edges.values().stream().sorted().toList();
    }
}
