package com.bayesnet.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named vertex of a {@link DirectedGraph}.
 *
 * Vertices are created by the graph, never directly. Equality, hashing and
 * ordering use the name only.
 */
public final class Vertex implements Comparable<Vertex> {
    private final String name;
    // Children this vertex points to.
    private final Set<Vertex> neighbors = new LinkedHashSet<>();

    Vertex(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /** Unmodifiable view of this vertex's children. */
    public Set<Vertex> neighbors() {
        return Collections.unmodifiableSet(neighbors);
    }

    void addNeighbor(Vertex child) {
        neighbors.add(child);
    }

    @Override
    public int compareTo(Vertex o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Vertex v && name.equals(v.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
