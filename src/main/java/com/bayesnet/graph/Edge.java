package com.bayesnet.graph;

/**
 * A directed edge from a parent vertex to a child vertex.
 *
 * Edges are identified by the ordered pair (parent, child). The weight is
 * carried along but takes no part in equality.
 */
public record Edge(Vertex parent, Vertex child, double weight) implements Comparable<Edge> {

    @Override
    public int compareTo(Edge o) {
        int c = parent.compareTo(o.parent);
        return c != 0 ? c : child.compareTo(o.child);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Edge e && parent.equals(e.parent) && child.equals(e.child);
    }

    @Override
    public int hashCode() {
        return 31 * parent.hashCode() + child.hashCode();
    }

    @Override
    public String toString() {
        return "(" + parent + ", " + child + ")";
    }
}
