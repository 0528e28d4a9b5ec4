package io.github.eutro.mirlens.core.ir;

import java.util.Objects;

/**
 * An outgoing edge of a block, derived from its {@link Terminator}.
 */
public final class Edge {
    /**
     * The target block.
     */
    public final int target;
    public final EdgeKind kind;
    /**
     * A short label, such as the matched switch value. May be empty.
     */
    public final String label;

    public Edge(int target, EdgeKind kind, String label) {
        this.target = target;
        this.kind = kind;
        this.label = label;
    }

    public boolean isUnwind() {
        return kind == EdgeKind.CLEANUP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return target == edge.target && kind == edge.kind && label.equals(edge.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, kind, label);
    }

    @Override
    public String toString() {
        return "-> bb" + target + " (" + kind.getId() + (label.isEmpty() ? "" : " " + label) + ")";
    }
}
