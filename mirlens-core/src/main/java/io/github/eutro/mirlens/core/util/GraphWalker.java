package io.github.eutro.mirlens.core.util;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ir.Edge;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final java.util.function.Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, java.util.function.Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the block indices of a {@link Function}.
     *
     * @param func         The function whose blocks should be walked.
     * @param root         The block to start from.
     * @param followUnwind Whether unwind edges are followed.
     * @return The graph walker.
     */
    public static GraphWalker<Integer> blockWalker(Function func, int root, boolean followUnwind) {
        if (followUnwind) {
            return new GraphWalker<>(root, block -> func.body.blocks.get(block).terminator.successors());
        }
        return new GraphWalker<>(root, block -> {
            List<Integer> targets = new ArrayList<>();
            for (Edge edge : func.body.blocks.get(block).terminator.edges()) {
                if (!edge.isUnwind()) targets.add(edge.target);
            }
            return targets;
        });
    }

    /**
     * Create a graph walker over the block indices of a {@link Function}, from its entry,
     * following every edge.
     *
     * @param func The function whose blocks should be walked.
     * @return The graph walker.
     */
    public static GraphWalker<Integer> blockWalker(Function func) {
        return blockWalker(func, 0, true);
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
