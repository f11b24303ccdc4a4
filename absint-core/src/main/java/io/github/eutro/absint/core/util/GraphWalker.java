package io.github.eutro.absint.core.util;

import io.github.eutro.absint.core.cfg.CfgView;

import java.util.*;
import java.util.function.Function;

/**
 * Walks a graph depth-first, in pre- or post-order, without recursion.
 * <p>
 * Each node is visited at most once, so cyclic graphs are fine.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the labels of a CFG, starting at its entry and following
     * {@link CfgView#nextNodes(Object) successors}.
     * <p>
     * The first successor of a block is visited first.
     *
     * @param cfg The graph.
     * @param <L> The type of labels.
     * @return The graph walker.
     */
    public static <L> GraphWalker<L> labelWalker(CfgView<L> cfg) {
        return new GraphWalker<L>(cfg.entry(), l -> GraphWalker.<L>reversedIterable(cfg.nextNodes(l)));
    }

    private static <T> Iterable<T> reversedIterable(List<T> ts) {
        return () -> {
            ListIterator<T> li = ts.listIterator(ts.size());
            return new Iterator<T>() {
                @Override
                public boolean hasNext() {
                    return li.hasPrevious();
                }

                @Override
                public T next() {
                    return li.previous();
                }
            };
        };
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

    public Order<T> preOrder() {
        return PreIter::new;
    }

    public Order<T> postOrder() {
        return PostIter::new;
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

    private class PostIter implements Iterator<T> {
        private final Deque<Object> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();
        private final Object sentinel = new Object();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @SuppressWarnings("unchecked")
        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Object last = stack.getLast();
                if (last == sentinel) {
                    stack.removeLast();
                    return (T) stack.removeLast();
                } else {
                    stack.addLast(sentinel);
                    for (T next : getChildren.apply((T) last)) {
                        if (seen.add(next)) {
                            stack.addLast(next);
                        }
                    }
                }
            }
        }
    }
}
