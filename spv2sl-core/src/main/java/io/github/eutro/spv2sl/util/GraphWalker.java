package io.github.eutro.spv2sl.util;

import io.github.eutro.spv2sl.ssa.BasicBlock;
import io.github.eutro.spv2sl.ssa.Function;

import java.util.*;

/**
 * Depth-first traversal of a graph given by a root and a successor function.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    final T root;
    final F<T, ? extends Iterable<T>> getChildren;

    public GraphWalker(T root, F<T, ? extends Iterable<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    public static GraphWalker<BasicBlock> blockWalker(BasicBlock root) {
        return new GraphWalker<>(root, $ -> $.getControl().targets);
    }

    /**
     * Walk the blocks reachable from {@code root} without passing through {@code stop}.
     * {@code stop} itself is never visited.
     *
     * @param root The block to start from.
     * @param stop The block to stop at.
     * @return The walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(BasicBlock root, Set<BasicBlock> stop) {
        return new GraphWalker<>(root, $ -> {
            List<BasicBlock> targets = new ArrayList<>();
            for (BasicBlock target : $.getControl().targets) {
                if (!stop.contains(target)) targets.add(target);
            }
            return targets;
        });
    }

    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return blockWalker(func.getEntry());
    }

    public interface Order<T> extends Iterable<T> {
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
            List<T> children = new ArrayList<>();
            for (T child : getChildren.apply(top)) {
                children.add(child);
            }
            // push in reverse so the first child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                T next = children.get(i);
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
