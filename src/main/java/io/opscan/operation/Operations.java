package io.opscan.operation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Traversal primitives over operation trees.
 * <p>
 * Every sequence returned here is lazy and restartable: each call to {@code iterator()}
 * starts a fresh walk, so the same sequence can be shared between threads.
 */
public final class Operations {

    private Operations() {
    }

    /**
     * All nodes below {@code root}, excluding {@code root}, in depth-first pre-order.
     */
    public static Iterable<Operation> descendants(Operation root) {
        Objects.requireNonNull(root, "root");
        return () -> new PreOrderIterator(root.children());
    }

    /**
     * {@code root} followed by {@link #descendants(Operation)}.
     */
    public static Iterable<Operation> descendantsAndSelf(Operation root) {
        Objects.requireNonNull(root, "root");
        return () -> new PreOrderIterator(List.of(root));
    }

    /**
     * Drops nodes the host synthesized, keeping the relative order of the rest.
     */
    public static Iterable<Operation> withoutSynthesized(Iterable<Operation> operations) {
        Objects.requireNonNull(operations, "operations");
        return () -> stream(operations).filter(op -> !op.isImplicit()).iterator();
    }

    public static Stream<Operation> stream(Iterable<Operation> operations) {
        return StreamSupport.stream(operations.spliterator(), false);
    }

    private static final class PreOrderIterator implements Iterator<Operation> {

        private final Deque<Operation> stack = new ArrayDeque<>();

        PreOrderIterator(List<Operation> roots) {
            pushAll(roots);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Operation next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Operation current = stack.pop();
            pushAll(current.children());
            return current;
        }

        // reversed so the first child is popped first
        private void pushAll(List<Operation> nodes) {
            for (int i = nodes.size() - 1; i >= 0; i--) {
                stack.push(nodes.get(i));
            }
        }
    }
}
