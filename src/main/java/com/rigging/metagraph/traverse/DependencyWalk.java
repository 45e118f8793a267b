package com.rigging.metagraph.traverse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;

/**
 * Lazy pre-order walk along connections between same-named plugs.
 *
 * Starting at a plug, each connected peer (destinations going {@link Direction#DOWN},
 * the source going {@link Direction#UP}; element connections count for array
 * plugs) is visited when its node has a top level attribute of the walked name.
 * That attribute's plug is yielded and, while depth remains, the walk continues
 * from it. Peers without the attribute end their branch.
 *
 * A depth limit of 1 yields the direct neighbours only; below 1 nothing is
 * yielded. A chain of N nodes walked from its head yields N - 1 plugs once the
 * limit reaches N - 1.
 *
 * Each {@link #iterator()} starts a fresh walk. Changing the scene's structure
 * while an iterator is in use makes it throw
 * {@link ConcurrentModificationException}.
 */
public final class DependencyWalk implements Iterable<Plug> {
    private final Plug start;
    private final String attributeName;
    private final int depthLimit;
    private final Direction direction;

    public DependencyWalk(Plug start, int depthLimit, Direction direction) {
        this(start, start.name(), depthLimit, direction);
    }

    public DependencyWalk(Plug start, String attributeName, int depthLimit, Direction direction) {
        this.start = start;
        this.attributeName = attributeName;
        this.depthLimit = depthLimit;
        this.direction = direction;
    }

    @Override
    public Iterator<Plug> iterator() {
        return new Walker();
    }

    public List<Plug> toList() {
        List<Plug> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }

    /** Plugs connected to {@code plug} or to its existing elements in the given direction. */
    public static List<Plug> neighbours(Plug plug, Direction direction) {
        List<Plug> out = new ArrayList<>();
        for (Plug slot : slots(plug)) {
            if (direction == Direction.DOWN)
                out.addAll(slot.destinations());
            else
                slot.source().ifPresent(out::add);
        }
        return out;
    }

    /** Whether the plug or one of its elements has a connection. */
    public static boolean isConnected(Plug plug) {
        for (Plug slot : slots(plug)) {
            if (slot.isConnected())
                return true;
        }
        return false;
    }

    private static List<Plug> slots(Plug plug) {
        List<Plug> out = new ArrayList<>();
        out.add(plug);
        if (plug.isArray()) {
            for (int index : plug.existingIndices())
                out.add(plug.elementByLogicalIndex(index));
        }
        return out;
    }

    private static final class Frame {
        final Iterator<Plug> peers;
        final int depth;

        Frame(Iterator<Plug> peers, int depth) {
            this.peers = peers;
            this.depth = depth;
        }
    }

    private final class Walker implements Iterator<Plug> {
        private final Scene scene = start.scene();
        private final int expectedModCount = scene.modCount();
        private final Deque<Frame> stack = new ArrayDeque<>();
        private Plug next;

        Walker() {
            start.node().require();
            stack.push(new Frame(neighbours(start, direction).iterator(), depthLimit));
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            if (next == null)
                next = advance();
            return next != null;
        }

        @Override
        public Plug next() {
            if (!hasNext())
                throw new NoSuchElementException();
            Plug out = next;
            next = null;
            return out;
        }

        private Plug advance() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.depth < 1 || !frame.peers.hasNext()) {
                    stack.pop();
                    continue;
                }
                Plug peer = frame.peers.next();
                Optional<Plug> match = scene.findPlug(peer.node(), attributeName);
                if (match.isEmpty())
                    continue;
                if (isConnected(match.get()))
                    stack.push(new Frame(neighbours(match.get(), direction).iterator(), frame.depth - 1));
                return match.get();
            }
            return null;
        }

        private void checkForComodification() {
            if (scene.modCount() != expectedModCount)
                throw new ConcurrentModificationException("Scene changed during dependency walk from " + start);
        }
    }
}
