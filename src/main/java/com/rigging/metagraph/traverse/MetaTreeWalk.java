package com.rigging.metagraph.traverse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Predicate;

import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Scene;

/**
 * Lazy pre-order walk over node connections of any attribute.
 *
 * Peers are the nodes on the other end of the current node's outgoing
 * ({@link Direction#DOWN}) or incoming ({@link Direction#UP}) connections, each
 * reported once per node. Peers rejected by the filter end their branch. Depth
 * is counted the way {@link DependencyWalk} counts it. Nodes on a cycle are
 * reported again on every lap until the depth limit stops the walk.
 */
public final class MetaTreeWalk implements Iterable<NodeHandle> {
    private final NodeHandle start;
    private final int depthLimit;
    private final Direction direction;
    private final Predicate<NodeHandle> filter;

    public MetaTreeWalk(NodeHandle start, int depthLimit, Direction direction, Predicate<NodeHandle> filter) {
        this.start = start;
        this.depthLimit = depthLimit;
        this.direction = direction;
        this.filter = filter;
    }

    @Override
    public Iterator<NodeHandle> iterator() {
        return new Walker();
    }

    public List<NodeHandle> toList() {
        List<NodeHandle> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }

    /** Distinct nodes across the node's connections in the given direction. */
    public static List<NodeHandle> peers(NodeHandle node, Direction direction) {
        Set<NodeHandle> out = new LinkedHashSet<>();
        boolean down = direction == Direction.DOWN;
        for (Connection c : Nodes.iterConnections(node, down, !down))
            out.add(down ? c.destination().node() : c.source().node());
        return new ArrayList<>(out);
    }

    private static final class Frame {
        final Iterator<NodeHandle> peers;
        final int depth;

        Frame(Iterator<NodeHandle> peers, int depth) {
            this.peers = peers;
            this.depth = depth;
        }
    }

    private final class Walker implements Iterator<NodeHandle> {
        private final Scene scene = start.scene();
        private final int expectedModCount = scene.modCount();
        private final Deque<Frame> stack = new ArrayDeque<>();
        private NodeHandle next;

        Walker() {
            stack.push(new Frame(peers(start, direction).iterator(), depthLimit));
        }

        @Override
        public boolean hasNext() {
            if (scene.modCount() != expectedModCount)
                throw new ConcurrentModificationException("Scene changed during tree walk from " + start);
            if (next == null)
                next = advance();
            return next != null;
        }

        @Override
        public NodeHandle next() {
            if (!hasNext())
                throw new NoSuchElementException();
            NodeHandle out = next;
            next = null;
            return out;
        }

        private NodeHandle advance() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.depth < 1 || !frame.peers.hasNext()) {
                    stack.pop();
                    continue;
                }
                NodeHandle peer = frame.peers.next();
                if (!filter.test(peer))
                    continue;
                stack.push(new Frame(peers(peer, direction).iterator(), frame.depth - 1));
                return peer;
            }
            return null;
        }
    }
}
