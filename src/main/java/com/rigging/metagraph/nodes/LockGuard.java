package com.rigging.metagraph.nodes;

import java.util.function.Supplier;

import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;

/**
 * Clears the lock on a plug or a node for the duration of a block and puts the
 * original state back on every exit path, exceptions included.
 *
 * <pre>
 * try (LockGuard guard = LockGuard.unlock(plug)) {
 *     Plugs.setValue(plug, 3.0);
 * }
 * </pre>
 *
 * The lock is restored only if the target still exists when the guard closes:
 * a block is free to delete the node or attribute it unlocked.
 */
public final class LockGuard implements AutoCloseable {
    private final Plug plug;
    private final NodeHandle node;
    private final boolean wasLocked;

    private LockGuard(Plug plug, NodeHandle node, boolean wasLocked) {
        this.plug = plug;
        this.node = node;
        this.wasLocked = wasLocked;
    }

    public static LockGuard unlock(Plug plug) {
        boolean locked = plug.isLocked();
        if (locked)
            Plugs.setLockState(plug, false);
        return new LockGuard(plug, null, locked);
    }

    public static LockGuard unlock(NodeHandle node) {
        boolean locked = node.require().scene().isNodeLocked(node);
        if (locked)
            Nodes.lockNode(node, false);
        return new LockGuard(null, node, locked);
    }

    public static <T> T withUnlocked(Plug plug, Supplier<T> action) {
        try (LockGuard guard = unlock(plug)) {
            return action.get();
        }
    }

    public static <T> T withUnlocked(NodeHandle node, Supplier<T> action) {
        try (LockGuard guard = unlock(node)) {
            return action.get();
        }
    }

    public static void runUnlocked(Plug plug, Runnable action) {
        try (LockGuard guard = unlock(plug)) {
            action.run();
        }
    }

    public static void runUnlocked(NodeHandle node, Runnable action) {
        try (LockGuard guard = unlock(node)) {
            action.run();
        }
    }

    /** Whether the target was locked when the guard was opened. */
    public boolean wasLocked() {
        return wasLocked;
    }

    @Override
    public void close() {
        if (!wasLocked)
            return;
        if (plug != null) {
            if (plug.node().isAlive() && plug.scene().findPlug(plug.node(), plug.path()).isPresent())
                Plugs.setLockState(plug, true);
        } else if (node.isAlive()) {
            Nodes.lockNode(node, true);
        }
    }
}
