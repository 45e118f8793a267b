package com.rigging.metagraph.nodes;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;

public class LockGuardTest {
    private Scene scene;
    private NodeHandle node;
    private Plug gain;

    @Before
    public void setUp() {
        scene = new Scene();
        node = Nodes.createDgNode(scene, "settings", "network");
        gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
    }

    @Test
    public void testPlugLockRestoredAfterBlock() {
        Plugs.setLockState(gain, true);
        LockGuard.runUnlocked(gain, () -> {
            assertFalse(gain.isLocked());
            Plugs.setValue(gain, 3.0);
        });
        assertTrue(gain.isLocked());
        assertEquals(3.0, (Double) gain.rawValue(), 0.0);
    }

    @Test
    public void testPlugLockRestoredAfterException() {
        Plugs.setLockState(gain, true);
        try {
            LockGuard.runUnlocked(gain, () -> {
                Plugs.setValue(gain, 1.0);
                throw new IllegalStateException("boom");
            });
            fail();
        } catch (IllegalStateException expected) {
        }
        assertTrue(gain.isLocked());
        assertEquals(1.0, (Double) gain.rawValue(), 0.0);
    }

    @Test
    public void testNodeLockRestoredAfterException() {
        Nodes.lockNode(node, true);
        try {
            LockGuard.runUnlocked(node, () -> {
                Nodes.rename(node, "renamed");
                throw new IllegalStateException("boom");
            });
            fail();
        } catch (IllegalStateException expected) {
        }
        assertTrue(Nodes.isLocked(node));
        assertEquals("renamed", node.name());
    }

    @Test
    public void testUnlockedTargetStaysUnlocked() {
        try (LockGuard guard = LockGuard.unlock(gain)) {
            assertFalse(guard.wasLocked());
        }
        assertFalse(gain.isLocked());
    }

    @Test
    public void testValueFromUnlockedBlock() {
        Nodes.lockNode(node, true);
        String name = LockGuard.withUnlocked(node, () -> Nodes.rename(node, "other"));
        assertEquals("other", name);
        assertTrue(Nodes.isLocked(node));
    }

    @Test
    public void testRemovedTargetIsNotRelocked() {
        Plugs.setLockState(gain, true);
        LockGuard.runUnlocked(gain, () -> Nodes.removeAttribute(node, "gain"));
        assertFalse(Nodes.hasAttribute(node, "gain"));
    }

    @Test
    public void testDeletedNodeIsNotRelocked() {
        Nodes.lockNode(node, true);
        LockGuard.runUnlocked(node, () -> Nodes.delete(node));
        assertFalse(node.isAlive());
    }
}
