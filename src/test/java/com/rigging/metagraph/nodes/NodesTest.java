package com.rigging.metagraph.nodes;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.rigging.metagraph.api.AttributeAlreadyExistsException;
import com.rigging.metagraph.api.SceneOperationException;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;

public class NodesTest {
    private Scene scene;

    @Before
    public void setUp() {
        scene = new Scene();
    }

    @Test
    public void testRenameReturnsUniqueName() {
        Nodes.createDgNode(scene, "arm2", "network");
        NodeHandle other = Nodes.createDgNode(scene, "leg", "network");
        assertEquals("arm1", Nodes.rename(other, "arm2"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNameRejected() {
        Nodes.createDgNode(scene, "9lives", "network");
    }

    @Test
    public void testLockNodeReportsChange() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        assertTrue(Nodes.lockNode(n, true));
        assertFalse(Nodes.lockNode(n, true));
        assertTrue(Nodes.isLocked(n));
        try {
            Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
            fail();
        } catch (SceneOperationException expected) {
        }
    }

    @Test(expected = AttributeAlreadyExistsException.class)
    public void testDuplicateAttribute() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Nodes.addAttribute(n, "gain", AttributeKind.INT, false);
    }

    @Test
    public void testIterAttributesSkipsFragments() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Nodes.addAttribute(n, "mClass", AttributeKind.STRING, false);
        Nodes.addCompoundAttribute(n, "limits", List.of(AttributeSpec.of("lower", AttributeKind.DOUBLE),
                AttributeSpec.of("upper", AttributeKind.DOUBLE)), false);

        List<Plug> plugs = Nodes.iterAttributes(n, List.of("mClass"));
        List<String> paths = plugs.stream().map(Plug::path).toList();
        assertTrue(paths.contains("gain"));
        assertTrue(paths.contains("limits.lower"));
        assertTrue(paths.contains("limits"));
        assertFalse(paths.contains("mClass"));
    }

    @Test
    public void testExtraAttributesByKind() {
        NodeHandle n = Nodes.createDagNode(scene, "ctrl", "transform", null);
        Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Nodes.addAttribute(n, "owner", AttributeKind.MESSAGE, false);
        assertEquals(2, Nodes.iterExtraAttributes(n, null).size());
        assertEquals("owner", Nodes.iterExtraAttributes(n, AttributeKind.MESSAGE).get(0).name());
    }

    @Test
    public void testRenameAndRemoveAttribute() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Nodes.renameAttribute(n, "gain", "weight");
        assertTrue(Nodes.hasAttribute(n, "weight"));
        assertFalse(Nodes.hasAttribute(n, "gain"));
        assertTrue(Nodes.removeAttribute(n, "weight"));
        assertFalse(Nodes.removeAttribute(n, "weight"));
    }

    @Test
    public void testIterConnectionsBySide() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Nodes.connect(out, in, false);

        List<Connection> outgoing = Nodes.iterConnections(a, true, false);
        assertEquals(1, outgoing.size());
        assertEquals(in, outgoing.get(0).destination());
        assertTrue(Nodes.iterConnections(a, false, true).isEmpty());
        assertEquals(1, Nodes.iterConnections(b, false, true).size());
    }

    @Test
    public void testDeleteBreaksLockedOutgoingConnection() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Nodes.connect(out, in, false);
        Plugs.setLockState(in, true);
        Nodes.lockNode(a, true);

        Nodes.delete(a);
        assertFalse(a.isAlive());
        assertTrue(b.isAlive());
        assertFalse(in.isDestination());
        assertTrue("Surviving destination keeps its lock", in.isLocked());
    }

    @Test
    public void testDeleteIsOneUndoStep() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Nodes.connect(out, in, false);
        Plugs.setLockState(in, true);
        Nodes.lockNode(b, true);
        int depth = scene.undoDepth();

        Nodes.delete(b);
        assertEquals(depth + 1, scene.undoDepth());
        assertTrue(scene.undo());
        assertTrue(b.isAlive());
        assertTrue(in.isDestination());
        assertEquals(out, in.source().orElseThrow());
        assertTrue(in.isLocked());
        assertTrue(Nodes.isLocked(b));
    }

    @Test
    public void testDeleteSubtreeIsOneUndoStep() {
        NodeHandle root = Nodes.createDagNode(scene, "root", "transform", null);
        NodeHandle arm = Nodes.createDagNode(scene, "arm", "transform", root);
        NodeHandle driver = Nodes.createDgNode(scene, "driver", "network");
        Plug out = Nodes.addAttribute(driver, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(arm, "in", AttributeKind.DOUBLE, false);
        Nodes.connect(out, in, false);
        Nodes.lockNode(arm, true);

        Nodes.delete(root);
        assertFalse(arm.isAlive());
        assertFalse(out.isSource());
        assertTrue(scene.undo());
        assertTrue(arm.isAlive());
        assertEquals("|root|arm", arm.fullPathName());
        assertEquals(out, in.source().orElseThrow());
        assertTrue(Nodes.isLocked(arm));
    }

    @Test
    public void testShowHideAttributesIsUndoable() {
        NodeHandle node = Nodes.createDgNode(scene, "settings", "network");
        Plug gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
        Plugs.setLockState(gain, true);
        boolean shown = gain.attribute().isChannelBox();
        Nodes.showHideAttributes(node, List.of("gain"), !shown);
        assertEquals("Locked plugs can still be hidden", !shown, gain.attribute().isChannelBox());
        assertTrue(scene.undo());
        assertEquals(shown, gain.attribute().isChannelBox());
    }

    @Test
    public void testDeleteDisconnectsLockedIncomingConnection() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Nodes.connect(out, in, false);
        Plugs.setLockState(in, true);

        Nodes.delete(b);
        assertFalse(b.isAlive());
        assertFalse(out.isSource());
    }

    @Test
    public void testSetParent() {
        NodeHandle root = Nodes.createDagNode(scene, "root", "transform", null);
        NodeHandle arm = Nodes.createDagNode(scene, "arm", "transform", null);
        assertFalse(Nodes.setParent(arm, arm, false));
        assertTrue(Nodes.setParent(arm, root, true));
        assertEquals("|root|arm", arm.fullPathName());
    }

    @Test
    public void testLockStateOnAttributes() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Plug gain = Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Nodes.setLockStateOnAttributes(n, List.of("gain"), true);
        assertTrue(gain.isLocked());
        Nodes.setLockStateOnAttributes(n, List.of("gain"), false);
        assertFalse(gain.isLocked());
    }
}
