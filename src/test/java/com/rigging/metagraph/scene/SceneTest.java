package com.rigging.metagraph.scene;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.rigging.metagraph.api.ConnectionConflictException;
import com.rigging.metagraph.api.MissingRequirementException;
import com.rigging.metagraph.api.SceneOperationException;
import com.rigging.metagraph.api.StaleReferenceException;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.nodes.Nodes;

public class SceneTest {
    private Scene scene;

    @Before
    public void setUp() {
        scene = new Scene();
    }

    @Test
    public void testClashingNameGetsSuffix() {
        NodeHandle a = Nodes.createDgNode(scene, "settings", "network");
        NodeHandle b = Nodes.createDgNode(scene, "settings", "network");
        assertEquals("settings", a.name());
        assertEquals("settings1", b.name());
    }

    @Test
    public void testDagFullPathName() {
        NodeHandle root = Nodes.createDagNode(scene, "root", "transform", null);
        NodeHandle arm = Nodes.createDagNode(scene, "arm", "transform", root);
        assertEquals("|root|arm", arm.fullPathName());
        assertEquals(root, scene.parent(arm).orElseThrow());
        assertTrue(scene.hasAttribute(arm, "translate"));
    }

    @Test
    public void testLockedNodeRefusesDelete() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        SceneModifier mod = new SceneModifier(scene);
        mod.setNodeLockState(n, true).deleteNode(n);
        try {
            mod.doIt();
            fail("Locked node should not be deletable");
        } catch (SceneOperationException e) {
            assertEquals("n", e.nodeName());
        }
        assertTrue(n.isAlive());
        assertFalse("The lock from the failed batch is rolled back", scene.isNodeLocked(n));
    }

    @Test
    public void testLockedPlugRefusesValue() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Plug gain = Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        Plugs.setValue(gain, 2.0);
        Plugs.setLockState(gain, true);
        try {
            Plugs.setValue(gain, 3.0);
            fail();
        } catch (SceneOperationException expected) {
        }
        assertEquals(2.0, (Double) gain.rawValue(), 0.0);
    }

    @Test(expected = ConnectionConflictException.class)
    public void testSecondIncomingConnectionConflicts() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        NodeHandle c = Nodes.createDgNode(scene, "c", "network");
        Plug src1 = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug src2 = Nodes.addAttribute(b, "out", AttributeKind.DOUBLE, false);
        Plug dst = Nodes.addAttribute(c, "in", AttributeKind.DOUBLE, false);
        Plugs.connectPlugs(src1, dst, false);
        Plugs.connectPlugs(src2, dst, false);
    }

    @Test
    public void testForcedConnectionReplacesSource() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        NodeHandle c = Nodes.createDgNode(scene, "c", "network");
        Plug src1 = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug src2 = Nodes.addAttribute(b, "out", AttributeKind.DOUBLE, false);
        Plug dst = Nodes.addAttribute(c, "in", AttributeKind.DOUBLE, false);
        Plugs.connectPlugs(src1, dst, false);
        Plugs.connectPlugs(src2, dst, true);
        assertEquals(src2, dst.source().orElseThrow());
        assertTrue(src1.destinations().isEmpty());
    }

    @Test
    public void testConnectedValueIsPulled() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Plugs.setValue(out, 4.5);
        Plugs.connectPlugs(out, in, false);
        assertEquals(4.5, (Double) in.rawValue(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfConnectionRejected() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(a, "in", AttributeKind.DOUBLE, false);
        Plugs.connectPlugs(out, in, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompatibleKindsRejected() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.STRING, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Plugs.connectPlugs(out, in, false);
    }

    @Test
    public void testMessageSourceConnectsToArrayElement() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "children", AttributeKind.MESSAGE, false);
        Plug parents = Nodes.addAttribute(b, "parents", AttributeKind.MESSAGE, true);
        Plug element = parents.elementByLogicalIndex(3);
        Plugs.connectPlugs(out, element, false);
        assertEquals("parents[3]", element.path());
        assertTrue(parents.existingIndices().contains(3));
        assertEquals(out, element.source().orElseThrow());
    }

    @Test
    public void testFailedBatchRollsBack() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        int depth = scene.undoDepth();
        SceneModifier mod = new SceneModifier(scene);
        mod.addAttribute(n, AttributeSpec.of("first", AttributeKind.INT));
        mod.addAttribute(n, AttributeSpec.of("first", AttributeKind.INT));
        try {
            mod.doIt();
            fail();
        } catch (RuntimeException expected) {
        }
        assertFalse(scene.hasAttribute(n, "first"));
        assertEquals(depth, scene.undoDepth());
    }

    @Test
    public void testUndoRedoDelete() {
        NodeHandle a = Nodes.createDgNode(scene, "a", "network");
        NodeHandle b = Nodes.createDgNode(scene, "b", "network");
        Plug out = Nodes.addAttribute(a, "out", AttributeKind.DOUBLE, false);
        Plug in = Nodes.addAttribute(b, "in", AttributeKind.DOUBLE, false);
        Plugs.connectPlugs(out, in, false);

        Nodes.delete(a);
        assertFalse(a.isAlive());
        assertFalse(in.isDestination());

        assertTrue(scene.undo());
        assertTrue(a.isAlive());
        assertEquals(out, in.source().orElseThrow());

        assertTrue(scene.redo());
        assertFalse(a.isAlive());
        assertFalse(in.isDestination());
    }

    @Test
    public void testModCountTracksStructureOnly() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Plug gain = Nodes.addAttribute(n, "gain", AttributeKind.DOUBLE, false);
        int before = scene.modCount();
        Plugs.setValue(gain, 1.0);
        assertEquals(before, scene.modCount());
        Nodes.addAttribute(n, "bias", AttributeKind.DOUBLE, false);
        assertTrue(scene.modCount() > before);
    }

    @Test
    public void testRequiredExtension() {
        scene.registerNodeType(new NodeTypeDefinition("skinCluster", false, "skinning", List.of()));
        try {
            Nodes.createDgNode(scene, "skin", "skinCluster");
            fail();
        } catch (MissingRequirementException expected) {
        }
        scene.registerExtension("skinning", () -> true);
        assertTrue(scene.loadExtension("skinning"));
        NodeHandle skin = Nodes.createDgNode(scene, "skin", "skinCluster");
        assertEquals(List.of("skinning"), scene.requirements(skin));
    }

    @Test(expected = StaleReferenceException.class)
    public void testDeadHandleIsStale() {
        NodeHandle n = Nodes.createDgNode(scene, "n", "network");
        Nodes.delete(n);
        n.name();
    }

    @Test
    public void testNodesCreatedBy() {
        Nodes.createDgNode(scene, "before", "network");
        var created = scene.nodesCreatedBy(() -> {
            Nodes.createDgNode(scene, "x", "network");
            Nodes.createDgNode(scene, "y", "network");
        });
        assertEquals(2, created.size());
        assertEquals("x", created.get(0).name());
    }
}
