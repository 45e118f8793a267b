package com.rigging.metagraph.attr;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.rigging.metagraph.api.SceneOperationException;
import com.rigging.metagraph.api.UnsupportedKindOperationException;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;

public class PlugsTest {
    private Scene scene;
    private NodeHandle node;

    @Before
    public void setUp() {
        scene = new Scene();
        node = Nodes.createDgNode(scene, "settings", "network");
    }

    @Test
    public void testBoundsOnScalar() {
        Plug gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
        assertFalse(Plugs.hasMin(gain));
        assertTrue(Plugs.setMin(gain, 0.0));
        assertTrue(Plugs.setMax(gain, 10.0));
        assertEquals(0.0, Plugs.getMin(gain).orElseThrow(), 0.0);
        Plugs.setValue(gain, 25.0);
        assertEquals("Values above max are clamped", 10.0, (Double) gain.rawValue(), 0.0);
    }

    @Test
    public void testBoundsReportFalseOnUnsupportedKind() {
        Plug label = Nodes.addAttribute(node, "label", AttributeKind.STRING, false);
        assertFalse(Plugs.setMin(label, 1.0));
        assertFalse(Plugs.setSoftMax(label, 1.0));
        assertFalse(Plugs.hasMax(label));
    }

    @Test(expected = UnsupportedKindOperationException.class)
    public void testGetMinOnUnsupportedKindThrows() {
        Plug offset = Nodes.addAttribute(node, "offset", AttributeKind.DOUBLE3, false);
        Plugs.getMin(offset);
    }

    @Test
    public void testEnumNamesAndRange() {
        Plug mode = Nodes.addAttribute(node, AttributeSpec.enumOf("mode", List.of("fk", "ik", "blend")));
        assertEquals(List.of("fk", "ik", "blend"), Plugs.enumNames(mode));
        assertEquals(List.of(0, 1, 2), Plugs.enumIndices(mode));
        Plugs.setValue(mode, 2);
        assertEquals(2, Plugs.getValue(mode));
        try {
            Plugs.setValue(mode, 3);
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testArrayValues() {
        Plug weights = Nodes.addAttribute(node, "weights", AttributeKind.DOUBLE, true);
        Plugs.setValue(weights, List.of(0.25, 0.75));
        assertEquals(List.of(0.25, 0.75), Plugs.getValue(weights));
        assertEquals(2, weights.numElements());
        assertEquals("Unconnected elements are reused", 0, Plugs.nextAvailableElement(weights).logicalIndex());
    }

    @Test
    public void testCompoundValuesByName() {
        Plug limits = Nodes.addCompoundAttribute(node, "limits", List.of(
                AttributeSpec.of("lower", AttributeKind.DOUBLE), AttributeSpec.of("upper", AttributeKind.DOUBLE)),
                false);
        Plugs.setValue(limits, Map.of("upper", 90.0));
        assertEquals(List.of(0.0, 90.0), Plugs.getValue(limits));
        assertEquals(2, Plugs.iterLeaves(limits).size());
        assertEquals("limits.upper", limits.child("upper").path());
    }

    @Test
    public void testNextAvailableDestElementSkipsConnected() {
        NodeHandle parent = Nodes.createDgNode(scene, "parent", "network");
        Plug children = Nodes.addAttribute(parent, "children", AttributeKind.MESSAGE, false);
        Plug parents = Nodes.addAttribute(node, "parents", AttributeKind.MESSAGE, true);
        Plug first = Plugs.nextAvailableDestElement(parents);
        assertEquals(0, first.logicalIndex());
        Plugs.connectPlugs(children, first, false);
        assertEquals(1, Plugs.nextAvailableDestElement(parents).logicalIndex());
    }

    @Test
    public void testRemoveUnconnectedEmptyElements() {
        NodeHandle other = Nodes.createDgNode(scene, "other", "network");
        Plug out = Nodes.addAttribute(other, "out", AttributeKind.DOUBLE, false);
        Plug values = Nodes.addAttribute(node, "values", AttributeKind.DOUBLE, true);
        Plugs.setValue(values, List.of(1.0, 2.0, 3.0));
        Plugs.connectPlugs(out, values.elementByLogicalIndex(1), true);
        assertEquals(2, Plugs.removeUnconnectedEmptyElements(values));
        assertEquals(List.of(1), List.copyOf(values.existingIndices()));
    }

    @Test
    public void testFilterConnectedNodes() {
        NodeHandle ctrl = Nodes.createDgNode(scene, "hand_ctrl", "network");
        NodeHandle jnt = Nodes.createDgNode(scene, "hand_jnt", "network");
        Plug rel = Nodes.addAttribute(node, "rel", AttributeKind.MESSAGE, false);
        Plugs.connectPlugs(rel, Nodes.addAttribute(ctrl, "owner", AttributeKind.MESSAGE, false), false);
        Plugs.connectPlugs(rel, Nodes.addAttribute(jnt, "owner", AttributeKind.MESSAGE, false), false);
        List<Plug> found = Plugs.filterConnectedNodes(rel, "_ctrl$", true, false);
        assertEquals(1, found.size());
        assertEquals(ctrl, found.get(0).node());
        assertTrue(Plugs.filterConnectedNodes(rel, "_ctrl$", false, true).isEmpty());
    }

    @Test
    public void testDefaults() {
        Plug gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
        assertTrue(Plugs.setPlugDefault(gain, 1.5));
        assertEquals(1.5, Plugs.plugDefault(gain).orElseThrow());
        assertEquals(1.5, (Double) gain.rawValue(), 0.0);
        Plug rel = Nodes.addAttribute(node, "rel", AttributeKind.MESSAGE, false);
        assertFalse(Plugs.setPlugDefault(rel, 1.0));
        assertTrue(Plugs.plugDefault(rel).isEmpty());
    }

    @Test
    public void testMetadataChangesAreUndoable() {
        Plug gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
        Plug mode = Nodes.addAttribute(node, AttributeSpec.enumOf("mode", List.of("fk", "ik")));
        int depth = scene.undoDepth();
        Plugs.setMin(gain, 0.0);
        Plugs.setSoftMax(gain, 5.0);
        Plugs.setPlugDefault(gain, 2.0);
        Plugs.setEnumNames(mode, List.of("fk", "ik", "blend"));
        assertEquals(depth + 4, scene.undoDepth());

        assertTrue(scene.undo());
        assertEquals(List.of("fk", "ik"), Plugs.enumNames(mode));
        assertTrue(scene.undo());
        assertFalse(gain.attribute().hasExplicitDefault());
        assertTrue(scene.undo());
        assertFalse(Plugs.hasSoftMax(gain));
        assertTrue(Plugs.hasMin(gain));
        assertTrue(scene.undo());
        assertFalse(Plugs.hasMin(gain));
        assertTrue(scene.redo());
        assertEquals(0.0, Plugs.getMin(gain).orElseThrow(), 0.0);
    }

    @Test
    public void testMetadataOfLockedPlugIsRefused() {
        Plug gain = Nodes.addAttribute(node, "gain", AttributeKind.DOUBLE, false);
        Plugs.setLockState(gain, true);
        int depth = scene.undoDepth();
        try {
            Plugs.setMax(gain, 1.0);
            fail();
        } catch (SceneOperationException expected) {
        }
        try {
            Plugs.setPlugDefault(gain, 1.0);
            fail();
        } catch (SceneOperationException expected) {
        }
        assertFalse(Plugs.hasMax(gain));
        assertFalse(gain.attribute().hasExplicitDefault());
        assertEquals(depth, scene.undoDepth());
    }

    @Test
    public void testOutOfRangeValueIsRejectedAndKeepsOldValue() {
        Plug count = Nodes.addAttribute(node, "count", AttributeKind.INT, false);
        Plug small = Nodes.addAttribute(node, "small", AttributeKind.SHORT, false);
        Plugs.setValue(count, 7);
        try {
            Plugs.setValue(count, 3_000_000_000L);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            Plugs.setValue(small, 70000);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        assertEquals(7, Plugs.getValue(count));
        assertEquals((short) 0, Plugs.getValue(small));
    }

    @Test
    public void testMessageArrayValueIsNull() {
        NodeHandle other = Nodes.createDgNode(scene, "other", "network");
        Plug parents = Nodes.addAttribute(node, "parents", AttributeKind.MESSAGE, true);
        Plugs.connectPlugs(Nodes.addAttribute(other, "children", AttributeKind.MESSAGE, false),
                parents.elementByLogicalIndex(0), false);
        assertEquals(1, parents.numElements());
        assertNull(Plugs.getValue(parents));
        assertNull(Plugs.getValueAndKind(parents).value());
    }

    @Test
    public void testMessageValueIsNull() {
        Plug rel = Nodes.addAttribute(node, "rel", AttributeKind.MESSAGE, false);
        assertNull(Plugs.getValue(rel));
        assertNull(Plugs.getValueAndKind(rel).value());
        assertEquals(AttributeKind.MESSAGE, Plugs.getValueAndKind(rel).kind());
    }
}
