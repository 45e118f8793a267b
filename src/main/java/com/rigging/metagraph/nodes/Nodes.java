package com.rigging.metagraph.nodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.rigging.metagraph.api.AttributeAlreadyExistsException;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.scene.Attribute;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;
import com.rigging.metagraph.scene.SceneModifier;

import lombok.extern.log4j.Log4j2;

/**
 * Node level mutation primitives. Every call without an explicit
 * {@link SceneModifier} is its own undoable step.
 */
@Log4j2
public final class Nodes {

    private Nodes() {
    }

    // ── Creation and deletion ───────────────────────────────────────

    public static NodeHandle createDgNode(Scene scene, String name, String nodeType) {
        SceneModifier mod = new SceneModifier(scene);
        NodeHandle node = mod.createNode(nodeType, name);
        mod.doIt();
        return node;
    }

    public static NodeHandle createDagNode(Scene scene, String name, String nodeType, NodeHandle parent) {
        SceneModifier mod = new SceneModifier(scene);
        NodeHandle node = mod.createNode(nodeType, name, parent);
        mod.doIt();
        return node;
    }

    /** Creates a DAG or DG node depending on the node type. */
    public static NodeHandle createNode(Scene scene, String name, String nodeType, NodeHandle parent) {
        boolean dag = scene.nodeType(nodeType).map(t -> t.dag()).orElse(false);
        return dag ? createDagNode(scene, name, nodeType, parent) : createDgNode(scene, name, nodeType);
    }

    /**
     * Deletes a node as one undoable step. A handle to a node that is already
     * gone is ignored.
     */
    public static void delete(NodeHandle node) {
        if (!node.isAlive())
            return;
        SceneModifier mod = new SceneModifier(node.scene());
        delete(mod, node);
        mod.doIt();
    }

    /**
     * Queues the deletion of a node and its DAG descendants. Their node locks are
     * cleared first, then every connection touching them is broken. A locked
     * destination is unlocked for the disconnect and, when it lives on a node
     * that survives, locked again afterwards.
     */
    public static void delete(SceneModifier mod, NodeHandle node) {
        Scene scene = node.require().scene();
        List<NodeHandle> doomed = new ArrayList<>();
        collectSubtree(scene, node, doomed);
        Set<Connection> edges = new LinkedHashSet<>();
        for (NodeHandle n : doomed) {
            if (scene.isNodeLocked(n))
                mod.setNodeLockState(n, false);
            edges.addAll(scene.connections(n));
        }
        for (Connection c : edges) {
            Plug destination = c.destination();
            boolean locked = destination.isLocked();
            if (locked)
                mod.setLocked(destination, false);
            mod.disconnect(c.source(), destination);
            if (locked && !doomed.contains(destination.node()))
                mod.setLocked(destination, true);
        }
        mod.deleteNode(node);
    }

    private static void collectSubtree(Scene scene, NodeHandle node, List<NodeHandle> out) {
        out.add(node);
        if (scene.isDag(node)) {
            for (NodeHandle child : scene.children(node))
                collectSubtree(scene, child, out);
        }
    }

    public static List<NodeHandle> nodesCreatedBy(Scene scene, Runnable action) {
        return scene.nodesCreatedBy(action);
    }

    // ── Naming, hierarchy and locking ───────────────────────────────

    /** @return the name the node ended up with, which may carry a numeric suffix. */
    public static String rename(NodeHandle node, String newName) {
        SceneModifier mod = new SceneModifier(node.scene());
        mod.renameNode(node, newName);
        mod.doIt();
        return node.name();
    }

    /** @return false when the child is its own requested parent. */
    public static boolean setParent(NodeHandle child, NodeHandle newParent, boolean maintainOffset) {
        if (child.equals(newParent))
            return false;
        SceneModifier mod = new SceneModifier(child.scene());
        mod.reparentNode(child, newParent, maintainOffset);
        mod.doIt();
        return true;
    }

    /** @return true when the lock state changed. */
    public static boolean lockNode(NodeHandle node, boolean state) {
        Scene scene = node.require().scene();
        if (scene.isNodeLocked(node) == state)
            return false;
        SceneModifier mod = new SceneModifier(scene);
        mod.setNodeLockState(node, state);
        mod.doIt();
        return true;
    }

    public static boolean isLocked(NodeHandle node) {
        return node.require().scene().isNodeLocked(node);
    }

    public static boolean setLockStateOnAttributes(NodeHandle node, Collection<String> attributeNames,
            boolean state) {
        for (String name : attributeNames)
            Plugs.setLockState(node.plug(name), state);
        return true;
    }

    /** Shows or hides attributes in the channel box. */
    public static boolean showHideAttributes(NodeHandle node, Collection<String> attributeNames, boolean state) {
        SceneModifier mod = new SceneModifier(node.require().scene());
        for (String name : attributeNames) {
            Plug plug = node.plug(name);
            if (plug.attribute().isChannelBox() != state)
                mod.setChannelBox(plug, state);
        }
        mod.doIt();
        return true;
    }

    /** Unlocks every plug of this node that takes part in a connection. */
    public static void unlockConnectedAttributes(NodeHandle node) {
        for (Connection c : iterConnections(node, true, true)) {
            Plug own = c.source().node().equals(node) ? c.source() : c.destination();
            Plugs.setLockState(own, false);
        }
    }

    /** Unlocks and disconnects every incoming connection of the node. */
    public static void unlockAndDisconnectConnectedAttributes(NodeHandle node) {
        for (Connection c : iterConnections(node, false, true)) {
            if (c.destination().isDestination())
                Plugs.disconnectPlug(c.destination(), true, false);
        }
    }

    // ── Connections ─────────────────────────────────────────────────

    public static void connect(Plug source, Plug destination, boolean force) {
        Plugs.connectPlugs(source, destination, force);
    }

    public static void connect(SceneModifier mod, Plug source, Plug destination, boolean force) {
        Plugs.connectPlugs(mod, source, destination, force);
    }

    public static boolean disconnect(Plug plug, boolean fromSource, boolean fromDestinations) {
        return Plugs.disconnectPlug(plug, fromSource, fromDestinations);
    }

    /**
     * Connections of the node: {@code source} selects those where the node is
     * the source side, {@code destination} those where it receives.
     */
    public static List<Connection> iterConnections(NodeHandle node, boolean source, boolean destination) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : node.require().scene().connections(node)) {
            boolean outgoing = c.source().node().equals(node);
            if ((outgoing && source) || (!outgoing && destination))
                out.add(c);
        }
        return out;
    }

    // ── Attributes ──────────────────────────────────────────────────

    public static boolean hasAttribute(NodeHandle node, String attributeName) {
        return node.require().scene().hasAttribute(node, attributeName);
    }

    public static Optional<Plug> findPlug(NodeHandle node, String path) {
        return node.require().scene().findPlug(node, path);
    }

    /**
     * @throws AttributeAlreadyExistsException when the node already has an
     *         attribute with that name.
     */
    public static Plug addAttribute(NodeHandle node, String name, AttributeKind kind, boolean isArray) {
        return addAttribute(node, isArray ? AttributeSpec.array(name, kind) : AttributeSpec.of(name, kind));
    }

    public static Plug addAttribute(NodeHandle node, AttributeSpec spec) {
        SceneModifier mod = new SceneModifier(node.require().scene());
        mod.addAttribute(node, spec);
        mod.doIt();
        return node.plug(spec.name());
    }

    public static Plug addCompoundAttribute(NodeHandle node, String name, List<AttributeSpec> children,
            boolean isArray) {
        return addAttribute(node, AttributeSpec.compound(name, isArray, children));
    }

    /** @return false when there is no such attribute. */
    public static boolean removeAttribute(NodeHandle node, String attributeName) {
        if (!hasAttribute(node, attributeName))
            return false;
        SceneModifier mod = new SceneModifier(node.scene());
        mod.removeAttribute(node, attributeName);
        mod.doIt();
        return true;
    }

    public static void renameAttribute(NodeHandle node, String oldName, String newName) {
        SceneModifier mod = new SceneModifier(node.require().scene());
        mod.renameAttribute(node, oldName, newName);
        mod.doIt();
    }

    /**
     * Leaf plugs of every top level attribute, skipping attributes whose name
     * contains one of the {@code skip} fragments.
     */
    public static List<Plug> iterAttributes(NodeHandle node, Collection<String> skip) {
        List<Plug> out = new ArrayList<>();
        for (Attribute a : node.require().scene().attributes(node)) {
            if (skip != null && skip.stream().anyMatch(s -> a.name().contains(s)))
                continue;
            Plug plug = node.plug(a.name());
            out.addAll(Plugs.iterLeaves(plug));
            if (plug.isArray() || plug.isCompound())
                out.add(plug);
        }
        return out;
    }

    /** Top level dynamic attributes, optionally only those of one kind. */
    public static List<Plug> iterExtraAttributes(NodeHandle node, AttributeKind kind) {
        List<Plug> out = new ArrayList<>();
        for (Attribute a : node.require().scene().attributes(node)) {
            if (a.isDynamic() && (kind == null || a.kind() == kind))
                out.add(node.plug(a.name()));
        }
        return out;
    }

    public static List<Plug> iterKeyablePlugs(NodeHandle node) {
        List<Plug> out = new ArrayList<>();
        for (Attribute a : node.require().scene().attributes(node)) {
            if (a.isKeyable())
                out.add(node.plug(a.name()));
        }
        return out;
    }

    public static List<Plug> iterChannelBoxPlugs(NodeHandle node) {
        List<Plug> out = new ArrayList<>();
        for (Attribute a : node.require().scene().attributes(node)) {
            if (a.isKeyable() && a.isChannelBox())
                out.add(node.plug(a.name()));
        }
        return out;
    }
}
