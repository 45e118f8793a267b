package com.rigging.metagraph.scene;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.rigging.metagraph.api.AttributeAlreadyExistsException;
import com.rigging.metagraph.api.AttributeNotFoundException;
import com.rigging.metagraph.api.ConnectionConflictException;
import com.rigging.metagraph.api.MissingRequirementException;
import com.rigging.metagraph.api.SceneOperationException;
import com.rigging.metagraph.api.StaleReferenceException;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Values;

import lombok.extern.log4j.Log4j2;

/**
 * In-memory host scene graph: nodes, their attributes, plug values, lock flags
 * and the directed plug-to-plug connections between them.
 *
 * Reads are public. Every mutation goes through a {@link SceneModifier}, which
 * calls the package-private {@code apply*} methods below. Each of those performs
 * one change and returns the action that reverts it, so a modifier can roll back
 * a failed batch and the scene can undo and redo whole batches.
 *
 * Rules enforced here, mirroring the host:
 * - node names are unique; a clashing name gets a numeric suffix
 * - a locked node cannot be deleted, renamed, reparented or have attributes added,
 *   removed or renamed
 * - a locked plug refuses new values and cannot be connected or disconnected as a
 *   destination
 * - a destination plug has at most one incoming connection
 * - connections join compatible plugs on two distinct nodes
 *
 * Not thread safe. The scene is owned by one thread.
 */
@Log4j2
public final class Scene {
    private static final Pattern SEGMENT = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(?:\\[(\\d+)\\])?");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<Long, SceneNode> nodes = new LinkedHashMap<>();
    private final Map<String, NodeTypeDefinition> nodeTypes = new HashMap<>();
    private final Map<String, BooleanSupplier> extensions = new HashMap<>();
    private final Set<String> loadedExtensions = new HashSet<>();

    // destination -> source, and source -> destinations
    private final Map<PlugKey, PlugKey> sources = new LinkedHashMap<>();
    private final Map<PlugKey, Set<PlugKey>> destinations = new HashMap<>();

    private final Deque<SceneModifier.Batch> undoStack = new ArrayDeque<>();
    private final Deque<SceneModifier.Batch> redoStack = new ArrayDeque<>();

    private long nextId = 1;
    private int modCount;

    public Scene() {
        registerNodeType(NodeTypeDefinition.NETWORK);
        registerNodeType(NodeTypeDefinition.TRANSFORM);
    }

    // ── Node types and extensions ───────────────────────────────────

    public void registerNodeType(NodeTypeDefinition type) {
        nodeTypes.put(type.name(), type);
    }

    public Optional<NodeTypeDefinition> nodeType(String typeName) {
        return Optional.ofNullable(nodeTypes.get(typeName));
    }

    /** Makes an extension loadable by name. The loader reports whether loading worked. */
    public void registerExtension(String extensionName, BooleanSupplier loader) {
        extensions.put(extensionName, loader);
    }

    /** Loads a registered extension once. Returns false when it is unknown or fails to load. */
    public boolean loadExtension(String extensionName) {
        if (loadedExtensions.contains(extensionName))
            return true;
        BooleanSupplier loader = extensions.get(extensionName);
        if (loader == null) {
            log.warn("No extension registered under '{}'", extensionName);
            return false;
        }
        boolean loaded;
        try {
            loaded = loader.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Extension '{}' failed to load", extensionName, e);
            return false;
        }
        if (loaded) {
            loadedExtensions.add(extensionName);
            log.info("Loaded extension '{}'", extensionName);
        }
        return loaded;
    }

    public boolean isExtensionLoaded(String extensionName) {
        return loadedExtensions.contains(extensionName);
    }

    /** Extensions that must be loaded before a node of this node's type can be created. */
    public List<String> requirements(NodeHandle node) {
        String ext = require(node).type.requiredExtension();
        return ext == null ? List.of() : List.of(ext);
    }

    // ── Node queries ────────────────────────────────────────────────

    public boolean exists(long id) {
        return nodes.containsKey(id);
    }

    SceneNode require(NodeHandle handle) {
        SceneNode n = handle.scene() == this ? nodes.get(handle.id()) : null;
        if (n == null)
            throw new StaleReferenceException("#" + handle.id());
        return n;
    }

    private NodeHandle handle(long id) {
        return new NodeHandle(this, id);
    }

    public String name(NodeHandle node) {
        return require(node).name;
    }

    public String fullPathName(NodeHandle node) {
        SceneNode n = require(node);
        if (!n.type.dag())
            return n.name;
        StringBuilder sb = new StringBuilder();
        for (SceneNode cur = n; cur != null; cur = cur.parentId == null ? null : nodes.get(cur.parentId))
            sb.insert(0, "|" + cur.name);
        return sb.toString();
    }

    public String typeName(NodeHandle node) {
        return require(node).type.name();
    }

    public boolean isDag(NodeHandle node) {
        return require(node).type.dag();
    }

    public boolean isNodeLocked(NodeHandle node) {
        return require(node).locked;
    }

    public Optional<NodeHandle> parent(NodeHandle node) {
        Long p = require(node).parentId;
        return p == null ? Optional.empty() : Optional.of(handle(p));
    }

    public List<NodeHandle> children(NodeHandle node) {
        List<NodeHandle> out = new ArrayList<>();
        for (Long id : require(node).children)
            out.add(handle(id));
        return out;
    }

    public List<NodeHandle> nodes() {
        List<NodeHandle> out = new ArrayList<>();
        for (Long id : nodes.keySet())
            out.add(handle(id));
        return out;
    }

    /** Finds a node by short name, or by full path when the name starts with {@code |}. */
    public Optional<NodeHandle> findNode(String nodeName) {
        boolean byPath = nodeName.startsWith("|");
        for (SceneNode n : nodes.values()) {
            NodeHandle h = handle(n.id);
            if (byPath ? fullPathName(h).equals(nodeName) : n.name.equals(nodeName))
                return Optional.of(h);
        }
        return Optional.empty();
    }

    /** Runs an action and returns the nodes it created that still exist afterwards. */
    public List<NodeHandle> nodesCreatedBy(Runnable action) {
        long first = nextId;
        action.run();
        List<NodeHandle> out = new ArrayList<>();
        for (SceneNode n : nodes.values()) {
            if (n.id >= first)
                out.add(handle(n.id));
        }
        out.sort((a, b) -> Long.compare(a.id(), b.id()));
        return out;
    }

    /** Structural modification counter, bumped by every change to nodes, attributes or connections. */
    public int modCount() {
        return modCount;
    }

    // ── Attribute and plug queries ──────────────────────────────────

    /** Top level attributes of a node, static first, in creation order. */
    public List<Attribute> attributes(NodeHandle node) {
        return new ArrayList<>(require(node).attributes.values());
    }

    /** Any attribute of the node by name, compound children included. */
    public Optional<Attribute> attribute(NodeHandle node, String attributeName) {
        return Optional.ofNullable(require(node).byName.get(attributeName));
    }

    public boolean hasAttribute(NodeHandle node, String attributeName) {
        return require(node).byName.containsKey(attributeName);
    }

    public Plug plug(NodeHandle node, String path) {
        return findPlug(node, path).orElseThrow(() -> new AttributeNotFoundException(name(node), path));
    }

    public Optional<Plug> findPlug(NodeHandle node, String path) {
        SceneNode n = require(node);
        Plug current = null;
        for (String part : path.split("\\.", -1)) {
            Matcher m = SEGMENT.matcher(part);
            if (!m.matches())
                return Optional.empty();
            String attrName = m.group(1);
            if (current == null) {
                Attribute a = n.byName.get(attrName);
                current = a == null ? null : plugFor(node, a);
            } else {
                Plug parent = current;
                current = parent.isCompound()
                        ? parent.attribute().child(attrName).map(c -> new Plug(node, c, parent, -1)).orElse(null)
                        : null;
            }
            if (current == null)
                return Optional.empty();
            if (m.group(2) != null) {
                if (!current.isArray())
                    return Optional.empty();
                current = new Plug(node, current.attribute(), current, Integer.parseInt(m.group(2)));
            }
        }
        return Optional.ofNullable(current);
    }

    // Builds the plug of an attribute addressed by short name; not possible under an array ancestor.
    private Plug plugFor(NodeHandle node, Attribute a) {
        if (a.parent() == null)
            return new Plug(node, a, null, -1);
        Plug parent = plugFor(node, a.parent());
        if (parent == null || parent.isArray())
            return null;
        return new Plug(node, a, parent, -1);
    }

    Plug plugAt(PlugKey key) {
        return plug(handle(key.nodeId()), key.path());
    }

    static boolean isLeaf(Plug plug) {
        return plug.kind().carriesValue() && !plug.isArray();
    }

    /** Value of a leaf plug: pulled from its incoming connection, else stored, else the default. */
    public Object value(Plug plug) {
        SceneNode n = require(plug.node());
        if (!isLeaf(plug))
            throw new IllegalArgumentException("Not a value leaf: " + plug.info());
        PlugKey src = sources.get(PlugKey.of(plug));
        if (src != null) {
            Plug sp = plugAt(src);
            if (isLeaf(sp))
                return plug.kind().coerce(value(sp));
        }
        Object v = n.values.get(plug.path());
        return v == null ? plug.attribute().defaultValue() : Values.copy(v);
    }

    /** Whether a value was explicitly stored on the plug, as opposed to reading the default. */
    public boolean hasStoredValue(Plug plug) {
        return require(plug.node()).values.containsKey(plug.path());
    }

    public boolean isLocked(Plug plug) {
        return require(plug.node()).lockedPlugs.contains(plug.path());
    }

    public SortedSet<Integer> existingIndices(Plug arrayPlug) {
        if (!arrayPlug.isArray())
            throw new IllegalArgumentException("Not an array plug: " + arrayPlug.info());
        TreeSet<Integer> set = require(arrayPlug.node()).indices.get(arrayPlug.path());
        return set == null ? new TreeSet<>() : new TreeSet<>(set);
    }

    public Optional<Plug> source(Plug destination) {
        require(destination.node());
        PlugKey src = sources.get(PlugKey.of(destination));
        return src == null ? Optional.empty() : Optional.of(plugAt(src));
    }

    public List<Plug> destinations(Plug source) {
        require(source.node());
        Set<PlugKey> dst = destinations.get(PlugKey.of(source));
        if (dst == null)
            return List.of();
        List<Plug> out = new ArrayList<>(dst.size());
        for (PlugKey k : dst)
            out.add(plugAt(k));
        return out;
    }

    /** Every connection with an endpoint on the node, in connection order. */
    public List<Connection> connections(NodeHandle node) {
        require(node);
        List<Connection> out = new ArrayList<>();
        for (Map.Entry<PlugKey, PlugKey> e : sources.entrySet()) {
            if (e.getKey().nodeId() == node.id() || e.getValue().nodeId() == node.id())
                out.add(new Connection(plugAt(e.getValue()), plugAt(e.getKey())));
        }
        return out;
    }

    public List<Connection> connections() {
        List<Connection> out = new ArrayList<>();
        for (Map.Entry<PlugKey, PlugKey> e : sources.entrySet())
            out.add(new Connection(plugAt(e.getValue()), plugAt(e.getKey())));
        return out;
    }

    // ── Undo ────────────────────────────────────────────────────────

    long reserveId() {
        return nextId++;
    }

    void pushUndo(SceneModifier.Batch batch) {
        undoStack.push(batch);
        redoStack.clear();
    }

    void dropUndo(SceneModifier.Batch batch) {
        undoStack.remove(batch);
        redoStack.remove(batch);
    }

    /** Reverts the most recent batch. Returns false when there is nothing to undo. */
    public boolean undo() {
        if (undoStack.isEmpty())
            return false;
        SceneModifier.Batch batch = undoStack.pop();
        batch.revert();
        redoStack.push(batch);
        return true;
    }

    public boolean redo() {
        if (redoStack.isEmpty())
            return false;
        SceneModifier.Batch batch = redoStack.pop();
        batch.apply();
        undoStack.push(batch);
        return true;
    }

    public int undoDepth() {
        return undoStack.size();
    }

    // ── Mutations, each returning its inverse ───────────────────────

    Runnable applyCreateNode(long id, String typeName, String nodeName, NodeHandle parent) {
        NodeTypeDefinition type = nodeTypes.get(typeName);
        if (type == null)
            throw new SceneOperationException("Unknown node type: " + typeName, nodeName, null);
        if (type.requiredExtension() != null && !loadedExtensions.contains(type.requiredExtension()))
            throw new MissingRequirementException(type.requiredExtension(), nodeName);
        SceneNode p = null;
        if (parent != null) {
            p = require(parent);
            if (!type.dag() || !p.type.dag())
                throw new SceneOperationException("Only DAG nodes can be parented", nodeName, null);
        }
        String requested = nodeName == null || nodeName.isEmpty() ? typeName + "1" : nodeName;
        validateName(requested);
        SceneNode n = new SceneNode(id, type, uniqueName(requested, id));
        for (AttributeSpec spec : type.attributes())
            n.register(Attribute.fromSpec(spec, false));
        if (p != null) {
            n.parentId = p.id;
            p.children.add(id);
        }
        nodes.put(id, n);
        modCount++;
        log.debug("Created {} '{}'", typeName, n.name);

        SceneNode parentNode = p;
        return () -> {
            nodes.remove(id);
            if (parentNode != null)
                parentNode.children.remove(Long.valueOf(id));
            modCount++;
        };
    }

    Runnable applyDeleteNode(NodeHandle node) {
        SceneNode root = require(node);
        List<SceneNode> doomed = new ArrayList<>();
        collectSubtree(root, doomed);
        Set<Long> ids = new HashSet<>();
        for (SceneNode n : doomed) {
            if (n.locked)
                throw new SceneOperationException("Cannot delete locked node", n.name, null);
            ids.add(n.id);
        }
        List<PlugKey[]> edges = new ArrayList<>();
        for (Map.Entry<PlugKey, PlugKey> e : sources.entrySet()) {
            PlugKey dst = e.getKey();
            PlugKey src = e.getValue();
            if (ids.contains(dst.nodeId()) || ids.contains(src.nodeId())) {
                for (PlugKey k : new PlugKey[] { src, dst }) {
                    if (isKeyLocked(k))
                        throw new SceneOperationException("Cannot delete node with locked connected plug",
                                nodes.get(k.nodeId()).name, k.path());
                }
                edges.add(new PlugKey[] { src, dst });
            }
        }
        for (PlugKey[] edge : edges)
            unlink(edge[0], edge[1]);
        SceneNode parent = root.parentId == null ? null : nodes.get(root.parentId);
        int position = parent == null ? -1 : parent.children.indexOf(root.id);
        if (parent != null)
            parent.children.remove(Long.valueOf(root.id));
        for (SceneNode n : doomed)
            nodes.remove(n.id);
        modCount++;
        log.debug("Deleted '{}' ({} node(s), {} connection(s))", root.name, doomed.size(), edges.size());

        return () -> {
            for (SceneNode n : doomed)
                nodes.put(n.id, n);
            if (parent != null)
                parent.children.add(position, root.id);
            for (PlugKey[] edge : edges)
                link(edge[0], edge[1]);
            modCount++;
        };
    }

    private void collectSubtree(SceneNode n, List<SceneNode> out) {
        out.add(n);
        for (Long child : n.children)
            collectSubtree(nodes.get(child), out);
    }

    Runnable applyRenameNode(NodeHandle node, String newName) {
        SceneNode n = require(node);
        if (n.locked)
            throw new SceneOperationException("Cannot rename locked node", n.name, null);
        validateName(newName);
        String old = n.name;
        n.name = uniqueName(newName, n.id);
        return () -> n.name = old;
    }

    Runnable applyReparent(NodeHandle child, NodeHandle newParent, boolean maintainOffset) {
        SceneNode n = require(child);
        if (!n.type.dag())
            throw new SceneOperationException("Only DAG nodes can be reparented", n.name, null);
        if (n.locked)
            throw new SceneOperationException("Cannot reparent locked node", n.name, null);
        SceneNode p = newParent == null ? null : require(newParent);
        if (p != null) {
            if (!p.type.dag())
                throw new SceneOperationException("Cannot parent under a DG node", p.name, null);
            for (Long cur = p.id; cur != null; cur = nodes.get(cur).parentId) {
                if (cur == n.id)
                    throw new IllegalArgumentException("Cannot parent " + n.name + " under itself or a descendant");
            }
        }
        SceneNode oldParent = n.parentId == null ? null : nodes.get(n.parentId);
        int oldPosition = oldParent == null ? -1 : oldParent.children.indexOf(n.id);
        boolean hadTranslate = n.values.containsKey("translate");
        Object oldTranslate = n.values.get("translate");

        Attribute translate = n.byName.get("translate");
        if (maintainOffset && translate != null && translate.kind() == AttributeKind.DOUBLE3) {
            double[] world = worldTranslate(n);
            double[] parentWorld = p == null ? new double[3] : worldTranslate(p);
            n.values.put("translate",
                    new double[] { world[0] - parentWorld[0], world[1] - parentWorld[1], world[2] - parentWorld[2] });
        }
        if (oldParent != null)
            oldParent.children.remove(Long.valueOf(n.id));
        n.parentId = p == null ? null : p.id;
        if (p != null)
            p.children.add(n.id);
        modCount++;

        return () -> {
            if (p != null)
                p.children.remove(Long.valueOf(n.id));
            n.parentId = oldParent == null ? null : oldParent.id;
            if (oldParent != null)
                oldParent.children.add(oldPosition, n.id);
            if (hadTranslate)
                n.values.put("translate", oldTranslate);
            else
                n.values.remove("translate");
            modCount++;
        };
    }

    private double[] worldTranslate(SceneNode n) {
        double[] world = new double[3];
        for (SceneNode cur = n; cur != null; cur = cur.parentId == null ? null : nodes.get(cur.parentId)) {
            Object t = cur.values.get("translate");
            if (t instanceof double[]) {
                double[] d = (double[]) t;
                for (int i = 0; i < 3; i++)
                    world[i] += d[i];
            }
        }
        return world;
    }

    Runnable applySetNodeLocked(NodeHandle node, boolean locked) {
        SceneNode n = require(node);
        boolean old = n.locked;
        n.locked = locked;
        return () -> n.locked = old;
    }

    Runnable applyAddAttribute(NodeHandle node, AttributeSpec spec) {
        SceneNode n = require(node);
        if (n.locked)
            throw new SceneOperationException("Cannot add attribute to locked node", n.name, spec.name());
        Attribute attribute = Attribute.fromSpec(spec, true);
        Set<String> seen = new HashSet<>();
        for (Attribute a : attribute.flatten()) {
            if (!NAME.matcher(a.name()).matches())
                throw new IllegalArgumentException("Invalid attribute name: '" + a.name() + "'");
            if (n.byName.containsKey(a.name()) || !seen.add(a.name()))
                throw new AttributeAlreadyExistsException(n.name, a.name());
        }
        n.register(attribute);
        modCount++;
        return () -> {
            n.unregister(attribute);
            modCount++;
        };
    }

    Runnable applyRemoveAttribute(NodeHandle node, String attributeName) {
        SceneNode n = require(node);
        Attribute attribute = n.attributes.get(attributeName);
        if (attribute == null) {
            if (n.byName.containsKey(attributeName))
                throw new IllegalArgumentException("Only top level attributes can be removed: " + attributeName);
            throw new AttributeNotFoundException(n.name, attributeName);
        }
        if (!attribute.isDynamic())
            throw new SceneOperationException("Cannot remove static attribute", n.name, attributeName);
        if (n.locked)
            throw new SceneOperationException("Cannot remove attribute from locked node", n.name, attributeName);
        SlotState state = new SlotState(n, attributeName);
        if (!state.locks.isEmpty())
            throw new SceneOperationException("Cannot remove locked attribute", n.name, state.locks.iterator().next());
        state.clear();
        n.unregister(attribute);
        modCount++;
        return () -> {
            n.register(attribute);
            state.restore();
            modCount++;
        };
    }

    Runnable applyRenameAttribute(NodeHandle node, String oldName, String newName) {
        SceneNode n = require(node);
        if (n.locked)
            throw new SceneOperationException("Cannot rename attribute on locked node", n.name, oldName);
        Attribute attribute = n.byName.get(oldName);
        if (attribute == null)
            throw new AttributeNotFoundException(n.name, oldName);
        if (!attribute.isDynamic())
            throw new SceneOperationException("Cannot rename static attribute", n.name, oldName);
        if (!NAME.matcher(newName).matches())
            throw new IllegalArgumentException("Invalid attribute name: '" + newName + "'");
        if (n.byName.containsKey(newName))
            throw new AttributeAlreadyExistsException(n.name, newName);
        renameAttribute(n, attribute, newName);
        return () -> renameAttribute(n, attribute, oldName);
    }

    private void renameAttribute(SceneNode n, Attribute attribute, String newName) {
        String oldName = attribute.name();
        Pattern segment = Pattern.compile("(?<=^|\\.)" + Pattern.quote(oldName) + "(?=$|\\.|\\[)");
        UnaryOperator<String> rekey = path -> segment.matcher(path).replaceFirst(Matcher.quoteReplacement(newName));

        Map<String, Object> values = new HashMap<>();
        n.values.forEach((k, v) -> values.put(rekey.apply(k), v));
        n.values.clear();
        n.values.putAll(values);

        Set<String> locks = new HashSet<>();
        n.lockedPlugs.forEach(k -> locks.add(rekey.apply(k)));
        n.lockedPlugs.clear();
        n.lockedPlugs.addAll(locks);

        Map<String, TreeSet<Integer>> indices = new HashMap<>();
        n.indices.forEach((k, v) -> indices.put(rekey.apply(k), v));
        n.indices.clear();
        n.indices.putAll(indices);

        UnaryOperator<PlugKey> rekeyPlug = k -> k.nodeId() == n.id ? new PlugKey(n.id, rekey.apply(k.path())) : k;
        Map<PlugKey, PlugKey> rebuilt = new LinkedHashMap<>();
        sources.forEach((dst, src) -> rebuilt.put(rekeyPlug.apply(dst), rekeyPlug.apply(src)));
        sources.clear();
        destinations.clear();
        rebuilt.forEach((dst, src) -> link(src, dst));

        n.byName.remove(oldName);
        attribute.rename(newName);
        n.byName.put(newName, attribute);
        if (attribute.parent() == null) {
            Map<String, Attribute> ordered = new LinkedHashMap<>();
            n.attributes.forEach((k, v) -> ordered.put(v.name(), v));
            n.attributes.clear();
            n.attributes.putAll(ordered);
        }
        modCount++;
    }

    Runnable applyConnect(Plug source, Plug destination) {
        SceneNode sn = require(source.node());
        SceneNode dn = require(destination.node());
        if (sn == dn)
            throw new IllegalArgumentException("Cannot connect a node to itself: " + source + " -> " + destination);
        if (!source.kind().isCompatibleWith(destination.kind()) || source.isArray() != destination.isArray())
            throw new IllegalArgumentException("Incompatible plugs: " + source + " (" + source.kind() + ") -> "
                    + destination + " (" + destination.kind() + ")");
        PlugKey sk = PlugKey.of(source);
        PlugKey dk = PlugKey.of(destination);
        PlugKey existing = sources.get(dk);
        if (existing != null) {
            if (existing.equals(sk))
                return () -> {
                };
            throw new ConnectionConflictException("Destination " + destination + " is already connected from "
                    + plugAt(existing), dn.name, destination.path());
        }
        if (dn.lockedPlugs.contains(dk.path()))
            throw new SceneOperationException("Cannot connect to locked plug", dn.name, dk.path());
        List<Runnable> marks = new ArrayList<>();
        markIndices(source, marks);
        markIndices(destination, marks);
        link(sk, dk);
        modCount++;
        return () -> {
            unlink(sk, dk);
            revert(marks);
            modCount++;
        };
    }

    Runnable applyDisconnect(Plug source, Plug destination) {
        require(source.node());
        SceneNode dn = require(destination.node());
        PlugKey sk = PlugKey.of(source);
        PlugKey dk = PlugKey.of(destination);
        if (!sk.equals(sources.get(dk)))
            throw new IllegalArgumentException("Not connected: " + source + " -> " + destination);
        if (dn.lockedPlugs.contains(dk.path()))
            throw new SceneOperationException("Cannot disconnect locked plug", dn.name, dk.path());
        unlink(sk, dk);
        modCount++;
        return () -> {
            link(sk, dk);
            modCount++;
        };
    }

    Runnable applySetValue(Plug plug, Object value) {
        SceneNode n = require(plug.node());
        String path = plug.path();
        if (!isLeaf(plug))
            throw new IllegalArgumentException("Not a value leaf: " + plug.info());
        if (n.lockedPlugs.contains(path))
            throw new SceneOperationException("Cannot set value on locked plug", n.name, path);
        if (sources.containsKey(PlugKey.of(plug)))
            throw new SceneOperationException("Cannot set value on connected plug", n.name, path);

        Attribute a = plug.attribute();
        Object coerced = a.kind().coerce(value);
        if (a.kind() == AttributeKind.ENUM && !a.enumFields().isEmpty()) {
            int index = (Integer) coerced;
            if (index < 0 || index >= a.enumFields().size())
                throw new IllegalArgumentException("Enum index " + index + " out of range on " + plug.info());
        } else if (a.kind().supportsBounds()) {
            double d = Values.number(a.kind(), coerced).doubleValue();
            if (a.min().isPresent() && d < a.min().get())
                coerced = a.kind().coerce(a.min().get());
            else if (a.max().isPresent() && d > a.max().get())
                coerced = a.kind().coerce(a.max().get());
        }

        boolean had = n.values.containsKey(path);
        Object old = n.values.get(path);
        List<Runnable> marks = new ArrayList<>();
        markIndices(plug, marks);
        n.values.put(path, coerced);
        return () -> {
            if (had)
                n.values.put(path, old);
            else
                n.values.remove(path);
            revert(marks);
        };
    }

    Runnable applySetLocked(Plug plug, boolean locked) {
        SceneNode n = require(plug.node());
        String path = plug.path();
        boolean old = n.lockedPlugs.contains(path);
        if (locked)
            n.lockedPlugs.add(path);
        else
            n.lockedPlugs.remove(path);
        return () -> {
            if (old)
                n.lockedPlugs.add(path);
            else
                n.lockedPlugs.remove(path);
        };
    }

    /**
     * Runs {@code edit} against the plug's attribute definition. Edits that shape
     * values (default, bounds, enum fields) are refused on a locked plug; display
     * flags may change on locked plugs so they can be hidden after locking.
     */
    Runnable applyEditAttribute(Plug plug, String property, boolean shapesValues, Consumer<Attribute> edit) {
        SceneNode n = require(plug.node());
        String path = plug.path();
        if (shapesValues && n.lockedPlugs.contains(path))
            throw new SceneOperationException("Cannot change " + property + " of locked plug", n.name, path);
        Attribute a = plug.attribute();
        Runnable restore = a.snapshot();
        edit.accept(a);
        return restore;
    }

    Runnable applyRemoveElement(Plug element, boolean breakConnections) {
        if (!element.isElement())
            throw new IllegalArgumentException("Not an array element: " + element.info());
        SceneNode n = require(element.node());
        SlotState state = new SlotState(n, element.path());
        if (!state.edges.isEmpty() && !breakConnections)
            throw new SceneOperationException("Array element is still connected", n.name, element.path());
        if (!state.locks.isEmpty())
            throw new SceneOperationException("Cannot remove locked array element", n.name, element.path());
        String arrayPath = element.parent().orElseThrow().path();
        TreeSet<Integer> set = n.indices.get(arrayPath);
        boolean removedIndex = set != null && set.remove(element.logicalIndex());
        state.clear();
        modCount++;
        return () -> {
            state.restore();
            if (removedIndex)
                n.indices.computeIfAbsent(arrayPath, k -> new TreeSet<>()).add(element.logicalIndex());
            modCount++;
        };
    }

    // ── Internals ───────────────────────────────────────────────────

    private void link(PlugKey source, PlugKey destination) {
        sources.put(destination, source);
        destinations.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(destination);
    }

    private void unlink(PlugKey source, PlugKey destination) {
        sources.remove(destination);
        Set<PlugKey> dst = destinations.get(source);
        if (dst != null) {
            dst.remove(destination);
            if (dst.isEmpty())
                destinations.remove(source);
        }
    }

    private boolean isKeyLocked(PlugKey key) {
        SceneNode n = nodes.get(key.nodeId());
        return n != null && n.lockedPlugs.contains(key.path());
    }

    // Records every element index along the plug's path as existing.
    private void markIndices(Plug plug, List<Runnable> undo) {
        SceneNode n = require(plug.node());
        for (Plug cur = plug; cur != null; cur = cur.parent().orElse(null)) {
            if (!cur.isElement())
                continue;
            String arrayPath = cur.parent().orElseThrow().path();
            int index = cur.logicalIndex();
            TreeSet<Integer> set = n.indices.computeIfAbsent(arrayPath, k -> new TreeSet<>());
            if (set.add(index))
                undo.add(() -> set.remove(index));
        }
    }

    private static void revert(List<Runnable> undo) {
        for (int i = undo.size() - 1; i >= 0; i--)
            undo.get(i).run();
    }

    private void validateName(String nodeName) {
        if (!NAME.matcher(nodeName).matches())
            throw new IllegalArgumentException("Invalid node name: '" + nodeName + "'");
    }

    private String uniqueName(String requested, long selfId) {
        if (!isNameTaken(requested, selfId))
            return requested;
        String stem = requested.replaceAll("\\d+$", "");
        int i = 1;
        while (isNameTaken(stem + i, selfId))
            i++;
        return stem + i;
    }

    private boolean isNameTaken(String candidate, long selfId) {
        for (SceneNode n : nodes.values()) {
            if (n.id != selfId && n.name.equals(candidate))
                return true;
        }
        return false;
    }

    static boolean isUnder(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "[") || path.startsWith(prefix + ".");
    }

    /** Values, locks, indices and connections stored under one plug path of a node. */
    private final class SlotState {
        final SceneNode node;
        final Map<String, Object> values = new HashMap<>();
        final Set<String> locks = new HashSet<>();
        final Map<String, TreeSet<Integer>> indices = new HashMap<>();
        final List<PlugKey[]> edges = new ArrayList<>();

        SlotState(SceneNode node, String prefix) {
            this.node = node;
            node.values.forEach((k, v) -> {
                if (isUnder(k, prefix))
                    values.put(k, v);
            });
            for (String k : node.lockedPlugs) {
                if (isUnder(k, prefix))
                    locks.add(k);
            }
            node.indices.forEach((k, v) -> {
                if (isUnder(k, prefix))
                    indices.put(k, v);
            });
            sources.forEach((dst, src) -> {
                boolean touches = (dst.nodeId() == node.id && dst.isUnder(prefix))
                        || (src.nodeId() == node.id && src.isUnder(prefix));
                if (touches)
                    edges.add(new PlugKey[] { src, dst });
            });
        }

        void clear() {
            for (PlugKey[] edge : edges) {
                if (edge[1].nodeId() != node.id && isKeyLocked(edge[1]))
                    throw new SceneOperationException("Cannot disconnect locked plug",
                            nodes.get(edge[1].nodeId()).name, edge[1].path());
            }
            values.keySet().forEach(node.values::remove);
            locks.forEach(node.lockedPlugs::remove);
            indices.keySet().forEach(node.indices::remove);
            for (PlugKey[] edge : edges)
                unlink(edge[0], edge[1]);
        }

        void restore() {
            node.values.putAll(values);
            node.lockedPlugs.addAll(locks);
            node.indices.putAll(indices);
            for (PlugKey[] edge : edges)
                link(edge[0], edge[1]);
        }
    }

    @Override
    public String toString() {
        return "Scene[" + nodes.size() + " nodes, " + sources.size() + " connections]";
    }
}
