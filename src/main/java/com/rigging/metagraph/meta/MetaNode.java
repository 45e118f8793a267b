package com.rigging.metagraph.meta;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import com.rigging.metagraph.MetaGraphConfig;
import com.rigging.metagraph.api.AttributeAlreadyExistsException;
import com.rigging.metagraph.api.ConnectionConflictException;
import com.rigging.metagraph.api.StaleReferenceException;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.io.AttributeRecord;
import com.rigging.metagraph.io.AttributeSerializer;
import com.rigging.metagraph.io.NodeRecord;
import com.rigging.metagraph.io.NodeSerializer;
import com.rigging.metagraph.nodes.LockGuard;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;
import com.rigging.metagraph.scene.SceneModifier;
import com.rigging.metagraph.traverse.DependencyWalk;
import com.rigging.metagraph.traverse.Direction;
import com.rigging.metagraph.traverse.MetaTreeWalk;

import lombok.extern.log4j.Log4j2;

/**
 * Persistent metadata record bound to one scene node.
 *
 * All state lives on the scene node: the {@code mClass} type tag, the
 * {@code mVersion} string, the {@code mMetaParent} message array receiving edges
 * from parents and the {@code mMetaChildren} message slot feeding children. A
 * meta node is a view over those attributes and holds nothing else besides its
 * handle.
 *
 * The handle is non-owning. Every operation checks that the scene node is still
 * alive and fails with {@link StaleReferenceException} once it is gone; only
 * {@link #exists()} and {@link #state()} are safe on a deleted node.
 *
 * Mutating methods run with the node lock temporarily cleared and restored, so a
 * locked meta node can only be changed through this API.
 *
 * Instances come from a {@link MetaFactory}. Subclasses declare a public
 * {@code (MetaFactory)} constructor and may add attributes by overriding
 * {@link #metaAttributes()}.
 */
@Log4j2
public abstract class MetaNode {
    public static final String CLASS_ATTR = "mClass";
    public static final String VERSION_ATTR = "mVersion";
    public static final String PARENT_ATTR = "mMetaParent";
    public static final String CHILDREN_ATTR = "mMetaChildren";
    public static final Set<String> STANDARD_ATTRIBUTES = Set.of(CLASS_ATTR, VERSION_ATTR, PARENT_ATTR,
            CHILDREN_ATTR);

    /** An attribute installed when the meta node is initialized. */
    public record MetaAttribute(AttributeSpec spec, Object value, boolean lock) {
    }

    private final MetaFactory factory;
    private NodeHandle handle;
    private MetaState state = MetaState.UNBOUND;
    private String lastKnownName;

    protected MetaNode(MetaFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    // ── Life cycle ──────────────────────────────────────────────────

    final void bind(NodeHandle node) {
        if (state != MetaState.UNBOUND)
            throw new IllegalStateException(this + " is already bound");
        handle = node.require();
        lastKnownName = node.name();
        state = MetaFactory.tagOf(node).isPresent() ? MetaState.INITIALIZED : MetaState.UNINITIALIZED;
    }

    /**
     * Queues the standard attributes with their values and locks onto
     * {@code mod}, so they land in the same undoable step as whatever was queued
     * before, including the creation of {@code node} itself. The instance is
     * bound once the modifier has applied.
     */
    final void initialize(SceneModifier mod, NodeHandle node, boolean lock) {
        if (state != MetaState.UNBOUND)
            throw new IllegalStateException(this + " is already bound");
        Scene scene = mod.scene();
        boolean exists = node.isAlive();
        boolean wasLocked = exists && scene.isNodeLocked(node);
        if (wasLocked)
            mod.setNodeLockState(node, false);
        for (MetaAttribute a : metaAttributes()) {
            String name = a.spec().name();
            if (exists && scene.hasAttribute(node, name))
                continue;
            mod.addAttribute(node, a.spec());
            if (a.value() == null && !a.lock())
                continue;
            mod.andThen(m -> {
                Plug plug = node.plug(name);
                if (a.value() != null)
                    Plugs.setValue(m, plug, a.value());
                if (a.lock())
                    m.setLocked(plug, true);
            });
        }
        if (lock || wasLocked)
            mod.setNodeLockState(node, true);
    }

    /**
     * Attributes installed on a fresh node. Subclasses extend the list returned
     * by the super call.
     */
    protected List<MetaAttribute> metaAttributes() {
        List<MetaAttribute> out = new ArrayList<>();
        out.add(new MetaAttribute(AttributeSpec.of(CLASS_ATTR, AttributeKind.STRING),
                MetaRegistry.tagOf(getClass()), true));
        out.add(new MetaAttribute(AttributeSpec.of(VERSION_ATTR, AttributeKind.STRING), config().getMetaVersion(),
                true));
        out.add(new MetaAttribute(AttributeSpec.array(PARENT_ATTR, AttributeKind.MESSAGE), null, false));
        out.add(new MetaAttribute(AttributeSpec.of(CHILDREN_ATTR, AttributeKind.MESSAGE), null, false));
        return out;
    }

    /** Never throws. */
    public MetaState state() {
        if (handle != null && state != MetaState.INVALID && !handle.isAlive())
            state = MetaState.INVALID;
        return state;
    }

    /** Never throws. */
    public boolean exists() {
        return handle != null && handle.isAlive();
    }

    protected final NodeHandle requireLive() {
        if (handle == null)
            throw new IllegalStateException(getClass().getSimpleName() + " is not bound to a scene node");
        if (state == MetaState.INVALID || !handle.isAlive()) {
            state = MetaState.INVALID;
            throw new StaleReferenceException(lastKnownName);
        }
        lastKnownName = handle.name();
        return handle;
    }

    protected final NodeHandle requireInitialized() {
        NodeHandle node = requireLive();
        if (state != MetaState.INITIALIZED)
            throw new IllegalStateException(lastKnownName + " does not carry the meta attributes");
        return node;
    }

    protected final <T> T callUnlocked(Supplier<T> action) {
        return LockGuard.withUnlocked(requireInitialized(), action);
    }

    protected final void runUnlocked(Runnable action) {
        LockGuard.runUnlocked(requireInitialized(), action);
    }

    // ── Identity ────────────────────────────────────────────────────

    public NodeHandle handle() {
        return requireLive();
    }

    /**
     * The factory this wrapper was made by. Unlike the node accessors this keeps
     * working after the node is deleted, so a stale wrapper can still reach the
     * session that owned it.
     */
    public MetaFactory factory() {
        return factory;
    }

    /** The factory's scene; available on stale wrappers like {@link #factory()}. */
    public Scene scene() {
        return factory.scene();
    }

    protected MetaGraphConfig config() {
        return factory.config();
    }

    public String name() {
        return requireLive().name();
    }

    public String fullPathName() {
        return requireLive().fullPathName();
    }

    /** The type tag stored on the node, which names its concrete subtype. */
    public String typeTag() {
        requireInitialized();
        return (String) requireAttribute(CLASS_ATTR).rawValue();
    }

    public String version() {
        requireInitialized();
        return (String) requireAttribute(VERSION_ATTR).rawValue();
    }

    public boolean isLocked() {
        return Nodes.isLocked(requireLive());
    }

    /** @return true when the lock state changed. */
    public boolean lock(boolean state) {
        return Nodes.lockNode(requireLive(), state);
    }

    /** @return the name the node ended up with. */
    public String rename(String newName) {
        NodeHandle node = requireInitialized();
        return callUnlocked(() -> Nodes.rename(node, newName));
    }

    // ── Attributes ──────────────────────────────────────────────────

    /** The plug for an attribute name or path, empty when it does not exist. */
    public Optional<Plug> attribute(String name) {
        return scene().findPlug(requireLive(), name);
    }

    /** @throws com.rigging.metagraph.api.AttributeNotFoundException when missing. */
    public Plug requireAttribute(String name) {
        return requireLive().plug(name);
    }

    public boolean hasAttribute(String name) {
        return Nodes.hasAttribute(requireLive(), name);
    }

    /** Plain value of an attribute; empty when the attribute is missing or carries no value. */
    public Optional<Object> getValue(String name) {
        return attribute(name).map(Plugs::getValue);
    }

    public Plug addAttribute(String name, Object value, AttributeKind kind, boolean isArray, boolean lock) {
        return addAttribute(isArray ? AttributeSpec.array(name, kind) : AttributeSpec.of(name, kind), value, lock);
    }

    /**
     * Adds a dynamic attribute and gives it a value. A {@link NodeHandle} or
     * {@link MetaNode} value on a message attribute connects this node to it.
     *
     * @throws AttributeAlreadyExistsException when the attribute exists.
     */
    public Plug addAttribute(AttributeSpec spec, Object value, boolean lock) {
        NodeHandle node = requireInitialized();
        if (hasAttribute(spec.name()))
            throw new AttributeAlreadyExistsException(node.name(), spec.name());
        return callUnlocked(() -> {
            Plug plug = Nodes.addAttribute(node, spec);
            try {
                if (value instanceof MetaNode)
                    connectTo(spec.name(), ((MetaNode) value).handle());
                else if (value instanceof NodeHandle)
                    connectTo(spec.name(), (NodeHandle) value);
                else if (value != null)
                    Plugs.setValue(plug, value);
            } catch (RuntimeException e) {
                removeAttributeUnchecked(spec.name());
                throw e;
            }
            if (lock)
                Plugs.setLockState(plug, true);
            return plug;
        });
    }

    /**
     * Sets an attribute value, clearing and restoring the slot lock around the
     * write. Node values on message attributes become connections.
     */
    public void setAttribute(String name, Object value) {
        requireInitialized();
        Plug plug = requireAttribute(name);
        if (plug.kind() == AttributeKind.MESSAGE && value instanceof MetaNode) {
            connectTo(name, ((MetaNode) value).handle());
            return;
        }
        if (plug.kind() == AttributeKind.MESSAGE && value instanceof NodeHandle) {
            connectTo(name, (NodeHandle) value);
            return;
        }
        LockGuard.runUnlocked(plug, () -> Plugs.setValue(plug, value));
    }

    /** @return false when there is no such attribute. */
    public boolean removeAttribute(String name) {
        requireInitialized();
        if (!hasAttribute(name))
            return false;
        return callUnlocked(() -> removeAttributeUnchecked(name));
    }

    // Disconnects and unlocks everything under the attribute, then removes it.
    private boolean removeAttributeUnchecked(String name) {
        NodeHandle node = requireLive();
        Plug plug = node.plug(name);
        Set<Plug> slots = slotsOf(plug);
        for (Plug slot : slots) {
            if (slot.isConnected())
                Plugs.disconnectPlug(slot, true, true);
        }
        for (Plug slot : slots)
            Plugs.setLockState(slot, false);
        return LockGuard.withUnlocked(node, () -> Nodes.removeAttribute(node, name));
    }

    public void renameAttribute(String name, String newName) {
        NodeHandle node = requireInitialized();
        requireAttribute(name);
        runUnlocked(() -> Nodes.renameAttribute(node, name, newName));
    }

    public List<Plug> iterAttributes() {
        return Nodes.iterAttributes(requireLive(), null);
    }

    /** Plugs whose path matches the pattern anywhere. */
    public List<Plug> findPlugsByFilteredName(String regex) {
        Pattern pattern = Pattern.compile(regex);
        List<Plug> out = new ArrayList<>();
        for (Plug plug : iterAttributes()) {
            if (pattern.matcher(plug.path()).find())
                out.add(plug);
        }
        return out;
    }

    public List<Plug> findPlugsByKind(AttributeKind kind) {
        List<Plug> out = new ArrayList<>();
        for (Plug plug : iterAttributes()) {
            if (plug.kind() == kind)
                out.add(plug);
        }
        return out;
    }

    // The plug, its existing elements and its compound children.
    private static Set<Plug> slotsOf(Plug plug) {
        Set<Plug> out = new LinkedHashSet<>();
        out.add(plug);
        if (plug.isArray()) {
            for (int index : plug.existingIndices()) {
                Plug element = plug.elementByLogicalIndex(index);
                out.addAll(slotsOf(element));
            }
        } else if (plug.isCompound()) {
            for (Plug child : plug.children())
                out.addAll(slotsOf(child));
        }
        return out;
    }

    // ── Connections ─────────────────────────────────────────────────

    public List<Connection> iterConnections(boolean source, boolean destination) {
        return Nodes.iterConnections(requireLive(), source, destination);
    }

    /**
     * Nodes connected to the attribute (or to any attribute when null) whose
     * full path matches the pattern.
     */
    public List<NodeHandle> findConnectedNodes(String attributeName, String regex) {
        List<Plug> plugs = new ArrayList<>();
        if (attributeName != null && !attributeName.isEmpty()) {
            plugs.addAll(slotsOf(requireAttribute(attributeName)));
        } else {
            for (Plug plug : topLevelPlugs())
                plugs.addAll(slotsOf(plug));
        }
        Set<NodeHandle> out = new LinkedHashSet<>();
        for (Plug plug : plugs) {
            for (Plug peer : Plugs.filterConnectedNodes(plug, regex, true, true))
                out.add(peer.node());
        }
        return new ArrayList<>(out);
    }

    /**
     * Nodes fed by the attributes whose name matches the pattern, optionally also
     * through the same attributes on every meta child.
     */
    public List<NodeHandle> findConnectedNodesByAttributeName(String regex, boolean recursive) {
        Set<NodeHandle> out = new LinkedHashSet<>();
        collectFedNodes(this, regex, out);
        if (recursive) {
            for (MetaNode child : children(config().getDefaultDepthLimit()))
                collectFedNodes(child, regex, out);
        }
        return new ArrayList<>(out);
    }

    private static void collectFedNodes(MetaNode meta, String regex, Set<NodeHandle> out) {
        for (Plug plug : meta.findPlugsByFilteredName(regex)) {
            for (Plug slot : slotsOf(plug)) {
                for (Plug destination : slot.destinations())
                    out.add(destination.node());
            }
        }
    }

    /** Nodes this meta node feeds, meta nodes excluded unless asked for. */
    public List<NodeHandle> iterChildren(boolean includeMeta) {
        Set<NodeHandle> out = new LinkedHashSet<>();
        for (Connection c : iterConnections(true, false)) {
            NodeHandle node = c.destination().node();
            if (includeMeta || !factory.isMetaNode(node))
                out.add(node);
        }
        return new ArrayList<>(out);
    }

    /** Every node this meta node feeds, plus those fed by its meta children when recursive. */
    public List<NodeHandle> allChildrenNodes(boolean recursive) {
        Set<NodeHandle> out = new LinkedHashSet<>(iterChildren(true));
        if (recursive) {
            for (MetaNode child : children(config().getDefaultDepthLimit()))
                out.addAll(child.iterChildren(true));
        }
        return new ArrayList<>(out);
    }

    public Plug connectTo(String attributeName, MetaNode target) {
        return connectTo(attributeName, target.handle(), null);
    }

    public Plug connectTo(String attributeName, NodeHandle target) {
        return connectTo(attributeName, target, null);
    }

    /**
     * Makes {@code attributeName} on this node the single relation to
     * {@code target}, received by {@code targetAttributeName} (the configured
     * peer name when null). Message attributes are created on either side when
     * missing. A previous target of the relation is disconnected and loses the
     * peer slot created for it. The receiving slot is left locked.
     *
     * @return the receiving plug on the target.
     */
    public Plug connectTo(String attributeName, NodeHandle target, String targetAttributeName) {
        NodeHandle node = requireInitialized();
        target.require();
        if (target.equals(node))
            throw new IllegalArgumentException("Cannot relate " + node.name() + " to itself");
        String peerName = peerName(targetAttributeName);
        return callUnlocked(() -> LockGuard.withUnlocked(target, () -> {
            Plug source = attribute(attributeName)
                    .orElseGet(() -> Nodes.addAttribute(node, attributeName, AttributeKind.MESSAGE, false));
            if (source.kind() != AttributeKind.MESSAGE || source.isArray())
                throw new IllegalArgumentException("Relation " + source.info() + " must be a message attribute");
            try (LockGuard sourceGuard = LockGuard.unlock(source)) {
                Plug current = null;
                for (Plug destination : source.destinations()) {
                    if (destination.node().equals(target) && destination.name().equals(peerName))
                        current = destination;
                    else
                        detachPeer(destination);
                }
                if (current != null) {
                    Plugs.setLockState(current, true);
                    return current;
                }
                Plug destination = receivingSlot(target, peerName);
                releaseDestination(destination);
                Plugs.connectPlugs(source, destination, true);
                Plugs.setLockState(destination, true);
                return destination;
            }
        }));
    }

    /**
     * Connects an existing plug of this node to {@code target} without touching
     * other connections of the plug. The receiving slot keeps its lock state.
     */
    public Plug connectToByPlug(Plug sourcePlug, NodeHandle target, String targetAttributeName) {
        requireInitialized();
        target.require();
        String peerName = peerName(targetAttributeName);
        return callUnlocked(() -> LockGuard.withUnlocked(target, () -> {
            Plug source = sourcePlug.isArray() ? Plugs.nextAvailableElement(sourcePlug) : sourcePlug;
            Plug destination = receivingSlot(target, peerName);
            boolean wasLocked = destination.isLocked();
            releaseDestination(destination);
            try (LockGuard sourceGuard = LockGuard.unlock(source)) {
                Plugs.connectPlugs(source, destination, true);
            }
            if (wasLocked)
                Plugs.setLockState(destination, true);
            return destination;
        }));
    }

    /**
     * Removes every connection from this node to {@code other}, the receiving
     * slots created for them and the relation attributes left unused here.
     *
     * @return true when something was disconnected.
     */
    public boolean disconnectFromNode(NodeHandle other) {
        NodeHandle node = requireInitialized();
        return callUnlocked(() -> {
            boolean any = false;
            for (Connection c : Nodes.iterConnections(node, true, false)) {
                if (!c.destination().node().equals(other))
                    continue;
                detachPeer(c.destination());
                removeTransientSlot(c.source());
                any = true;
            }
            return any;
        });
    }

    private String peerName(String targetAttributeName) {
        return targetAttributeName == null || targetAttributeName.isEmpty() ? config().getPeerAttributeName()
                : targetAttributeName;
    }

    // The slot on target that will receive a relation; arrays hand out their next free element.
    private static Plug receivingSlot(NodeHandle target, String peerName) {
        Plug plug = target.scene().findPlug(target, peerName)
                .orElseGet(() -> Nodes.addAttribute(target, peerName, AttributeKind.MESSAGE, false));
        return plug.isArray() ? Plugs.nextAvailableDestElement(plug) : plug;
    }

    // Breaks the destination's incoming edge; a relation attribute of ours left unused goes with it.
    private void releaseDestination(Plug destination) {
        Optional<Plug> previous = destination.source();
        if (previous.isEmpty())
            return;
        Plugs.disconnectPlug(destination, true, false);
        if (previous.get().node().equals(handle))
            removeTransientSlot(previous.get());
    }

    private static void detachPeer(Plug destination) {
        Plugs.disconnectPlug(destination, true, false);
        removeTransientSlot(destination);
    }

    /**
     * Removes a relation slot that no longer carries a connection: an element of
     * a message array, or a dynamic top level message attribute that is not one
     * of the standard meta attributes.
     */
    static void removeTransientSlot(Plug slot) {
        NodeHandle owner = slot.node();
        if (!owner.isAlive() || slot.isConnected())
            return;
        SceneModifier mod = new SceneModifier(owner.scene());
        if (queueSlotRemoval(mod, slot))
            mod.doIt();
    }

    // Queues the removal of a slot that carries no connection once the batch applies.
    private static boolean queueSlotRemoval(SceneModifier mod, Plug slot) {
        if (slot.kind() != AttributeKind.MESSAGE)
            return false;
        NodeHandle owner = slot.node();
        if (slot.isElement()) {
            if (slot.isLocked())
                mod.setLocked(slot, false);
            mod.removeMultiInstance(slot, false);
            return true;
        }
        if (!slot.isDynamic() || slot.isChild() || slot.isArray() || STANDARD_ATTRIBUTES.contains(slot.name()))
            return false;
        boolean ownerLocked = owner.scene().isNodeLocked(owner);
        if (slot.isLocked())
            mod.setLocked(slot, false);
        if (ownerLocked)
            mod.setNodeLockState(owner, false);
        mod.removeAttribute(owner, slot.name());
        if (ownerLocked)
            mod.setNodeLockState(owner, true);
        return true;
    }

    // ── Parent and child relation ───────────────────────────────────

    /**
     * Connects {@code parent.mMetaChildren} to the next free element of this
     * node's {@code mMetaParent}. With {@link ParentPolicy#SINGLE} the current
     * parents are removed first.
     *
     * @throws ConnectionConflictException when the edge would close a cycle and
     *         cycles are rejected.
     */
    public void addParent(MetaNode parent) {
        NodeHandle node = requireInitialized();
        parent.requireInitialized();
        if (parent.equals(this))
            throw new ConnectionConflictException(node.name() + " cannot be its own meta parent", node.name(),
                    PARENT_ATTR);
        if (metaParents(false).contains(parent))
            return;
        if (config().getCyclePolicy() == CyclePolicy.REJECT && parent.ancestors().contains(this))
            throw new ConnectionConflictException("Parenting " + node.name() + " under " + parent.name()
                    + " would close a cycle", node.name(), PARENT_ATTR);
        if (config().getParentPolicy() == ParentPolicy.SINGLE)
            removeParent(null);
        runUnlocked(() -> {
            Plug parents = requireAttribute(PARENT_ATTR);
            Plug element = Plugs.nextAvailableDestElement(parents);
            Plug children = parent.requireAttribute(CHILDREN_ATTR);
            try (LockGuard childrenGuard = LockGuard.unlock(children)) {
                Plugs.connectPlugs(children, element, false);
            }
        });
        log.debug("Parented {} under {}", node.name(), parent.name());
    }

    public void addChild(MetaNode child) {
        child.addParent(this);
    }

    /**
     * Disconnects and removes the parent elements fed by {@code parent}, or all
     * of them when parent is null.
     *
     * @return true when an edge was removed.
     */
    public boolean removeParent(MetaNode parent) {
        NodeHandle node = requireInitialized();
        NodeHandle parentNode = parent == null ? null : parent.handle();
        Plug parents = requireAttribute(PARENT_ATTR);
        SceneModifier mod = new SceneModifier(node.scene());
        boolean any = false;
        for (int index : parents.existingIndices()) {
            Plug element = parents.elementByLogicalIndex(index);
            Optional<Plug> source = element.source();
            if (source.isEmpty() || (parentNode != null && !source.get().node().equals(parentNode)))
                continue;
            if (element.isLocked())
                mod.setLocked(element, false);
            mod.removeMultiInstance(element, true);
            any = true;
        }
        mod.doIt();
        return any;
    }

    public boolean removeAllParents() {
        return removeParent(null);
    }

    public boolean removeChild(MetaNode child) {
        return child.removeParent(this);
    }

    /** The first meta parent, if any. */
    public Optional<MetaNode> metaParent() {
        List<MetaNode> parents = metaParents(false);
        return parents.isEmpty() ? Optional.empty() : Optional.of(parents.get(0));
    }

    /** Meta nodes feeding {@code mMetaParent}, each reported once; ancestors too when recursive. */
    public List<MetaNode> metaParents(boolean recursive) {
        requireInitialized();
        List<MetaNode> out = new ArrayList<>();
        Set<NodeHandle> seen = new HashSet<>();
        seen.add(handle);
        collectParents(this, recursive, out, seen);
        return out;
    }

    private void collectParents(MetaNode meta, boolean recursive, List<MetaNode> out, Set<NodeHandle> seen) {
        Optional<Plug> parents = meta.attribute(PARENT_ATTR);
        if (parents.isEmpty())
            return;
        for (int index : parents.get().existingIndices()) {
            Optional<Plug> source = parents.get().elementByLogicalIndex(index).source();
            if (source.isEmpty() || !factory.isMetaNode(source.get().node()) || !seen.add(source.get().node()))
                continue;
            MetaNode parent = factory.wrap(source.get().node());
            out.add(parent);
            if (recursive)
                collectParents(parent, true, out, seen);
        }
    }

    private Set<MetaNode> ancestors() {
        return new HashSet<>(metaParents(true));
    }

    /** Direct meta children. */
    public List<MetaNode> metaChildren() {
        List<MetaNode> out = new ArrayList<>();
        children(1).forEach(out::add);
        return out;
    }

    public Iterable<MetaNode> children() {
        return children(config().getDefaultDepthLimit());
    }

    /**
     * Lazy walk down the {@code mMetaChildren} relation. A depth limit of 1
     * yields direct children and a limit below 1 yields nothing.
     */
    public Iterable<MetaNode> children(int depthLimit) {
        return walk(CHILDREN_ATTR, depthLimit, Direction.DOWN);
    }

    public Iterable<MetaNode> parents() {
        return parents(config().getDefaultDepthLimit());
    }

    /** Lazy walk up the {@code mMetaParent} relation. */
    public Iterable<MetaNode> parents(int depthLimit) {
        return walk(PARENT_ATTR, depthLimit, Direction.UP);
    }

    private Iterable<MetaNode> walk(String attributeName, int depthLimit, Direction direction) {
        Plug start = requireAttribute(attributeName);
        DependencyWalk plugs = new DependencyWalk(start, attributeName, depthLimit, direction);
        return () -> new MappingIterator<>(plugs.iterator(), plug -> factory.tryWrap(plug.node()));
    }

    public Iterable<MetaNode> tree(int depthLimit) {
        return tree(depthLimit, Direction.DOWN);
    }

    /**
     * Lazy walk over every connection in the given direction, reporting the meta
     * nodes reached through any attribute, not only the parent/child relation.
     * Non-meta nodes end their branch.
     */
    public Iterable<MetaNode> tree(int depthLimit, Direction direction) {
        MetaTreeWalk nodes = new MetaTreeWalk(requireInitialized(), depthLimit, direction, factory::isMetaNode);
        return () -> new MappingIterator<>(nodes.iterator(), node -> Optional.of(factory.wrap(node)));
    }

    public boolean isRoot() {
        return metaParents(false).isEmpty();
    }

    /** Topmost ancestor reached through first parents; this node when it is a root. */
    public MetaNode metaRoot() {
        MetaNode current = this;
        Set<MetaNode> seen = new HashSet<>();
        while (seen.add(current)) {
            Optional<MetaNode> parent = current.metaParent();
            if (parent.isEmpty())
                break;
            current = parent.get();
        }
        return current;
    }

    /**
     * Meta descendants whose name matches the pattern, or whose string value of
     * {@code attributeName} matches when an attribute is given.
     */
    public List<MetaNode> findChildrenByFilter(String regex, String attributeName, int depthLimit) {
        Pattern pattern = Pattern.compile(regex);
        List<MetaNode> out = new ArrayList<>();
        for (MetaNode child : children(depthLimit)) {
            String text;
            if (attributeName == null || attributeName.isEmpty()) {
                text = child.name();
            } else {
                Object value = child.getValue(attributeName).orElse(null);
                if (!(value instanceof String))
                    continue;
                text = (String) value;
            }
            if (pattern.matcher(text).find())
                out.add(child);
        }
        return out;
    }

    /** Direct meta children carrying the given type tag. */
    public List<MetaNode> findChildrenByType(String tag) {
        List<MetaNode> out = new ArrayList<>();
        for (MetaNode child : metaChildren()) {
            if (child.typeTag().equals(tag))
                out.add(child);
        }
        return out;
    }

    // ── Persistence and deletion ────────────────────────────────────

    /**
     * Records and then removes the attributes installed by
     * {@link #metaAttributes()}. The node stops being a meta node.
     */
    public List<AttributeRecord> purgeMetaAttributes() {
        requireInitialized();
        List<AttributeRecord> records = new ArrayList<>();
        runUnlocked(() -> {
            for (MetaAttribute a : metaAttributes()) {
                Optional<Plug> plug = attribute(a.spec().name());
                if (plug.isEmpty())
                    continue;
                AttributeSerializer.serialize(plug.get()).ifPresent(records::add);
                removeAttributeUnchecked(a.spec().name());
            }
        });
        state = MetaState.UNINITIALIZED;
        return records;
    }

    /** Node record of the underlying node, incoming connections included. */
    public NodeRecord serialize() {
        return NodeSerializer.serializeNode(requireLive(), null, true);
    }

    /**
     * Disconnects every edge touching this node, removes the relation slots that
     * existed only to hold those edges on the peers, then deletes the node. All of
     * it is one undoable step.
     */
    public void delete() {
        NodeHandle node = requireLive();
        String name = node.name();
        Set<Plug> peerSlots = new LinkedHashSet<>();
        for (Connection c : Nodes.iterConnections(node, true, true)) {
            Plug peer = c.source().node().equals(node) ? c.destination() : c.source();
            if (!connectedBeyond(peer, node))
                peerSlots.add(peer);
        }
        SceneModifier mod = new SceneModifier(node.scene());
        Nodes.delete(mod, node);
        for (Plug slot : peerSlots)
            queueSlotRemoval(mod, slot);
        mod.doIt();
        state = MetaState.INVALID;
        log.debug("Deleted meta node '{}'", name);
    }

    // Whether the slot has a connection to any node other than {@code node}.
    private static boolean connectedBeyond(Plug slot, NodeHandle node) {
        Optional<Plug> source = slot.source();
        if (source.isPresent() && !source.get().node().equals(node))
            return true;
        for (Plug destination : slot.destinations()) {
            if (!destination.node().equals(node))
                return true;
        }
        return false;
    }

    // ── Object ──────────────────────────────────────────────────────

    private Iterable<Plug> topLevelPlugs() {
        NodeHandle node = requireLive();
        List<Plug> out = new ArrayList<>();
        node.scene().attributes(node).forEach(a -> out.add(node.plug(a.name())));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetaNode))
            return false;
        MetaNode other = (MetaNode) o;
        return handle != null && handle.equals(other.handle);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(handle);
    }

    @Override
    public String toString() {
        String label = exists() ? handle.name() : lastKnownName == null ? "<unbound>" : "<deleted " + lastKnownName + ">";
        return getClass().getSimpleName() + ":" + label;
    }

    /** Maps walk results to meta nodes, skipping those that cannot be mapped. */
    private static final class MappingIterator<S> implements Iterator<MetaNode> {
        private final Iterator<S> source;
        private final Function<S, Optional<MetaNode>> mapper;
        private final Deque<MetaNode> buffer = new ArrayDeque<>(1);

        MappingIterator(Iterator<S> source, Function<S, Optional<MetaNode>> mapper) {
            this.source = source;
            this.mapper = mapper;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && source.hasNext())
                mapper.apply(source.next()).ifPresent(buffer::add);
            return !buffer.isEmpty();
        }

        @Override
        public MetaNode next() {
            if (!hasNext())
                throw new NoSuchElementException();
            return buffer.poll();
        }
    }
}
