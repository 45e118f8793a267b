package com.rigging.metagraph.attr;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.regex.Pattern;

import com.rigging.metagraph.api.ConnectionConflictException;
import com.rigging.metagraph.api.UnsupportedKindOperationException;
import com.rigging.metagraph.scene.Attribute;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.SceneModifier;

/**
 * Generic value marshalling over plugs, dispatching on {@link AttributeKind}.
 *
 * Array plugs read and write element by element and compound plugs child by
 * child, so nested shapes reduce to one dispatch per leaf. Message plugs have
 * no value: they read as empty and a {@link Plug} written to one is a request to
 * connect.
 */
public final class Plugs {

    private Plugs() {
    }

    // ── Values ──────────────────────────────────────────────────────

    public static TypedValue getValueAndKind(Plug plug) {
        AttributeKind kind = plug.kind();
        if (!kind.carriesValue() && !plug.isCompound())
            return new TypedValue(kind, null);
        if (plug.isArray()) {
            List<TypedValue> elements = new ArrayList<>();
            for (int index : plug.existingIndices())
                elements.add(getValueAndKind(plug.elementByLogicalIndex(index)));
            return new TypedValue(kind, elements);
        }
        if (plug.isCompound()) {
            List<TypedValue> children = new ArrayList<>();
            for (Plug child : plug.children())
                children.add(getValueAndKind(child));
            return new TypedValue(kind, children);
        }
        return new TypedValue(kind, plug.rawValue());
    }

    /**
     * Plain value of a plug: the canonical leaf value, a list of element values
     * for arrays, a list of child values for compounds and null for messages,
     * message arrays included.
     */
    public static Object getValue(Plug plug) {
        return unwrap(getValueAndKind(plug));
    }

    private static Object unwrap(TypedValue typed) {
        if (typed.value() instanceof List) {
            List<?> items = (List<?>) typed.value();
            if (items.isEmpty() || !(items.get(0) instanceof TypedValue))
                return items;
            List<Object> out = new ArrayList<>();
            for (TypedValue t : typed.elements())
                out.add(unwrap(t));
            return out;
        }
        return typed.value();
    }

    /** Sets the value as one undoable step. */
    public static void setValue(Plug plug, Object value) {
        SceneModifier mod = new SceneModifier(plug.scene());
        setValue(mod, plug, value);
        mod.doIt();
    }

    /**
     * Queues the writes needed to give {@code plug} the value. Arrays take a list
     * (element i goes to logical index i), compounds a list in child order or a
     * map by child name.
     */
    public static void setValue(SceneModifier mod, Plug plug, Object value) {
        if (value instanceof TypedValue)
            value = ((TypedValue) value).value();
        if (plug.kind() == AttributeKind.MESSAGE) {
            if (value instanceof Plug) {
                Plug target = (Plug) value;
                connectPlugs(mod, plug.isArray() ? nextAvailableElement(plug) : plug, target, true);
            } else if (value != null) {
                throw new IllegalArgumentException("Message plug " + plug + " only accepts a plug to connect");
            }
            return;
        }
        if (plug.isArray()) {
            List<?> items = asList(value);
            for (int i = 0; i < items.size(); i++)
                setValue(mod, plug.elementByLogicalIndex(i), items.get(i));
            return;
        }
        if (plug.isCompound()) {
            List<Plug> children = plug.children();
            if (value instanceof Map) {
                Map<?, ?> byName = (Map<?, ?>) value;
                for (Plug child : children) {
                    if (byName.containsKey(child.name()))
                        setValue(mod, child, byName.get(child.name()));
                }
                return;
            }
            List<?> items = asList(value);
            if (items.size() > children.size())
                throw new IllegalArgumentException(
                        "Compound " + plug + " has " + children.size() + " children, got " + items.size() + " values");
            for (int i = 0; i < items.size(); i++)
                setValue(mod, children.get(i), items.get(i));
            return;
        }
        mod.setValue(plug, value);
    }

    private static List<?> asList(Object value) {
        if (value == null)
            return List.of();
        if (value instanceof List)
            return (List<?>) value;
        if (value instanceof Object[])
            return Arrays.asList((Object[]) value);
        if (value.getClass().isArray()) {
            List<Object> out = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++)
                out.add(Array.get(value, i));
            return out;
        }
        throw new IllegalArgumentException("Expected a list value, got " + value.getClass().getSimpleName());
    }

    // ── Connections and locks ───────────────────────────────────────

    /**
     * Queues a connection. When the destination already has a different source
     * it is disconnected first if {@code force} is set, otherwise the call fails.
     *
     * @throws ConnectionConflictException when the destination is occupied and
     *         force is false.
     */
    public static void connectPlugs(SceneModifier mod, Plug source, Plug destination, boolean force) {
        Optional<Plug> existing = destination.source();
        if (existing.isPresent()) {
            if (existing.get().equals(source))
                return;
            if (!force)
                throw new ConnectionConflictException("Plug " + destination + " has incoming connection "
                        + existing.get(), destination.node().name(), destination.path());
            mod.disconnect(existing.get(), destination);
        }
        mod.connect(source, destination);
    }

    public static void connectPlugs(Plug source, Plug destination, boolean force) {
        SceneModifier mod = new SceneModifier(source.scene());
        connectPlugs(mod, source, destination, force);
        mod.doIt();
    }

    /**
     * Disconnects the incoming connection (when {@code source}) and the outgoing
     * ones (when {@code destination}), unlocking the plugs involved so the host
     * accepts the change.
     *
     * @return true when at least one connection was removed.
     */
    public static boolean disconnectPlug(Plug plug, boolean source, boolean destination) {
        SceneModifier mod = new SceneModifier(plug.scene());
        boolean any = false;
        if (plug.isLocked())
            mod.setLocked(plug, false);
        if (source && plug.isDestination()) {
            Plug src = plug.source().orElseThrow();
            if (src.isLocked())
                mod.setLocked(src, false);
            mod.disconnect(src, plug);
            any = true;
        }
        if (destination) {
            for (Plug dst : plug.destinations()) {
                if (dst.isLocked())
                    mod.setLocked(dst, false);
                mod.disconnect(plug, dst);
                any = true;
            }
        }
        mod.doIt();
        return any;
    }

    /** @return true when the lock state changed. */
    public static boolean setLockState(Plug plug, boolean state) {
        if (plug.isLocked() == state)
            return false;
        SceneModifier mod = new SceneModifier(plug.scene());
        mod.setLocked(plug, state);
        mod.doIt();
        return true;
    }

    // ── Default, bounds and enums ───────────────────────────────────

    public static Optional<Object> plugDefault(Plug plug) {
        if (!plug.kind().supportsDefault())
            return Optional.empty();
        return Optional.ofNullable(plug.attribute().defaultValue());
    }

    /** @return false when the kind has no default. */
    public static boolean setPlugDefault(Plug plug, Object value) {
        if (!plug.kind().supportsDefault())
            return false;
        new SceneModifier(plug.scene()).setDefault(plug, value).doIt();
        return true;
    }

    public static boolean hasMin(Plug plug) {
        return plug.kind().supportsBounds() && plug.attribute().min().isPresent();
    }

    public static boolean hasMax(Plug plug) {
        return plug.kind().supportsBounds() && plug.attribute().max().isPresent();
    }

    public static boolean hasSoftMin(Plug plug) {
        return plug.kind().supportsBounds() && plug.attribute().softMin().isPresent();
    }

    public static boolean hasSoftMax(Plug plug) {
        return plug.kind().supportsBounds() && plug.attribute().softMax().isPresent();
    }

    /** @throws UnsupportedKindOperationException when the kind has no bounds. */
    public static Optional<Double> getMin(Plug plug) {
        return bounded(plug, "getMin").min();
    }

    public static Optional<Double> getMax(Plug plug) {
        return bounded(plug, "getMax").max();
    }

    public static Optional<Double> getSoftMin(Plug plug) {
        return bounded(plug, "getSoftMin").softMin();
    }

    public static Optional<Double> getSoftMax(Plug plug) {
        return bounded(plug, "getSoftMax").softMax();
    }

    // The setters report failure instead of throwing; callers check the result.
    // Each is one undoable step and is refused on a locked plug.
    public static boolean setMin(Plug plug, double value) {
        if (!plug.kind().supportsBounds())
            return false;
        new SceneModifier(plug.scene()).setMin(plug, value).doIt();
        return true;
    }

    public static boolean setMax(Plug plug, double value) {
        if (!plug.kind().supportsBounds())
            return false;
        new SceneModifier(plug.scene()).setMax(plug, value).doIt();
        return true;
    }

    public static boolean setSoftMin(Plug plug, double value) {
        if (!plug.kind().supportsBounds())
            return false;
        new SceneModifier(plug.scene()).setSoftMin(plug, value).doIt();
        return true;
    }

    public static boolean setSoftMax(Plug plug, double value) {
        if (!plug.kind().supportsBounds())
            return false;
        new SceneModifier(plug.scene()).setSoftMax(plug, value).doIt();
        return true;
    }

    private static Attribute bounded(Plug plug, String operation) {
        if (!plug.kind().supportsBounds())
            throw new UnsupportedKindOperationException(operation, plug.kind(), plug.node().name(), plug.path());
        return plug.attribute();
    }

    public static List<String> enumNames(Plug plug) {
        if (plug.kind() != AttributeKind.ENUM)
            throw new UnsupportedKindOperationException("enumNames", plug.kind(), plug.node().name(), plug.path());
        return plug.attribute().enumFields();
    }

    public static List<Integer> enumIndices(Plug plug) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < enumNames(plug).size(); i++)
            out.add(i);
        return out;
    }

    public static boolean setEnumNames(Plug plug, List<String> names) {
        if (plug.kind() != AttributeKind.ENUM)
            return false;
        new SceneModifier(plug.scene()).setEnumFields(plug, names).doIt();
        return true;
    }

    // ── Arrays and compounds ────────────────────────────────────────

    /** Leaf plugs under a plug, depth first: existing array elements and compound children. */
    public static List<Plug> iterLeaves(Plug plug) {
        List<Plug> out = new ArrayList<>();
        collectLeaves(plug, out);
        return out;
    }

    private static void collectLeaves(Plug plug, List<Plug> out) {
        if (plug.isArray()) {
            for (int index : plug.existingIndices())
                collectLeaves(plug.elementByLogicalIndex(index), out);
        } else if (plug.isCompound()) {
            for (Plug child : plug.children())
                collectLeaves(child, out);
        } else {
            out.add(plug);
        }
    }

    /** First existing element that is not a connection source, else the next unused index. */
    public static Plug nextAvailableElement(Plug arrayPlug) {
        SortedSet<Integer> existing = arrayPlug.existingIndices();
        for (int index : existing) {
            Plug element = arrayPlug.elementByLogicalIndex(index);
            if (!element.isSource() && !element.isDestination())
                return element;
        }
        return arrayPlug.elementByLogicalIndex(existing.isEmpty() ? 0 : existing.last() + 1);
    }

    /** First element without an incoming connection, else the next unused index. */
    public static Plug nextAvailableDestElement(Plug arrayPlug) {
        SortedSet<Integer> existing = arrayPlug.existingIndices();
        for (int index : existing) {
            Plug element = arrayPlug.elementByLogicalIndex(index);
            if (!element.isDestination())
                return element;
        }
        return arrayPlug.elementByLogicalIndex(existing.isEmpty() ? 0 : existing.last() + 1);
    }

    /** Removes every element with no connection on it or on any of its children. */
    public static int removeUnconnectedEmptyElements(Plug arrayPlug) {
        SceneModifier mod = new SceneModifier(arrayPlug.scene());
        int removed = 0;
        for (int index : arrayPlug.existingIndices()) {
            Plug element = arrayPlug.elementByLogicalIndex(index);
            boolean connected = element.isConnected();
            for (Plug leaf : iterLeaves(element))
                connected |= leaf.isConnected();
            if (!connected) {
                mod.removeMultiInstance(element, false);
                removed++;
            }
        }
        mod.doIt();
        return removed;
    }

    // ── Connection filters ──────────────────────────────────────────

    /** Plugs connected to this one in either direction whose {@code node.path} matches the pattern. */
    public static List<Plug> filterConnected(Plug plug, String regex) {
        Pattern pattern = Pattern.compile(regex);
        List<Plug> connected = new ArrayList<>(plug.destinations());
        plug.source().ifPresent(connected::add);
        List<Plug> out = new ArrayList<>();
        for (Plug p : connected) {
            if (pattern.matcher(p.info()).find())
                out.add(p);
        }
        return out;
    }

    /**
     * Connected plugs whose node's full path matches the pattern. {@code source}
     * selects the outgoing side, {@code destination} the incoming side.
     */
    public static List<Plug> filterConnectedNodes(Plug plug, String regex, boolean source, boolean destination) {
        Pattern pattern = Pattern.compile(regex);
        List<Plug> candidates = new ArrayList<>();
        if (destination)
            plug.source().ifPresent(candidates::add);
        if (source)
            candidates.addAll(plug.destinations());
        List<Plug> out = new ArrayList<>();
        for (Plug p : candidates) {
            NodeHandle node = p.node();
            if (pattern.matcher(node.fullPathName()).find())
                out.add(p);
        }
        return out;
    }
}
