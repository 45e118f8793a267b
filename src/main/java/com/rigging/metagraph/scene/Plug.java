package com.rigging.metagraph.scene;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

import com.rigging.metagraph.attr.AttributeKind;

/**
 * An attribute slot on a specific node: a top level attribute, an element of an
 * array attribute, or a child of a compound.
 *
 * A plug is a lightweight value object. Two plugs are equal when they address
 * the same path on the same node. Paths read like {@code mMetaParent[2]},
 * {@code limits.lower} or {@code points[3].x}.
 */
public final class Plug {
    private final NodeHandle node;
    private final Attribute attribute;
    private final Plug parent;
    private final int index;

    Plug(NodeHandle node, Attribute attribute, Plug parent, int index) {
        this.node = node;
        this.attribute = attribute;
        this.parent = parent;
        this.index = index;
    }

    public NodeHandle node() {
        return node;
    }

    public Scene scene() {
        return node.scene();
    }

    public Attribute attribute() {
        return attribute;
    }

    public AttributeKind kind() {
        return attribute.kind();
    }

    /** Short attribute name, without parents or indices. */
    public String name() {
        return attribute.name();
    }

    public String path() {
        if (index >= 0)
            return parent.path() + "[" + index + "]";
        if (parent != null)
            return parent.path() + "." + attribute.name();
        return attribute.name();
    }

    /** {@code node.path}, the way the host prints a plug. */
    public String info() {
        return node + "." + path();
    }

    // ── Shape ───────────────────────────────────────────────────────

    public boolean isArray() {
        return attribute.isArray() && index < 0;
    }

    public boolean isElement() {
        return index >= 0;
    }

    public boolean isCompound() {
        return attribute.isCompound() && !isArray();
    }

    public boolean isChild() {
        return parent != null && index < 0;
    }

    public boolean isDynamic() {
        return attribute.isDynamic();
    }

    /** Logical index of an element plug, -1 otherwise. */
    public int logicalIndex() {
        return index;
    }

    /** For an element, its array plug; for a compound child, its compound plug. */
    public Optional<Plug> parent() {
        return Optional.ofNullable(parent);
    }

    public Plug elementByLogicalIndex(int logicalIndex) {
        if (!isArray())
            throw new IllegalArgumentException("Not an array plug: " + info());
        if (logicalIndex < 0)
            throw new IllegalArgumentException("Negative logical index " + logicalIndex + " on " + info());
        return new Plug(node, attribute, this, logicalIndex);
    }

    public Plug elementByPhysicalIndex(int physicalIndex) {
        List<Integer> existing = new ArrayList<>(existingIndices());
        if (physicalIndex < 0 || physicalIndex >= existing.size())
            throw new IndexOutOfBoundsException("Physical index " + physicalIndex + " out of range on " + info());
        return elementByLogicalIndex(existing.get(physicalIndex));
    }

    public int numElements() {
        return existingIndices().size();
    }

    public SortedSet<Integer> existingIndices() {
        return scene().existingIndices(this);
    }

    public Plug child(String childName) {
        if (!isCompound())
            throw new IllegalArgumentException("Not a compound plug: " + info());
        Attribute c = attribute.child(childName)
                .orElseThrow(() -> new IllegalArgumentException("No child " + childName + " on " + info()));
        return new Plug(node, c, this, -1);
    }

    public List<Plug> children() {
        if (!isCompound())
            return List.of();
        List<Plug> out = new ArrayList<>();
        for (Attribute c : attribute.children())
            out.add(new Plug(node, c, this, -1));
        return out;
    }

    // ── Connections and state ───────────────────────────────────────

    public Optional<Plug> source() {
        return scene().source(this);
    }

    public List<Plug> destinations() {
        return scene().destinations(this);
    }

    public boolean isSource() {
        return !destinations().isEmpty();
    }

    public boolean isDestination() {
        return source().isPresent();
    }

    public boolean isConnected() {
        return isSource() || isDestination();
    }

    public boolean isLocked() {
        return scene().isLocked(this);
    }

    /** Raw leaf value as stored or pulled from the incoming connection. */
    public Object rawValue() {
        return scene().value(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Plug))
            return false;
        Plug other = (Plug) o;
        return node.equals(other.node) && path().equals(other.path());
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, path());
    }

    @Override
    public String toString() {
        return info();
    }
}
