package com.rigging.metagraph.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Values;

/**
 * Definition of an attribute on one scene node.
 *
 * The kind and array-ness are fixed at creation. Name, default, bounds, enum
 * fields and the keyable/channel box flags may change afterwards, the way a host
 * attribute function set allows, but only through {@link SceneModifier} so each
 * change is undoable.
 */
public final class Attribute {
    private String name;
    private final AttributeKind kind;
    private final boolean array;
    private final boolean dynamic;
    private final List<Attribute> children;
    private Attribute parent;

    private Object defaultValue;
    private Double min;
    private Double max;
    private Double softMin;
    private Double softMax;
    private List<String> enumFields;
    private boolean keyable;
    private boolean channelBox;

    private Attribute(AttributeSpec spec, boolean dynamic) {
        this.name = spec.name();
        this.kind = spec.kind();
        this.array = spec.array();
        this.dynamic = dynamic;
        List<Attribute> kids = new ArrayList<>();
        for (AttributeSpec child : spec.children()) {
            Attribute a = new Attribute(child, dynamic);
            a.parent = this;
            kids.add(a);
        }
        this.children = Collections.unmodifiableList(kids);
        this.enumFields = spec.enumFields();
        this.keyable = spec.keyable();
        this.channelBox = spec.channelBox();
        if (spec.defaultValue() != null)
            setDefaultValue(spec.defaultValue());
        if (spec.min() != null)
            setMin(spec.min());
        if (spec.max() != null)
            setMax(spec.max());
        if (spec.softMin() != null)
            setSoftMin(spec.softMin());
        if (spec.softMax() != null)
            setSoftMax(spec.softMax());
    }

    static Attribute fromSpec(AttributeSpec spec, boolean dynamic) {
        return new Attribute(spec, dynamic);
    }

    public String name() {
        return name;
    }

    void rename(String newName) {
        this.name = newName;
    }

    public AttributeKind kind() {
        return kind;
    }

    public boolean isArray() {
        return array;
    }

    /** True for attributes added after node creation, false for the node type's built-ins. */
    public boolean isDynamic() {
        return dynamic;
    }

    public boolean isCompound() {
        return kind == AttributeKind.COMPOUND;
    }

    public List<Attribute> children() {
        return children;
    }

    public Optional<Attribute> child(String childName) {
        return children.stream().filter(c -> c.name.equals(childName)).findFirst();
    }

    /** The compound this attribute belongs to, or null for a top level attribute. */
    public Attribute parent() {
        return parent;
    }

    /** This attribute followed by all of its descendants, depth first. */
    public List<Attribute> flatten() {
        List<Attribute> out = new ArrayList<>();
        out.add(this);
        for (Attribute c : children)
            out.addAll(c.flatten());
        return out;
    }

    // ── Metadata ────────────────────────────────────────────────────

    public Object defaultValue() {
        if (defaultValue == null)
            return kind.defaultValue();
        return Values.copy(defaultValue);
    }

    public boolean hasExplicitDefault() {
        return defaultValue != null;
    }

    void setDefaultValue(Object value) {
        if (!kind.supportsDefault())
            throw new IllegalStateException("Kind " + kind + " has no default value");
        this.defaultValue = value == null ? null : kind.coerce(value);
    }

    public Optional<Double> min() {
        return Optional.ofNullable(min);
    }

    public Optional<Double> max() {
        return Optional.ofNullable(max);
    }

    public Optional<Double> softMin() {
        return Optional.ofNullable(softMin);
    }

    public Optional<Double> softMax() {
        return Optional.ofNullable(softMax);
    }

    void setMin(Double value) {
        requireBounds("min");
        this.min = value;
    }

    void setMax(Double value) {
        requireBounds("max");
        this.max = value;
    }

    void setSoftMin(Double value) {
        requireBounds("softMin");
        this.softMin = value;
    }

    void setSoftMax(Double value) {
        requireBounds("softMax");
        this.softMax = value;
    }

    private void requireBounds(String what) {
        if (!kind.supportsBounds())
            throw new IllegalStateException("Kind " + kind + " has no " + what);
    }

    public List<String> enumFields() {
        return enumFields;
    }

    void setEnumFields(List<String> fields) {
        if (kind != AttributeKind.ENUM)
            throw new IllegalStateException("Not an enum attribute: " + name);
        this.enumFields = List.copyOf(fields);
    }

    public boolean isKeyable() {
        return keyable;
    }

    void setKeyable(boolean keyable) {
        this.keyable = keyable;
    }

    public boolean isChannelBox() {
        return channelBox;
    }

    void setChannelBox(boolean channelBox) {
        this.channelBox = channelBox;
    }

    /** Captures the mutable metadata; running the result puts it back. */
    Runnable snapshot() {
        Object oldDefault = defaultValue;
        Double oldMin = min;
        Double oldMax = max;
        Double oldSoftMin = softMin;
        Double oldSoftMax = softMax;
        List<String> oldEnumFields = enumFields;
        boolean oldKeyable = keyable;
        boolean oldChannelBox = channelBox;
        return () -> {
            defaultValue = oldDefault;
            min = oldMin;
            max = oldMax;
            softMin = oldSoftMin;
            softMax = oldSoftMax;
            enumFields = oldEnumFields;
            keyable = oldKeyable;
            channelBox = oldChannelBox;
        };
    }

    @Override
    public String toString() {
        return name + ":" + kind + (array ? "[]" : "");
    }
}
