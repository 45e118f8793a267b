package com.rigging.metagraph.attr;

import java.util.List;

/**
 * Immutable description of an attribute to create: its name, kind, array-ness,
 * compound children and the optional value metadata.
 */
public record AttributeSpec(String name, AttributeKind kind, boolean array, List<AttributeSpec> children,
        Object defaultValue, Double min, Double max, Double softMin, Double softMax, List<String> enumFields,
        boolean keyable, boolean channelBox) {

    public AttributeSpec {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Attribute name must not be empty");
        if (kind == null)
            throw new IllegalArgumentException("Attribute kind must not be null for " + name);
        children = children == null ? List.of() : List.copyOf(children);
        enumFields = enumFields == null ? List.of() : List.copyOf(enumFields);
        if (kind == AttributeKind.COMPOUND && children.isEmpty())
            throw new IllegalArgumentException("Compound attribute " + name + " needs at least one child");
    }

    public static AttributeSpec of(String name, AttributeKind kind) {
        return new AttributeSpec(name, kind, false, null, null, null, null, null, null, null, false, false);
    }

    public static AttributeSpec array(String name, AttributeKind kind) {
        return new AttributeSpec(name, kind, true, null, null, null, null, null, null, null, false, false);
    }

    public static AttributeSpec enumOf(String name, List<String> fields) {
        return new AttributeSpec(name, AttributeKind.ENUM, false, null, null, null, null, null, null, fields,
                false, false);
    }

    public static AttributeSpec compound(String name, boolean array, List<AttributeSpec> children) {
        return new AttributeSpec(name, AttributeKind.COMPOUND, array, children, null, null, null, null, null,
                null, false, false);
    }

    public AttributeSpec asArray(boolean isArray) {
        return new AttributeSpec(name, kind, isArray, children, defaultValue, min, max, softMin, softMax,
                enumFields, keyable, channelBox);
    }

    public AttributeSpec withDefault(Object value) {
        return new AttributeSpec(name, kind, array, children, value, min, max, softMin, softMax, enumFields,
                keyable, channelBox);
    }

    public AttributeSpec withRange(Double minimum, Double maximum) {
        return new AttributeSpec(name, kind, array, children, defaultValue, minimum, maximum, softMin, softMax,
                enumFields, keyable, channelBox);
    }

    public AttributeSpec withSoftRange(Double softMinimum, Double softMaximum) {
        return new AttributeSpec(name, kind, array, children, defaultValue, min, max, softMinimum, softMaximum,
                enumFields, keyable, channelBox);
    }

    public AttributeSpec withFlags(boolean isKeyable, boolean inChannelBox) {
        return new AttributeSpec(name, kind, array, children, defaultValue, min, max, softMin, softMax,
                enumFields, isKeyable, inChannelBox);
    }
}
