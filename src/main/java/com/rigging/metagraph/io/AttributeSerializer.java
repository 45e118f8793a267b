package com.rigging.metagraph.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.attr.Values;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.Attribute;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.SceneModifier;

/**
 * Converts attributes to {@link AttributeRecord}s and back.
 *
 * Dynamic attributes are always written in full. Static attributes are only
 * written when their value differs from the default, so an untouched built-in
 * leaves no record.
 */
public final class AttributeSerializer {

    private AttributeSerializer() {
    }

    public static Optional<AttributeRecord> serialize(Plug plug) {
        Attribute a = plug.attribute();
        if (!a.isDynamic() && isDefaultValue(plug))
            return Optional.empty();

        AttributeRecord record = new AttributeRecord();
        record.setName(plug.path());
        record.setType(a.kind());
        record.setDynamic(a.isDynamic());
        if (plug.isArray()) {
            record.setArray(true);
            record.setIndices(new ArrayList<>(plug.existingIndices()));
        }
        if (a.kind().carriesValue() || a.isCompound())
            record.setValue(Plugs.getValue(plug));
        if (a.isDynamic())
            describe(a, record);
        if (a.kind() == AttributeKind.ENUM)
            record.setEnums(new ArrayList<>(a.enumFields()));
        record.setKeyable(a.isKeyable());
        record.setChannelBox(a.isChannelBox());
        record.setLocked(plug.isLocked());
        return Optional.of(record);
    }

    // Definition metadata: default, bounds and compound children.
    private static void describe(Attribute a, AttributeRecord record) {
        if (a.kind().supportsDefault())
            record.setDefaultValue(a.defaultValue());
        if (a.kind().supportsBounds()) {
            record.setMin(a.min().orElse(null));
            record.setMax(a.max().orElse(null));
            record.setSoftMin(a.softMin().orElse(null));
            record.setSoftMax(a.softMax().orElse(null));
        }
        if (a.isCompound()) {
            List<AttributeRecord> children = new ArrayList<>();
            for (Attribute child : a.children()) {
                AttributeRecord c = new AttributeRecord();
                c.setName(child.name());
                c.setType(child.kind());
                c.setDynamic(true);
                if (child.isArray())
                    c.setArray(true);
                if (child.kind() == AttributeKind.ENUM)
                    c.setEnums(new ArrayList<>(child.enumFields()));
                c.setKeyable(child.isKeyable());
                c.setChannelBox(child.isChannelBox());
                describe(child, c);
                children.add(c);
            }
            record.setChildren(children);
        }
    }

    /** True when every value leaf under the plug holds its default. */
    public static boolean isDefaultValue(Plug plug) {
        for (Plug leaf : Plugs.iterLeaves(plug)) {
            if (!leaf.kind().carriesValue())
                continue;
            if (!Values.valueEquals(leaf.rawValue(), leaf.attribute().defaultValue()))
                return false;
        }
        return true;
    }

    /**
     * Recreates (dynamic) or updates (static) the attribute described by the
     * record. Enum fields of a static attribute are restored before its value and
     * the lock is applied last.
     */
    public static Plug deserialize(NodeHandle node, AttributeRecord record) {
        Plug plug = record.isDynamic() ? Nodes.addAttribute(node, toSpec(record)) : node.plug(record.getName());
        Attribute a = plug.attribute();
        if (record.getEnums() != null && !record.isDynamic() && a.kind() == AttributeKind.ENUM
                && !record.getEnums().equals(a.enumFields()))
            new SceneModifier(plug.scene()).setEnumFields(plug, record.getEnums()).doIt();
        restoreValue(plug, record);
        SceneModifier mod = new SceneModifier(plug.scene());
        if (a.isKeyable() != record.isKeyable())
            mod.setKeyable(plug, record.isKeyable());
        if (a.isChannelBox() != record.isChannelBox())
            mod.setChannelBox(plug, record.isChannelBox());
        if (plug.isLocked() != record.isLocked())
            mod.setLocked(plug, record.isLocked());
        mod.doIt();
        return plug;
    }

    static AttributeSpec toSpec(AttributeRecord record) {
        AttributeKind kind = record.getType();
        List<AttributeSpec> children = new ArrayList<>();
        if (record.getChildren() != null) {
            for (AttributeRecord child : record.getChildren())
                children.add(toSpec(child));
        }
        boolean bounds = kind.supportsBounds();
        return new AttributeSpec(record.getName(), kind, Boolean.TRUE.equals(record.getArray()), children,
                kind.supportsDefault() ? record.getDefaultValue() : null,
                bounds ? record.getMin() : null, bounds ? record.getMax() : null,
                bounds ? record.getSoftMin() : null, bounds ? record.getSoftMax() : null,
                record.getEnums(), record.isKeyable(), record.isChannelBox());
    }

    private static void restoreValue(Plug plug, AttributeRecord record) {
        Object value = record.getValue();
        if (value == null)
            return;
        SceneModifier mod = new SceneModifier(plug.scene());
        if (plug.isArray() && value instanceof List<?> items) {
            List<Integer> indices = record.getIndices();
            for (int i = 0; i < items.size(); i++) {
                int logical = indices != null && i < indices.size() ? indices.get(i) : i;
                Plugs.setValue(mod, plug.elementByLogicalIndex(logical), items.get(i));
            }
        } else {
            Plugs.setValue(mod, plug, value);
        }
        mod.doIt();
    }
}
