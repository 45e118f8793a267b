package com.rigging.metagraph.scene;

import java.util.List;

import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.attr.AttributeSpec;

/**
 * A node type known to the scene: its name, whether it lives in the DAG
 * hierarchy, the extension that must be loaded before it can be created, and its
 * static attributes.
 */
public record NodeTypeDefinition(String name, boolean dag, String requiredExtension,
        List<AttributeSpec> attributes) {

    public static final NodeTypeDefinition NETWORK = new NodeTypeDefinition("network", false, null, List.of(
            AttributeSpec.enumOf("nodeState", List.of("normal", "hasNoEffect", "blocking")),
            AttributeSpec.of("caching", AttributeKind.BOOLEAN)));

    public static final NodeTypeDefinition TRANSFORM = new NodeTypeDefinition("transform", true, null, List.of(
            AttributeSpec.enumOf("nodeState", List.of("normal", "hasNoEffect", "blocking")),
            AttributeSpec.of("translate", AttributeKind.DOUBLE3).withFlags(true, true),
            AttributeSpec.of("rotate", AttributeKind.DOUBLE3).withFlags(true, true),
            AttributeSpec.of("scale", AttributeKind.DOUBLE3).withDefault(new double[] { 1, 1, 1 })
                    .withFlags(true, true),
            AttributeSpec.of("visibility", AttributeKind.BOOLEAN).withDefault(true).withFlags(true, true)));

    public NodeTypeDefinition {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Node type name must not be empty");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
