package com.rigging.metagraph.scene;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable storage of one node. Only {@link Scene} touches it.
 *
 * Values, lock flags and existing array indices are keyed by plug path, e.g.
 * {@code points[3].x}.
 */
final class SceneNode {
    final long id;
    final NodeTypeDefinition type;
    String name;
    Long parentId;
    final List<Long> children = new ArrayList<>();
    boolean locked;

    /** Top level attributes in creation order. */
    final Map<String, Attribute> attributes = new LinkedHashMap<>();
    /** Every attribute, compound children included, by name. */
    final Map<String, Attribute> byName = new HashMap<>();

    final Map<String, Object> values = new HashMap<>();
    final Set<String> lockedPlugs = new HashSet<>();
    final Map<String, TreeSet<Integer>> indices = new HashMap<>();

    SceneNode(long id, NodeTypeDefinition type, String name) {
        this.id = id;
        this.type = type;
        this.name = name;
    }

    void register(Attribute attribute) {
        attributes.put(attribute.name(), attribute);
        for (Attribute a : attribute.flatten())
            byName.put(a.name(), a);
    }

    void unregister(Attribute attribute) {
        attributes.remove(attribute.name());
        for (Attribute a : attribute.flatten())
            byName.remove(a.name());
    }
}
