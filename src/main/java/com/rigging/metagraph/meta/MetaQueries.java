package com.rigging.metagraph.meta;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.traverse.Direction;

/** Scene wide lookups over the meta nodes known to a factory. */
public final class MetaQueries {

    private MetaQueries() {
    }

    public static List<MetaNode> iterSceneMetaNodes(MetaFactory factory) {
        List<MetaNode> out = new ArrayList<>();
        for (NodeHandle node : factory.scene().nodes()) {
            if (factory.isMetaNode(node))
                out.add(factory.wrap(node));
        }
        return out;
    }

    /** Meta nodes without a meta parent. */
    public static List<MetaNode> findSceneRoots(MetaFactory factory) {
        List<MetaNode> out = new ArrayList<>();
        for (MetaNode meta : iterSceneMetaNodes(factory)) {
            if (meta.isRoot())
                out.add(meta);
        }
        return out;
    }

    public static List<MetaNode> findMetaNodesByType(MetaFactory factory, String tag) {
        List<MetaNode> out = new ArrayList<>();
        for (MetaNode meta : iterSceneMetaNodes(factory)) {
            if (meta.typeTag().equals(tag))
                out.add(meta);
        }
        return out;
    }

    /**
     * Plugs of meta nodes, among the named attributes, whose value matches the
     * filter: a regular expression searched in string values, plain equality for
     * anything else.
     */
    public static List<Plug> filterSceneByAttributeValues(MetaFactory factory, Collection<String> attributeNames,
            Object filter) {
        Pattern pattern = filter instanceof String ? Pattern.compile((String) filter) : null;
        List<Plug> out = new ArrayList<>();
        for (MetaNode meta : iterSceneMetaNodes(factory)) {
            for (String name : attributeNames) {
                Optional<Plug> plug = meta.attribute(name);
                if (plug.isEmpty() || !plug.get().kind().carriesValue())
                    continue;
                Object value = Plugs.getValue(plug.get());
                boolean match = pattern != null
                        ? value instanceof String && pattern.matcher((String) value).find()
                        : Objects.equals(value, filter);
                if (match)
                    out.add(plug.get());
            }
        }
        return out;
    }

    public static boolean isMetaNode(MetaFactory factory, NodeHandle node) {
        return factory.isMetaNode(node);
    }

    /** Whether a meta node feeds one of the node's attributes. */
    public static boolean isConnectedToMeta(MetaFactory factory, NodeHandle node) {
        return upstreamMetaNode(factory, node).isPresent();
    }

    /** The first meta node feeding one of the node's attributes. */
    public static Optional<MetaNode> upstreamMetaNode(MetaFactory factory, NodeHandle node) {
        for (Connection c : Nodes.iterConnections(node, false, true)) {
            if (factory.isMetaNode(c.source().node()))
                return Optional.of(factory.wrap(c.source().node()));
        }
        return Optional.empty();
    }

    /**
     * Meta nodes directly connected to the node: those it feeds going
     * {@link Direction#DOWN}, those feeding it going {@link Direction#UP}.
     */
    public static List<MetaNode> connectedMetaNodes(MetaFactory factory, NodeHandle node, Direction direction) {
        boolean down = direction == Direction.DOWN;
        Set<NodeHandle> peers = new LinkedHashSet<>();
        for (Connection c : Nodes.iterConnections(node, down, !down))
            peers.add(down ? c.destination().node() : c.source().node());
        List<MetaNode> out = new ArrayList<>();
        for (NodeHandle peer : peers) {
            if (factory.isMetaNode(peer))
                out.add(factory.wrap(peer));
        }
        return out;
    }
}
