package com.rigging.metagraph.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rigging.metagraph.api.MetaGraphException;
import com.rigging.metagraph.attr.Plugs;
import com.rigging.metagraph.nodes.LockGuard;
import com.rigging.metagraph.nodes.Nodes;
import com.rigging.metagraph.scene.Attribute;
import com.rigging.metagraph.scene.Connection;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;

import lombok.extern.log4j.Log4j2;

/**
 * Converts scene nodes to {@link NodeRecord}s and back, and reads and writes
 * them as JSON.
 *
 * Loading is resilient per record: a node whose requirements cannot be loaded,
 * or whose record is broken, is logged and skipped while its siblings load.
 */
@Log4j2
public final class NodeSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<List<NodeRecord>> RECORDS = new TypeReference<>() {
    };

    private NodeSerializer() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ── Serialize ───────────────────────────────────────────────────

    /**
     * @param skip attribute name fragments to leave out, may be null.
     * @param includeConnections whether to record the node's incoming connections.
     */
    public static NodeRecord serializeNode(NodeHandle node, Collection<String> skip, boolean includeConnections) {
        Scene scene = node.require().scene();
        NodeRecord record = new NodeRecord();
        record.setName(node.fullPathName());
        record.setType(node.typeName());
        record.setRequirements(new ArrayList<>(scene.requirements(node)));
        if (scene.isDag(node))
            record.setParent(scene.parent(node).map(NodeHandle::fullPathName).orElse(null));

        for (Attribute a : scene.attributes(node)) {
            if (skip != null && skip.stream().anyMatch(s -> a.name().contains(s)))
                continue;
            AttributeSerializer.serialize(node.plug(a.name())).ifPresent(record.getAttributes()::add);
        }
        if (includeConnections) {
            for (Connection c : Nodes.iterConnections(node, false, true)) {
                record.getConnections().add(new ConnectionRecord(c.destination().path(),
                        c.source().node().fullPathName(), c.source().path()));
            }
        }
        return record;
    }

    public static List<NodeRecord> serializeNodes(Collection<NodeHandle> nodes, boolean includeConnections) {
        List<NodeRecord> out = new ArrayList<>();
        for (NodeHandle node : nodes)
            out.add(serializeNode(node, null, includeConnections));
        return out;
    }

    // ── Deserialize ─────────────────────────────────────────────────

    /**
     * Recreates a node from its record.
     *
     * @return empty when one of the record's requirements cannot be loaded.
     */
    public static Optional<NodeHandle> deserializeNode(Scene scene, NodeRecord record, boolean includeConnections) {
        Optional<NodeHandle> node = createNode(scene, record);
        if (node.isPresent() && includeConnections)
            restoreConnections(scene, record, node.get(), Map.of());
        return node;
    }

    /**
     * Recreates a batch of nodes. Nodes are created first and connected in a
     * second pass, so records may reference each other in any order.
     *
     * @return the created nodes, in record order, without the skipped ones.
     */
    public static List<NodeHandle> deserializeNodes(Scene scene, List<NodeRecord> records) {
        Map<String, NodeHandle> created = new HashMap<>();
        List<NodeRecord> loadedRecords = new ArrayList<>();
        List<NodeHandle> loadedNodes = new ArrayList<>();
        for (NodeRecord record : records) {
            try {
                Optional<NodeHandle> node = createNode(scene, record, created);
                if (node.isEmpty()) {
                    log.info("Skipped node record '{}': missing requirement", record.getName());
                    continue;
                }
                created.put(record.getName(), node.get());
                loadedRecords.add(record);
                loadedNodes.add(node.get());
            } catch (MetaGraphException | IllegalArgumentException e) {
                log.error("Skipping node record '{}': {}", record.getName(), e.getMessage());
            }
        }
        for (int i = 0; i < loadedRecords.size(); i++)
            restoreConnections(scene, loadedRecords.get(i), loadedNodes.get(i), created);
        return loadedNodes;
    }

    private static Optional<NodeHandle> createNode(Scene scene, NodeRecord record) {
        return createNode(scene, record, Map.of());
    }

    private static Optional<NodeHandle> createNode(Scene scene, NodeRecord record, Map<String, NodeHandle> created) {
        for (String requirement : record.getRequirements()) {
            if (!scene.loadExtension(requirement)) {
                log.debug("Could not load requirement '{}' for '{}'", requirement, record.getName());
                return Optional.empty();
            }
        }
        String fullName = record.getName();
        String name = fullName.substring(fullName.lastIndexOf('|') + 1);
        NodeHandle parent = null;
        if (record.getParent() != null) {
            parent = resolve(scene, record.getParent(), created).orElse(null);
            if (parent == null)
                log.debug("Parent '{}' of '{}' not found, creating under the world", record.getParent(), name);
        }
        NodeHandle node = Nodes.createNode(scene, name, record.getType(), parent);
        try {
            for (AttributeRecord attribute : record.getAttributes())
                AttributeSerializer.deserialize(node, attribute);
        } catch (RuntimeException e) {
            Nodes.delete(node);
            throw e;
        }
        return Optional.of(node);
    }

    private static void restoreConnections(Scene scene, NodeRecord record, NodeHandle node,
            Map<String, NodeHandle> created) {
        for (ConnectionRecord c : record.getConnections()) {
            Optional<NodeHandle> sourceNode = resolve(scene, c.getSourceNodeName(), created);
            if (sourceNode.isEmpty()) {
                log.debug("Source node '{}' missing, skipping connection to {}.{}", c.getSourceNodeName(),
                        node.name(), c.getDestinationPath());
                continue;
            }
            Optional<Plug> source = scene.findPlug(sourceNode.get(), c.getSourcePath());
            Optional<Plug> destination = scene.findPlug(node, c.getDestinationPath());
            if (source.isEmpty() || destination.isEmpty()) {
                log.debug("Plug missing, skipping connection {}.{} -> {}.{}", c.getSourceNodeName(),
                        c.getSourcePath(), node.name(), c.getDestinationPath());
                continue;
            }
            try {
                LockGuard.runUnlocked(destination.get(),
                        () -> Plugs.connectPlugs(source.get(), destination.get(), true));
            } catch (MetaGraphException | IllegalArgumentException e) {
                log.debug("Could not restore connection {} -> {}: {}", source.get(), destination.get(),
                        e.getMessage());
            }
        }
    }

    private static Optional<NodeHandle> resolve(Scene scene, String name, Map<String, NodeHandle> created) {
        NodeHandle node = created.get(name);
        if (node != null && node.isAlive())
            return Optional.of(node);
        return scene.findNode(name);
    }

    // ── JSON ────────────────────────────────────────────────────────

    public static String toJson(List<NodeRecord> records) {
        try {
            return MAPPER.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write node records", e);
        }
    }

    public static List<NodeRecord> fromJson(String json) {
        try {
            return MAPPER.readValue(json, RECORDS);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed node records", e);
        }
    }

    public static void write(Path path, List<NodeRecord> records) {
        try {
            Files.writeString(path, toJson(records));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    public static List<NodeRecord> read(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
