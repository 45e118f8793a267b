package com.rigging.metagraph;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.rigging.metagraph.io.NodeRecord;
import com.rigging.metagraph.io.NodeSerializer;
import com.rigging.metagraph.meta.MetaFactory;
import com.rigging.metagraph.meta.MetaNode;
import com.rigging.metagraph.meta.MetaQueries;
import com.rigging.metagraph.meta.MetaRegistry;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Scene;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point tying a scene, a type registry and a configuration together.
 *
 * <pre>
 * MetaGraph graph = new MetaGraph(new Scene(), MetaGraphConfig.load());
 * MetaRig rig = graph.create(MetaRig.class, "hero");
 * rig.addControl(handCtrl, "hand_L");
 * graph.save(Path.of("hero.json"));
 * </pre>
 */
@Log4j2
public class MetaGraph {
    private final Scene scene;
    private final MetaGraphConfig config;
    private final MetaRegistry registry;
    private final MetaFactory factory;

    public MetaGraph() {
        this(new Scene(), MetaGraphConfig.load());
    }

    /** Registers the built-in types and then those found on the configured search paths. */
    public MetaGraph(Scene scene, MetaGraphConfig config) {
        this(scene, config, MetaRegistry.withBuiltIns());
        if (!config.getMetaSearchPaths().isEmpty())
            registry.registerPaths(config.getMetaSearchPaths().stream().map(Path::of).toList());
    }

    public MetaGraph(Scene scene, MetaGraphConfig config, MetaRegistry registry) {
        this.scene = scene;
        this.config = config;
        this.registry = registry;
        this.factory = new MetaFactory(scene, registry, config);
        log.info("Meta graph ready: {} meta type(s), parent policy {}, cycle policy {}", registry.size(),
                config.getParentPolicy(), config.getCyclePolicy());
    }

    public Scene scene() {
        return scene;
    }

    public MetaGraphConfig config() {
        return config;
    }

    public MetaRegistry registry() {
        return registry;
    }

    public MetaFactory factory() {
        return factory;
    }

    public <T extends MetaNode> T create(Class<T> type, String name) {
        return factory.create(type, name);
    }

    public MetaNode wrap(NodeHandle node) {
        return factory.wrap(node);
    }

    public <T extends MetaNode> T wrap(NodeHandle node, Class<T> type) {
        return factory.wrap(node, type);
    }

    /** The meta node on the scene node of that name, if it is one. */
    public Optional<MetaNode> find(String nodeName) {
        return scene.findNode(nodeName).flatMap(factory::tryWrap);
    }

    public List<MetaNode> sceneMetaNodes() {
        return MetaQueries.iterSceneMetaNodes(factory);
    }

    public List<MetaNode> sceneRoots() {
        return MetaQueries.findSceneRoots(factory);
    }

    /** Writes every scene node, connections included, as JSON records. */
    public void save(Path path) {
        List<NodeRecord> records = NodeSerializer.serializeNodes(scene.nodes(), true);
        NodeSerializer.write(path, records);
        log.info("Saved {} node(s) to {}", records.size(), path);
    }

    /**
     * Recreates the nodes recorded in a file. Records that cannot be loaded are
     * skipped.
     *
     * @return the meta nodes among the loaded nodes.
     */
    public List<MetaNode> load(Path path) {
        List<NodeHandle> loaded = NodeSerializer.deserializeNodes(scene, NodeSerializer.read(path));
        log.info("Loaded {} node(s) from {}", loaded.size(), path);
        return loaded.stream().filter(factory::isMetaNode).map(factory::wrap).toList();
    }
}
