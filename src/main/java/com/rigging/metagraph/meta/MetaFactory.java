package com.rigging.metagraph.meta;

import java.util.Optional;

import com.rigging.metagraph.MetaGraphConfig;
import com.rigging.metagraph.attr.AttributeKind;
import com.rigging.metagraph.scene.NodeHandle;
import com.rigging.metagraph.scene.Plug;
import com.rigging.metagraph.scene.Scene;
import com.rigging.metagraph.scene.SceneModifier;

import lombok.extern.log4j.Log4j2;

/**
 * Builds {@link MetaNode} instances for one scene.
 *
 * Wrapping an existing node always yields the type named by the node's
 * {@code mClass} tag when that tag is registered, whatever type the caller asked
 * for, so a rig retrieved through the base type still behaves as a rig.
 */
@Log4j2
public final class MetaFactory {
    private final Scene scene;
    private final MetaRegistry registry;
    private final MetaGraphConfig config;

    public MetaFactory(Scene scene, MetaRegistry registry, MetaGraphConfig config) {
        this.scene = scene;
        this.registry = registry;
        this.config = config;
    }

    public Scene scene() {
        return scene;
    }

    public MetaRegistry registry() {
        return registry;
    }

    public MetaGraphConfig config() {
        return config;
    }

    // ── Creation ────────────────────────────────────────────────────

    public <T extends MetaNode> T create(Class<T> type, String name) {
        return create(type, name, config.isLockMetaNodes());
    }

    /**
     * Creates a {@code network} node named {@code <name>_meta} (or
     * {@code <Type>_meta} when name is null or empty) and installs the standard
     * attributes of {@code type} on it, all as one undoable step. Nothing is left
     * in the scene when installing fails.
     */
    public <T extends MetaNode> T create(Class<T> type, String name, boolean lock) {
        String base = name == null || name.isEmpty() ? MetaRegistry.tagOf(type) : name;
        T meta = instantiate(MetaRegistry.tagOf(type), type);
        SceneModifier mod = new SceneModifier(scene);
        NodeHandle node = mod.createNode("network", base + "_meta");
        meta.initialize(mod, node, lock);
        mod.doIt();
        return bindInitialized(meta, node);
    }

    /**
     * Turns an existing scene node into a meta node of {@code type}. A node that
     * already carries a tag is wrapped instead.
     */
    public <T extends MetaNode> T attach(Class<T> type, NodeHandle node, boolean lock) {
        node.require();
        if (tagOf(node).isPresent())
            return wrap(node, type);
        T meta = instantiate(MetaRegistry.tagOf(type), type);
        SceneModifier mod = new SceneModifier(scene);
        meta.initialize(mod, node, lock);
        mod.doIt();
        return bindInitialized(meta, node);
    }

    private <T extends MetaNode> T bindInitialized(T meta, NodeHandle node) {
        meta.bind(node);
        log.debug("Initialized {} on '{}'", meta.getClass().getSimpleName(), node.name());
        return meta;
    }

    // ── Wrapping ────────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException when the node carries no type tag.
     * @throws com.rigging.metagraph.api.StaleReferenceException when the node is gone.
     */
    public MetaNode wrap(NodeHandle node) {
        node.require();
        String tag = tagOf(node)
                .orElseThrow(() -> new IllegalArgumentException("Not a meta node: " + node.fullPathName()));
        return fromTag(tag, node);
    }

    /**
     * Wraps a node as the type its tag names. Untagged nodes or unregistered
     * tags fall back to {@code requested}, bound but not initialized in the
     * untagged case.
     *
     * @throws IllegalArgumentException when the tagged type is not a
     *         {@code requested}.
     */
    public <T extends MetaNode> T wrap(NodeHandle node, Class<T> requested) {
        node.require();
        Optional<String> tag = tagOf(node);
        Optional<MetaRegistry.MetaType> registered = tag.flatMap(registry::type);
        MetaNode meta;
        if (registered.isPresent()) {
            meta = registered.get().constructor().apply(this);
        } else {
            if (tag.isPresent())
                log.warn("Meta type '{}' of {} is not registered, using {}", tag.get(), node.name(),
                        requested.getSimpleName());
            Class<? extends MetaNode> fallback = concrete(requested);
            meta = instantiate(MetaRegistry.tagOf(fallback), fallback);
        }
        if (!requested.isInstance(meta))
            throw new IllegalArgumentException(node.name() + " is a " + meta.getClass().getSimpleName() + ", not a "
                    + requested.getSimpleName());
        meta.bind(node);
        return requested.cast(meta);
    }

    /** Wraps the node as the registered type for {@code tag}, or {@link MetaBase} when unknown. */
    public MetaNode fromTag(String tag, NodeHandle node) {
        return wrap(node, registry.type(tag).<Class<? extends MetaNode>>map(MetaRegistry.MetaType::type)
                .orElse(MetaBase.class));
    }

    public Optional<MetaNode> tryWrap(NodeHandle node) {
        return isMetaNode(node) ? Optional.of(wrap(node)) : Optional.empty();
    }

    /** True when the node is alive and carries a registered type tag. */
    public boolean isMetaNode(NodeHandle node) {
        return node != null && node.isAlive() && tagOf(node).map(registry::isRegistered).orElse(false);
    }

    static Optional<String> tagOf(NodeHandle node) {
        Optional<Plug> plug = node.scene().findPlug(node, MetaNode.CLASS_ATTR);
        if (plug.isEmpty() || plug.get().kind() != AttributeKind.STRING)
            return Optional.empty();
        String tag = (String) plug.get().rawValue();
        return tag == null || tag.isEmpty() ? Optional.empty() : Optional.of(tag);
    }

    private Class<? extends MetaNode> concrete(Class<? extends MetaNode> requested) {
        return requested == MetaNode.class ? MetaBase.class : requested;
    }

    private <T extends MetaNode> T instantiate(String tag, Class<T> type) {
        registry.register(type);
        MetaNode meta = registry.type(tag).orElseThrow().constructor().apply(this);
        if (!type.isInstance(meta))
            throw new IllegalStateException("Tag '" + tag + "' is registered to " + meta.getClass().getName()
                    + ", not " + type.getName());
        return type.cast(meta);
    }
}
