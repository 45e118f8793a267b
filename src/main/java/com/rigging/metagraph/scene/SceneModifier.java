package com.rigging.metagraph.scene;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.rigging.metagraph.attr.AttributeSpec;

import lombok.extern.log4j.Log4j2;

/**
 * Undoable batch of scene mutations.
 *
 * Calls queue commands; nothing changes until {@link #doIt()}. A failing command
 * reverts the commands already applied by the same {@code doIt()} call, drops
 * the rest of the queue and rethrows. A successful {@code doIt()} becomes one
 * entry on the scene's undo stack.
 *
 * <pre>
 * SceneModifier mod = new SceneModifier(scene);
 * NodeHandle n = mod.createNode("network", "settings");
 * mod.addAttribute(n, AttributeSpec.of("gain", AttributeKind.DOUBLE));
 * mod.doIt();
 * </pre>
 */
@Log4j2
public final class SceneModifier {
    private final Scene scene;
    private final List<Supplier<Runnable>> pending = new ArrayList<>();
    private final List<Batch> applied = new ArrayList<>();

    public SceneModifier(Scene scene) {
        this.scene = scene;
    }

    public Scene scene() {
        return scene;
    }

    /**
     * Queues creation of a node. The returned handle becomes alive once
     * {@link #doIt()} has run.
     */
    public NodeHandle createNode(String typeName, String nodeName) {
        return createNode(typeName, nodeName, null);
    }

    public NodeHandle createNode(String typeName, String nodeName, NodeHandle parent) {
        long id = scene.reserveId();
        pending.add(() -> scene.applyCreateNode(id, typeName, nodeName, parent));
        return new NodeHandle(scene, id);
    }

    public SceneModifier deleteNode(NodeHandle node) {
        pending.add(() -> scene.applyDeleteNode(node));
        return this;
    }

    public SceneModifier renameNode(NodeHandle node, String newName) {
        pending.add(() -> scene.applyRenameNode(node, newName));
        return this;
    }

    /** Reparents a DAG node; a null parent moves it to the world. */
    public SceneModifier reparentNode(NodeHandle child, NodeHandle newParent, boolean maintainOffset) {
        pending.add(() -> scene.applyReparent(child, newParent, maintainOffset));
        return this;
    }

    public SceneModifier setNodeLockState(NodeHandle node, boolean locked) {
        pending.add(() -> scene.applySetNodeLocked(node, locked));
        return this;
    }

    public SceneModifier addAttribute(NodeHandle node, AttributeSpec spec) {
        pending.add(() -> scene.applyAddAttribute(node, spec));
        return this;
    }

    public SceneModifier removeAttribute(NodeHandle node, String attributeName) {
        pending.add(() -> scene.applyRemoveAttribute(node, attributeName));
        return this;
    }

    public SceneModifier renameAttribute(NodeHandle node, String oldName, String newName) {
        pending.add(() -> scene.applyRenameAttribute(node, oldName, newName));
        return this;
    }

    public SceneModifier connect(Plug source, Plug destination) {
        pending.add(() -> scene.applyConnect(source, destination));
        return this;
    }

    public SceneModifier disconnect(Plug source, Plug destination) {
        pending.add(() -> scene.applyDisconnect(source, destination));
        return this;
    }

    public SceneModifier setValue(Plug plug, Object value) {
        pending.add(() -> scene.applySetValue(plug, value));
        return this;
    }

    public SceneModifier setLocked(Plug plug, boolean locked) {
        pending.add(() -> scene.applySetLocked(plug, locked));
        return this;
    }

    public SceneModifier removeMultiInstance(Plug element, boolean breakConnections) {
        pending.add(() -> scene.applyRemoveElement(element, breakConnections));
        return this;
    }

    /** Sets the attribute default; a null value clears it back to the kind's default. */
    public SceneModifier setDefault(Plug plug, Object value) {
        return editAttribute(plug, "default", true, a -> a.setDefaultValue(value));
    }

    public SceneModifier setMin(Plug plug, Double value) {
        return editAttribute(plug, "min", true, a -> a.setMin(value));
    }

    public SceneModifier setMax(Plug plug, Double value) {
        return editAttribute(plug, "max", true, a -> a.setMax(value));
    }

    public SceneModifier setSoftMin(Plug plug, Double value) {
        return editAttribute(plug, "softMin", true, a -> a.setSoftMin(value));
    }

    public SceneModifier setSoftMax(Plug plug, Double value) {
        return editAttribute(plug, "softMax", true, a -> a.setSoftMax(value));
    }

    public SceneModifier setEnumFields(Plug plug, List<String> fields) {
        return editAttribute(plug, "enum fields", true, a -> a.setEnumFields(fields));
    }

    public SceneModifier setKeyable(Plug plug, boolean keyable) {
        return editAttribute(plug, "keyable", false, a -> a.setKeyable(keyable));
    }

    public SceneModifier setChannelBox(Plug plug, boolean channelBox) {
        return editAttribute(plug, "channelBox", false, a -> a.setChannelBox(channelBox));
    }

    private SceneModifier editAttribute(Plug plug, String property, boolean shapesValues, Consumer<Attribute> edit) {
        pending.add(() -> scene.applyEditAttribute(plug, property, shapesValues, edit));
        return this;
    }

    /**
     * Queues commands that can only be planned once the commands queued before
     * them have applied, such as writes to an attribute added earlier in the same
     * batch. The planner queues onto the modifier it is given and must not call
     * {@code doIt()} on it; what it queues applies and reverts with this batch.
     */
    public SceneModifier andThen(Consumer<SceneModifier> planner) {
        pending.add(() -> {
            SceneModifier nested = new SceneModifier(scene);
            planner.accept(nested);
            Batch inner = new Batch(new ArrayList<>(nested.pending));
            inner.apply();
            return inner::revert;
        });
        return this;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /** Applies the queued commands as one undoable unit. */
    public void doIt() {
        if (pending.isEmpty())
            return;
        Batch batch = new Batch(new ArrayList<>(pending));
        pending.clear();
        batch.apply();
        applied.add(batch);
        scene.pushUndo(batch);
    }

    /** Reverts everything this modifier applied, newest first. */
    public void undoIt() {
        for (int i = applied.size() - 1; i >= 0; i--) {
            applied.get(i).revert();
            scene.dropUndo(applied.get(i));
        }
        applied.clear();
    }

    /** One applied {@code doIt()} call: its commands and the actions that revert them. */
    static final class Batch {
        private final List<Supplier<Runnable>> commands;
        private final List<Runnable> inverses = new ArrayList<>();

        Batch(List<Supplier<Runnable>> commands) {
            this.commands = commands;
        }

        void apply() {
            inverses.clear();
            try {
                for (Supplier<Runnable> command : commands)
                    inverses.add(command.get());
            } catch (RuntimeException e) {
                log.debug("Command {} of {} failed, reverting {} applied", inverses.size() + 1, commands.size(),
                        inverses.size());
                revert();
                throw e;
            }
        }

        void revert() {
            for (int i = inverses.size() - 1; i >= 0; i--)
                inverses.get(i).run();
            inverses.clear();
        }
    }
}
