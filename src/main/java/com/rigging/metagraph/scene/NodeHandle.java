package com.rigging.metagraph.scene;

import com.rigging.metagraph.api.StaleReferenceException;

/**
 * Non-owning reference to a scene node. The node may be deleted while handles to
 * it are still held; check {@link #isAlive()} or use {@link #require()} before
 * dereferencing.
 */
public record NodeHandle(Scene scene, long id) {

    public boolean isAlive() {
        return scene.exists(id);
    }

    /** @throws StaleReferenceException when the node has been deleted. */
    public NodeHandle require() {
        if (!isAlive())
            throw new StaleReferenceException("#" + id);
        return this;
    }

    public String name() {
        return scene.name(this);
    }

    public String fullPathName() {
        return scene.fullPathName(this);
    }

    public String typeName() {
        return scene.typeName(this);
    }

    public Plug plug(String path) {
        return scene.plug(this, path);
    }

    @Override
    public String toString() {
        return isAlive() ? scene.name(this) : "<deleted #" + id + ">";
    }
}
