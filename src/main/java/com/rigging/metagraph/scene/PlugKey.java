package com.rigging.metagraph.scene;

/** Storage key of a plug: node id and attribute path. */
record PlugKey(long nodeId, String path) {

    static PlugKey of(Plug plug) {
        return new PlugKey(plug.node().id(), plug.path());
    }

    boolean isUnder(String prefix) {
        return Scene.isUnder(path, prefix);
    }
}
