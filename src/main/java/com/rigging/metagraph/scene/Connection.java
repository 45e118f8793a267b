package com.rigging.metagraph.scene;

/** A directed edge from a source plug to a destination plug. */
public record Connection(Plug source, Plug destination) {

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
