package com.rigging.metagraph.api;

/**
 * Raised by the scene itself when it refuses a mutation: editing a locked node or
 * slot, deleting a node that still holds locked connections, unknown node types.
 */
public class SceneOperationException extends MetaGraphException {
    public SceneOperationException(String message, String nodeName, String attributeName) {
        super(message, nodeName, attributeName);
    }
}
