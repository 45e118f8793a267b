package com.rigging.metagraph.api;

/**
 * Raised when an operation reaches a node whose underlying scene node has been
 * deleted.
 */
public class StaleReferenceException extends MetaGraphException {
    public StaleReferenceException(String nodeName) {
        super("Node no longer exists in the scene: " + nodeName, nodeName, null);
    }
}
