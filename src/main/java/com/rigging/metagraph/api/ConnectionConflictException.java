package com.rigging.metagraph.api;

/**
 * Raised when a connection would replace an existing incoming edge without the
 * force flag, or would close a cycle in the parent/child relation.
 */
public class ConnectionConflictException extends MetaGraphException {
    public ConnectionConflictException(String message, String nodeName, String attributeName) {
        super(message, nodeName, attributeName);
    }
}
