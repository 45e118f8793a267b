package com.rigging.metagraph.api;

/**
 * Root of the failures raised by the attribute and metadata graph layer.
 *
 * Every subclass names the node (and, where relevant, the attribute) involved so
 * the surrounding tool can report the specific failure instead of a generic one.
 */
public class MetaGraphException extends RuntimeException {
    private final String nodeName;
    private final String attributeName;

    public MetaGraphException(String message, String nodeName, String attributeName) {
        this(message, nodeName, attributeName, null);
    }

    public MetaGraphException(String message, String nodeName, String attributeName, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
        this.attributeName = attributeName;
    }

    /** @return the node involved, or null when unknown. */
    public String nodeName() {
        return nodeName;
    }

    /** @return the attribute involved, or null when the failure is node level. */
    public String attributeName() {
        return attributeName;
    }
}
