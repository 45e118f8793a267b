package com.rigging.metagraph.api;

public class AttributeAlreadyExistsException extends MetaGraphException {
    public AttributeAlreadyExistsException(String nodeName, String attributeName) {
        super("Node '" + nodeName + "' already has attribute '" + attributeName + "'", nodeName, attributeName);
    }
}
