package com.rigging.metagraph.api;

public class AttributeNotFoundException extends MetaGraphException {
    public AttributeNotFoundException(String nodeName, String attributeName) {
        super("No attribute named '" + attributeName + "' on node '" + nodeName + "'", nodeName, attributeName);
    }
}
