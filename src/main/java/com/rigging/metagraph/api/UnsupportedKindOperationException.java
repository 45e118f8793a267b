package com.rigging.metagraph.api;

import com.rigging.metagraph.attr.AttributeKind;

public class UnsupportedKindOperationException extends MetaGraphException {
    private final AttributeKind kind;

    public UnsupportedKindOperationException(String operation, AttributeKind kind, String nodeName,
            String attributeName) {
        super("Operation '" + operation + "' is not supported for kind " + kind + " on " + nodeName + "."
                + attributeName, nodeName, attributeName);
        this.kind = kind;
    }

    public AttributeKind kind() {
        return kind;
    }
}
