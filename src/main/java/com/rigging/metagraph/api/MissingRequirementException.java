package com.rigging.metagraph.api;

/**
 * Raised when a node type needs a scene extension that cannot be loaded.
 * Batch deserialization recovers from it by skipping the affected record.
 */
public class MissingRequirementException extends MetaGraphException {
    private final String requirement;

    public MissingRequirementException(String requirement, String nodeName) {
        super("Could not load requirement '" + requirement + "'"
                + (nodeName != null ? " for node '" + nodeName + "'" : ""), nodeName, null);
        this.requirement = requirement;
    }

    public String requirement() {
        return requirement;
    }
}
