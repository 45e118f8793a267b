package com.rigging.metagraph.meta;

/**
 * Plain meta node carrying only the standard attributes. Used for nodes whose
 * tag is unknown and as the base of the built-in subtypes.
 */
public class MetaBase extends MetaNode {

    public MetaBase(MetaFactory factory) {
        super(factory);
    }
}
