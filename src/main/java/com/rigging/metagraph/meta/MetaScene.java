package com.rigging.metagraph.meta;

/** Scene level meta node, the usual root for everything else in a file. */
public class MetaScene extends MetaBase {

    public MetaScene(MetaFactory factory) {
        super(factory);
    }
}
