package com.rigging.metagraph.meta.rig;

import com.rigging.metagraph.meta.MetaFactory;

/** Helper rig parts that are not animated directly, such as deformation or space switching setups. */
public class MetaSupportSystem extends MetaRig {

    public MetaSupportSystem(MetaFactory factory) {
        super(factory);
    }
}
