package com.rigging.metagraph.meta.rig;

import com.rigging.metagraph.meta.MetaFactory;

/** Component of a rig, such as an arm or a spine, linked under its rig. */
public class MetaSubSystem extends MetaRig {

    public MetaSubSystem(MetaFactory factory) {
        super(factory);
    }
}
