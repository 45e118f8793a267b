package com.rigging.metagraph.meta.rig;

import com.rigging.metagraph.meta.MetaFactory;

/** Facial rig, kept as its own type so tools can find it by tag. */
public class MetaFaceRig extends MetaRig {

    public MetaFaceRig(MetaFactory factory) {
        super(factory);
    }
}
