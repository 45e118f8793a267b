package com.rigging.metagraph.traverse;

/** Side of a connection a walk follows. */
public enum Direction {
    /** From sources to their destinations. */
    DOWN,
    /** From destinations to their sources. */
    UP
}
