package com.rigging.metagraph.meta;

/**
 * Life cycle of a {@link MetaNode} instance.
 *
 * UNBOUND -> UNINITIALIZED -> INITIALIZED -> INVALID. INVALID is terminal and is
 * entered as soon as the underlying scene node is found to be gone.
 */
public enum MetaState {
    /** No scene node attached yet. */
    UNBOUND,
    /** Attached to a scene node that does not carry the standard attributes. */
    UNINITIALIZED,
    INITIALIZED,
    /** The scene node was deleted. */
    INVALID
}
