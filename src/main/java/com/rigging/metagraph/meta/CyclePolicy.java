package com.rigging.metagraph.meta;

/** Whether a parent/child edge may close a cycle. */
public enum CyclePolicy {
    REJECT,
    ALLOW
}
