package com.rigging.metagraph.meta;

/** How many meta parents a meta node may have at once. */
public enum ParentPolicy {
    /** Adding a parent first removes the current one, giving a tree. */
    SINGLE,
    /** Parents accumulate in the parent array, giving a DAG. */
    MULTIPLE
}
