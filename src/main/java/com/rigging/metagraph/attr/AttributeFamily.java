package com.rigging.metagraph.attr;

/**
 * The host-native attribute constructor a kind maps to.
 */
public enum AttributeFamily {
    /** Numeric scalars and fixed-size numeric tuples. */
    NUMERIC("MFnNumericAttribute"),
    /** Distance, angle and time values carrying a unit. */
    UNIT("MFnUnitAttribute"),
    ENUM("MFnEnumAttribute"),
    /** Strings, matrices and the data arrays. */
    TYPED("MFnTypedAttribute"),
    COMPOUND("MFnCompoundAttribute"),
    /** Edge-only attributes; the connection is the information. */
    MESSAGE("MFnMessageAttribute");

    private final String nativeConstructor;

    AttributeFamily(String nativeConstructor) {
        this.nativeConstructor = nativeConstructor;
    }

    public String nativeConstructor() {
        return nativeConstructor;
    }
}
