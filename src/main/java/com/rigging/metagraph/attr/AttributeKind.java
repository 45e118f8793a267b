package com.rigging.metagraph.attr;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Closed catalog of attribute value kinds.
 *
 * Each kind fixes four things about an attribute slot for its whole lifetime:
 * the host attribute family that constructs it, the native data type inside that
 * family, how many numeric components a value has, and whether a value is carried
 * at all (edge-only kinds carry none).
 *
 * The numeric {@link #code()} values are the host's identifiers of the kinds.
 * BYTE shares its code with LONG, so records persist the constant name and
 * {@link #fromCode(int)} resolves a shared code to the first declared constant.
 *
 * Canonical Java value types:
 * - BOOLEAN: Boolean, BYTE: Byte, SHORT: Short, INT/LONG: Integer, INT64/ADDR: Long,
 * CHAR: Character, FLOAT: Float, DOUBLE and the unit kinds: Double, ENUM: Integer
 * - 2/3/4 component tuples: double[], float[], int[] or short[]
 * - STRING: String, MATRIX: double[16]
 * - FLOAT_ARRAY: float[], DOUBLE_ARRAY: double[], INT_ARRAY: int[]
 * - POINT_ARRAY, VECTOR_ARRAY, MATRIX_ARRAY: List of double[]
 * - STRING_ARRAY: List of String
 */
public enum AttributeKind {
    BOOLEAN(0, AttributeFamily.NUMERIC, "kBoolean", 1),
    SHORT(1, AttributeFamily.NUMERIC, "kShort", 1),
    INT(2, AttributeFamily.NUMERIC, "kInt", 1),
    LONG(3, AttributeFamily.NUMERIC, "kLong", 1),
    BYTE(3, AttributeFamily.NUMERIC, "kByte", 1),
    FLOAT(4, AttributeFamily.NUMERIC, "kFloat", 1),
    DOUBLE(5, AttributeFamily.NUMERIC, "kDouble", 1),
    ADDR(6, AttributeFamily.NUMERIC, "kAddr", 1),
    CHAR(8, AttributeFamily.NUMERIC, "kChar", 1),
    DISTANCE(9, AttributeFamily.UNIT, "kDistance", 1),
    ANGLE(10, AttributeFamily.UNIT, "kAngle", 1),
    TIME(11, AttributeFamily.UNIT, "kTime", 1),
    ENUM(12, AttributeFamily.ENUM, "kEnumAttribute", 1),
    STRING(13, AttributeFamily.TYPED, "kString", 0),
    MATRIX(14, AttributeFamily.TYPED, "kMatrix", 16),
    FLOAT_ARRAY(15, AttributeFamily.TYPED, "kFloatArray", 0),
    DOUBLE_ARRAY(16, AttributeFamily.TYPED, "kDoubleArray", 0),
    INT_ARRAY(17, AttributeFamily.TYPED, "kIntArray", 0),
    POINT_ARRAY(18, AttributeFamily.TYPED, "kPointArray", 4),
    VECTOR_ARRAY(19, AttributeFamily.TYPED, "kVectorArray", 3),
    STRING_ARRAY(20, AttributeFamily.TYPED, "kStringArray", 0),
    MATRIX_ARRAY(21, AttributeFamily.TYPED, "kMatrixArray", 16),
    COMPOUND(22, AttributeFamily.COMPOUND, "kCompoundAttribute", 0),
    INT64(23, AttributeFamily.NUMERIC, "kInt64", 1),
    DOUBLE2(25, AttributeFamily.NUMERIC, "k2Double", 2),
    FLOAT2(26, AttributeFamily.NUMERIC, "k2Float", 2),
    INT2(27, AttributeFamily.NUMERIC, "k2Int", 2),
    LONG2(28, AttributeFamily.NUMERIC, "k2Long", 2),
    SHORT2(29, AttributeFamily.NUMERIC, "k2Short", 2),
    DOUBLE3(30, AttributeFamily.NUMERIC, "k3Double", 3),
    FLOAT3(31, AttributeFamily.NUMERIC, "k3Float", 3),
    INT3(32, AttributeFamily.NUMERIC, "k3Int", 3),
    LONG3(33, AttributeFamily.NUMERIC, "k3Long", 3),
    SHORT3(34, AttributeFamily.NUMERIC, "k3Short", 3),
    DOUBLE4(35, AttributeFamily.NUMERIC, "k4Double", 4),
    MESSAGE(36, AttributeFamily.MESSAGE, "kMessageAttribute", 0);

    private static final List<AttributeKind> TUPLES = List.of(DOUBLE2, FLOAT2, INT2, LONG2, SHORT2, DOUBLE3,
            FLOAT3, INT3, LONG3, SHORT3, DOUBLE4);

    private final int code;
    private final AttributeFamily family;
    private final String nativeType;
    private final int components;

    AttributeKind(int code, AttributeFamily family, String nativeType, int components) {
        this.code = code;
        this.family = family;
        this.nativeType = nativeType;
        this.components = components;
    }

    public int code() {
        return code;
    }

    public AttributeFamily family() {
        return family;
    }

    /** Data type constant inside the host family, e.g. {@code k3Double}. */
    public String nativeType() {
        return nativeType;
    }

    /**
     * Number of numeric components of one value (or of one element for the
     * point, vector and matrix arrays). Zero for non numeric shapes.
     */
    public int components() {
        return components;
    }

    /** Edge-only and compound kinds have no value of their own. */
    public boolean carriesValue() {
        return family != AttributeFamily.MESSAGE && family != AttributeFamily.COMPOUND;
    }

    public boolean isTuple() {
        return TUPLES.contains(this);
    }

    public boolean isScalarNumber() {
        return (family == AttributeFamily.NUMERIC && components == 1 && this != BOOLEAN)
                || family == AttributeFamily.UNIT || family == AttributeFamily.ENUM;
    }

    /** Min, max, soft min and soft max only exist on scalar numeric, unit and enum kinds. */
    public boolean supportsBounds() {
        return isScalarNumber() && this != CHAR && this != ADDR;
    }

    public boolean supportsDefault() {
        return carriesValue();
    }

    /** Whether an edge from a slot of this kind may land on a slot of {@code other}. */
    public boolean isCompatibleWith(AttributeKind other) {
        if (this == other)
            return true;
        if (family == AttributeFamily.MESSAGE || other.family == AttributeFamily.MESSAGE)
            return false;
        if (isScalarNumber() && other.isScalarNumber())
            return true;
        return isTuple() && other.isTuple() && components == other.components;
    }

    /** The value a freshly created slot of this kind holds. */
    public Object defaultValue() {
        return Values.defaultFor(this);
    }

    /**
     * Converts a loosely typed value (boxed numbers of another width, lists of
     * numbers, strings for characters) to this kind's canonical representation.
     *
     * @throws IllegalArgumentException when the value cannot represent this kind.
     */
    public Object coerce(Object value) {
        return Values.coerce(this, value);
    }

    public static AttributeKind fromCode(int code) {
        for (AttributeKind k : values()) {
            if (k.code == code)
                return k;
        }
        throw new IllegalArgumentException("Unknown attribute kind code: " + code);
    }

    /** Accepts a constant name, a native type name or a numeric code. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AttributeKind fromJson(Object raw) {
        if (raw instanceof Number n)
            return fromCode(n.intValue());
        return fromString(String.valueOf(raw));
    }

    public static AttributeKind fromString(String text) {
        for (AttributeKind k : values()) {
            if (k.name().equalsIgnoreCase(text) || k.nativeType.equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown attribute kind: " + text);
    }
}
