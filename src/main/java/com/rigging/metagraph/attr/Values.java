package com.rigging.metagraph.attr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical value conversion, comparison and copying for {@link AttributeKind}s.
 *
 * Values arrive in loose shapes (JSON lists of boxed numbers, an Integer for a
 * float slot, a 3 component point for a point array) and are normalised here so
 * that storage, comparison and serialization only ever see one representation per
 * kind.
 */
public final class Values {

    private static final double[] IDENTITY = {
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 1, 0,
            0, 0, 0, 1 };

    private Values() {
    }

    public static double[] identityMatrix() {
        return IDENTITY.clone();
    }

    static Object defaultFor(AttributeKind kind) {
        switch (kind) {
            case BOOLEAN:
                return Boolean.FALSE;
            case BYTE:
                return (byte) 0;
            case SHORT:
                return (short) 0;
            case INT:
            case LONG:
            case ENUM:
                return 0;
            case INT64:
            case ADDR:
                return 0L;
            case CHAR:
                return '\0';
            case FLOAT:
                return 0f;
            case DOUBLE:
            case DISTANCE:
            case ANGLE:
            case TIME:
                return 0.0;
            case STRING:
                return "";
            case MATRIX:
                return identityMatrix();
            case DOUBLE2:
            case DOUBLE3:
            case DOUBLE4:
                return new double[kind.components()];
            case FLOAT2:
            case FLOAT3:
                return new float[kind.components()];
            case INT2:
            case INT3:
            case LONG2:
            case LONG3:
                return new int[kind.components()];
            case SHORT2:
            case SHORT3:
                return new short[kind.components()];
            case FLOAT_ARRAY:
                return new float[0];
            case DOUBLE_ARRAY:
                return new double[0];
            case INT_ARRAY:
                return new int[0];
            case POINT_ARRAY:
            case VECTOR_ARRAY:
            case MATRIX_ARRAY:
            case STRING_ARRAY:
                return new ArrayList<>();
            default:
                return null;
        }
    }

    static Object coerce(AttributeKind kind, Object value) {
        if (!kind.carriesValue())
            return null;
        if (value == null)
            return defaultFor(kind);
        switch (kind) {
            case BOOLEAN:
                if (value instanceof Boolean)
                    return value;
                return number(kind, value).doubleValue() != 0.0;
            case BYTE:
                return (byte) integral(kind, number(kind, value), Byte.MIN_VALUE, Byte.MAX_VALUE);
            case SHORT:
                return (short) integral(kind, number(kind, value), Short.MIN_VALUE, Short.MAX_VALUE);
            case INT:
            case LONG:
            case ENUM:
                return Math.toIntExact(integral(kind, number(kind, value), Integer.MIN_VALUE, Integer.MAX_VALUE));
            case INT64:
            case ADDR:
                return integral(kind, number(kind, value), Long.MIN_VALUE, Long.MAX_VALUE);
            case CHAR:
                if (value instanceof Character)
                    return value;
                if (value instanceof String && ((String) value).length() == 1)
                    return ((String) value).charAt(0);
                return (char) integral(kind, number(kind, value), Character.MIN_VALUE, Character.MAX_VALUE);
            case FLOAT:
                return number(kind, value).floatValue();
            case DOUBLE:
            case DISTANCE:
            case ANGLE:
            case TIME:
                return number(kind, value).doubleValue();
            case STRING:
                return value.toString();
            case MATRIX:
                return fixed(kind, flatten(kind, value), 16);
            case DOUBLE2:
            case DOUBLE3:
            case DOUBLE4:
                return fixed(kind, flatten(kind, value), kind.components());
            case FLOAT2:
            case FLOAT3:
                return toFloats(fixed(kind, flatten(kind, value), kind.components()));
            case INT2:
            case INT3:
            case LONG2:
            case LONG3:
                return toInts(kind, fixed(kind, flatten(kind, value), kind.components()));
            case SHORT2:
            case SHORT3: {
                double[] d = fixed(kind, flatten(kind, value), kind.components());
                short[] s = new short[d.length];
                for (int i = 0; i < d.length; i++)
                    s[i] = (short) integral(kind, d[i], Short.MIN_VALUE, Short.MAX_VALUE);
                return s;
            }
            case FLOAT_ARRAY:
                return toFloats(flatten(kind, value));
            case DOUBLE_ARRAY:
                return flatten(kind, value);
            case INT_ARRAY:
                return toInts(kind, flatten(kind, value));
            case POINT_ARRAY:
            case VECTOR_ARRAY:
            case MATRIX_ARRAY:
                return tuples(kind, value);
            case STRING_ARRAY:
                return strings(kind, value);
            default:
                throw new IllegalArgumentException("Kind " + kind + " has no value");
        }
    }

    /** Structural equality that compares primitive arrays and lists of arrays by content. */
    public static boolean valueEquals(Object a, Object b) {
        if (a == b)
            return true;
        if (a == null || b == null)
            return false;
        if (a.getClass().isArray() && b.getClass().isArray())
            return Arrays.deepEquals(new Object[] { a }, new Object[] { b });
        if (a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size())
                return false;
            for (int i = 0; i < la.size(); i++) {
                if (!valueEquals(la.get(i), lb.get(i)))
                    return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /** Deep copy of array and list shaped values; immutable scalars are returned as is. */
    public static Object copy(Object value) {
        if (value instanceof double[])
            return ((double[]) value).clone();
        if (value instanceof float[])
            return ((float[]) value).clone();
        if (value instanceof int[])
            return ((int[]) value).clone();
        if (value instanceof short[])
            return ((short[]) value).clone();
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object o : (List<?>) value)
                out.add(copy(o));
            return out;
        }
        return value;
    }

    /** Numeric view of a scalar value, used for bounds and JSON output. */
    public static Number number(AttributeKind kind, Object value) {
        if (value instanceof Number)
            return (Number) value;
        if (value instanceof Boolean)
            return (Boolean) value ? 1 : 0;
        if (value instanceof Character)
            return (int) (Character) value;
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for kind " + kind + ": " + value, e);
            }
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName() + " to " + kind);
    }

    /**
     * Whole number within {@code [min, max]}. Fractions are truncated toward
     * zero; values outside the range are rejected rather than wrapped.
     */
    private static long integral(AttributeKind kind, Number n, long min, long max) {
        long whole;
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            whole = n.longValue();
        } else if (n instanceof BigInteger) {
            if (((BigInteger) n).bitLength() > 63)
                throw outOfRange(kind, n, min, max);
            whole = n.longValue();
        } else {
            double d = n.doubleValue();
            if (Double.isNaN(d) || d < min || d > max)
                throw outOfRange(kind, n, min, max);
            whole = (long) d;
        }
        if (whole < min || whole > max)
            throw outOfRange(kind, n, min, max);
        return whole;
    }

    private static IllegalArgumentException outOfRange(AttributeKind kind, Number n, long min, long max) {
        return new IllegalArgumentException(kind + " value " + n + " is outside [" + min + ", " + max + "]");
    }

    // ── Shape helpers ───────────────────────────────────────────────

    private static double[] flatten(AttributeKind kind, Object value) {
        List<Double> out = new ArrayList<>();
        flattenInto(kind, value, out);
        double[] d = new double[out.size()];
        for (int i = 0; i < d.length; i++)
            d[i] = out.get(i);
        return d;
    }

    private static void flattenInto(AttributeKind kind, Object value, List<Double> out) {
        if (value instanceof double[]) {
            for (double v : (double[]) value)
                out.add(v);
        } else if (value instanceof float[]) {
            for (float v : (float[]) value)
                out.add((double) v);
        } else if (value instanceof int[]) {
            for (int v : (int[]) value)
                out.add((double) v);
        } else if (value instanceof short[]) {
            for (short v : (short[]) value)
                out.add((double) v);
        } else if (value instanceof long[]) {
            for (long v : (long[]) value)
                out.add((double) v);
        } else if (value instanceof Object[]) {
            for (Object o : (Object[]) value)
                flattenInto(kind, o, out);
        } else if (value instanceof Iterable) {
            for (Object o : (Iterable<?>) value)
                flattenInto(kind, o, out);
        } else {
            out.add(number(kind, value).doubleValue());
        }
    }

    private static double[] fixed(AttributeKind kind, double[] values, int size) {
        if (values.length != size)
            throw new IllegalArgumentException(kind + " expects " + size + " components, got " + values.length);
        return values;
    }

    private static float[] toFloats(double[] d) {
        float[] f = new float[d.length];
        for (int i = 0; i < d.length; i++)
            f[i] = (float) d[i];
        return f;
    }

    private static int[] toInts(AttributeKind kind, double[] d) {
        int[] n = new int[d.length];
        for (int i = 0; i < d.length; i++)
            n[i] = (int) integral(kind, d[i], Integer.MIN_VALUE, Integer.MAX_VALUE);
        return n;
    }

    private static List<double[]> tuples(AttributeKind kind, Object value) {
        Iterable<?> items = iterable(kind, value);
        List<double[]> out = new ArrayList<>();
        for (Object item : items) {
            double[] d = flatten(kind, item);
            if (kind == AttributeKind.POINT_ARRAY && d.length == 3)
                d = new double[] { d[0], d[1], d[2], 1.0 };
            out.add(fixed(kind, d, kind.components()));
        }
        return out;
    }

    private static List<String> strings(AttributeKind kind, Object value) {
        List<String> out = new ArrayList<>();
        for (Object item : iterable(kind, value))
            out.add(item == null ? "" : item.toString());
        return out;
    }

    private static Iterable<?> iterable(AttributeKind kind, Object value) {
        if (value instanceof Iterable)
            return (Iterable<?>) value;
        if (value instanceof Object[])
            return Arrays.asList((Object[]) value);
        if (value instanceof String && kind == AttributeKind.STRING_ARRAY)
            return Collections.singletonList(value);
        throw new IllegalArgumentException(kind + " expects a list, got " + value.getClass().getSimpleName());
    }
}
