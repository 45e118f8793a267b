package com.rigging.metagraph.attr;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class ValuesTest {

    @Test
    public void testLooseNumbersAreCoerced() {
        assertEquals(3, AttributeKind.INT.coerce(3.0));
        assertEquals(2.0, AttributeKind.DOUBLE.coerce(2));
        assertEquals(1.5f, AttributeKind.FLOAT.coerce(1.5));
        assertEquals(Boolean.TRUE, AttributeKind.BOOLEAN.coerce(1));
        assertEquals('x', AttributeKind.CHAR.coerce("x"));
    }

    @Test
    public void testJsonListsBecomeCanonicalArrays() {
        assertArrayEquals(new double[] { 1, 2, 3 }, (double[]) AttributeKind.DOUBLE3.coerce(List.of(1, 2, 3.0)),
                0.0);
        assertArrayEquals(new int[] { 1, 2, 3, 4, 5 },
                (int[]) AttributeKind.INT_ARRAY.coerce(List.of(1, 2, 3, 4, 5)));
        assertArrayEquals(new float[] { 0.5f, 1f }, (float[]) AttributeKind.FLOAT2.coerce(List.of(0.5, 1)), 0f);
    }

    @Test
    public void testPointArrayGainsHomogeneousComponent() {
        @SuppressWarnings("unchecked")
        List<double[]> points = (List<double[]>) AttributeKind.POINT_ARRAY.coerce(List.of(List.of(1, 2, 3)));
        assertArrayEquals(new double[] { 1, 2, 3, 1 }, points.get(0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongTupleSize() {
        AttributeKind.DOUBLE3.coerce(List.of(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericString() {
        AttributeKind.DOUBLE.coerce("abc");
    }

    @Test
    public void testNarrowingKindsAcceptTheirBounds() {
        assertEquals((byte) -128, AttributeKind.BYTE.coerce(-128));
        assertEquals((short) 32767, AttributeKind.SHORT.coerce(32767));
        assertEquals(Integer.MAX_VALUE, AttributeKind.INT.coerce(2147483647L));
        assertEquals(Long.MAX_VALUE, AttributeKind.INT64.coerce(Long.MAX_VALUE));
        assertEquals((char) 65535, AttributeKind.CHAR.coerce(65535));
        assertEquals(2, AttributeKind.LONG.coerce(2.7));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testByteOutOfRange() {
        AttributeKind.BYTE.coerce(128);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortOutOfRange() {
        AttributeKind.SHORT.coerce(70000);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIntOutOfRange() {
        AttributeKind.INT.coerce(3_000_000_000L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLongOutOfRangeFromDouble() {
        AttributeKind.LONG.coerce(-3.0e9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEnumOutOfRange() {
        AttributeKind.ENUM.coerce(1L << 40);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInt64FromHugeBigInteger() {
        AttributeKind.INT64.coerce(new java.math.BigInteger("18446744073709551616"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeChar() {
        AttributeKind.CHAR.coerce(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShort3ComponentOutOfRange() {
        AttributeKind.SHORT3.coerce(List.of(1, 40000, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInt3ComponentOutOfRange() {
        AttributeKind.INT3.coerce(List.of(1, 2, 5e9));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNIsNotAnInteger() {
        AttributeKind.INT.coerce(Double.NaN);
    }

    @Test
    public void testMessageCarriesNoValue() {
        assertFalse(AttributeKind.MESSAGE.carriesValue());
        assertNull(AttributeKind.MESSAGE.coerce("anything"));
        assertNull(AttributeKind.MESSAGE.defaultValue());
    }

    @Test
    public void testDefaults() {
        assertArrayEquals(Values.identityMatrix(), (double[]) AttributeKind.MATRIX.defaultValue(), 0.0);
        assertEquals("", AttributeKind.STRING.defaultValue());
        assertEquals(0, AttributeKind.ENUM.defaultValue());
    }

    @Test
    public void testValueEqualsComparesContent() {
        assertTrue(Values.valueEquals(new double[] { 1, 2 }, new double[] { 1, 2 }));
        assertFalse(Values.valueEquals(new double[] { 1, 2 }, new double[] { 1, 3 }));
        assertTrue(Values.valueEquals(List.of(new double[] { 1 }), List.of(new double[] { 1 })));
        assertFalse(Values.valueEquals(null, 0));
    }

    @Test
    public void testCopyIsDeep() {
        double[] original = { 1, 2, 3 };
        double[] copy = (double[]) Values.copy(original);
        copy[0] = 9;
        assertEquals(1.0, original[0], 0.0);
    }

    @Test
    public void testCodes() {
        assertEquals(36, AttributeKind.MESSAGE.code());
        assertEquals(AttributeKind.LONG, AttributeKind.fromCode(3));
        assertEquals(AttributeKind.DOUBLE3, AttributeKind.fromString("k3Double"));
        assertEquals(AttributeKind.BYTE, AttributeKind.fromJson("BYTE"));
        assertEquals(AttributeFamily.UNIT, AttributeKind.ANGLE.family());
    }

    @Test
    public void testCompatibility() {
        assertTrue(AttributeKind.DOUBLE.isCompatibleWith(AttributeKind.FLOAT));
        assertTrue(AttributeKind.DOUBLE3.isCompatibleWith(AttributeKind.FLOAT3));
        assertFalse(AttributeKind.DOUBLE3.isCompatibleWith(AttributeKind.DOUBLE2));
        assertFalse(AttributeKind.MESSAGE.isCompatibleWith(AttributeKind.DOUBLE));
        assertTrue(AttributeKind.MESSAGE.isCompatibleWith(AttributeKind.MESSAGE));
    }
}
