package com.bayesnet.tensor;

import org.junit.Test;

import static org.junit.Assert.*;

public class TensorTest {

    @Test
    public void testShapeAndRowMajorAccess() {
        Tensor t = Tensor.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
        assertEquals(2, t.rank());
        assertArrayEquals(new int[] { 2, 3 }, t.shape());
        assertEquals(6, t.size());
        assertEquals(6.0, t.get(1, 2), 0.0);
        assertEquals(2.0, t.get(0, 1), 0.0);
        assertArrayEquals(new double[] { 1, 2, 3, 4, 5, 6 }, t.toArray(), 0.0);
    }

    @Test
    public void testRank3Factory() {
        Tensor t = Tensor.of(new double[][][] { { { 1, 2 }, { 3, 4 } }, { { 5, 6 }, { 7, 8 } } });
        assertArrayEquals(new int[] { 2, 2, 2 }, t.shape());
        assertEquals(7.0, t.get(1, 1, 0), 0.0);
    }

    @Test
    public void testInputArrayIsCopied() {
        double[] data = { 0.5, 0.5 };
        Tensor t = Tensor.of(data);
        data[0] = 99;
        assertEquals(0.5, t.get(0), 0.0);
        t.toArray()[1] = 42;
        assertEquals(0.5, t.get(1), 0.0);
    }

    @Test
    public void testNormalize() {
        Tensor t = Tensor.of(1, 3).normalize();
        assertEquals(0.25, t.get(0), 1e-12);
        assertEquals(0.75, t.get(1), 1e-12);
        assertEquals(1.0, t.sum(), 1e-12);
    }

    @Test(expected = IllegalStateException.class)
    public void testNormalizeZeroMassFails() {
        Tensor.of(0, 0).normalize();
    }

    @Test
    public void testSliceDropsAxis() {
        // shape [2, 3, 2]
        double[] data = new double[12];
        for (int i = 0; i < 12; i++)
            data[i] = i;
        Tensor t = Tensor.of(new int[] { 2, 3, 2 }, data);

        Tensor middle = t.slice(1, 2);
        assertArrayEquals(new int[] { 2, 2 }, middle.shape());
        assertEquals(t.get(0, 2, 0), middle.get(0, 0), 0.0);
        assertEquals(t.get(1, 2, 1), middle.get(1, 1), 0.0);

        Tensor first = t.slice(0, 1);
        assertArrayEquals(new int[] { 3, 2 }, first.shape());
        assertEquals(t.get(1, 1, 0), first.get(1, 0), 0.0);

        Tensor last = t.slice(2, 0);
        assertArrayEquals(new int[] { 2, 3 }, last.shape());
        assertEquals(t.get(1, 2, 0), last.get(1, 2), 0.0);
    }

    @Test
    public void testSliceToScalar() {
        Tensor s = Tensor.of(0.2, 0.8).slice(0, 1);
        assertEquals(0, s.rank());
        assertEquals(0.8, s.get(), 0.0);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testSliceOutOfRange() {
        Tensor.of(0.2, 0.8).slice(0, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShapeDataMismatch() {
        Tensor.of(new int[] { 2, 2 }, new double[] { 1, 2, 3 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedMatrix() {
        Tensor.of(new double[][] { { 1, 2 }, { 3 } });
    }

    @Test
    public void testEqualityIsByValue() {
        assertEquals(Tensor.of(1, 2), Tensor.of(new int[] { 2 }, new double[] { 1, 2 }));
        assertNotEquals(Tensor.of(1, 2), Tensor.of(new int[] { 1, 2 }, new double[] { 1, 2 }));
        assertTrue(Tensor.of(1, 2).approxEquals(Tensor.of(1 + 1e-12, 2), 1e-9));
        assertFalse(Tensor.of(1, 2).approxEquals(Tensor.of(1.1, 2), 1e-9));
    }
}
