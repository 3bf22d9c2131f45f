package org.smlm.samplemaker;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoiserTest {

    private static final int SIZE = 64;

    /** Two ramps 0..255 side by side. */
    private static double[][] gradient() {
        double[][] image = new double[SIZE][SIZE];
        int half = SIZE / 2;
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) image[y][x] = 255.0 * (x % half) / (half - 1);
        }
        return image;
    }

    private static double mean(double[][] image) {
        double s = 0;
        for (double[] row : image) for (double v : row) s += v;
        return s / (image.length * image[0].length);
    }

    @Test
    void testNoNoise_ReturnsUnchangedCopy() {
        double[][] ref = gradient();
        double[][] res = new Noiser(0, 0, 0).apply(ref, new Well19937c(1));
        assertNotSame(ref, res);
        for (int y = 0; y < SIZE; y++) assertArrayEquals(ref[y], res[y], 1e-5);
    }

    @Test
    void testInputIsNotModified() {
        double[][] ref = gradient();
        double[][] copy = gradient();
        new Noiser(5, 100, 20).apply(ref, new Well19937c(1));
        for (int y = 0; y < SIZE; y++) assertArrayEquals(copy[y], ref[y]);
    }

    @Test
    void testBackgroundOnly_MeanNearBackground() {
        double[][] res = new Noiser(0, 500, 10).apply(new double[SIZE][SIZE], new Well19937c(2));
        assertEquals(500, mean(res), 5);
    }

    @Test
    void testBackgroundWithoutVariation_Skipped() {
        double[][] res = new Noiser(0, 500, 0).apply(new double[SIZE][SIZE], new Well19937c(2));
        assertEquals(0, mean(res));
    }

    @Test
    void testSnrOnZeroSignal_SkippedWithoutNaN() {
        double[][] res = new Noiser(10, 0, 0).apply(new double[SIZE][SIZE], new Well19937c(3));
        for (double[] row : res) for (double v : row) assertEquals(0.0, v);
    }

    @Test
    void testSnrOnConstantSignal_Skipped() {
        double[][] flat = new double[SIZE][SIZE];
        for (double[] row : flat) java.util.Arrays.fill(row, 100.0);
        double[][] res = new Noiser(2, 0, 0).apply(flat, new Well19937c(3));
        for (int y = 0; y < SIZE; y++) assertArrayEquals(flat[y], res[y]);
    }

    @Test
    void testSnrOnly_AddsNonNegativeNoise() {
        double[][] ref = gradient();
        double[][] res = new Noiser(2.5, 0, 0).apply(ref, new Well19937c(4));
        boolean changed = false;
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                assertTrue(res[y][x] >= ref[y][x]);
                assertTrue(res[y][x] <= PsfRenderer.MAX_INTENSITY);
                if (res[y][x] != ref[y][x]) changed = true;
            }
        }
        assertTrue(changed);
    }

    @Test
    void testLowerSnr_MoreNoise() {
        double[][] ref = gradient();
        double low = mean(new Noiser(1, 0, 0).apply(ref, new Well19937c(5))) - mean(ref);
        double high = mean(new Noiser(20, 0, 0).apply(ref, new Well19937c(5))) - mean(ref);
        assertTrue(low > high);
    }

    @Test
    void testCreateNoise_ZeroMeanZeroScale() {
        double[][] noise = Noiser.createNoise(8, 8, 0, 0, new Well19937c(6));
        for (double[] row : noise) for (double v : row) assertEquals(0.0, v);
    }

    @Test
    void testClampedTo16Bit() {
        double[][] res = new Noiser(0, 65000, 50).apply(new double[16][16], new Well19937c(7));
        for (double[] row : res) for (double v : row) assertTrue(v >= 0 && v <= 65535);
    }

    @Test
    void testToString() {
        assertEquals("snr: 10.0, background: 500.0, deviation: 10.0 %", new Noiser().toString());
    }
}
