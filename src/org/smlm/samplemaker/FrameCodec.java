package org.smlm.samplemaker;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.io.File;
import java.io.IOException;

/**
 * Writes frames as 8-bit PNG previews and reads PNG images back as frames.
 */
public final class FrameCodec {

    private static final double EPS = Math.ulp(1.0f);

    private FrameCodec() {}

    /**
     * Saves a frame as 8-bit grayscale. The value found at {@code percentile} (0..100) becomes 255;
     * brighter pixels saturate. A percentile of 0 disables rescaling and the raw values are clamped.
     */
    public static void save(double[][] frame, String path, double percentile) throws IOException {
        int h = frame.length;
        int w = (h > 0) ? frame[0].length : 0;
        if (h == 0 || w == 0) throw new IllegalArgumentException("Frame is empty");

        double p = Math.max(0.0, Math.min(100.0, percentile));
        double scale = 1.0;
        if (Math.abs(p) > EPS) {
            double maxI = percentileOf(frame, p);
            scale = (maxI == 0) ? 0.0 : 255.0 / maxI;
        }

        ByteProcessor bp = new ByteProcessor(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = frame[y][x] * scale;
                if (v < 0) v = 0;
                if (v > 255) v = 255;
                bp.set(x, y, (int) v);
            }
        }
        FileSaver fs = new FileSaver(new ImagePlus(new File(path).getName(), bp));
        if (!fs.saveAsPng(path) || !new File(path).isFile()) throw new IOException("Failed to save frame to " + path);
    }

    public static void save(double[][] frame, String path) throws IOException {
        save(frame, path, 100.0);
    }

    /**
     * Loads a grayscale image as a frame, multiplying each value by {@code intensityFactor}.
     */
    public static double[][] read(String path, double intensityFactor) throws IOException {
        ImagePlus imp = MaskCodec.open(path);
        return toFrame(imp.getProcessor(), intensityFactor);
    }

    public static double[][] read(String path) throws IOException {
        return read(path, 1.0);
    }

    static double[][] toFrame(ImageProcessor source, double factor) {
        ImageProcessor ip = source.convertToFloatProcessor();
        int w = ip.getWidth();
        int h = ip.getHeight();
        double[][] image = new double[h][w];
        float[] pix = (float[]) ip.getPixels();
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                image[y][x] = pix[row + x] * factor;
            }
        }
        return image;
    }

    static double percentileOf(double[][] frame, double p) {
        int w = frame[0].length;
        double[] values = new double[frame.length * w];
        for (int y = 0; y < frame.length; y++) System.arraycopy(frame[y], 0, values, y * w, w);
        // R_7 is linear interpolation between closest ranks
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
    }
}
