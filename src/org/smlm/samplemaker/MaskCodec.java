package org.smlm.samplemaker;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;

/**
 * Reads and writes masks as 8-bit grayscale PNG files (255 = white, 0 = black).
 */
public final class MaskCodec {

    private MaskCodec() {}

    public static void save(Mask mask, String path) throws IOException {
        save(mask.toArray(), path);
    }

    public static void save(boolean[][] mask, String path) throws IOException {
        int h = mask.length;
        int w = (h > 0) ? mask[0].length : 0;
        if (h == 0 || w == 0) throw new IllegalArgumentException("Mask is empty");
        ByteProcessor bp = new ByteProcessor(w, h);
        for (int y = 0; y < h; y++) {
            if (mask[y].length != w) throw new IllegalArgumentException("Mask rows have different lengths");
            for (int x = 0; x < w; x++) bp.set(x, y, mask[y][x] ? 255 : 0);
        }
        FileSaver fs = new FileSaver(new ImagePlus(new File(path).getName(), bp));
        // saveAsPng reports success even when the PNG writer fails
        if (!fs.saveAsPng(path) || !new File(path).isFile()) throw new IOException("Failed to save mask to " + path);
    }

    /**
     * Loads a grayscale image and binarizes it: a pixel is white when its value is at least
     * half the maximum of the image type (127.5 for 8-bit and RGB, 32767.5 for 16-bit,
     * half the image maximum for 32-bit).
     *
     * @return grid indexed {@code [row][col]}
     */
    public static boolean[][] read(String path) throws IOException {
        return binarize(open(path).getProcessor());
    }

    /**
     * Same as {@link #read(String)}, with the image scaled to {@code size x size}
     * (nearest neighbour) before binarization.
     *
     * @throws IOException if the file cannot be opened or the image is not square
     */
    public static boolean[][] read(String path, int size) throws IOException {
        ImageProcessor ip = open(path).getProcessor();
        if (ip.getWidth() != ip.getHeight()) {
            throw new IOException("image is " + ip.getWidth() + "x" + ip.getHeight() + ", not square");
        }
        if (ip.getBitDepth() == 24) ip = ip.convertToByteProcessor(false);
        if (ip.getWidth() != size) {
            ip.setInterpolationMethod(ImageProcessor.NONE);
            ip = ip.resize(size, size);
        }
        return binarize(ip);
    }

    private static boolean[][] binarize(ImageProcessor ip) {
        double threshold;
        switch (ip.getBitDepth()) {
            case 16:
                threshold = 65535 / 2.0;
                break;
            case 32:
                threshold = ip.getStatistics().max / 2.0;
                break;
            case 24:
                ip = ip.convertToByteProcessor(false);
                threshold = 255 / 2.0;
                break;
            default:
                threshold = 255 / 2.0;
                break;
        }
        int w = ip.getWidth();
        int h = ip.getHeight();
        boolean[][] mask = new boolean[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) mask[y][x] = ip.getf(x, y) >= threshold;
        }
        return mask;
    }

    static ImagePlus open(String path) throws IOException {
        if (path == null || !new File(path).isFile()) throw new IOException("File not found: " + path);
        ImagePlus imp = IJ.openImage(path);
        if (imp == null) throw new IOException("Cannot open image: " + path);
        return imp;
    }
}
