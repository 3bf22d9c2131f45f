package org.smlm.samplemaker;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ShortProcessor;

import java.io.File;
import java.io.IOException;

/**
 * Writes stacks as 16-bit multi-page TIFF files and reads them back.
 */
public final class StackCodec {

    public static final int MAX_UI_16 = 65535;

    private StackCodec() {}

    public static void save(Stack stack, String path) throws IOException {
        if (stack.isEmpty()) throw new IllegalArgumentException("Cannot save an empty stack");
        int[] shape = stack.shape();
        int h = shape[1];
        int w = shape[2];
        ImageStack is = new ImageStack(w, h);
        for (int f = 0; f < stack.size(); f++) {
            double[][] image = stack.get(f);
            short[] shortPix = new short[w * h];
            int idx = 0;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    double v = image[y][x];
                    int v16 = (v <= 0 || Double.isNaN(v)) ? 0 : (int) Math.min(v, MAX_UI_16);
                    shortPix[idx++] = (short) (v16 & 0xffff);
                }
            }
            is.addSlice(String.format("f%06d", f), new ShortProcessor(w, h, shortPix, null));
        }
        ImagePlus imp = new ImagePlus(new File(path).getName(), is);
        FileSaver fs = new FileSaver(imp);
        boolean ok = (is.getSize() > 1) ? fs.saveAsTiffStack(path) : fs.saveAsTiff(path);
        if (!ok) throw new IOException("TIFF stack save failed: " + path);
    }

    /** Saves a single frame as a one-frame stack. */
    public static void save(double[][] frame, String path) throws IOException {
        Stack stack = new Stack();
        stack.add(frame);
        save(stack, path);
    }

    public static Stack read(String path) throws IOException {
        ImagePlus imp = MaskCodec.open(path);
        ImageStack is = imp.getStack();
        Stack stack = new Stack();
        for (int i = 1; i <= is.getSize(); i++) {
            stack.add(FrameCodec.toFrame(is.getProcessor(i), 1.0));
        }
        return stack;
    }
}
