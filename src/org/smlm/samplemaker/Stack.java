package org.smlm.samplemaker;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered frames of identical shape. {@link #add(double[][], int)} stores a copy of the frame;
 * {@link #get(int)} returns the stored frame itself, so writing to it changes the stack.
 */
public class Stack {

    private final List<double[][]> frames = new ArrayList<>();
    private int height = -1;
    private int width = -1;

    /** Appends a frame. */
    public void add(double[][] frame) {
        add(frame, -1);
    }

    /**
     * Replaces the frame at {@code index}, or appends when {@code index} is negative or past the end.
     *
     * @throws IllegalArgumentException if the frame is not rectangular or its shape differs from the stack
     */
    public void add(double[][] frame, int index) {
        int h = frame.length;
        int w = (h > 0) ? frame[0].length : 0;
        for (double[] row : frame) {
            if (row.length != w) throw new IllegalArgumentException("Frame must be a rectangular 2D array");
        }
        if (frames.isEmpty()) {
            height = h;
            width = w;
        } else if (h != height || w != width) {
            throw new IllegalArgumentException("Frame shape (" + h + ", " + w + ") does not match stack frame shape ("
                    + height + ", " + width + ")");
        }
        double[][] copy = new double[h][];
        for (int y = 0; y < h; y++) copy[y] = frame[y].clone();
        if (index >= 0 && index < frames.size()) frames.set(index, copy);
        else frames.add(copy);
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside the stack
     */
    public double[][] get(int index) {
        if (index < 0 || index >= frames.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside of stack depth " + frames.size());
        }
        return frames.get(index);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /** {frames, height, width}; {0, 0, 0} when empty. */
    public int[] shape() {
        if (frames.isEmpty()) return new int[]{0, 0, 0};
        return new int[]{frames.size(), height, width};
    }

    @Override
    public String toString() {
        if (frames.isEmpty()) return "Empty stack";
        return "Stack: (" + frames.size() + ", " + height + ", " + width + ")";
    }
}
