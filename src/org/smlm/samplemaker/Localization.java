package org.smlm.samplemaker;

/**
 * Molecule position. x and y are in image pixels, z in [-1, 1] encodes defocus.
 */
public final class Localization {
    public final double x;
    public final double y;
    public final double z;

    public Localization(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    @Override
    public String toString() {
        return String.format("(%.3f, %.3f, %.3f)", x, y, z);
    }
}
