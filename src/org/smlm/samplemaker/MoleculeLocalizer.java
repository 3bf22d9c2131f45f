package org.smlm.samplemaker;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces molecule positions: uniformly random from a density, or on a calibration grid.
 */
public final class MoleculeLocalizer {

    private MoleculeLocalizer() {}

    /** Image area in square micrometres. {@code pixelSize} is in nanometres. */
    public static double area(int size, double pixelSize) {
        double side = size * pixelSize / 1000.0;
        return side * side;
    }

    /** Expected molecule count for a density in molecules per square micrometre. */
    public static int moleculeCount(int size, double pixelSize, double density) {
        return (int) (area(size, pixelSize) * density);
    }

    public static List<Localization> localize(int size, double pixelSize, double density, RandomGenerator rng) {
        return localize(size, moleculeCount(size, pixelSize, density), rng);
    }

    /**
     * {@code count} positions with x, y uniform in [0, size) and z uniform in [-1, 1).
     */
    public static List<Localization> localize(int size, int count, RandomGenerator rng) {
        List<Localization> out = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            double x = rng.nextDouble() * size;
            double y = rng.nextDouble() * size;
            double z = -1.0 + 2.0 * rng.nextDouble();
            out.add(new Localization(x, y, z));
        }
        return out;
    }

    /**
     * Molecules at the centres of {@code shift}-sized cells: coordinates start at {@code shift/2}
     * and stay below {@code size - shift/2}. Enumeration is row by row, x fastest, with z spread
     * linearly over [-1, 1] in that order.
     */
    public static List<Localization> grid(int size, int shift) {
        if (shift <= 0) throw new IllegalArgumentException("Grid shift must be positive: " + shift);
        int start = shift / 2;
        List<Integer> coords = new ArrayList<>();
        for (int c = start; c < size - start; c += shift) coords.add(c);

        int n = coords.size() * coords.size();
        List<Localization> out = new ArrayList<>(n);
        int i = 0;
        for (int y : coords) {
            for (int x : coords) {
                double z = (n == 1) ? -1.0 : -1.0 + 2.0 * i / (n - 1);
                out.add(new Localization(x, y, z));
                i++;
            }
        }
        return out;
    }

    /**
     * Keeps the positions whose truncated pixel, clamped to the mask, is white.
     */
    public static List<Localization> filter(List<Localization> positions, Mask mask) {
        int last = mask.getSize() - 1;
        List<Localization> out = new ArrayList<>();
        for (Localization l : positions) {
            int col = Math.max(0, Math.min(last, (int) l.x));
            int row = Math.max(0, Math.min(last, (int) l.y));
            if (mask.get(row, col)) out.add(l);
        }
        return out;
    }
}
