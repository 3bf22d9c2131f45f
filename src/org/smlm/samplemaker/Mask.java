package org.smlm.samplemaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Square boolean structure mask, indexed {@code mask[row][col]} like the frames ({@code image[y][x]}).
 * A mask never changes once generated; {@link #withSize(int)} and {@link #withPattern(Pattern)}
 * build a new one.
 * <p>
 * Structurally invalid parameters (squares that do not fit, a ray count that is not a power of two,
 * a missing image file) never throw: the mask falls back to all-white and the reason is logged
 * and kept in {@link #getWarnings()}.
 */
public final class Mask {

    private static final Logger logger = LoggerFactory.getLogger(Mask.class);

    public static final int DEFAULT_SIZE = 256;

    private final int size;
    private final Pattern pattern;
    private final boolean[][] mask;
    private final List<String> warnings;

    private Mask(int size, Pattern pattern, boolean[][] mask, List<String> warnings) {
        this.size = size;
        this.pattern = pattern;
        this.mask = mask;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    /** All-white mask of the default size. */
    public Mask() {
        this(DEFAULT_SIZE, Pattern.NONE, white(DEFAULT_SIZE), new ArrayList<>());
    }

    public static Mask generate(Pattern pattern, int size) {
        if (size <= 0) throw new IllegalArgumentException("Mask size must be positive: " + size);
        Pattern p = pattern == null ? Pattern.NONE : pattern;
        List<String> warnings = new ArrayList<>();
        switch (p.type) {
            case STRIPES:
                return new Mask(size, p, stripes(size, (PatternOptions.StripesOptions) p.options, warnings), warnings);
            case SQUARES:
                return new Mask(size, p, squares(size, ((PatternOptions.SquaresOptions) p.options).size, warnings), warnings);
            case SUN:
                return new Mask(size, p, sun(size, ((PatternOptions.SunOptions) p.options).rayCount, warnings), warnings);
            case EXISTING_IMAGE:
                return new Mask(size, p, existingImage(size, ((PatternOptions.ExistingImageOptions) p.options).path, warnings), warnings);
            default:
                return new Mask(size, p, white(size), warnings);
        }
    }

    /**
     * Wraps an existing grid, e.g. one read by {@link MaskCodec}. The grid is copied.
     */
    public static Mask of(boolean[][] grid, Pattern pattern) {
        int n = grid.length;
        boolean[][] copy = new boolean[n][];
        for (int r = 0; r < n; r++) {
            if (grid[r].length != n) throw new IllegalArgumentException("Mask must be square, row " + r + " has " + grid[r].length + " columns");
            copy[r] = Arrays.copyOf(grid[r], n);
        }
        return new Mask(n, pattern == null ? Pattern.NONE : pattern, copy, new ArrayList<>());
    }

    public Mask withSize(int newSize) {
        return generate(pattern, newSize);
    }

    public Mask withPattern(Pattern newPattern) {
        return generate(newPattern, size);
    }

    public int getSize() {
        return size;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean get(int row, int col) {
        return mask[row][col];
    }

    /** Copy of the grid. */
    public boolean[][] toArray() {
        boolean[][] out = new boolean[size][];
        for (int r = 0; r < size; r++) out[r] = Arrays.copyOf(mask[r], size);
        return out;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public int countWhite() {
        int n = 0;
        for (boolean[] row : mask) for (boolean b : row) if (b) n++;
        return n;
    }

    public boolean isAllWhite() {
        return countWhite() == size * size;
    }

    @Override
    public String toString() {
        return "Size: " + size + ", " + pattern;
    }

    //  generators

    private static boolean[][] white(int size) {
        boolean[][] m = new boolean[size][size];
        for (boolean[] row : m) Arrays.fill(row, true);
        return m;
    }

    private static boolean[][] failSoft(int size, String msg, List<String> warnings) {
        logger.warn("{} White mask generated.", msg);
        warnings.add(msg);
        return white(size);
    }

    private static boolean[][] stripes(int size, PatternOptions.StripesOptions opts, List<String> warnings) {
        List<Double> limits = new ArrayList<>();
        for (int len : opts.lengths) {
            // one black band and one white band of the same width
            limits.add((double) len);
            limits.add((double) len);
        }
        if (opts.mirror) {
            List<Double> reversed = new ArrayList<>(limits);
            Collections.reverse(reversed);
            limits.add(1.0);
            limits.addAll(reversed);
        }
        double total = 0;
        double[] cumulative = new double[limits.size()];
        for (int i = 0; i < cumulative.length; i++) {
            total += limits.get(i);
            cumulative[i] = total;
        }
        if (limits.isEmpty() || total <= 0) {
            return failSoft(size, "Stripe lengths are empty or not positive (" + opts.lengths + ").", warnings);
        }

        double ratio = size / total;
        int n = cumulative.length;
        int[] pixelLimits = new int[n + 1];
        // a mirrored pattern reflects the limits of its first half around the separator
        int scaled = opts.mirror ? opts.lengths.size() * 2 : n;
        for (int i = 0; i < scaled; i++) pixelLimits[i + 1] = (int) (cumulative[i] * ratio);
        for (int i = scaled + 1; i <= n; i++) pixelLimits[i] = size - pixelLimits[n - i];

        boolean[][] m = new boolean[size][size];
        for (int i = 0; i + 1 < pixelLimits.length; i += 2) {
            int start = Math.max(0, pixelLimits[i]);
            int end = Math.min(size, pixelLimits[i + 1]);
            for (int a = start; a < end; a++) {
                for (int b = 0; b < size; b++) {
                    if (opts.orientation) m[b][a] = true; // vertical band: column a
                    else m[a][b] = true;
                }
            }
        }
        return m;
    }

    private static boolean[][] squares(int size, int s, List<String> warnings) {
        if (s <= 0 || s * 2 > size) {
            return failSoft(size, "Square size " + s + " does not fit in a " + size + " px mask.", warnings);
        }
        int n = (size - s) / (s * 2) + 1;
        int start = (size - (n * (s * 2) - s)) / 2;
        boolean[][] m = new boolean[size][size];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int r0 = start + i * (s * 2);
                int c0 = start + j * (s * 2);
                for (int r = r0; r < r0 + s; r++) Arrays.fill(m[r], c0, c0 + s, true);
            }
        }
        return m;
    }

    private static boolean[][] sun(int size, int rays, List<String> warnings) {
        if (rays <= 0 || (rays & (rays - 1)) != 0) {
            return failSoft(size, "Ray count " + rays + " is not a power of two.", warnings);
        }
        int center = size / 2;
        int segments = rays * 2;
        double anglePerSegment = 2.0 * Math.PI / segments;
        boolean[][] m = new boolean[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double angle = (Math.atan2(r - center, c - center) + 2.0 * Math.PI) % (2.0 * Math.PI);
                int segment = (int) (angle / anglePerSegment);
                m[r][c] = segment % 2 == 0;
            }
        }
        return m;
    }

    private static boolean[][] existingImage(int size, String path, List<String> warnings) {
        if (path == null || path.isEmpty() || !new File(path).isFile()) {
            return failSoft(size, "No mask file given or file not found: '" + path + "'.", warnings);
        }
        try {
            return MaskCodec.read(path, size);
        } catch (IOException e) {
            logger.debug("Mask image read failed", e);
            return failSoft(size, "Cannot read mask image '" + path + "': " + e.getMessage() + ".", warnings);
        }
    }
}
