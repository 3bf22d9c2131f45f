package org.smlm.samplemaker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Option payloads, one shape per {@link PatternType}.
 * Instances are immutable; build them through {@link #forType(PatternType, Map)}
 * so that the keys are checked against the selected type.
 */
public interface PatternOptions {

    String STRIPES_LENGTHS = "lengths";
    String STRIPES_MIRROR = "mirror";
    String STRIPES_ORIENTATION = "orientation";
    String SQUARES_SIZE = "size";
    String SUN_RAY_COUNT = "ray_count";
    String IMAGE_PATH = "path";

    /**
     * Option keys accepted by this payload.
     */
    Set<String> keys();

    /**
     * Builds the payload matching {@code type}. Missing keys take their defaults.
     *
     * @throws PatternOptionsException if a key is foreign to the type or a value has the wrong type
     */
    static PatternOptions forType(PatternType type, Map<String, ?> options) {
        Map<String, ?> opts = options == null ? Collections.<String, Object>emptyMap() : options;
        PatternOptions defaults;
        switch (type) {
            case STRIPES:        defaults = new StripesOptions(); break;
            case SQUARES:        defaults = new SquaresOptions(); break;
            case SUN:            defaults = new SunOptions(); break;
            case EXISTING_IMAGE: defaults = new ExistingImageOptions(); break;
            default:             defaults = NoneOptions.INSTANCE; break;
        }
        for (String key : opts.keySet()) {
            if (!defaults.keys().contains(key)) {
                throw new PatternOptionsException(type, "unknown option '" + key + "', expected one of " + defaults.keys());
            }
        }
        switch (type) {
            case STRIPES: {
                StripesOptions d = (StripesOptions) defaults;
                List<Integer> lengths = opts.containsKey(STRIPES_LENGTHS)
                        ? toIntList(type, STRIPES_LENGTHS, opts.get(STRIPES_LENGTHS)) : d.lengths;
                boolean mirror = opts.containsKey(STRIPES_MIRROR)
                        ? toBoolean(type, STRIPES_MIRROR, opts.get(STRIPES_MIRROR)) : d.mirror;
                boolean orientation = opts.containsKey(STRIPES_ORIENTATION)
                        ? toBoolean(type, STRIPES_ORIENTATION, opts.get(STRIPES_ORIENTATION)) : d.orientation;
                return new StripesOptions(lengths, mirror, orientation);
            }
            case SQUARES:
                return opts.containsKey(SQUARES_SIZE)
                        ? new SquaresOptions(toInt(type, SQUARES_SIZE, opts.get(SQUARES_SIZE))) : defaults;
            case SUN:
                return opts.containsKey(SUN_RAY_COUNT)
                        ? new SunOptions(toInt(type, SUN_RAY_COUNT, opts.get(SUN_RAY_COUNT))) : defaults;
            case EXISTING_IMAGE: {
                Object path = opts.get(IMAGE_PATH);
                if (path != null && !(path instanceof CharSequence) && !(path instanceof java.io.File)
                        && !(path instanceof java.nio.file.Path)) {
                    throw new PatternOptionsException(type, "option '" + IMAGE_PATH + "' must be a path, got "
                            + path.getClass().getSimpleName());
                }
                return path == null ? defaults : new ExistingImageOptions(path.toString());
            }
            default:
                return defaults;
        }
    }

    private static int toInt(PatternType type, String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d)) return (int) d;
        }
        throw new PatternOptionsException(type, "option '" + key + "' must be an integer, got " + value);
    }

    private static boolean toBoolean(PatternType type, String key, Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        throw new PatternOptionsException(type, "option '" + key + "' must be a boolean, got " + value);
    }

    private static List<Integer> toIntList(PatternType type, String key, Object value) {
        List<Integer> out = new ArrayList<>();
        if (value instanceof int[]) {
            for (int v : (int[]) value) out.add(v);
        } else if (value instanceof Iterable) {
            for (Object o : (Iterable<?>) value) out.add(toInt(type, key, o));
        } else {
            throw new PatternOptionsException(type, "option '" + key + "' must be a list of integers, got " + value);
        }
        return out;
    }

    /** No options. */
    final class NoneOptions implements PatternOptions {
        public static final NoneOptions INSTANCE = new NoneOptions();

        private NoneOptions() {}

        @Override
        public Set<String> keys() {
            return Collections.emptySet();
        }

        @Override
        public String toString() {
            return "No Options";
        }
    }

    /**
     * Alternating black/white bands. Each length gives one black and one white band of that width.
     * With {@code mirror} the sequence is reflected around a unit separator.
     * {@code orientation} true gives vertical bands (filled along columns).
     */
    final class StripesOptions implements PatternOptions {
        public static final List<Integer> DEFAULT_LENGTHS = Collections.unmodifiableList(Arrays.asList(200, 100, 50, 25, 12, 6));

        public final List<Integer> lengths;
        public final boolean mirror;
        public final boolean orientation;

        public StripesOptions() {
            this(DEFAULT_LENGTHS, true, true);
        }

        public StripesOptions(List<Integer> lengths, boolean mirror, boolean orientation) {
            this.lengths = Collections.unmodifiableList(new ArrayList<>(lengths));
            this.mirror = mirror;
            this.orientation = orientation;
        }

        @Override
        public Set<String> keys() {
            return Set.of(STRIPES_LENGTHS, STRIPES_MIRROR, STRIPES_ORIENTATION);
        }

        @Override
        public String toString() {
            return "Lengths: " + lengths + ", " + (mirror ? "mirrored" : "not mirrored") + ", "
                    + (orientation ? "vertical" : "horizontal");
        }
    }

    /** Lattice of squares of edge {@code size} separated by gaps of the same width. */
    final class SquaresOptions implements PatternOptions {
        public final int size;

        public SquaresOptions() {
            this(32);
        }

        public SquaresOptions(int size) {
            this.size = size;
        }

        @Override
        public Set<String> keys() {
            return Set.of(SQUARES_SIZE);
        }

        @Override
        public String toString() {
            return "Size: " + size;
        }
    }

    /** Triangular wedges meeting at the image centre; {@code rayCount} must be a power of two. */
    final class SunOptions implements PatternOptions {
        public final int rayCount;

        public SunOptions() {
            this(16);
        }

        public SunOptions(int rayCount) {
            this.rayCount = rayCount;
        }

        @Override
        public Set<String> keys() {
            return Set.of(SUN_RAY_COUNT);
        }

        @Override
        public String toString() {
            return "Ray number: " + rayCount;
        }
    }

    /** Grayscale image file binarized at half its maximum value. */
    final class ExistingImageOptions implements PatternOptions {
        public final String path;

        public ExistingImageOptions() {
            this("");
        }

        public ExistingImageOptions(String path) {
            this.path = path == null ? "" : path;
        }

        @Override
        public Set<String> keys() {
            return Set.of(IMAGE_PATH);
        }

        @Override
        public String toString() {
            return "Path: " + path;
        }
    }
}
