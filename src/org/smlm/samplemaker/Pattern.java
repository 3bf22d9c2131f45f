package org.smlm.samplemaker;

import java.util.Map;
import java.util.Objects;

/**
 * A pattern type together with its option payload.
 */
public final class Pattern {

    public static final Pattern NONE = new Pattern(PatternType.NONE, PatternOptions.NoneOptions.INSTANCE);

    public final PatternType type;
    public final PatternOptions options;

    private Pattern(PatternType type, PatternOptions options) {
        this.type = type;
        this.options = options;
    }

    /**
     * Pattern of the given type with default options.
     */
    public static Pattern fromPattern(PatternType type) {
        return fromPattern(type, null);
    }

    /**
     * Pattern of the given type; {@code options} may be null or partial.
     *
     * @throws PatternOptionsException if {@code options} holds a key foreign to {@code type}
     */
    public static Pattern fromPattern(PatternType type, Map<String, ?> options) {
        Objects.requireNonNull(type, "type");
        return new Pattern(type, PatternOptions.forType(type, options));
    }

    public static Pattern stripes(PatternOptions.StripesOptions options) {
        return new Pattern(PatternType.STRIPES, options);
    }

    public static Pattern squares(int size) {
        return new Pattern(PatternType.SQUARES, new PatternOptions.SquaresOptions(size));
    }

    public static Pattern sun(int rayCount) {
        return new Pattern(PatternType.SUN, new PatternOptions.SunOptions(rayCount));
    }

    public static Pattern existingImage(String path) {
        return new Pattern(PatternType.EXISTING_IMAGE, new PatternOptions.ExistingImageOptions(path));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern other = (Pattern) o;
        return type == other.type && options.toString().equals(other.options.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, options.toString());
    }

    @Override
    public String toString() {
        return "Pattern: " + type + ", Options: " + options;
    }
}
