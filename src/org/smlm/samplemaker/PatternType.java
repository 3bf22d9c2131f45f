package org.smlm.samplemaker;

/**
 * Structural patterns available for mask generation.
 */
public enum PatternType {
    NONE("None"),
    STRIPES("Stripes"),
    SQUARES("Squares"),
    SUN("Sun"),
    EXISTING_IMAGE("Existing image");

    private final String displayName;

    PatternType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
