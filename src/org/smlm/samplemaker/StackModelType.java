package org.smlm.samplemaker;

/**
 * How successive frames of a stack relate to each other.
 */
public enum StackModelType {
    /** Independent frames, each drawn afresh. */
    RANDOM("Random");

    private final String displayName;

    StackModelType(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
