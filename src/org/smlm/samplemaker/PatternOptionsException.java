package org.smlm.samplemaker;

/**
 * Thrown when an option map does not fit the pattern type it is attached to
 * (unknown key or value of the wrong type).
 */
public class PatternOptionsException extends IllegalArgumentException {

    private final PatternType patternType;

    public PatternOptionsException(PatternType patternType, String message) {
        super(patternType + ": " + message);
        this.patternType = patternType;
    }

    public PatternType getPatternType() {
        return patternType;
    }
}
