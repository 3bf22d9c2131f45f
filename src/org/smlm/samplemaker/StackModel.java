package org.smlm.samplemaker;

import java.util.Map;
import java.util.Objects;

/**
 * Stack model selector. The random model takes no options.
 */
public final class StackModel {

    public final StackModelType type;

    public StackModel() {
        this(StackModelType.RANDOM);
    }

    public StackModel(StackModelType type) {
        this.type = type;
    }

    /**
     * @throws IllegalArgumentException if {@code options} holds a key the model does not accept
     */
    public static StackModel fromModel(StackModelType type, Map<String, ?> options) {
        Objects.requireNonNull(type, "type");
        if (options != null && !options.isEmpty()) {
            throw new IllegalArgumentException("Stack model " + type + " takes no options, got " + options.keySet());
        }
        return new StackModel(type);
    }

    @Override
    public String toString() {
        return "Model: " + type + ", Options: No Options";
    }
}
