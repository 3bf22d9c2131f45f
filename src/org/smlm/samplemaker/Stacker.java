package org.smlm.samplemaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds stacks by calling a {@link Sampler} once per frame, according to a {@link StackModel}.
 */
public class Stacker {

    private static final Logger logger = LoggerFactory.getLogger(Stacker.class);

    private final Sampler sampler;
    private StackModel stackModel;

    private volatile ProgressListener progressListener = null;

    // timing / ETA smoothing
    private long startTimeNs = 0L;
    private double avgFrameMs = 0.0;
    private static final double ALPHA = 0.12; // EWMA smoothing for per-frame time

    public Stacker() {
        this(new Sampler(), new StackModel());
    }

    public Stacker(Sampler sampler) {
        this(sampler, new StackModel());
    }

    public Stacker(Sampler sampler, StackModel stackModel) {
        this.sampler = sampler;
        this.stackModel = stackModel;
    }

    public void setProgressListener(ProgressListener l) {
        this.progressListener = l;
    }

    public Sampler getSampler() {
        return sampler;
    }

    public StackModel getStackModel() {
        return stackModel;
    }

    public void setStackModel(StackModel stackModel) {
        this.stackModel = stackModel;
    }

    /**
     * Resets the sampler and generates {@code count} frames.
     *
     * @throws IllegalStateException if no known stack model is selected
     */
    public Stack generate(int count) {
        if (count < 0) throw new IllegalArgumentException("Frame count must not be negative: " + count);
        if (stackModel == null || stackModel.type == null) {
            throw new IllegalStateException("No stack model selected");
        }
        sampler.reset();
        switch (stackModel.type) {
            case RANDOM:
                return randomModel(count);
            default:
                throw new IllegalStateException("Unsupported stack model: " + stackModel.type);
        }
    }

    private Stack randomModel(int count) {
        Stack stack = new Stack();
        startTimeNs = System.nanoTime();
        avgFrameMs = 0.0;
        if (progressListener != null) progressListener.initProgress(count);
        try {
            for (int f = 0; f < count; f++) {
                stack.add(sampler.generateSample());
                updateTimingAndNotifyProgress(f + 1, count);
            }
        } finally {
            if (progressListener != null) progressListener.closeProgress();
        }
        logger.info("Generated stack of {} frames ({} molecules in the last frame)", stack.size(),
                sampler.getLastLocalizations().size());
        return stack;
    }

    private void updateTimingAndNotifyProgress(int processed, int frames) {
        long now = System.nanoTime();
        double elapsedMs = (now - startTimeNs) / 1e6;
        double instFrameMs = (processed > 0) ? (elapsedMs / processed) : 0.0;
        if (avgFrameMs == 0.0) avgFrameMs = instFrameMs;
        else avgFrameMs = ALPHA * instFrameMs + (1.0 - ALPHA) * avgFrameMs;

        long remaining = Math.max(0, frames - processed);
        long etaMs = Math.round(remaining * avgFrameMs);
        String etaStr = formatMillis(etaMs);

        logger.debug("Frame {}/{} done, ETA {}", processed, frames, etaStr);
        if (progressListener != null) progressListener.updateProgress(processed, frames, etaStr);
    }

    static String formatMillis(long ms) {
        long s = ms / 1000;
        long h = s / 3600;
        long m = (s % 3600) / 60;
        long sec = s % 60;
        if (h > 0) return String.format("%dh %dm %ds", h, m, sec);
        if (m > 0) return String.format("%dm %ds", m, sec);
        return String.format("%ds", sec);
    }

    @Override
    public String toString() {
        return stackModel + "\nSampler: " + sampler;
    }
}
