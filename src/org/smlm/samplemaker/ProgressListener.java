package org.smlm.samplemaker;

/**
 * Callback for long stack generations.
 */
public interface ProgressListener {
    /**
     * Called once before the first frame.
     * @param totalFrames number of frames to generate
     */
    void initProgress(int totalFrames);

    /**
     * Called after each frame.
     * @param processed frames completed so far (1..totalFrames)
     * @param totalFrames total frames expected
     * @param etaText human-readable ETA string (e.g. "12s", "1m 3s")
     */
    void updateProgress(int processed, int totalFrames, String etaText);

    /**
     * Called when generation finishes or fails.
     */
    void closeProgress();
}
