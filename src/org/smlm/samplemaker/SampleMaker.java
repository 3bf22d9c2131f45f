package org.smlm.samplemaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Headless entry point: {@code SampleMaker [config.properties] [output.tif]}.
 * <p>
 * Loads the parameters (defaults when no file is given), generates the stack and writes it as a
 * 16-bit TIFF, together with a PNG preview of the first frame and, when a pattern is set, the mask.
 */
public class SampleMaker {

    private static final Logger logger = LoggerFactory.getLogger(SampleMaker.class);

    /** Key prefix used in configuration files. */
    public static final String PREFIX = "sample.";
    public static final double PREVIEW_PERCENTILE = 99.5;

    private final SamplerParameters params;

    public SampleMaker(SamplerParameters params) {
        this.params = params;
    }

    public static SamplerParameters loadParameters(String path) throws IOException {
        SamplerParameters params = new SamplerParameters();
        Properties properties = new Properties();
        try (InputStream in = new FileInputStream(path)) {
            properties.load(in);
        }
        params.getProperties(PREFIX, properties);
        return params;
    }

    /**
     * Generates the stack and writes the output files.
     *
     * @return the generated stack
     */
    public Stack run() throws IOException {
        Sampler sampler = new Sampler(params);
        for (String w : sampler.getMask().getWarnings()) logger.warn("Mask: {}", w);
        logger.info("Sampler configured:\n{}", sampler);

        Stacker stacker = new Stacker(sampler);
        stacker.setProgressListener(new LoggingProgressListener());
        Stack stack = stacker.generate(params.frames);
        if (stack.isEmpty()) {
            logger.warn("No frame requested, nothing written");
            return stack;
        }

        String output = FileNames.addExtension(params.output, ".tif");
        File parent = new File(output).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Cannot create output directory " + parent);
        }
        StackCodec.save(stack, output);
        logger.info("Saved TIFF stack: {}", output);

        String preview = FileNames.addSuffix(output, "_preview").replaceAll("\\.tif$", ".png");
        FrameCodec.save(stack.get(0), preview, PREVIEW_PERCENTILE);
        logger.info("Saved preview: {}", preview);

        if (params.pattern != PatternType.NONE) {
            String maskFile = FileNames.addSuffix(output, "_mask").replaceAll("\\.tif$", ".png");
            MaskCodec.save(sampler.getMask(), maskFile);
            logger.info("Saved mask: {}", maskFile);
        }
        return stack;
    }

    static class LoggingProgressListener implements ProgressListener {
        private int step = 1;

        @Override
        public void initProgress(int totalFrames) {
            step = Math.max(1, totalFrames / 10);
            logger.info("Generating {} frames", totalFrames);
        }

        @Override
        public void updateProgress(int processed, int totalFrames, String etaText) {
            if (processed % step == 0 || processed == totalFrames) {
                logger.info("{}/{} frames, ETA {}", processed, totalFrames, etaText);
            }
        }

        @Override
        public void closeProgress() {
            logger.debug("Generation finished");
        }
    }

    public static void main(String[] args) {
        try {
            SamplerParameters params = (args.length > 0) ? loadParameters(args[0]) : new SamplerParameters();
            if (args.length > 1) params.output = args[1];
            new SampleMaker(params).run();
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Sample generation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
