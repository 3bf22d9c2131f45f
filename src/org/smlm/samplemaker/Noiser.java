package org.smlm.samplemaker;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds a background layer and an SNR driven layer of Gaussian-then-Poisson noise to a frame.
 *
 * <ul>
 *     <li>background: mean {@code background}, deviation {@code background * variation / 100}</li>
 *     <li>signal: zero mean, deviation {@code mean(signal) / snr}</li>
 * </ul>
 * A layer whose parameters are zero is skipped, so a zero configuration leaves the frame unchanged.
 */
public class Noiser {

    private static final Logger logger = LoggerFactory.getLogger(Noiser.class);

    private static final double EPS = Math.ulp(1.0f);

    public final double snr;
    public final double background;
    public final double variation;

    public Noiser() {
        this(10, 500, 10);
    }

    /**
     * @param snr        target signal to noise ratio
     * @param background base background level
     * @param variation  background standard deviation in percent of {@code background}
     */
    public Noiser(double snr, double background, double variation) {
        this.snr = snr;
        this.background = background;
        this.variation = variation;
    }

    /**
     * Gaussian noise floored at zero, then used as the mean of a Poisson draw (shot noise).
     */
    public static double[][] createNoise(int h, int w, double loc, double scale, RandomGenerator rng) {
        RandomDataGenerator rdg = new RandomDataGenerator(rng);
        double[][] noise = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double g = (scale > 0) ? rdg.nextGaussian(loc, scale) : loc;
                if (!(g > 0)) continue;
                noise[y][x] = rdg.nextPoisson(g);
            }
        }
        return noise;
    }

    /**
     * @return a new frame; {@code image} is left untouched
     */
    public double[][] apply(double[][] image, RandomGenerator rng) {
        int h = image.length;
        int w = (h > 0) ? image[0].length : 0;
        double[][] noisy = new double[h][];
        for (int y = 0; y < h; y++) noisy[y] = image[y].clone();

        if (background > EPS && variation > EPS) {
            add(noisy, createNoise(h, w, background, background * variation / 100.0, rng));
        }

        if (snr > EPS) {
            SummaryStatistics signal = new SummaryStatistics();
            for (double[] row : image) for (double v : row) if (v > EPS) signal.addValue(v);
            double mean = signal.getMean();
            if (signal.getN() == 0 || Double.isNaN(mean) || Math.abs(mean) <= EPS) {
                logger.warn("Mean signal is zero, the SNR cannot be reached. Only the background noise is added.");
            } else if (signal.getN() > 1 && signal.getStandardDeviation() <= EPS) {
                logger.warn("Signal is constant, the SNR cannot be reached. Only the background noise is added.");
            } else {
                double noiseStd = mean / snr;
                logger.debug("Signal mean {} gives a noise deviation of {} for SNR {}", mean, noiseStd, snr);
                add(noisy, createNoise(h, w, 0, noiseStd, rng));
            }
        } else if (snr < -EPS) {
            logger.warn("SNR must be positive (got {}), no signal noise added.", snr);
        }

        PsfRenderer.clamp(noisy);
        return noisy;
    }

    private static void add(double[][] target, double[][] layer) {
        for (int y = 0; y < target.length; y++) {
            for (int x = 0; x < target[y].length; x++) target[y][x] += layer[y][x];
        }
    }

    @Override
    public String toString() {
        return "snr: " + snr + ", background: " + background + ", deviation: " + variation + " %";
    }
}
