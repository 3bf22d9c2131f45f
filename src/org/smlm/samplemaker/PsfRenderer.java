package org.smlm.samplemaker;

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders molecules as axis-aligned anisotropic Gaussians. The z coordinate of each molecule
 * stretches the spot along x and squeezes it along y (astigmatism).
 */
public class PsfRenderer {

    private static final Logger logger = LoggerFactory.getLogger(PsfRenderer.class);

    public static final double MAX_INTENSITY = 65535.0;
    /** FWHM to sigma: 2 * sqrt(2 * ln 2). */
    public static final double FWHM_SIGMA_RATIO = 2.355;
    /** Sigma in pixels used when no numerical aperture is given. */
    public static final double DEFAULT_SIGMA = 1.0;

    private final double sigmaBase;
    private final double astigmatismRatio;
    private final double minRatio;
    private final double maxRatio;

    public PsfRenderer(double sigmaBase, double astigmatismRatio) {
        this.sigmaBase = sigmaBase;
        this.astigmatismRatio = astigmatismRatio;
        if (astigmatismRatio > 0) {
            this.minRatio = Math.min(astigmatismRatio, 1.0 / astigmatismRatio);
            this.maxRatio = Math.max(astigmatismRatio, 1.0 / astigmatismRatio);
        } else {
            this.minRatio = 1.0;
            this.maxRatio = 1.0;
        }
    }

    /**
     * Diffraction limited sigma in pixels: {@code fwhm = 0.61 * wavelength / na},
     * {@code sigma = fwhm / 2.355 / pixelSize}. Falls back to {@link #DEFAULT_SIGMA} when
     * {@code na} is not positive.
     *
     * @param wavelength emission wavelength in nm
     * @param pixelSize  pixel size in nm
     */
    public static double sigmaFromOptics(double wavelength, double na, double pixelSize) {
        if (na <= 0 || pixelSize <= 0) return DEFAULT_SIGMA;
        double fwhm = 0.61 * wavelength / na;
        return fwhm / FWHM_SIGMA_RATIO / pixelSize;
    }

    public double getSigmaBase() {
        return sigmaBase;
    }

    /** Lower and upper bound of the x/y aspect ratio. */
    public double[] getRatioBounds() {
        return new double[]{minRatio, maxRatio};
    }

    /** Aspect ratio for a given z, linear between 1 (z = 0) and the astigmatism ratio (z = 1). */
    public double ratioAt(double z) {
        double ratio = 1.0 + z * (astigmatismRatio - 1.0);
        return Math.max(minRatio, Math.min(maxRatio, ratio));
    }

    /**
     * @return frame {@code [size][size]} indexed {@code [y][x]}, clamped to [0, 65535];
     * all zero when the astigmatism ratio is not strictly positive
     */
    public double[][] render(int size, List<Localization> positions, Fluorophore fluorophore, RandomGenerator rng) {
        double[][] image = new double[size][size];
        if (astigmatismRatio <= 0) {
            logger.warn("Astigmatism ratio must be strictly positive (got {}), the frame will be black.", astigmatismRatio);
            return image;
        }

        double[] gx = new double[size];
        double[] gy = new double[size];
        for (Localization l : positions) {
            double ratio = ratioAt(l.z);
            double sx = sigmaBase * ratio;
            double sy = sigmaBase / ratio;
            double amplitude = fluorophore.getIntensity(true, rng) / (2.0 * Math.PI * sx * sy);

            // the diagonal covariance makes the density separable
            for (int i = 0; i < size; i++) {
                double dx = i - l.x;
                double dy = i - l.y;
                gx[i] = Math.exp(-dx * dx / (2.0 * sx * sx));
                gy[i] = Math.exp(-dy * dy / (2.0 * sy * sy));
            }
            for (int y = 0; y < size; y++) {
                double ay = amplitude * gy[y];
                if (ay == 0) continue;
                double[] row = image[y];
                for (int x = 0; x < size; x++) row[x] += ay * gx[x];
            }
        }
        clamp(image);
        return image;
    }

    static void clamp(double[][] image) {
        for (double[] row : image) {
            for (int x = 0; x < row.length; x++) {
                double v = row[x];
                if (v < 0 || Double.isNaN(v)) row[x] = 0;
                else if (v > MAX_INTENSITY) row[x] = MAX_INTENSITY;
            }
        }
    }
}
