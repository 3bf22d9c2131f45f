package org.smlm.samplemaker;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optical description of a fluorophore: emission wavelength (nm), base intensity,
 * maximum intensity variation (%) and flickering period (ms).
 */
public final class Fluorophore {

    public static final Map<String, Fluorophore> PREDEFINED;

    static {
        Map<String, Fluorophore> m = new LinkedHashMap<>();
        m.put("GFP", new Fluorophore(509, 4000, 5, 30));
        m.put("RFP", new Fluorophore(582, 4500, 10, 50));
        m.put("CFP", new Fluorophore(475, 3500, 7, 40));
        m.put("YFP", new Fluorophore(527, 3800, 6, 35));
        m.put("Alexa488", new Fluorophore(495, 6000, 3, 25));
        PREDEFINED = Collections.unmodifiableMap(m);
    }

    public final int wavelength;
    public final double intensity;
    public final double delta;
    public final int flickering;

    public Fluorophore() {
        this(600, 5000, 10, 50);
    }

    public Fluorophore(int wavelength, double intensity, double delta, int flickering) {
        this.wavelength = wavelength;
        this.intensity = intensity;
        this.delta = delta;
        this.flickering = flickering;
    }

    /**
     * @param variation if true, the base intensity is jittered uniformly within +/- delta percent
     * @return intensity, never negative
     */
    public double getIntensity(boolean variation, RandomGenerator rng) {
        if (!variation || delta == 0) return Math.max(0.0, intensity);
        double percent = (-delta + 2.0 * delta * rng.nextDouble()) / 100.0;
        return Math.max(0.0, intensity * (1.0 + percent));
    }

    public double getIntensity() {
        return Math.max(0.0, intensity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fluorophore)) return false;
        Fluorophore f = (Fluorophore) o;
        return wavelength == f.wavelength && flickering == f.flickering
                && Double.compare(intensity, f.intensity) == 0 && Double.compare(delta, f.delta) == 0;
    }

    @Override
    public int hashCode() {
        int h = wavelength;
        h = 31 * h + Double.hashCode(intensity);
        h = 31 * h + Double.hashCode(delta);
        return 31 * h + flickering;
    }

    @Override
    public String toString() {
        return "wavelength: " + wavelength + " nm, intensity: " + intensity
                + ", delta: +/-" + delta + " %, flickering: " + flickering + " ms";
    }
}
