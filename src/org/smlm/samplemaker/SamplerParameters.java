package org.smlm.samplemaker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Everything needed to configure a {@link Sampler} and a stack run.
 * Can be stored to and loaded from {@link Properties} under a key prefix.
 */
public class SamplerParameters {
    // acquisition geometry
    public int size = 256;
    public double pixelSize = 160;
    public double na = 1.4;
    public double density = 0.25;
    public double astigmatismRatio = 2.0;

    // fluorophore
    public int wavelength = 600;
    public double intensity = 5000;
    public double delta = 10;
    public int flickering = 50;

    // noise
    public double snr = 10;
    public double background = 500;
    public double variation = 10;

    // structure mask
    public PatternType pattern = PatternType.NONE;
    public String stripeLengths = "200,100,50,25,12,6";
    public boolean stripeMirror = true;
    public boolean stripeVertical = true;
    public int squareSize = 32;
    public int rayCount = 16;
    public String maskPath = "";

    // stack run
    public int frames = 10;
    public Long seed = null;
    public String output = "stack.tif";

    public Fluorophore toFluorophore() {
        return new Fluorophore(wavelength, intensity, delta, flickering);
    }

    public Noiser toNoiser() {
        return new Noiser(snr, background, variation);
    }

    /**
     * @throws PatternOptionsException if the stripe lengths are not integers
     */
    public Pattern toPattern() {
        Map<String, Object> options = new LinkedHashMap<>();
        switch (pattern) {
            case STRIPES:
                options.put(PatternOptions.STRIPES_LENGTHS, parseLengths(stripeLengths));
                options.put(PatternOptions.STRIPES_MIRROR, stripeMirror);
                options.put(PatternOptions.STRIPES_ORIENTATION, stripeVertical);
                break;
            case SQUARES:
                options.put(PatternOptions.SQUARES_SIZE, squareSize);
                break;
            case SUN:
                options.put(PatternOptions.SUN_RAY_COUNT, rayCount);
                break;
            case EXISTING_IMAGE:
                options.put(PatternOptions.IMAGE_PATH, maskPath);
                break;
            default:
                break;
        }
        return Pattern.fromPattern(pattern, options);
    }

    private List<Integer> parseLengths(String text) {
        List<Integer> lengths = new ArrayList<>();
        if (text == null) return lengths;
        for (String part : text.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            try {
                lengths.add(Integer.parseInt(t));
            } catch (NumberFormatException e) {
                throw new PatternOptionsException(PatternType.STRIPES, "stripe length '" + t + "' is not an integer");
            }
        }
        return lengths;
    }

    public void setProperties(String prefix, Properties properties) {
        properties.setProperty(prefix + "size", size + "");
        properties.setProperty(prefix + "pixelSize", pixelSize + "");
        properties.setProperty(prefix + "na", na + "");
        properties.setProperty(prefix + "density", density + "");
        properties.setProperty(prefix + "astigmatismRatio", astigmatismRatio + "");
        properties.setProperty(prefix + "wavelength", wavelength + "");
        properties.setProperty(prefix + "intensity", intensity + "");
        properties.setProperty(prefix + "delta", delta + "");
        properties.setProperty(prefix + "flickering", flickering + "");
        properties.setProperty(prefix + "snr", snr + "");
        properties.setProperty(prefix + "background", background + "");
        properties.setProperty(prefix + "variation", variation + "");
        properties.setProperty(prefix + "pattern", pattern.name());
        properties.setProperty(prefix + "stripeLengths", stripeLengths);
        properties.setProperty(prefix + "stripeMirror", stripeMirror + "");
        properties.setProperty(prefix + "stripeVertical", stripeVertical + "");
        properties.setProperty(prefix + "squareSize", squareSize + "");
        properties.setProperty(prefix + "rayCount", rayCount + "");
        properties.setProperty(prefix + "maskPath", maskPath);
        properties.setProperty(prefix + "frames", frames + "");
        if (seed != null) properties.setProperty(prefix + "seed", seed + "");
        properties.setProperty(prefix + "output", output);
    }

    /**
     * Reads the keys present under {@code prefix}; absent keys keep their current value.
     *
     * @throws IllegalArgumentException naming the key when a value cannot be parsed
     */
    public void getProperties(String prefix, Properties properties) {
        String key = null;
        try {
            if (properties.getProperty(key = prefix + "size") != null)
                this.size = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "pixelSize") != null)
                this.pixelSize = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "na") != null)
                this.na = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "density") != null)
                this.density = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "astigmatismRatio") != null)
                this.astigmatismRatio = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "wavelength") != null)
                this.wavelength = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "intensity") != null)
                this.intensity = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "delta") != null)
                this.delta = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "flickering") != null)
                this.flickering = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "snr") != null)
                this.snr = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "background") != null)
                this.background = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "variation") != null)
                this.variation = Double.parseDouble(properties.getProperty(key));
            if (properties.getProperty(key = prefix + "pattern") != null)
                this.pattern = PatternType.valueOf(properties.getProperty(key).trim().toUpperCase());
            if (properties.getProperty(key = prefix + "stripeLengths") != null)
                this.stripeLengths = properties.getProperty(key);
            if (properties.getProperty(key = prefix + "stripeMirror") != null)
                this.stripeMirror = Boolean.parseBoolean(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "stripeVertical") != null)
                this.stripeVertical = Boolean.parseBoolean(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "squareSize") != null)
                this.squareSize = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "rayCount") != null)
                this.rayCount = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "maskPath") != null)
                this.maskPath = properties.getProperty(key);
            if (properties.getProperty(key = prefix + "frames") != null)
                this.frames = Integer.parseInt(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "seed") != null)
                this.seed = Long.parseLong(properties.getProperty(key).trim());
            if (properties.getProperty(key = prefix + "output") != null)
                this.output = properties.getProperty(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + properties.getProperty(key), e);
        }
    }
}
