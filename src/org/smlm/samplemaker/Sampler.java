package org.smlm.samplemaker;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates single frames: localize molecules, keep those on the mask, render their PSF, add noise.
 * <p>
 * Image size, pixel size, numerical aperture, density, astigmatism ratio and fluorophore feed
 * cached constants (area, molecule count, PSF sigma, ratio bounds). Each of their setters, and
 * {@link #configure(SamplerParameters)}, calls {@link #reset()} right away so the constants always
 * match the configuration.
 */
public class Sampler {

    private static final Logger logger = LoggerFactory.getLogger(Sampler.class);

    private int size = 256;
    private double pixelSize = 160;
    private double na = 1.4;
    private double density = 0.25;
    private double astigmatismRatio = 2.0;
    private Fluorophore fluorophore = new Fluorophore();
    private Mask mask = new Mask();
    private Noiser noiser = new Noiser();
    private RandomGenerator rng = new Well19937c();

    // diagnostics
    private final List<Integer> moleculeCounts = new ArrayList<>();
    private List<Localization> lastLocalizations = Collections.emptyList();

    // derived
    private double area;
    private int maxMolecules;
    private PsfRenderer renderer;

    public Sampler() {
        reset();
    }

    public Sampler(int size, double pixelSize, double na, double density, double astigmatismRatio,
                   Fluorophore fluorophore, Mask mask, Noiser noiser) {
        this.size = size;
        this.pixelSize = pixelSize;
        this.na = na;
        this.density = density;
        this.astigmatismRatio = astigmatismRatio;
        this.fluorophore = fluorophore;
        this.mask = fitMask(mask);
        this.noiser = noiser;
        reset();
    }

    public Sampler(SamplerParameters params) {
        configure(params);
    }

    /**
     * Applies a whole parameter set: geometry, fluorophore, noise, a mask generated from the
     * pattern at the configured size, and the seed when one is given.
     */
    public void configure(SamplerParameters params) {
        this.size = params.size;
        this.pixelSize = params.pixelSize;
        this.na = params.na;
        this.density = params.density;
        this.astigmatismRatio = params.astigmatismRatio;
        this.fluorophore = params.toFluorophore();
        this.noiser = params.toNoiser();
        this.mask = Mask.generate(params.toPattern(), params.size);
        if (params.seed != null) this.rng = new Well19937c(params.seed);
        reset();
    }

    /**
     * Clears the diagnostics and recomputes the derived constants.
     */
    public void reset() {
        moleculeCounts.clear();
        lastLocalizations = Collections.emptyList();
        area = MoleculeLocalizer.area(size, pixelSize);
        maxMolecules = (int) (area * density);
        renderer = new PsfRenderer(PsfRenderer.sigmaFromOptics(fluorophore.wavelength, na, pixelSize), astigmatismRatio);
        logger.debug("Sampler reset: area {} um2, {} molecules max, sigma {} px",
                area, maxMolecules, renderer.getSigmaBase());
    }

    /**
     * Random molecules, filtered by the mask unless its pattern is NONE.
     */
    public List<Localization> generateLocalizations(boolean applyMask) {
        List<Localization> positions = MoleculeLocalizer.localize(size, maxMolecules, rng);
        if (applyMask && mask.getPattern().type != PatternType.NONE) {
            positions = MoleculeLocalizer.filter(positions, mask);
        }
        return positions;
    }

    public double[][] generatePsf(List<Localization> positions) {
        return renderer.render(size, positions, fluorophore, rng);
    }

    /**
     * @return a noisy frame {@code [size][size]} with randomly placed molecules
     */
    public double[][] generateSample() {
        return generate(generateLocalizations(true));
    }

    /**
     * Same pipeline with molecules on a regular grid of pitch {@code shift} and no mask.
     */
    public double[][] generateGrid(int shift) {
        return generate(MoleculeLocalizer.grid(size, shift));
    }

    public double[][] generateGrid() {
        return generateGrid(10);
    }

    private double[][] generate(List<Localization> positions) {
        lastLocalizations = Collections.unmodifiableList(positions);
        moleculeCounts.add(positions.size());
        return noiser.apply(generatePsf(positions), rng);
    }

    //  configuration

    public int getSize() { return size; }

    /** Also regenerates the mask at the new size. */
    public void setSize(int size) {
        this.size = size;
        this.mask = fitMask(mask);
        reset();
    }

    public double getPixelSize() { return pixelSize; }

    public void setPixelSize(double pixelSize) {
        this.pixelSize = pixelSize;
        reset();
    }

    public double getNa() { return na; }

    public void setNa(double na) {
        this.na = na;
        reset();
    }

    public double getDensity() { return density; }

    public void setDensity(double density) {
        this.density = density;
        reset();
    }

    public double getAstigmatismRatio() { return astigmatismRatio; }

    public void setAstigmatismRatio(double astigmatismRatio) {
        this.astigmatismRatio = astigmatismRatio;
        reset();
    }

    public Fluorophore getFluorophore() { return fluorophore; }

    public void setFluorophore(Fluorophore fluorophore) {
        this.fluorophore = fluorophore;
        reset();
    }

    public Mask getMask() { return mask; }

    /** A mask of another size is regenerated from its pattern at the sampler size. */
    public void setMask(Mask mask) { this.mask = fitMask(mask); }

    private Mask fitMask(Mask m) {
        if (m.getSize() == size) return m;
        logger.debug("Regenerating {} mask from {} to {} px", m.getPattern().type, m.getSize(), size);
        return m.withSize(size);
    }

    public Noiser getNoiser() { return noiser; }

    public void setNoiser(Noiser noiser) { this.noiser = noiser; }

    public void setRandomGenerator(RandomGenerator rng) { this.rng = rng; }

    public RandomGenerator getRandomGenerator() { return rng; }

    //  derived state and diagnostics

    public double getArea() { return area; }

    public int getMaxMolecules() { return maxMolecules; }

    public double getSigmaBase() { return renderer.getSigmaBase(); }

    public double[] getAstigmatismBounds() { return renderer.getRatioBounds(); }

    public List<Integer> getMoleculeCounts() {
        return Collections.unmodifiableList(moleculeCounts);
    }

    public List<Localization> getLastLocalizations() {
        return lastLocalizations;
    }

    @Override
    public String toString() {
        return "size: " + size + ", Pixel Size: " + pixelSize + " nm, Molecule Density: " + density + "\n"
                + "Area: " + area + ", Maximum molecule number: " + maxMolecules + "\n"
                + "Mask: " + mask + "\n"
                + "Fluorophore: " + fluorophore + "\n"
                + "Noise: " + noiser + "\n"
                + "Generation number: " + moleculeCounts.size();
    }
}
