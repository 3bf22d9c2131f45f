package org.smlm.samplemaker;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SamplerTest {

    private static Sampler small(Mask mask, Noiser noiser) {
        Sampler sampler = new Sampler(64, 160, 1.4, 1.0, 2.0, new Fluorophore(), mask, noiser);
        sampler.setRandomGenerator(new Well19937c(21));
        return sampler;
    }

    @Test
    void testDefaults_DerivedConstants() {
        Sampler sampler = new Sampler();
        assertEquals(256, sampler.getSize());
        assertEquals(1677.7216, sampler.getArea(), 1e-9);
        assertEquals(419, sampler.getMaxMolecules());
        assertEquals(0.61 * 600 / 1.4 / 2.355 / 160, sampler.getSigmaBase(), 1e-12);
        assertArrayEquals(new double[]{0.5, 2.0}, sampler.getAstigmatismBounds());
        assertTrue(sampler.getMoleculeCounts().isEmpty());
    }

    @Test
    void testSetters_RecomputeImmediately() {
        Sampler sampler = new Sampler();
        sampler.setSize(100);
        sampler.setPixelSize(100);
        sampler.setDensity(1.0);
        assertEquals(100.0, sampler.getArea(), 1e-9);
        assertEquals(100, sampler.getMaxMolecules());

        sampler.setNa(0);
        assertEquals(PsfRenderer.DEFAULT_SIGMA, sampler.getSigmaBase());
        sampler.setAstigmatismRatio(4.0);
        assertArrayEquals(new double[]{0.25, 4.0}, sampler.getAstigmatismBounds());
    }

    @Test
    void testSetter_ClearsDiagnostics() {
        Sampler sampler = small(new Mask(), new Noiser(0, 0, 0));
        sampler.generateSample();
        assertEquals(1, sampler.getMoleculeCounts().size());
        sampler.setFluorophore(Fluorophore.PREDEFINED.get("GFP"));
        assertTrue(sampler.getMoleculeCounts().isEmpty());
        assertTrue(sampler.getLastLocalizations().isEmpty());
    }

    @Test
    void testGenerateSample_ShapeAndDiagnostics() {
        Sampler sampler = small(new Mask(), new Noiser());
        double[][] frame = sampler.generateSample();
        assertEquals(64, frame.length);
        assertEquals(64, frame[0].length);
        // no structure: every molecule is kept
        assertEquals(sampler.getMaxMolecules(), sampler.getLastLocalizations().size());
        assertEquals(List.of(sampler.getMaxMolecules()), sampler.getMoleculeCounts());
        for (double[] row : frame) for (double v : row) assertTrue(v >= 0 && v <= 65535);
    }

    @Test
    void testGenerateSample_MoleculesOnMask() {
        Mask mask = Mask.generate(Pattern.squares(8), 64);
        Sampler sampler = small(mask, new Noiser(0, 0, 0));
        sampler.generateSample();
        List<Localization> kept = sampler.getLastLocalizations();
        assertTrue(kept.size() < sampler.getMaxMolecules());
        for (Localization l : kept) {
            int col = Math.min(63, Math.max(0, (int) l.x));
            int row = Math.min(63, Math.max(0, (int) l.y));
            assertTrue(mask.get(row, col), "molecule " + l + " outside the mask");
        }
    }

    @Test
    void testGenerateLocalizations_MaskCanBeBypassed() {
        Sampler sampler = small(Mask.generate(Pattern.squares(8), 64), new Noiser(0, 0, 0));
        assertEquals(sampler.getMaxMolecules(), sampler.generateLocalizations(false).size());
    }

    @Test
    void testSetSize_RegeneratesMask() {
        Sampler sampler = small(Mask.generate(Pattern.squares(8), 64), new Noiser(0, 0, 0));
        sampler.setSize(256);
        Mask mask = sampler.getMask();
        assertEquals(256, mask.getSize());
        assertEquals(Pattern.squares(8), mask.getPattern());

        sampler.generateSample();
        List<Localization> kept = sampler.getLastLocalizations();
        assertTrue(kept.stream().anyMatch(l -> l.x >= 64 || l.y >= 64), "molecules beyond the old mask");
        for (Localization l : kept) {
            int col = Math.min(255, Math.max(0, (int) l.x));
            int row = Math.min(255, Math.max(0, (int) l.y));
            assertTrue(mask.get(row, col), "molecule " + l + " outside the mask");
        }
    }

    @Test
    void testMaskOfOtherSize_Regenerated() {
        Sampler sampler = small(Mask.generate(Pattern.sun(4), 32), new Noiser(0, 0, 0));
        assertEquals(64, sampler.getMask().getSize());
        assertEquals(PatternType.SUN, sampler.getMask().getPattern().type);

        sampler.setMask(Mask.generate(Pattern.squares(4), 16));
        assertEquals(64, sampler.getMask().getSize());
        assertEquals(Mask.generate(Pattern.squares(4), 64).countWhite(), sampler.getMask().countWhite());
    }

    @Test
    void testGenerateGrid() {
        Sampler sampler = new Sampler(100, 160, 1.4, 0.25, 2.0, new Fluorophore(), new Mask(), new Noiser(0, 0, 0));
        double[][] frame = sampler.generateGrid();
        assertEquals(100, frame.length);
        assertEquals(81, sampler.getLastLocalizations().size());
        assertEquals(List.of(81), sampler.getMoleculeCounts());
        assertTrue(frame[5][5] > frame[10][10]);
    }

    @Test
    void testNonPositiveAstigmatism_BlackFrame() {
        Sampler sampler = small(new Mask(), new Noiser(0, 0, 0));
        sampler.setAstigmatismRatio(0);
        double[][] frame = sampler.generateSample();
        for (double[] row : frame) for (double v : row) assertEquals(0.0, v);
    }

    @Test
    void testConfigure_SeedIsReproducible() {
        SamplerParameters params = new SamplerParameters();
        params.size = 32;
        params.seed = 7L;
        params.pattern = PatternType.SUN;
        params.rayCount = 4;

        double[][] a = new Sampler(params).generateSample();
        double[][] b = new Sampler(params).generateSample();
        for (int y = 0; y < 32; y++) assertArrayEquals(a[y], b[y]);
    }

    @Test
    void testConfigure_AppliesParameters() {
        SamplerParameters params = new SamplerParameters();
        params.size = 48;
        params.pattern = PatternType.SQUARES;
        params.squareSize = 4;
        params.snr = 3;
        params.wavelength = 509;

        Sampler sampler = new Sampler();
        sampler.configure(params);
        assertEquals(48, sampler.getSize());
        assertEquals(48, sampler.getMask().getSize());
        assertEquals(PatternType.SQUARES, sampler.getMask().getPattern().type);
        assertEquals(3.0, sampler.getNoiser().snr);
        assertEquals(509, sampler.getFluorophore().wavelength);
    }
}
