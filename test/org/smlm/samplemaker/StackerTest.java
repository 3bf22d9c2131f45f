package org.smlm.samplemaker;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StackerTest {

    @Mock
    private ProgressListener listener;

    private Sampler sampler;

    @BeforeEach
    void setUp() {
        sampler = new Sampler(32, 160, 1.4, 0.5, 2.0, new Fluorophore(), new Mask(), new Noiser(5, 100, 10));
        sampler.setRandomGenerator(new Well19937c(11));
    }

    @Test
    void testGenerate_FrameCountAndShape() {
        Stack stack = new Stacker(sampler).generate(3);
        assertArrayEquals(new int[]{3, 32, 32}, stack.shape());
    }

    @Test
    void testGenerate_ProgressCallbacks() {
        Stacker stacker = new Stacker(sampler);
        stacker.setProgressListener(listener);
        stacker.generate(3);

        InOrder order = inOrder(listener);
        order.verify(listener).initProgress(3);
        order.verify(listener).updateProgress(eq(1), eq(3), anyString());
        order.verify(listener).updateProgress(eq(2), eq(3), anyString());
        order.verify(listener).updateProgress(eq(3), eq(3), anyString());
        order.verify(listener).closeProgress();
        verifyNoMoreInteractions(listener);
    }

    @Test
    void testGenerate_ClosesProgressOnFailure() {
        Sampler failing = mock(Sampler.class);
        when(failing.generateSample()).thenThrow(new IllegalStateException("boom"));
        Stacker stacker = new Stacker(failing);
        stacker.setProgressListener(listener);

        assertThrows(IllegalStateException.class, () -> stacker.generate(2));
        verify(listener).initProgress(2);
        verify(listener).closeProgress();
        verify(listener, never()).updateProgress(anyInt(), anyInt(), anyString());
    }

    @Test
    void testGenerate_ResetsSamplerDiagnostics() {
        Stacker stacker = new Stacker(sampler);
        stacker.generate(2);
        assertEquals(2, sampler.getMoleculeCounts().size());
        stacker.generate(3);
        assertEquals(3, sampler.getMoleculeCounts().size());
    }

    @Test
    void testGenerate_ZeroFrames() {
        Stacker stacker = new Stacker(sampler);
        stacker.setProgressListener(listener);
        assertTrue(stacker.generate(0).isEmpty());
        verify(listener).initProgress(0);
        verify(listener).closeProgress();
    }

    @Test
    void testGenerate_NegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> new Stacker(sampler).generate(-1));
    }

    @Test
    void testGenerate_NoModel() {
        Stacker stacker = new Stacker(sampler, null);
        assertThrows(IllegalStateException.class, () -> stacker.generate(1));
        stacker.setStackModel(new StackModel(null));
        assertThrows(IllegalStateException.class, () -> stacker.generate(1));
    }

    @Test
    void testStackModel_RejectsOptions() {
        assertEquals(StackModelType.RANDOM, StackModel.fromModel(StackModelType.RANDOM, Map.of()).type);
        assertThrows(IllegalArgumentException.class,
                () -> StackModel.fromModel(StackModelType.RANDOM, Map.of("frames", 3)));
        assertEquals("Model: Random, Options: No Options", new StackModel().toString());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0s",
            "999, 0s",
            "59000, 59s",
            "61000, 1m 1s",
            "3600000, 1h 0m 0s",
            "3725000, 1h 2m 5s"
    })
    void testFormatMillis(long ms, String expected) {
        assertEquals(expected, Stacker.formatMillis(ms));
    }
}
