/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.engine.JavaSpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.math.ComplexGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterEngineTest {

    private final JavaSpectralTransform transform = new JavaSpectralTransform();
    private final FilterEngine filters = new FilterEngine(transform);
    private final PsfEngine psfs = new PsfEngine(transform);

    @Test
    void deltaPsf_givesFlatFilter() {
        DeconvolutionFilter m = filters.buildDeconvolutionFilter(Psf.delta(16), 1e-3);
        double expected = 1.0 / (1.0 + 1e-3);
        assertEquals(expected, m.real(0, 0), 1e-12);
        assertEquals(expected, m.real(7, 11), 1e-12);
        assertEquals(0.0, m.imag(7, 11), 1e-12);
        assertEquals(1e-3, m.epsilon());
    }

    @Test
    void filter_isRegularizedInverse() {
        Psf psf = psfs.generatePsf(Prescription.of(-3.0, -0.75, 60.0), 32, 550.0, 2.5e-5);
        double eps = 1e-3;
        ComplexGrid h = filters.opticalTransferFunction(psf);
        DeconvolutionFilter m = filters.buildDeconvolutionFilter(psf, eps);
        for (int v = 0; v < 32; v += 5) {
            for (int u = 0; u < 32; u += 3) {
                double hr = h.real(u, v), hi = h.imag(u, v);
                double denom = hr * hr + hi * hi + eps;
                assertEquals(hr / denom, m.real(u, v), 1e-9);
                assertEquals(-hi / denom, m.imag(u, v), 1e-9);
                // M·H = |H|²/(|H|²+ε) is real and below 1
                double mhRe = m.real(u, v) * hr - m.imag(u, v) * hi;
                double mhIm = m.real(u, v) * hi + m.imag(u, v) * hr;
                assertEquals(0.0, mhIm, 1e-12);
                assertTrue(mhRe <= 1.0 + 1e-12);
            }
        }
    }

    @Test
    void filterGrid_isDefensiveCopy() {
        DeconvolutionFilter m = filters.buildDeconvolutionFilter(Psf.delta(8));
        m.toComplexGrid().set(0, 0, 42.0, 0.0);
        assertNotEquals(42.0, m.real(0, 0));
    }

    @Test
    void badEpsilon_isRejected() {
        Psf psf = Psf.delta(8);
        assertThrows(InvalidInputException.class, () -> filters.buildDeconvolutionFilter(psf, 0.0));
        assertThrows(InvalidInputException.class, () -> filters.buildDeconvolutionFilter(psf, -1e-3));
        assertThrows(InvalidInputException.class, () -> filters.buildDeconvolutionFilter(psf, Double.POSITIVE_INFINITY));
        assertThrows(InvalidInputException.class, () -> filters.buildDeconvolutionFilter(null, 1e-3));
    }
}
