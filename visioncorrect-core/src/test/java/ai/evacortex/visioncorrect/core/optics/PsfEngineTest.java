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

class PsfEngineTest {

    private final PsfEngine engine = new PsfEngine(new JavaSpectralTransform());

    @Test
    void psfEnergy_isOne() {
        Prescription p = new Prescription(-3.0, -1.25, 30.0, 2.5, 1.25);
        Psf psf = engine.generatePsf(p, 64, 550.0, 2.5e-5);
        assertEquals(1.0, psf.sum(), 1e-3);
        for (int y = 0; y < psf.size(); y++) {
            for (int x = 0; x < psf.size(); x++) {
                assertTrue(psf.get(x, y) >= 0.0);
            }
        }
    }

    @Test
    void pupil_hasUnitMagnitudeInsideAndZeroOutside() {
        WavefrontCoefficients z = PrescriptionOptics.computeWavefrontCoefficients(Prescription.of(-4.0, -1.0, 10.0));
        ComplexGrid pupil = engine.buildPupilFunction(z, 33, 550.0, 2.5e-5);
        assertEquals(1.0, pupil.magnitudeSquared(16, 16), 1e-12);
        assertEquals(1.0, pupil.magnitudeSquared(16, 0), 1e-12);
        assertEquals(0.0, pupil.magnitudeSquared(0, 0), 0.0);
        assertEquals(0.0, pupil.magnitudeSquared(32, 32), 0.0);
    }

    @Test
    void noAberration_givesRotationallySymmetricPsf() {
        int n = 64;
        Psf psf = engine.generatePsf(Prescription.emmetropic(), n, 550.0, 2.5e-5).centered();
        int c = n / 2;
        for (int a = -6; a <= 6; a++) {
            for (int b = -6; b <= 6; b++) {
                double v = psf.get(c + a, c + b);
                double rotated = psf.get(c - b, c + a);
                assertEquals(v, rotated, 1e-9, "90° rotation at (" + a + "," + b + ")");
            }
        }
        assertEquals(psf.peak(), psf.get(c, c), 1e-12, "peak sits at the center");
    }

    @Test
    void buildPsf_doesNotModifyPupil() {
        ComplexGrid pupil = engine.buildPupilFunction(WavefrontCoefficients.ZERO, 16, 550.0, 2.5e-5);
        ComplexGrid snapshot = pupil.copy();
        engine.buildPsf(pupil);
        assertEquals(snapshot, pupil);
    }

    @Test
    void zeroPupil_doesNotDivideByZero() {
        Psf psf = engine.buildPsf(new ComplexGrid(8));
        assertEquals(0.0, psf.sum(), 0.0);
        assertFalse(Double.isNaN(psf.get(0, 0)));
    }

    @Test
    void singleCell_isPupilCenter() {
        ComplexGrid pupil = engine.buildPupilFunction(WavefrontCoefficients.ZERO, 1, 550.0, 1.0);
        assertEquals(1.0, pupil.real(0, 0), 1e-12);
    }

    @Test
    void invalidArguments_areRejected() {
        WavefrontCoefficients z = WavefrontCoefficients.ZERO;
        assertThrows(InvalidInputException.class, () -> engine.buildPupilFunction(z, 0, 550.0, 1.0));
        assertThrows(InvalidInputException.class, () -> engine.buildPupilFunction(z, 8, -1.0, 1.0));
        assertThrows(InvalidInputException.class, () -> engine.buildPupilFunction(z, 8, 550.0, Double.NaN));
        assertThrows(InvalidInputException.class, () -> engine.generatePsf(null, 8, 550.0, 1.0));
    }
}
