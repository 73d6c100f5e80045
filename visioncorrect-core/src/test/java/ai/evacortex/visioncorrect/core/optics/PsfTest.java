/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.image.RgbaImage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PsfTest {

    @Test
    void fromIntensities_normalizesAndClamps() {
        Psf psf = Psf.fromIntensities(new double[][]{{2, -1}, {1, 1}});
        assertEquals(0.5, psf.get(0, 0), 1e-12);
        assertEquals(0.0, psf.get(1, 0), 0.0);
        assertEquals(1.0, psf.sum(), 1e-12);
        assertEquals(0.5, psf.peak(), 1e-12);
    }

    @Test
    void centered_movesOriginToMiddle() {
        Psf c = Psf.delta(8).centered();
        assertEquals(1.0, c.get(4, 4), 0.0);
        assertEquals(0.0, c.get(0, 0), 0.0);
    }

    @Test
    void toArray_isCopy() {
        Psf psf = Psf.delta(4);
        double[][] a = psf.toArray();
        a[0][0] = 0.0;
        assertEquals(1.0, psf.get(0, 0));
    }

    @Test
    void toImage_scalesToPeak() {
        Psf psf = Psf.fromIntensities(new double[][]{{1, 3}, {0, 0}});
        RgbaImage img = psf.toImage(true);
        assertEquals(1.0f, img.r(1, 0), 1e-6f);
        assertEquals(1.0f / 3.0f, img.g(0, 0), 1e-6f);
        assertEquals(0.25f, psf.toImage(false).b(0, 0), 1e-6f);
    }

    @Test
    void badShapes_areRejected() {
        assertThrows(InvalidInputException.class, () -> Psf.fromIntensities(3, new double[8]));
        assertThrows(InvalidInputException.class, () -> Psf.fromIntensities(0, new double[0]));
        assertThrows(InvalidInputException.class, () -> Psf.fromIntensities(new double[][]{{1, 2}, {3}}));
        assertThrows(InvalidInputException.class, () -> Psf.delta(0));
        assertThrows(InvalidInputException.class, () -> Psf.delta(-1));
    }
}
