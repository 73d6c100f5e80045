/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexGridTest {

    @Test
    void fromReal_indexesRowsByY() {
        ComplexGrid g = ComplexGrid.fromReal(new double[][]{{1, 2}, {3, 4}});
        assertEquals(2.0, g.real(1, 0));
        assertEquals(3.0, g.real(0, 1));
        assertEquals(0.0, g.imag(1, 1));
    }

    @Test
    void multiplyInPlace_isComplexProduct() {
        ComplexGrid a = new ComplexGrid(2);
        ComplexGrid b = new ComplexGrid(2);
        a.set(1, 1, 1.0, 2.0);
        b.set(1, 1, 0.0, 2.0);
        a.multiplyInPlace(b);
        // (1+2i)·2i = -4 + 2i
        assertEquals(-4.0, a.real(1, 1), 1e-12);
        assertEquals(2.0, a.imag(1, 1), 1e-12);
        assertEquals(0.0, a.magnitudeSquared(0, 0));
    }

    @Test
    void columnsRoundTrip() {
        ComplexGrid g = new ComplexGrid(3);
        double[] line = {1, -1, 2, -2, 3, -3};
        g.writeColumn(2, line);
        assertEquals(2.0, g.real(2, 1));
        assertEquals(-2.0, g.imag(2, 1));
        double[] back = new double[6];
        g.readColumn(2, back);
        assertArrayEquals(line, back);
        g.readRow(0, back);
        assertEquals(1.0, back[4]);
    }

    @Test
    void copy_isIndependent() {
        ComplexGrid g = new ComplexGrid(2);
        ComplexGrid c = g.copy();
        c.set(0, 0, 1.0, 0.0);
        assertEquals(0.0, g.real(0, 0));
        assertNotEquals(g, c);
    }

    @Test
    void invalidShapes_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ComplexGrid(0));
        assertThrows(IllegalArgumentException.class, () -> new ComplexGrid(2).multiplyInPlace(new ComplexGrid(3)));
        assertThrows(IllegalArgumentException.class, () -> ComplexGrid.fromReal(new double[][]{{1, 2}, {3}}));
    }
}
