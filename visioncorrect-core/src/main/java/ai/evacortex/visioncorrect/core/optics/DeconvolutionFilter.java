/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.math.ComplexGrid;

/**
 * Frequency-domain pre-correction filter {@code M = H* / (|H|² + ε)} and the {@code ε} it was
 * built with. Immutable: the grid is copied in and out.
 */
public final class DeconvolutionFilter {

    private final ComplexGrid m;
    private final double epsilon;

    // takes ownership of m
    DeconvolutionFilter(ComplexGrid m, double epsilon) {
        this.m = m;
        this.epsilon = epsilon;
    }

    public int size() {
        return m.size();
    }

    public double epsilon() {
        return epsilon;
    }

    public double real(int u, int v) {
        return m.real(u, v);
    }

    public double imag(int u, int v) {
        return m.imag(u, v);
    }

    public ComplexGrid toComplexGrid() {
        return m.copy();
    }

    @Override
    public String toString() {
        return "DeconvolutionFilter[" + m.size() + "x" + m.size() + ", epsilon=" + epsilon + "]";
    }
}
