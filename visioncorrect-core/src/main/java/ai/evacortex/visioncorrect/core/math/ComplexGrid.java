/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.math;

import java.util.Arrays;
import java.util.Objects;

/**
 * Square N×N grid of complex doubles.
 *
 * <p>Cells are stored interleaved and row-major: cell {@code (x, y)} lives at
 * {@code data[2 * (y * N + x)]} (real) and the following slot (imaginary). A row is
 * therefore one contiguous line of {@code 2N} doubles, which is the layout the
 * 1D transforms in {@code engine} work on.</p>
 *
 * <p>A grid is mutable and owned by whoever created it. It is never shared between
 * concurrently running eye pipelines; callers that need to keep a value use
 * {@link #copy()}.</p>
 */
public final class ComplexGrid {

    private final int size;
    private final double[] data;

    public ComplexGrid(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Grid size must be positive: " + size);
        }
        this.size = size;
        this.data = new double[2 * size * size];
    }

    private ComplexGrid(int size, double[] data) {
        this.size = size;
        this.data = data;
    }

    /**
     * Builds a grid with the given real parts (indexed {@code values[y][x]}) and zero imaginary parts.
     */
    public static ComplexGrid fromReal(double[][] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        ComplexGrid grid = new ComplexGrid(n);
        for (int y = 0; y < n; y++) {
            if (values[y].length != n) {
                throw new IllegalArgumentException("Row " + y + " has length " + values[y].length + ", expected " + n);
            }
            for (int x = 0; x < n; x++) {
                grid.data[grid.offset(x, y)] = values[y][x];
            }
        }
        return grid;
    }

    public int size() {
        return size;
    }

    public double real(int x, int y) {
        return data[offset(x, y)];
    }

    public double imag(int x, int y) {
        return data[offset(x, y) + 1];
    }

    public void set(int x, int y, double real, double imag) {
        int o = offset(x, y);
        data[o] = real;
        data[o + 1] = imag;
    }

    public double magnitudeSquared(int x, int y) {
        int o = offset(x, y);
        return data[o] * data[o] + data[o + 1] * data[o + 1];
    }

    /**
     * Element-wise complex product {@code this[x,y] *= other[x,y]}.
     */
    public ComplexGrid multiplyInPlace(ComplexGrid other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.size != size) {
            throw new IllegalArgumentException("Mismatched grid sizes: " + size + " vs " + other.size);
        }
        for (int o = 0; o < data.length; o += 2) {
            double ar = data[o], ai = data[o + 1];
            double br = other.data[o], bi = other.data[o + 1];
            data[o] = ar * br - ai * bi;
            data[o + 1] = ar * bi + ai * br;
        }
        return this;
    }

    public ComplexGrid copy() {
        return new ComplexGrid(size, data.clone());
    }

    /**
     * Copies row {@code y} into {@code line} (interleaved, length ≥ 2N).
     */
    public void readRow(int y, double[] line) {
        System.arraycopy(data, 2 * y * size, line, 0, 2 * size);
    }

    public void writeRow(int y, double[] line) {
        System.arraycopy(line, 0, data, 2 * y * size, 2 * size);
    }

    /**
     * Copies column {@code x} into {@code line} (interleaved, length ≥ 2N).
     */
    public void readColumn(int x, double[] line) {
        for (int y = 0; y < size; y++) {
            int o = offset(x, y);
            line[2 * y] = data[o];
            line[2 * y + 1] = data[o + 1];
        }
    }

    public void writeColumn(int x, double[] line) {
        for (int y = 0; y < size; y++) {
            int o = offset(x, y);
            data[o] = line[2 * y];
            data[o + 1] = line[2 * y + 1];
        }
    }

    private int offset(int x, int y) {
        return 2 * (y * size + x);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComplexGrid)) return false;
        ComplexGrid other = (ComplexGrid) obj;
        return size == other.size && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ComplexGrid[" + size + "x" + size + "]";
    }
}
