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
import ai.evacortex.visioncorrect.core.math.ComplexGrid;

import java.util.Objects;

/**
 * Energy-normalized point-spread function: N×N non-negative samples summing to 1.
 *
 * <p>Samples are laid out as the transform produces them, with the zero offset at {@code (0, 0)}
 * and negative offsets wrapped to the far edges. {@link #centered()} moves the zero offset to the
 * grid center for display. Instances are immutable.</p>
 */
public final class Psf {

    private final int size;
    private final double[] values;

    private Psf(int size, double[] values) {
        this.size = size;
        this.values = values;
    }

    /**
     * Normalizes raw intensities (row-major, length {@code size²}) to unit energy.
     * Negative samples are clamped to 0; a non-positive total is treated as 1.
     */
    public static Psf fromIntensities(int size, double[] intensities) {
        Objects.requireNonNull(intensities, "intensities must not be null");
        if (size <= 0) {
            throw new InvalidInputException("PSF size must be positive: " + size);
        }
        if (intensities.length != size * size) {
            throw new InvalidInputException("expected " + (size * size) + " PSF samples, got " + intensities.length);
        }

        double[] v = new double[intensities.length];
        double sum = 0.0;
        for (int i = 0; i < v.length; i++) {
            v[i] = Math.max(0.0, intensities[i]);
            sum += v[i];
        }
        if (sum <= 0.0) {
            sum = 1.0;
        }
        for (int i = 0; i < v.length; i++) {
            v[i] /= sum;
        }
        return new Psf(size, v);
    }

    /**
     * Normalizes intensities indexed {@code values[y][x]}.
     */
    public static Psf fromIntensities(double[][] intensities) {
        Objects.requireNonNull(intensities, "intensities must not be null");
        int n = intensities.length;
        double[] flat = new double[n * n];
        for (int y = 0; y < n; y++) {
            if (intensities[y].length != n) {
                throw new InvalidInputException("PSF must be square, row " + y + " has length " + intensities[y].length);
            }
            System.arraycopy(intensities[y], 0, flat, y * n, n);
        }
        return fromIntensities(n, flat);
    }

    /**
     * A single-sample PSF: the optics of a perfect eye at this sampling.
     */
    public static Psf delta(int size) {
        if (size <= 0) {
            throw new InvalidInputException("PSF size must be positive: " + size);
        }
        double[] v = new double[size * size];
        v[0] = 1.0;
        return fromIntensities(size, v);
    }

    public int size() {
        return size;
    }

    public double get(int x, int y) {
        return values[y * size + x];
    }

    public double sum() {
        double s = 0.0;
        for (double v : values) s += v;
        return s;
    }

    public double peak() {
        double max = 0.0;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    /**
     * Copy with the zero offset moved from {@code (0, 0)} to {@code (N/2, N/2)}.
     */
    public Psf centered() {
        int shift = size / 2;
        double[] shifted = new double[values.length];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int sx = (x + shift) % size;
                int sy = (y + shift) % size;
                shifted[sy * size + sx] = values[y * size + x];
            }
        }
        return new Psf(size, shifted);
    }

    public ComplexGrid toComplexGrid() {
        ComplexGrid grid = new ComplexGrid(size);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                grid.set(x, y, values[y * size + x], 0.0);
            }
        }
        return grid;
    }

    public double[][] toArray() {
        double[][] out = new double[size][size];
        for (int y = 0; y < size; y++) {
            System.arraycopy(values, y * size, out[y], 0, size);
        }
        return out;
    }

    /**
     * Grayscale rendering for inspection. Raw energies are tiny, so by default samples are
     * scaled so the peak maps to 1.
     */
    public RgbaImage toImage(boolean normalizeToPeak) {
        double peak = peak();
        double scale = normalizeToPeak && peak > 0.0 ? 1.0 / peak : 1.0;
        float[] lum = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            lum[i] = (float) Math.min(1.0, values[i] * scale);
        }
        return RgbaImage.fromLuminance(size, size, lum);
    }

    @Override
    public String toString() {
        return "Psf[" + size + "x" + size + ", peak=" + peak() + "]";
    }
}
