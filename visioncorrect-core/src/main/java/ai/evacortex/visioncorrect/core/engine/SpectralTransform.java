/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import ai.evacortex.visioncorrect.core.math.ComplexGrid;

/**
 * {@code SpectralTransform} defines the 2D discrete Fourier transform used by every stage of the
 * correction pipeline: pupil → PSF, PSF → transfer function and filter, image → spectrum and back.
 *
 * <p>The transform is separable. A 2D transform of an N×N grid is N independent 1D transforms
 * along the rows followed by N independent 1D transforms along the columns. The row pass is a
 * barrier: no column is transformed before every row has been written.</p>
 *
 * <p>Normalization is fixed for all implementations:</p>
 * <pre>
 *     forward:  X[k] = Σ x[n] · e^{-2πi·kn/N}            (unscaled)
 *     inverse:  x[n] = (1/N) · Σ X[k] · e^{+2πi·kn/N}    (per axis, 1/N² overall)
 * </pre>
 *
 * <p>so that {@code inverse(forward(x)) ≈ x} element-wise. Downstream magnitudes depend on it:
 * with this convention a PSF whose samples sum to 1 has a transfer function equal to 1 at the
 * zero frequency, which is what gives the filter regularization {@code ε} its scale.</p>
 *
 * <p>Both methods transform the given grid in place and return it for chaining.
 * Implementations must be deterministic and safe to call from several threads on distinct grids.</p>
 *
 * @see JavaSpectralTransform
 * @see JTransformsSpectralTransform
 */
public interface SpectralTransform {

    /**
     * Replaces the contents of {@code grid} with its unscaled forward spectrum.
     *
     * @param grid the spatial-domain grid, modified in place
     * @return the same grid instance
     * @throws NullPointerException if {@code grid} is {@code null}
     */
    ComplexGrid forward(ComplexGrid grid);

    /**
     * Replaces the contents of {@code grid} with its inverse transform, scaled by {@code 1/N} per axis.
     *
     * @param grid the frequency-domain grid, modified in place
     * @return the same grid instance
     * @throws NullPointerException if {@code grid} is {@code null}
     */
    ComplexGrid inverse(ComplexGrid grid);

    /**
     * Forward transform of a copy; {@code grid} is left untouched.
     */
    default ComplexGrid forwardCopy(ComplexGrid grid) {
        if (grid == null) {
            throw new NullPointerException("grid must not be null");
        }
        return forward(grid.copy());
    }

    /**
     * Inverse transform of a copy; {@code grid} is left untouched.
     */
    default ComplexGrid inverseCopy(ComplexGrid grid) {
        if (grid == null) {
            throw new NullPointerException("grid must not be null");
        }
        return inverse(grid.copy());
    }
}
