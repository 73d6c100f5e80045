/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

/**
 * Low-order Zernike coefficients of an eye's wavefront.
 *
 * @param cAstigObliq oblique astigmatism, Z₋₂²
 * @param cDefocus    defocus, Z₀²
 * @param cAstigVert  vertical astigmatism, Z₂²
 */
public record WavefrontCoefficients(double cAstigObliq, double cDefocus, double cAstigVert) {

    public static final WavefrontCoefficients ZERO = new WavefrontCoefficients(0.0, 0.0, 0.0);

    public boolean isZero(double tolerance) {
        return Math.abs(cAstigObliq) <= tolerance
                && Math.abs(cDefocus) <= tolerance
                && Math.abs(cAstigVert) <= tolerance;
    }
}
