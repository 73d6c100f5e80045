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

/**
 * Prescription → wavefront. Stateless.
 *
 * <p>The wavefront is expanded in three Zernike terms over the unit pupil disk:</p>
 * <pre>
 *     Z₋₂²(x, y) = 2√6 · x · y
 *     Z₀²(x, y)  = √3 · (2(x² + y²) − 1)
 *     Z₂²(x, y)  = √6 · (x² − y²)
 * </pre>
 */
public final class PrescriptionOptics {

    /** Near point of 0.125 m, in diopters. */
    public static final double ACCOMMODATION_LIMIT = 8.0;

    private static final double SQRT3 = Math.sqrt(3.0);
    private static final double SQRT6 = Math.sqrt(6.0);

    private PrescriptionOptics() {}

    /**
     * Effective sphere at viewing distance {@code d}, accounting for residual accommodation:
     * <pre>
     *     S(d) = Sm + 1/d         if 1/d &lt; |Sm|
     *     S(d) = Sm − (8 − 1/d)   else if (8 − 1/d) &lt; |Sm|
     *     S(d) = 0                otherwise
     * </pre>
     * The branches are tested in this order and the function is deliberately non-smooth
     * at both boundaries.
     *
     * @param measuredSphere sphere in diopters
     * @param distance       viewing distance in meters
     */
    public static double adjustedSphere(double measuredSphere, double distance) {
        if (!(distance > 0.0)) {
            throw new InvalidInputException("viewing distance must be positive: " + distance);
        }
        double invD = 1.0 / distance;
        double absSm = Math.abs(measuredSphere);

        if (invD < absSm) {
            return measuredSphere + invD;
        }

        double term = ACCOMMODATION_LIMIT - invD;
        if (term < absSm) {
            return measuredSphere - term;
        }

        return 0.0;
    }

    /**
     * <pre>
     *     c₋₂² =  R² · C · sin(2A) / (4√6)
     *     c₀²  = −R² · (S + C/2) / (4√3)
     *     c₂²  =  R² · C · cos(2A) / (4√6)
     * </pre>
     * with S the adjusted sphere, C the cylinder, A the axis in radians and R the pupil radius.
     */
    public static WavefrontCoefficients computeWavefrontCoefficients(Prescription p) {
        if (p == null) {
            throw new InvalidInputException("prescription must not be null");
        }
        double a = Math.toRadians(p.axis());
        double s = adjustedSphere(p.sphere(), p.viewingDistance());
        double c = p.cylinder();
        double r2 = p.pupilRadius() * p.pupilRadius();

        double obliq = r2 * c * Math.sin(2.0 * a) / (4.0 * SQRT6);
        double defocus = -r2 * (s + c * 0.5) / (4.0 * SQRT3);
        double vert = r2 * c * Math.cos(2.0 * a) / (4.0 * SQRT6);
        return new WavefrontCoefficients(obliq, defocus, vert);
    }

    /**
     * Wavefront at normalized pupil coordinates, scaled by {@code strength}.
     * Points outside the unit disk are outside the aperture and return 0.
     */
    public static double wavefront(WavefrontCoefficients z, double x, double y, double strength) {
        double r2 = x * x + y * y;
        if (r2 > 1.0) {
            return 0.0;
        }

        double zObliq = 2.0 * SQRT6 * x * y;
        double zDefocus = SQRT3 * (2.0 * r2 - 1.0);
        double zVert = SQRT6 * (x * x - y * y);

        return strength * (z.cAstigObliq() * zObliq
                + z.cDefocus() * zDefocus
                + z.cAstigVert() * zVert);
    }

    public static double wavefront(WavefrontCoefficients z, double x, double y) {
        return wavefront(z, x, y, 1.0);
    }
}
