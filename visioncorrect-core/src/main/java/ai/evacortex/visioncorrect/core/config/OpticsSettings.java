/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.config;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.image.LuminanceMapping;

/**
 * Numerical settings shared by both eyes.
 */
public record OpticsSettings(
        int kernelSize,                     // PSF / image side length
        double wavelengthNm,                // 550 nm = green, peak photopic sensitivity
        double blurStrength,                // wavefront scale; 2.5e-5 matches published PSFs
        double epsilon,                     // filter regularization
        LuminanceMapping luminanceMapping   // how filtered luminance returns to [0, 1]
) {
    public static final int DEFAULT_KERNEL_SIZE = 512;
    public static final double DEFAULT_WAVELENGTH_NM = 550.0;
    public static final double DEFAULT_BLUR_STRENGTH = 2.5e-5;
    public static final double DEFAULT_EPSILON = 1e-3;

    public OpticsSettings {
        if (kernelSize <= 0) {
            throw new InvalidInputException("kernelSize must be positive: " + kernelSize);
        }
        if (!(wavelengthNm > 0.0) || !Double.isFinite(wavelengthNm)) {
            throw new InvalidInputException("wavelengthNm must be positive and finite: " + wavelengthNm);
        }
        if (!Double.isFinite(blurStrength)) {
            throw new InvalidInputException("blurStrength must be finite: " + blurStrength);
        }
        if (!(epsilon > 0.0) || !Double.isFinite(epsilon)) {
            throw new InvalidInputException("epsilon must be positive and finite: " + epsilon);
        }
        if (luminanceMapping == null) {
            luminanceMapping = LuminanceMapping.DIRECT_CLAMP;
        }
    }

    /**
     * Built-in defaults, each overridable by a {@code visioncorrect.*} system property.
     */
    public static OpticsSettings defaults() {
        return new OpticsSettings(
                Integer.getInteger("visioncorrect.kernelSize", DEFAULT_KERNEL_SIZE),
                Double.parseDouble(System.getProperty("visioncorrect.wavelengthNm", String.valueOf(DEFAULT_WAVELENGTH_NM))),
                Double.parseDouble(System.getProperty("visioncorrect.blurStrength", String.valueOf(DEFAULT_BLUR_STRENGTH))),
                Double.parseDouble(System.getProperty("visioncorrect.epsilon", String.valueOf(DEFAULT_EPSILON))),
                LuminanceMapping.valueOf(System.getProperty("visioncorrect.luminanceMapping", LuminanceMapping.DIRECT_CLAMP.name()))
        );
    }

    public OpticsSettings withKernelSize(int size) {
        return new OpticsSettings(size, wavelengthNm, blurStrength, epsilon, luminanceMapping);
    }

    public OpticsSettings withBlurStrength(double strength) {
        return new OpticsSettings(kernelSize, wavelengthNm, strength, epsilon, luminanceMapping);
    }

    public OpticsSettings withEpsilon(double eps) {
        return new OpticsSettings(kernelSize, wavelengthNm, blurStrength, eps, luminanceMapping);
    }

    public OpticsSettings withLuminanceMapping(LuminanceMapping mapping) {
        return new OpticsSettings(kernelSize, wavelengthNm, blurStrength, epsilon, mapping);
    }
}
