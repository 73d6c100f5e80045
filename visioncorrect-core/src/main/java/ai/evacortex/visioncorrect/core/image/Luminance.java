/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.image;

/**
 * ITU-R BT.709 luma weights.
 */
public final class Luminance {

    public static final double WEIGHT_R = 0.2126;
    public static final double WEIGHT_G = 0.7152;
    public static final double WEIGHT_B = 0.0722;

    private Luminance() {}

    public static double of(double r, double g, double b) {
        return WEIGHT_R * r + WEIGHT_G * g + WEIGHT_B * b;
    }

    /**
     * Clamps to [0, 1]; NaN maps to 0.
     */
    public static float clamp01(double v) {
        if (!(v > 0.0)) return 0f;
        if (v >= 1.0) return 1f;
        return (float) v;
    }
}
