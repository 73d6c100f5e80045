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
 * How filtered luminance is brought back into [0, 1] before color reconstruction.
 */
public enum LuminanceMapping {
    /** Clamp each filtered value to [0, 1]. Keeps absolute brightness. */
    DIRECT_CLAMP,
    /** Stretch the image's filtered min..max to [0, 1]; a near-flat image uses a range of 1. */
    GLOBAL_REMAP
}
