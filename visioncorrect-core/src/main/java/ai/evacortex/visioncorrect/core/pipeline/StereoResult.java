/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.pipeline;

public record StereoResult(EyePipelineResult od, EyePipelineResult os) {

    public EyePipelineResult get(Eye eye) {
        return eye == Eye.OD ? od : os;
    }
}
