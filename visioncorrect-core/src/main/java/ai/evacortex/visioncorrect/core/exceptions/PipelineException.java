/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.exceptions;

import ai.evacortex.visioncorrect.core.pipeline.Eye;

public class PipelineException extends RuntimeException {
    public PipelineException(Eye eye, Throwable cause) {
        super("Correction pipeline failed for eye " + eye + ": " + cause.getMessage(), cause);
    }
}
