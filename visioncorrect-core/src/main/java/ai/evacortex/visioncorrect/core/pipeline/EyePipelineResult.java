/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.pipeline;

import ai.evacortex.visioncorrect.core.image.RgbaImage;
import ai.evacortex.visioncorrect.core.optics.DeconvolutionFilter;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import ai.evacortex.visioncorrect.core.optics.Psf;
import ai.evacortex.visioncorrect.core.optics.WavefrontCoefficients;

/**
 * Everything one eye's chain produced.
 *
 * @param blurred      source as seen without correction
 * @param preCorrected what the display should show
 * @param retinal      what the eye sees when the display shows {@code preCorrected}
 * @param psfFromCatalog whether the PSF was reused rather than generated
 */
public record EyePipelineResult(
        Eye eye,
        Prescription prescription,
        WavefrontCoefficients coefficients,
        double adjustedSphere,
        Psf psf,
        DeconvolutionFilter filter,
        RgbaImage source,
        RgbaImage blurred,
        RgbaImage preCorrected,
        RgbaImage retinal,
        boolean psfFromCatalog
) {

    /** Luminance MSE between the source and the corrected retinal image; NaN if sizes differ. */
    public double retinalMse() {
        return CorrectionValidator.luminanceMse(source, retinal);
    }

    /** Luminance MSE between the source and the uncorrected blur; NaN if sizes differ. */
    public double uncorrectedMse() {
        return CorrectionValidator.luminanceMse(source, blurred);
    }
}
