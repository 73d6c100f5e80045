/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

class JTransformsSpectralTransformContractTest extends SpectralTransformContractTest {

    private static final SpectralTransform TRANSFORM = new JTransformsSpectralTransform();

    @Override
    protected SpectralTransform transform() {
        return TRANSFORM;
    }
}
