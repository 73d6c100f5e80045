/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JavaSpectralTransformContractTest extends SpectralTransformContractTest {

    private static final SpectralTransform TRANSFORM = new JavaSpectralTransform();

    @Override
    protected SpectralTransform transform() {
        return TRANSFORM;
    }

    @Test
    void isPowerOfTwo() {
        assertTrue(JavaSpectralTransform.isPowerOfTwo(1));
        assertTrue(JavaSpectralTransform.isPowerOfTwo(512));
        assertFalse(JavaSpectralTransform.isPowerOfTwo(0));
        assertFalse(JavaSpectralTransform.isPowerOfTwo(12));
    }
}
