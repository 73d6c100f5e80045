/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import ai.evacortex.visioncorrect.core.math.ComplexGrid;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.ForkJoinPool;

import static ai.evacortex.visioncorrect.core.OpticsTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class SpectralBackendAgreementTest {

    @ParameterizedTest
    @ValueSource(ints = {8, 30, 64, 128})
    void backendsProduceSameSpectrum(int n) {
        ForkJoinPool pool = new ForkJoinPool(4);
        try {
            ComplexGrid in = randomGrid(n, 1234L + n);
            ComplexGrid a = new JavaSpectralTransform(pool).forwardCopy(in);
            ComplexGrid b = new JTransformsSpectralTransform(pool).forwardCopy(in);
            assertTrue(maxAbsDiff(a, b) < 1e-8 * n * n, "backends disagree for N=" + n);
        } finally {
            pool.shutdown();
        }
    }
}
