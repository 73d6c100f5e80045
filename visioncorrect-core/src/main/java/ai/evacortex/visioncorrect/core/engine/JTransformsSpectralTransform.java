/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import org.jtransforms.fft.DoubleFFT_1D;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;

/**
 * Backend delegating each 1D line to JTransforms. Its {@code complexForward} is unscaled and
 * {@code complexInverse(a, true)} divides by N, which matches the {@link SpectralTransform} contract.
 *
 * <p>One {@link DoubleFFT_1D} per line length and thread, so concurrent passes never share
 * a transform instance.</p>
 */
public final class JTransformsSpectralTransform extends SeparableSpectralTransform {

    private final Map<Integer, ThreadLocal<DoubleFFT_1D>> transforms = new ConcurrentHashMap<>();

    public JTransformsSpectralTransform() {
        this(ForkJoinPool.commonPool());
    }

    public JTransformsSpectralTransform(ForkJoinPool pool) {
        super(pool);
    }

    @Override
    protected void forwardLine(double[] line, int n) {
        fftFor(n).complexForward(line);
    }

    @Override
    protected void inverseLine(double[] line, int n) {
        fftFor(n).complexInverse(line, true);
    }

    private DoubleFFT_1D fftFor(int n) {
        return transforms
                .computeIfAbsent(n, len -> ThreadLocal.withInitial(() -> new DoubleFFT_1D(len)))
                .get();
    }
}
