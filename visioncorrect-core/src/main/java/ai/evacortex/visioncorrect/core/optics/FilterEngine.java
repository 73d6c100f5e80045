/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.engine.SpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.math.ComplexGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Regularized inverse of a PSF:
 * <pre>
 *     H = FFT(PSF)
 *     M = conj(H) / (|H|² + ε)
 * </pre>
 * Larger {@code ε} suppresses more noise at the cost of a weaker correction;
 * 1e-4..1e-2 is the useful range.
 */
public class FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    public static final double DEFAULT_EPSILON = 1e-3;

    private final SpectralTransform transform;

    public FilterEngine(SpectralTransform transform) {
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
    }

    /**
     * Optical transfer function {@code H = FFT(PSF)}.
     */
    public ComplexGrid opticalTransferFunction(Psf psf) {
        if (psf == null) {
            throw new InvalidInputException("psf must not be null");
        }
        return transform.forward(psf.toComplexGrid());
    }

    public DeconvolutionFilter buildDeconvolutionFilter(Psf psf) {
        return buildDeconvolutionFilter(psf, DEFAULT_EPSILON);
    }

    public DeconvolutionFilter buildDeconvolutionFilter(Psf psf, double epsilon) {
        if (!(epsilon > 0.0) || !Double.isFinite(epsilon)) {
            throw new InvalidInputException("epsilon must be positive and finite: " + epsilon);
        }
        ComplexGrid h = opticalTransferFunction(psf);
        int n = h.size();

        double hMin = Double.MAX_VALUE;
        double hMax = 0.0;
        ComplexGrid m = new ComplexGrid(n);
        for (int v = 0; v < n; v++) {
            for (int u = 0; u < n; u++) {
                double hr = h.real(u, v);
                double hi = h.imag(u, v);
                double mag2 = hr * hr + hi * hi;

                double denom = mag2 + epsilon;
                if (denom <= 0.0) {
                    denom = epsilon;
                }
                m.set(u, v, hr / denom, -hi / denom);

                double mag = Math.sqrt(mag2);
                hMin = Math.min(hMin, mag);
                hMax = Math.max(hMax, mag);
            }
        }

        log.debug("Deconvolution filter {}x{}: |H| min={}, max={}, epsilon={}", n, n, hMin, hMax, epsilon);
        return new DeconvolutionFilter(m, epsilon);
    }
}
