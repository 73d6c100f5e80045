/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.config.OpticsSettings;
import ai.evacortex.visioncorrect.core.engine.SpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.math.ComplexGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the diffraction PSF of an eye:
 * prescription → Zernike coefficients → pupil function P·e^{−i2πW/λ} → FFT → |·|² → normalize.
 */
public class PsfEngine {

    private static final Logger log = LoggerFactory.getLogger(PsfEngine.class);

    /** Wavefront is in millimeters, so nanometers scale by 1e-6. */
    private static final double NM_TO_MM = 1e-6;

    private final SpectralTransform transform;

    public PsfEngine(SpectralTransform transform) {
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
    }

    /**
     * Pure-phase pupil of unit magnitude inside the aperture disk, zero outside.
     * Cell {@code (i, j)} maps to {@code ((i − half)/half, (j − half)/half)} with {@code half = (size − 1)/2}.
     */
    public ComplexGrid buildPupilFunction(WavefrontCoefficients coeffs, int size, double wavelengthNm, double strength) {
        if (coeffs == null) {
            throw new InvalidInputException("wavefront coefficients must not be null");
        }
        requireSize(size);
        if (!(wavelengthNm > 0.0) || !Double.isFinite(wavelengthNm)) {
            throw new InvalidInputException("wavelength must be positive and finite: " + wavelengthNm);
        }
        if (!Double.isFinite(strength)) {
            throw new InvalidInputException("strength must be finite: " + strength);
        }

        double lambda = wavelengthNm * NM_TO_MM;
        double half = (size - 1) * 0.5;
        ComplexGrid pupil = new ComplexGrid(size);

        for (int j = 0; j < size; j++) {
            double ny = half > 0.0 ? (j - half) / half : 0.0;
            for (int i = 0; i < size; i++) {
                double nx = half > 0.0 ? (i - half) / half : 0.0;
                if (nx * nx + ny * ny <= 1.0) {
                    double w = PrescriptionOptics.wavefront(coeffs, nx, ny, strength);
                    double phase = -2.0 * Math.PI * w / lambda;
                    pupil.set(i, j, Math.cos(phase), Math.sin(phase));
                }
            }
        }
        return pupil;
    }

    /**
     * {@code PSF = |FFT(pupil)|² / Σ|FFT(pupil)|²}. The pupil grid is not modified.
     */
    public Psf buildPsf(ComplexGrid pupil) {
        if (pupil == null) {
            throw new InvalidInputException("pupil function must not be null");
        }
        ComplexGrid h = transform.forwardCopy(pupil);
        int n = h.size();
        double[] raw = new double[n * n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                raw[y * n + x] = h.magnitudeSquared(x, y);
            }
        }
        return Psf.fromIntensities(n, raw);
    }

    public Psf generatePsf(Prescription prescription, int size, double wavelengthNm, double strength) {
        if (prescription == null) {
            throw new InvalidInputException("prescription must not be null");
        }
        WavefrontCoefficients coeffs = PrescriptionOptics.computeWavefrontCoefficients(prescription);
        Psf psf = buildPsf(buildPupilFunction(coeffs, size, wavelengthNm, strength));
        if (log.isDebugEnabled()) {
            log.debug("Generated PSF {}x{} for {} at {} nm, strength={}: {} peak={}",
                    size, size, prescription, wavelengthNm, strength, coeffs, psf.peak());
        }
        return psf;
    }

    public Psf generatePsf(Prescription prescription, OpticsSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return generatePsf(prescription, settings.kernelSize(), settings.wavelengthNm(), settings.blurStrength());
    }

    static void requireSize(int size) {
        if (size <= 0) {
            throw new InvalidInputException("size must be positive: " + size);
        }
    }
}
