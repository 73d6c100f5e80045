/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.image;

import ai.evacortex.visioncorrect.core.engine.SpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.math.ComplexGrid;
import ai.evacortex.visioncorrect.core.optics.DeconvolutionFilter;
import ai.evacortex.visioncorrect.core.optics.Psf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Frequency-domain blur and pre-correction of color images.
 *
 * <p>Only luminance is filtered. Color is rebuilt by scaling the original RGB by
 * {@code L'/max(L, 1e-4)}, which keeps hue and avoids channels ringing differently.
 * Inputs are never modified; every call returns a new {@code size×size} image.</p>
 *
 * <p>If the image or kernel does not match {@code size} the call still runs at {@code size}
 * and a warning is logged: the image is sampled with clamp-to-edge, kernel cells outside
 * their source grid count as 0.</p>
 */
public class ImagePipeline {

    private static final Logger log = LoggerFactory.getLogger(ImagePipeline.class);

    /** Floor for the original luminance in the color ratio. */
    static final double MIN_LUMINANCE = 1e-4;
    /** Below this filtered range a global remap uses a range of 1. */
    static final double MIN_REMAP_RANGE = 1e-8;

    private final SpectralTransform transform;
    private final LuminanceMapping mapping;

    public ImagePipeline(SpectralTransform transform) {
        this(transform, LuminanceMapping.DIRECT_CLAMP);
    }

    public ImagePipeline(SpectralTransform transform, LuminanceMapping mapping) {
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
    }

    public LuminanceMapping mapping() {
        return mapping;
    }

    /**
     * Simulates the eye: {@code image ⊛ PSF}, computed as {@code IFFT(FFT(L) · FFT(PSF))}.
     */
    public RgbaImage blur(RgbaImage image, Psf psf, int size) {
        if (psf == null) {
            throw new InvalidInputException("psf must not be null");
        }
        requireSize(size);
        warnIfMismatched("PSF", psf.size(), psf.size(), size);
        ComplexGrid otf = transform.forward(fit(psf.toComplexGrid(), size));
        return applyConvolutionKernel(image, otf, size);
    }

    public RgbaImage blur(RgbaImage image, Psf psf) {
        if (psf == null) {
            throw new InvalidInputException("psf must not be null");
        }
        return blur(image, psf, psf.size());
    }

    /**
     * Applies the deconvolution filter to a sharp image, producing what the display should show.
     */
    public RgbaImage preCorrect(RgbaImage image, DeconvolutionFilter filter, int size) {
        if (filter == null) {
            throw new InvalidInputException("deconvolution filter must not be null");
        }
        requireSize(size);
        warnIfMismatched("filter", filter.size(), filter.size(), size);
        return applyConvolutionKernel(image, fit(filter.toComplexGrid(), size), size);
    }

    public RgbaImage preCorrect(RgbaImage image, DeconvolutionFilter filter) {
        if (filter == null) {
            throw new InvalidInputException("deconvolution filter must not be null");
        }
        return preCorrect(image, filter, filter.size());
    }

    /**
     * What the eye perceives when the display shows {@code preCorrected}.
     */
    public RgbaImage simulateRetina(RgbaImage preCorrected, Psf psf, int size) {
        return blur(preCorrected, psf, size);
    }

    /**
     * Multiplies the luminance spectrum of {@code image} by {@code kernel} (a frequency-domain grid)
     * and rebuilds color from the filtered luminance.
     */
    public RgbaImage applyConvolutionKernel(RgbaImage image, ComplexGrid kernel, int size) {
        if (image == null) {
            throw new InvalidInputException("image must not be null");
        }
        if (kernel == null) {
            throw new InvalidInputException("kernel must not be null");
        }
        requireSize(size);
        warnIfMismatched("image", image.width(), image.height(), size);
        warnIfMismatched("kernel", kernel.size(), kernel.size(), size);
        ComplexGrid k = fit(kernel, size);

        float[][] orig = new float[size * size][];
        double[] lOrig = new double[size * size];
        ComplexGrid spectrum = new ComplexGrid(size);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                float[] px = image.sampleClamped(x, y);
                double l = Luminance.of(px[0], px[1], px[2]);
                orig[y * size + x] = px;
                lOrig[y * size + x] = l;
                spectrum.set(x, y, l, 0.0);
            }
        }

        transform.forward(spectrum);
        spectrum.multiplyInPlace(k);
        transform.inverse(spectrum);

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double v = spectrum.real(x, y);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        log.debug("Filtered luminance {}x{}: min={}, max={}", size, size, min, max);

        double range = max - min;
        if (mapping == LuminanceMapping.GLOBAL_REMAP && range <= MIN_REMAP_RANGE) {
            log.warn("Filtered luminance is nearly constant (range={}); output may look flat", range);
            range = 1.0;
        }

        float[] out = new float[size * size * 4];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int p = y * size + x;
                double raw = spectrum.real(x, y);
                double lNew = mapping == LuminanceMapping.GLOBAL_REMAP
                        ? Luminance.clamp01((raw - min) / range)
                        : Luminance.clamp01(raw);

                double factor = lNew / Math.max(lOrig[p], MIN_LUMINANCE);
                float[] px = orig[p];
                out[p * 4] = Luminance.clamp01(px[0] * factor);
                out[p * 4 + 1] = Luminance.clamp01(px[1] * factor);
                out[p * 4 + 2] = Luminance.clamp01(px[2] * factor);
                out[p * 4 + 3] = px[3];
            }
        }
        return RgbaImage.of(size, size, out);
    }

    /**
     * Copies {@code grid} into a {@code size×size} grid, truncating or zero-padding.
     */
    static ComplexGrid fit(ComplexGrid grid, int size) {
        if (grid.size() == size) {
            return grid;
        }
        ComplexGrid out = new ComplexGrid(size);
        int n = Math.min(size, grid.size());
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                out.set(x, y, grid.real(x, y), grid.imag(x, y));
            }
        }
        return out;
    }

    private static void warnIfMismatched(String what, int width, int height, int size) {
        if (width != size || height != size) {
            log.warn("{} is {}x{}, size={}. This may cause artifacts.", what, width, height, size);
        }
    }

    private static void requireSize(int size) {
        if (size <= 0) {
            throw new InvalidInputException("size must be positive: " + size);
        }
    }
}
