/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.pipeline;

import ai.evacortex.visioncorrect.core.catalog.CatalogEntry;
import ai.evacortex.visioncorrect.core.catalog.PsfCatalog;
import ai.evacortex.visioncorrect.core.config.OpticsSettings;
import ai.evacortex.visioncorrect.core.engine.SpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.image.ImagePipeline;
import ai.evacortex.visioncorrect.core.image.RgbaImage;
import ai.evacortex.visioncorrect.core.optics.DeconvolutionFilter;
import ai.evacortex.visioncorrect.core.optics.FilterEngine;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import ai.evacortex.visioncorrect.core.optics.PrescriptionOptics;
import ai.evacortex.visioncorrect.core.optics.Psf;
import ai.evacortex.visioncorrect.core.optics.PsfEngine;
import ai.evacortex.visioncorrect.core.optics.WavefrontCoefficients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One eye's chain: prescription → PSF → filter → blur / pre-correct / retinal simulation.
 * Holds no mutable state of its own; the catalog is the only thing shared between runs.
 */
public class EyePipeline {

    private static final Logger log = LoggerFactory.getLogger(EyePipeline.class);

    private final PsfEngine psfEngine;
    private final FilterEngine filterEngine;
    private final ImagePipeline imagePipeline;
    private final PsfCatalog catalog;
    private final OpticsSettings settings;

    public EyePipeline(SpectralTransform transform, PsfCatalog catalog, OpticsSettings settings) {
        Objects.requireNonNull(transform, "transform must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.psfEngine = new PsfEngine(transform);
        this.filterEngine = new FilterEngine(transform);
        this.imagePipeline = new ImagePipeline(transform, settings.luminanceMapping());
    }

    public OpticsSettings settings() {
        return settings;
    }

    public EyePipelineResult run(Eye eye, Prescription prescription, RgbaImage image) {
        if (eye == null) {
            throw new InvalidInputException("eye must not be null");
        }
        if (prescription == null) {
            throw new InvalidInputException("prescription must not be null");
        }
        if (image == null) {
            throw new InvalidInputException("image must not be null");
        }
        int size = settings.kernelSize();

        WavefrontCoefficients coeffs = PrescriptionOptics.computeWavefrontCoefficients(prescription);
        double adjusted = PrescriptionOptics.adjustedSphere(prescription.sphere(), prescription.viewingDistance());

        Psf psf = catalog.lookup(prescription)
                .map(CatalogEntry::psf)
                .filter(cached -> cached.size() == size)
                .orElse(null);
        boolean fromCatalog = psf != null;
        RgbaImage blurred;
        if (fromCatalog) {
            log.debug("{}: reusing catalog PSF for {}", eye, prescription);
            blurred = imagePipeline.blur(image, psf, size);
        } else {
            psf = psfEngine.generatePsf(prescription, settings);
            blurred = imagePipeline.blur(image, psf, size);
            catalog.upsert(prescription, psf, blurred);
        }

        DeconvolutionFilter filter = filterEngine.buildDeconvolutionFilter(psf, settings.epsilon());
        RgbaImage preCorrected = imagePipeline.preCorrect(image, filter, size);
        RgbaImage retinal = imagePipeline.simulateRetina(preCorrected, psf, size);

        log.debug("{}: done {} (adjusted sphere {})", eye, prescription, adjusted);
        return new EyePipelineResult(eye, prescription, coeffs, adjusted, psf, filter,
                image, blurred, preCorrected, retinal, fromCatalog);
    }
}
