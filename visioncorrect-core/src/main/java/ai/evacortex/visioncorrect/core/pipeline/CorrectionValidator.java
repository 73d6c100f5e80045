/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.pipeline;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.image.RgbaImage;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Checks that pre-correction actually helps: compares the uncorrected blur and the
 * corrected retinal image against the source.
 */
public class CorrectionValidator {

    private static final Logger log = LoggerFactory.getLogger(CorrectionValidator.class);

    private final EyePipeline pipeline;

    public CorrectionValidator(EyePipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    public ValidationReport validate(Prescription prescription, RgbaImage image) {
        return validate(Eye.OD, prescription, image);
    }

    public ValidationReport validate(Eye eye, Prescription prescription, RgbaImage image) {
        EyePipelineResult result = pipeline.run(eye, prescription, image);
        ValidationReport report = new ValidationReport(prescription, result.uncorrectedMse(), result.retinalMse());
        log.info("{} {}: blur MSE={}, retinal MSE={}, improvement={}",
                eye, prescription, report.blurMse(), report.retinalMse(), report.improvementRatio());
        return report;
    }

    /**
     * Mean squared luminance difference. Images of different sizes are not comparable:
     * a warning is logged and NaN returned.
     */
    public static double luminanceMse(RgbaImage a, RgbaImage b) {
        if (a == null || b == null) {
            throw new InvalidInputException("images must not be null");
        }
        if (a.width() != b.width() || a.height() != b.height()) {
            log.warn("MSE size mismatch: {}x{} vs {}x{}", a.width(), a.height(), b.width(), b.height());
            return Double.NaN;
        }
        double sum = 0.0;
        for (int y = 0; y < a.height(); y++) {
            for (int x = 0; x < a.width(); x++) {
                double d = a.luminance(x, y) - b.luminance(x, y);
                sum += d * d;
            }
        }
        return sum / ((double) a.width() * a.height());
    }

    public record ValidationReport(Prescription prescription, double blurMse, double retinalMse) {

        /** {@code blurMse / retinalMse}; above 1 means correction helped. */
        public double improvementRatio() {
            if (retinalMse == 0.0) {
                return blurMse == 0.0 ? 1.0 : Double.POSITIVE_INFINITY;
            }
            return blurMse / retinalMse;
        }

        public boolean improved() {
            return retinalMse < blurMse;
        }
    }
}
