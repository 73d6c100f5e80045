/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.config;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import ai.evacortex.visioncorrect.core.pipeline.Eye;

/**
 * Prescriptions for both eyes plus the optics settings they are processed with.
 *
 * @param od right eye
 * @param os left eye
 */
public record AberrationConfig(Prescription od, Prescription os, OpticsSettings settings) {

    public AberrationConfig {
        if (od == null || os == null) {
            throw new InvalidInputException("both OD and OS prescriptions are required");
        }
        if (settings == null) {
            settings = OpticsSettings.defaults();
        }
    }

    public static AberrationConfig of(Prescription od, Prescription os) {
        return new AberrationConfig(od, os, OpticsSettings.defaults());
    }

    public Prescription prescription(Eye eye) {
        return eye == Eye.OD ? od : os;
    }

    public AberrationConfig withSettings(OpticsSettings newSettings) {
        return new AberrationConfig(od, os, newSettings);
    }
}
