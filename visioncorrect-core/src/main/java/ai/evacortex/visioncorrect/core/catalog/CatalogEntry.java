/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.catalog;

import ai.evacortex.visioncorrect.core.image.RgbaImage;
import ai.evacortex.visioncorrect.core.optics.Psf;
import ai.evacortex.visioncorrect.core.optics.Prescription;

/**
 * A cached PSF and, optionally, an image derived from it (usually the blurred preview).
 */
public record CatalogEntry(Prescription prescription, Psf psf, RgbaImage derivedAsset) {

    public CatalogEntry {
        if (prescription == null || psf == null) {
            throw new IllegalArgumentException("prescription and psf are required");
        }
    }

    public boolean hasDerivedAsset() {
        return derivedAsset != null;
    }
}
