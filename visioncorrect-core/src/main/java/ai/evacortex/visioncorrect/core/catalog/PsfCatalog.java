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

import java.util.Optional;

/**
 * Store of precomputed PSFs keyed by prescription.
 *
 * <p>Keys match by {@link Prescription#equals(Object)}, which is approximate: two prescriptions
 * whose fields differ by less than {@link Prescription#TOLERANCE} resolve to the same entry.
 * Implementations must be safe for concurrent use by both eye pipelines.</p>
 *
 * <p>{@link Prescription#hashCode()} quantizes to a coarser grid than {@code equals} tolerates, so
 * two equal prescriptions near a grid line can hash differently. A plain {@code HashMap} or
 * {@code HashSet} keyed by prescription will then miss; implementations backed by hashing must
 * follow a miss with an approximate scan, as {@link CaffeinePsfCatalog} does.</p>
 */
public interface PsfCatalog {

    Optional<CatalogEntry> lookup(Prescription prescription);

    /**
     * Inserts or replaces the entry for {@code prescription}.
     *
     * @param derivedAsset may be {@code null}
     */
    void upsert(Prescription prescription, Psf psf, RgbaImage derivedAsset);

    void invalidate(Prescription prescription);

    long size();
}
