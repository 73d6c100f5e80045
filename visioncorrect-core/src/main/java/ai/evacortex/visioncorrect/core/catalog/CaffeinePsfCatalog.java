/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.catalog;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.image.RgbaImage;
import ai.evacortex.visioncorrect.core.optics.Psf;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Bounded in-memory catalog.
 *
 * <p>The cache is keyed by {@link Prescription}, whose hash is quantized to a coarse grid.
 * Two prescriptions within tolerance can still fall on different sides of a grid line, so a
 * miss on the hashed lookup is followed by a linear scan.</p>
 */
public class CaffeinePsfCatalog implements PsfCatalog {

    private static final Logger log = LoggerFactory.getLogger(CaffeinePsfCatalog.class);

    public static final int DEFAULT_MAX_ENTRIES = 64;

    private final Cache<Prescription, CatalogEntry> cache;

    public CaffeinePsfCatalog() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public CaffeinePsfCatalog(int maxEntries) {
        if (maxEntries <= 0) {
            throw new InvalidInputException("maxEntries must be positive: " + maxEntries);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .removalListener((Prescription k, CatalogEntry e, RemovalCause c) -> {
                    if (c.wasEvicted()) log.debug("Catalog evicted {} ({})", k, c);
                })
                .build();
    }

    @Override
    public Optional<CatalogEntry> lookup(Prescription prescription) {
        if (prescription == null) {
            throw new InvalidInputException("prescription must not be null");
        }
        CatalogEntry hit = cache.getIfPresent(prescription);
        if (hit != null) {
            return Optional.of(hit);
        }
        for (CatalogEntry entry : cache.asMap().values()) {
            if (entry.prescription().approximatelyEquals(prescription, Prescription.TOLERANCE)) {
                log.debug("Catalog hit by scan for {}", prescription);
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    @Override
    public void upsert(Prescription prescription, Psf psf, RgbaImage derivedAsset) {
        if (prescription == null || psf == null) {
            throw new InvalidInputException("prescription and psf must not be null");
        }
        // drop a near-duplicate stored under a different hash bucket
        cache.asMap().keySet().removeIf(k -> k.approximatelyEquals(prescription, Prescription.TOLERANCE)
                && k.hashCode() != prescription.hashCode());
        cache.put(prescription, new CatalogEntry(prescription, psf, derivedAsset));
        log.debug("Catalog upsert {} ({}x{})", prescription.fileKey(), psf.size(), psf.size());
    }

    @Override
    public void invalidate(Prescription prescription) {
        if (prescription == null) {
            return;
        }
        cache.asMap().keySet().removeIf(k -> k.approximatelyEquals(prescription, Prescription.TOLERANCE));
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
