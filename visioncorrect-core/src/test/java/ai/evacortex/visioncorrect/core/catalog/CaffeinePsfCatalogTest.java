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
import ai.evacortex.visioncorrect.core.optics.Prescription;
import ai.evacortex.visioncorrect.core.optics.Psf;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CaffeinePsfCatalogTest {

    @Test
    void lookup_toleratesTinyDifferences() {
        CaffeinePsfCatalog catalog = new CaffeinePsfCatalog();
        Psf psf = Psf.delta(8);
        catalog.upsert(Prescription.of(-2.0, -0.5, 90.0), psf, null);

        Optional<CatalogEntry> hit = catalog.lookup(Prescription.of(-2.0 + 5e-7, -0.5, 90.0));
        assertTrue(hit.isPresent());
        assertSame(psf, hit.get().psf());
        assertFalse(hit.get().hasDerivedAsset());

        assertTrue(catalog.lookup(Prescription.of(-2.001, -0.5, 90.0)).isEmpty());
    }

    @Test
    void lookup_acrossHashGridLine_fallsBackToScan() {
        CaffeinePsfCatalog catalog = new CaffeinePsfCatalog();
        Prescription stored = Prescription.of(-2.004999, 0.0, 0.0);
        Prescription nearby = Prescription.of(-2.005001, 0.0, 0.0);
        assertEquals(stored, nearby);
        assertNotEquals(stored.hashCode(), nearby.hashCode());

        catalog.upsert(stored, Psf.delta(4), null);
        assertTrue(catalog.lookup(nearby).isPresent());
    }

    @Test
    void upsert_replacesEntry() {
        CaffeinePsfCatalog catalog = new CaffeinePsfCatalog();
        Prescription p = Prescription.of(-1.0, 0.0, 0.0);
        RgbaImage asset = RgbaImage.uniform(4, 4, 0.1f, 0.2f, 0.3f, 1f);
        catalog.upsert(p, Psf.delta(4), null);
        catalog.upsert(p, Psf.delta(8), asset);

        CatalogEntry entry = catalog.lookup(p).orElseThrow();
        assertEquals(8, entry.psf().size());
        assertSame(asset, entry.derivedAsset());
        assertEquals(1, catalog.size());

        catalog.invalidate(p);
        assertTrue(catalog.lookup(p).isEmpty());
    }

    @Test
    void catalog_isBounded() {
        CaffeinePsfCatalog catalog = new CaffeinePsfCatalog(2);
        for (int i = 0; i < 10; i++) {
            catalog.upsert(Prescription.of(-0.25 * i, 0.0, 0.0), Psf.delta(4), null);
        }
        assertTrue(catalog.size() <= 2, "size=" + catalog.size());
    }
}
