/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.optics;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;

import java.util.Locale;

/**
 * Refraction of one eye plus the distance the display is viewed from.
 *
 * <p>Equality is approximate on every field ({@link #TOLERANCE}), since prescriptions come out
 * of sliders and float configuration and are used as catalog keys. {@link #hashCode()} hashes
 * fields rounded to a coarser grid ({@link #HASH_QUANTUM}); two equal prescriptions that
 * straddle a rounding boundary can hash differently, so hash-based lookups need an
 * approximate fallback (see {@code CaffeinePsfCatalog}).</p>
 *
 * @param sphere          spherical error in diopters, negative for myopia
 * @param cylinder        cylindrical error in diopters
 * @param axis            cylinder axis in degrees, 0..180
 * @param pupilRadius     pupil radius in millimeters
 * @param viewingDistance virtual screen distance in meters
 */
public record Prescription(double sphere,
                           double cylinder,
                           double axis,
                           double pupilRadius,
                           double viewingDistance) {

    public static final double DEFAULT_PUPIL_RADIUS = 2.5;   // mm, typical indoors
    public static final double HMD_VIEWING_DISTANCE = 1.25;  // m, Quest 3 focal plane
    public static final double TOLERANCE = 1e-5;
    static final double HASH_QUANTUM = 1e-2;

    public Prescription {
        requireFinite("sphere", sphere);
        requireFinite("cylinder", cylinder);
        requireFinite("axis", axis);
        requireFinite("pupilRadius", pupilRadius);
        requireFinite("viewingDistance", viewingDistance);
        if (pupilRadius <= 0.0) {
            throw new InvalidInputException("pupilRadius must be positive: " + pupilRadius);
        }
        if (viewingDistance <= 0.0) {
            throw new InvalidInputException("viewingDistance must be positive: " + viewingDistance);
        }
    }

    public static Prescription of(double sphere, double cylinder, double axis) {
        return new Prescription(sphere, cylinder, axis, DEFAULT_PUPIL_RADIUS, HMD_VIEWING_DISTANCE);
    }

    public static Prescription emmetropic() {
        return of(0.0, 0.0, 0.0);
    }

    public Prescription withViewingDistance(double distance) {
        return new Prescription(sphere, cylinder, axis, pupilRadius, distance);
    }

    public Prescription withPupilRadius(double radius) {
        return new Prescription(sphere, cylinder, axis, radius, viewingDistance);
    }

    public boolean approximatelyEquals(Prescription other, double tolerance) {
        if (other == null) return false;
        return close(sphere, other.sphere, tolerance)
                && close(cylinder, other.cylinder, tolerance)
                && close(axis, other.axis, tolerance)
                && close(pupilRadius, other.pupilRadius, tolerance)
                && close(viewingDistance, other.viewingDistance, tolerance);
    }

    /**
     * Filesystem-safe key, two decimals per field: {@code Sm2p00_C0p50_A90_R2p50_D1p25}.
     */
    public String fileKey() {
        return "S" + sanitize(String.format(Locale.ROOT, "%.2f", sphere))
                + "_C" + sanitize(String.format(Locale.ROOT, "%.2f", cylinder))
                + "_A" + sanitize(String.format(Locale.ROOT, "%.0f", axis))
                + "_R" + sanitize(String.format(Locale.ROOT, "%.2f", pupilRadius))
                + "_D" + sanitize(String.format(Locale.ROOT, "%.2f", viewingDistance));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Prescription)) return false;
        return approximatelyEquals((Prescription) obj, TOLERANCE);
    }

    @Override
    public int hashCode() {
        long h = 17;
        h = h * 31 + quantize(sphere);
        h = h * 31 + quantize(cylinder);
        h = h * 31 + quantize(axis);
        h = h * 31 + quantize(pupilRadius);
        h = h * 31 + quantize(viewingDistance);
        return Long.hashCode(h);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Rx[S=%.2f C=%.2f A=%.0f R=%.2fmm d=%.2fm]",
                sphere, cylinder, axis, pupilRadius, viewingDistance);
    }

    private static long quantize(double v) {
        return Math.round(v / HASH_QUANTUM);
    }

    private static boolean close(double a, double b, double tolerance) {
        return Math.abs(a - b) <= tolerance;
    }

    private static String sanitize(String value) {
        return value.replace("-", "m").replace(".", "p");
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field + " must be finite: " + value);
        }
    }
}
