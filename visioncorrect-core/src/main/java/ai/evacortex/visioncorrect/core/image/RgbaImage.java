/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.image;

import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Immutable RGBA raster with float channels in [0, 1], row-major, origin top-left.
 */
public final class RgbaImage {

    private static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final float[] rgba;

    private RgbaImage(int width, int height, float[] rgba) {
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    /**
     * Copies {@code rgba} (length {@code width·height·4}); values are clamped to [0, 1].
     */
    public static RgbaImage of(int width, int height, float[] rgba) {
        Objects.requireNonNull(rgba, "rgba must not be null");
        requireDimensions(width, height);
        if (rgba.length != width * height * CHANNELS) {
            throw new InvalidInputException("expected " + (width * height * CHANNELS) + " samples, got " + rgba.length);
        }
        float[] copy = new float[rgba.length];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = Luminance.clamp01(rgba[i]);
        }
        return new RgbaImage(width, height, copy);
    }

    public static RgbaImage uniform(int width, int height, float r, float g, float b, float a) {
        requireDimensions(width, height);
        float[] data = new float[width * height * CHANNELS];
        for (int i = 0; i < data.length; i += CHANNELS) {
            data[i] = Luminance.clamp01(r);
            data[i + 1] = Luminance.clamp01(g);
            data[i + 2] = Luminance.clamp01(b);
            data[i + 3] = Luminance.clamp01(a);
        }
        return new RgbaImage(width, height, data);
    }

    /**
     * Opaque gray image from row-major luminance samples.
     */
    public static RgbaImage fromLuminance(int width, int height, float[] luminance) {
        Objects.requireNonNull(luminance, "luminance must not be null");
        requireDimensions(width, height);
        if (luminance.length != width * height) {
            throw new InvalidInputException("expected " + (width * height) + " luminance samples, got " + luminance.length);
        }
        float[] data = new float[width * height * CHANNELS];
        for (int p = 0; p < luminance.length; p++) {
            float v = Luminance.clamp01(luminance[p]);
            data[p * CHANNELS] = v;
            data[p * CHANNELS + 1] = v;
            data[p * CHANNELS + 2] = v;
            data[p * CHANNELS + 3] = 1f;
        }
        return new RgbaImage(width, height, data);
    }

    public static RgbaImage fromBufferedImage(BufferedImage image) {
        if (image == null) {
            throw new InvalidInputException("image must not be null");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        float[] data = new float[w * h * CHANNELS];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                int o = (y * w + x) * CHANNELS;
                data[o] = ((argb >> 16) & 0xFF) / 255f;
                data[o + 1] = ((argb >> 8) & 0xFF) / 255f;
                data[o + 2] = (argb & 0xFF) / 255f;
                data[o + 3] = ((argb >>> 24) & 0xFF) / 255f;
            }
        }
        return new RgbaImage(w, h, data);
    }

    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int o = (y * width + x) * CHANNELS;
                int argb = (toByte(rgba[o + 3]) << 24)
                        | (toByte(rgba[o]) << 16)
                        | (toByte(rgba[o + 1]) << 8)
                        | toByte(rgba[o + 2]);
                out.setRGB(x, y, argb);
            }
        }
        return out;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isSquare() {
        return width == height;
    }

    public float r(int x, int y) {
        return rgba[(y * width + x) * CHANNELS];
    }

    public float g(int x, int y) {
        return rgba[(y * width + x) * CHANNELS + 1];
    }

    public float b(int x, int y) {
        return rgba[(y * width + x) * CHANNELS + 2];
    }

    public float a(int x, int y) {
        return rgba[(y * width + x) * CHANNELS + 3];
    }

    public double luminance(int x, int y) {
        int o = (y * width + x) * CHANNELS;
        return Luminance.of(rgba[o], rgba[o + 1], rgba[o + 2]);
    }

    /**
     * Pixel at {@code (x, y)} with coordinates clamped to the image edges, as {r, g, b, a}.
     */
    public float[] sampleClamped(int x, int y) {
        int cx = Math.max(0, Math.min(width - 1, x));
        int cy = Math.max(0, Math.min(height - 1, y));
        int o = (cy * width + cx) * CHANNELS;
        return new float[]{rgba[o], rgba[o + 1], rgba[o + 2], rgba[o + 3]};
    }

    /**
     * Copy of the raw channel data.
     */
    public float[] toArray() {
        return rgba.clone();
    }

    private static int toByte(float v) {
        return Math.round(Luminance.clamp01(v) * 255f);
    }

    private static void requireDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("image dimensions must be positive: " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "RgbaImage[" + width + "x" + height + "]";
    }
}
