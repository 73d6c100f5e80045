/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ForkJoinPool;

/**
 * Pure-Java backend. Power-of-two lines use an iterative radix-2 Cooley-Tukey transform;
 * every other length goes through Bluestein's chirp-z algorithm on a padded power-of-two
 * convolution, so any grid size is accepted.
 *
 * <p>Twiddle tables are computed once per line length and shared between threads.</p>
 */
public final class JavaSpectralTransform extends SeparableSpectralTransform {

    private final ConcurrentMap<Integer, LinePlan> plans = new ConcurrentHashMap<>();

    public JavaSpectralTransform() {
        this(ForkJoinPool.commonPool());
    }

    public JavaSpectralTransform(ForkJoinPool pool) {
        super(pool);
    }

    @Override
    protected void forwardLine(double[] line, int n) {
        planFor(n).transform(line, false);
    }

    @Override
    protected void inverseLine(double[] line, int n) {
        planFor(n).transform(line, true);
        double scale = 1.0 / n;
        for (int i = 0; i < 2 * n; i++) {
            line[i] *= scale;
        }
    }

    private LinePlan planFor(int n) {
        return plans.computeIfAbsent(n, len -> isPowerOfTwo(len) ? new Radix2Plan(len) : new BluesteinPlan(len));
    }

    static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    private interface LinePlan {
        /** Unscaled DFT in place; {@code inverse} selects the e^{+2πi·kn/N} kernel. */
        void transform(double[] line, boolean inverse);
    }

    private static final class Radix2Plan implements LinePlan {
        private final int n;
        private final int[] reversed;
        private final double[] cos;
        private final double[] sin;

        Radix2Plan(int n) {
            this.n = n;
            this.reversed = new int[n];
            int bits = Integer.numberOfTrailingZeros(n);
            for (int i = 0; i < n; i++) {
                reversed[i] = bits == 0 ? 0 : Integer.reverse(i) >>> (32 - bits);
            }
            int half = Math.max(1, n / 2);
            this.cos = new double[half];
            this.sin = new double[half];
            for (int k = 0; k < half; k++) {
                double angle = 2.0 * Math.PI * k / n;
                cos[k] = Math.cos(angle);
                sin[k] = Math.sin(angle);
            }
        }

        @Override
        public void transform(double[] a, boolean inverse) {
            for (int i = 0; i < n; i++) {
                int j = reversed[i];
                if (j > i) {
                    double tr = a[2 * i], ti = a[2 * i + 1];
                    a[2 * i] = a[2 * j];
                    a[2 * i + 1] = a[2 * j + 1];
                    a[2 * j] = tr;
                    a[2 * j + 1] = ti;
                }
            }

            double sign = inverse ? 1.0 : -1.0;
            for (int len = 2; len <= n; len <<= 1) {
                int half = len >>> 1;
                int step = n / len;
                for (int start = 0; start < n; start += len) {
                    for (int k = 0; k < half; k++) {
                        double wr = cos[k * step];
                        double wi = sign * sin[k * step];

                        int u = 2 * (start + k);
                        int v = 2 * (start + k + half);
                        double vr = a[v] * wr - a[v + 1] * wi;
                        double vi = a[v] * wi + a[v + 1] * wr;

                        a[v] = a[u] - vr;
                        a[v + 1] = a[u + 1] - vi;
                        a[u] += vr;
                        a[u + 1] += vi;
                    }
                }
            }
        }
    }

    private static final class BluesteinPlan implements LinePlan {
        private final int n;
        private final int m;
        private final Radix2Plan convolution;
        // chirp e^{-iπk²/n}
        private final double[] chirpRe;
        private final double[] chirpIm;
        // spectra of the conjugate chirp, one per direction
        private final double[] kernelForward;
        private final double[] kernelInverse;

        BluesteinPlan(int n) {
            this.n = n;
            this.m = Integer.highestOneBit(2 * n - 1) << 1;
            this.convolution = new Radix2Plan(m);
            this.chirpRe = new double[n];
            this.chirpIm = new double[n];
            for (int k = 0; k < n; k++) {
                // k² mod 2n keeps the angle small for large k
                long k2 = ((long) k * k) % (2L * n);
                double angle = Math.PI * k2 / n;
                chirpRe[k] = Math.cos(angle);
                chirpIm[k] = -Math.sin(angle);
            }
            this.kernelForward = kernel(false);
            this.kernelInverse = kernel(true);
        }

        private double[] kernel(boolean inverse) {
            double[] b = new double[2 * m];
            for (int k = 0; k < n; k++) {
                double re = chirpRe[k];
                // conj(w) for forward, w for inverse
                double im = inverse ? chirpIm[k] : -chirpIm[k];
                b[2 * k] = re;
                b[2 * k + 1] = im;
                if (k > 0) {
                    b[2 * (m - k)] = re;
                    b[2 * (m - k) + 1] = im;
                }
            }
            convolution.transform(b, false);
            return b;
        }

        @Override
        public void transform(double[] line, boolean inverse) {
            double[] a = new double[2 * m];
            for (int k = 0; k < n; k++) {
                double wr = chirpRe[k];
                double wi = inverse ? -chirpIm[k] : chirpIm[k];
                double xr = line[2 * k], xi = line[2 * k + 1];
                a[2 * k] = xr * wr - xi * wi;
                a[2 * k + 1] = xr * wi + xi * wr;
            }

            convolution.transform(a, false);
            double[] b = inverse ? kernelInverse : kernelForward;
            for (int k = 0; k < m; k++) {
                double ar = a[2 * k], ai = a[2 * k + 1];
                double br = b[2 * k], bi = b[2 * k + 1];
                a[2 * k] = ar * br - ai * bi;
                a[2 * k + 1] = ar * bi + ai * br;
            }
            convolution.transform(a, true);

            double scale = 1.0 / m;
            for (int k = 0; k < n; k++) {
                double wr = chirpRe[k];
                double wi = inverse ? -chirpIm[k] : chirpIm[k];
                double cr = a[2 * k] * scale, ci = a[2 * k + 1] * scale;
                line[2 * k] = cr * wr - ci * wi;
                line[2 * k + 1] = cr * wi + ci * wr;
            }
        }
    }
}
