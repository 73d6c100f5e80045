/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.engine;

import ai.evacortex.visioncorrect.core.math.ComplexGrid;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

/**
 * Row/column driver shared by the transform backends. Subclasses only supply the 1D transform
 * of one interleaved line; this class runs the row pass, waits for it, then runs the column pass.
 *
 * <p>Grids at least {@link #PARALLEL_MIN_SIZE} wide split each pass across the pool; smaller
 * grids run on the calling thread.</p>
 */
public abstract class SeparableSpectralTransform implements SpectralTransform {

    static final int PARALLEL_MIN_SIZE =
            Integer.getInteger("visioncorrect.fft.parallelMinSize", 64);
    private static final int LINES_PER_TASK = 8;

    private final ForkJoinPool pool;

    protected SeparableSpectralTransform(ForkJoinPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    /**
     * Unscaled forward DFT of one line of {@code n} interleaved complex values.
     */
    protected abstract void forwardLine(double[] line, int n);

    /**
     * Inverse DFT of one line, including the {@code 1/n} scaling.
     */
    protected abstract void inverseLine(double[] line, int n);

    @Override
    public final ComplexGrid forward(ComplexGrid grid) {
        return transform(grid, false);
    }

    @Override
    public final ComplexGrid inverse(ComplexGrid grid) {
        return transform(grid, true);
    }

    private ComplexGrid transform(ComplexGrid grid, boolean inverse) {
        if (grid == null) {
            throw new NullPointerException("grid must not be null");
        }
        int n = grid.size();
        runPass(new LinePass(grid, Axis.ROWS, inverse, 0, n));
        // rows must be complete here: every column reads one value from each row
        runPass(new LinePass(grid, Axis.COLUMNS, inverse, 0, n));
        return grid;
    }

    private void runPass(LinePass pass) {
        if (pass.grid.size() >= PARALLEL_MIN_SIZE) {
            pool.invoke(pass);
        } else {
            pass.compute();
        }
    }

    private enum Axis { ROWS, COLUMNS }

    private final class LinePass extends RecursiveAction {
        private final ComplexGrid grid;
        private final Axis axis;
        private final boolean inverse;
        private final int from;
        private final int to;

        LinePass(ComplexGrid grid, Axis axis, boolean inverse, int from, int to) {
            this.grid = grid;
            this.axis = axis;
            this.inverse = inverse;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from <= LINES_PER_TASK || grid.size() < PARALLEL_MIN_SIZE) {
                transformLines();
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new LinePass(grid, axis, inverse, from, mid),
                      new LinePass(grid, axis, inverse, mid, to));
        }

        private void transformLines() {
            int n = grid.size();
            double[] line = new double[2 * n];
            for (int i = from; i < to; i++) {
                if (axis == Axis.ROWS) {
                    grid.readRow(i, line);
                } else {
                    grid.readColumn(i, line);
                }

                if (inverse) {
                    inverseLine(line, n);
                } else {
                    forwardLine(line, n);
                }

                if (axis == Axis.ROWS) {
                    grid.writeRow(i, line);
                } else {
                    grid.writeColumn(i, line);
                }
            }
        }
    }
}
