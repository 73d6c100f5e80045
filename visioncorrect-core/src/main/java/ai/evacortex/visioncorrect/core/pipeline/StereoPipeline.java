/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.pipeline;

import ai.evacortex.visioncorrect.core.catalog.CaffeinePsfCatalog;
import ai.evacortex.visioncorrect.core.catalog.PsfCatalog;
import ai.evacortex.visioncorrect.core.config.AberrationConfig;
import ai.evacortex.visioncorrect.core.engine.JavaSpectralTransform;
import ai.evacortex.visioncorrect.core.engine.SpectralTransform;
import ai.evacortex.visioncorrect.core.exceptions.InvalidInputException;
import ai.evacortex.visioncorrect.core.exceptions.PipelineException;
import ai.evacortex.visioncorrect.core.image.RgbaImage;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the OD and OS chains side by side. The two chains share only the catalog.
 */
public class StereoPipeline implements Closeable {

    private final SpectralTransform transform;
    private final PsfCatalog catalog;
    private final ExecutorService executor;

    public StereoPipeline() {
        this(new JavaSpectralTransform(), new CaffeinePsfCatalog());
    }

    public StereoPipeline(SpectralTransform transform, PsfCatalog catalog) {
        this(transform, catalog, Executors.newWorkStealingPool());
    }

    /**
     * @param executor runs the two eye tasks; shut down by {@link #close()}
     */
    public StereoPipeline(SpectralTransform transform, PsfCatalog catalog, ExecutorService executor) {
        this.transform = Objects.requireNonNull(transform, "transform must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public PsfCatalog catalog() {
        return catalog;
    }

    public StereoResult run(AberrationConfig config, RgbaImage image) {
        if (config == null) {
            throw new InvalidInputException("config must not be null");
        }
        if (image == null) {
            throw new InvalidInputException("image must not be null");
        }
        EyePipeline pipeline = new EyePipeline(transform, catalog, config.settings());

        Future<EyePipelineResult> od = executor.submit(() -> pipeline.run(Eye.OD, config.od(), image));
        Future<EyePipelineResult> os = executor.submit(() -> pipeline.run(Eye.OS, config.os(), image));
        return new StereoResult(await(Eye.OD, od, os), await(Eye.OS, os, od));
    }

    // a failed eye cancels its sibling
    private static EyePipelineResult await(Eye eye, Future<EyePipelineResult> future, Future<?> sibling) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            sibling.cancel(true);
            throw new PipelineException(eye, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            sibling.cancel(true);
            throw new PipelineException(eye, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
