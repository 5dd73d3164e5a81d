/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.reticle.registration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.geometry.transform.DegenerateTransformException;
import ai.kognition.reticle.nr.InsufficientDataException;
import ai.kognition.reticle.registration.config.MissionConfig;
import ai.kognition.reticle.registration.config.SeedPointProvider;
import ai.kognition.reticle.util.Timer;

/**
 * <p>
 * Registers every frame of an {@link ImageSequence} onto its first frame. The reference frame is
 * calibrated first, on the calling thread, and then every frame (the reference frame included)
 * is registered on a fixed pool of worker threads. Rectified frames are passed to a
 * {@link RectifiedFrameHandler} as they complete.
 * </p>
 *
 * <p>
 * If the calling thread is interrupted the remaining frames are abandoned and the pipeline is
 * shut down. {@link #run} doesn't return until frames already being registered have stopped.
 * </p>
 *
 * <p>
 * A frame whose marks can't be fit, whose fit can't be inverted, or that can't be loaded or
 * handled is logged and reported as failed without affecting the other frames. Problems
 * calibrating the reference frame abort the run.
 * </p>
 */
public class RegistrationPipeline implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistrationPipeline.class);

    private static final AtomicLong threadSequence = new AtomicLong(0);

    private final MissionConfig config;
    private final SeedPointProvider seedProvider;
    private final ExecutorService executor;

    public RegistrationPipeline(final MissionConfig config, final SeedPointProvider seedProvider) {
        this(config, seedProvider, Runtime.getRuntime().availableProcessors());
    }

    public RegistrationPipeline(final MissionConfig config, final SeedPointProvider seedProvider, final int threads) {
        if(threads < 1)
            throw new IllegalArgumentException("A " + RegistrationPipeline.class.getSimpleName() + " needs at least one thread but was given "
                + threads);
        this.config = config;
        this.seedProvider = seedProvider;
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            final Thread ret = new Thread(r, nextThreadName());
            ret.setDaemon(true);
            return ret;
        });
    }

    /**
     * @throws IOException if the reference frame can't be loaded.
     * @throws ConfigurationException if the mission configuration doesn't fit the seeds.
     * @throws InsufficientDataException if the seeds can't determine the reference lattice fit.
     */
    public SequenceReport run(final ImageSequence sequence, final RectifiedFrameHandler handler) throws IOException {
        final List<Integer> indices = sequence.frameIndices();
        if(indices.isEmpty()) {
            LOGGER.warn("{}: there are no frames to register", config.key);
            return new SequenceReport(List.of());
        }

        final Timer timer = Timer.started();
        final int referenceIndex = indices.get(0);
        LOGGER.info("{}: registering {} frames onto frame {}", config.key, indices.size(), referenceIndex);

        try(final CvMat referenceRaw = sequence.load(referenceIndex);
            final ReferenceCalibration calibration = ReferenceCalibration.calibrate(config, referenceRaw, seedProvider);) {

            final List<Future<FrameOutcome>> futures = new ArrayList<>(indices.size());
            for(final int index: indices)
                futures.add(executor.submit(() -> registerFrame(calibration, sequence, handler, index)));

            // every task has to finish before the calibration is closed
            final List<FrameOutcome> outcomes = new ArrayList<>(indices.size());
            RuntimeException unexpected = null;
            for(int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch(final InterruptedException ie) {
                    futures.forEach(f -> f.cancel(true));
                    // running tasks still read the calibration's templates
                    executor.shutdownNow();
                    awaitWorkers();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while registering " + config.key, ie);
                } catch(final ExecutionException ee) {
                    final Throwable cause = ee.getCause();
                    LOGGER.error("{}: frame {} failed unexpectedly", config.key, indices.get(i), cause);
                    if(unexpected == null)
                        unexpected = (cause instanceof RuntimeException) ? (RuntimeException)cause
                            : new IllegalStateException("Frame " + indices.get(i) + " failed", cause);
                }
            }
            if(unexpected != null)
                throw unexpected;

            final SequenceReport ret = new SequenceReport(outcomes);
            LOGGER.info("{}: {} in {} seconds", config.key, ret, timer.stop());
            return ret;
        }
    }

    private FrameOutcome registerFrame(final ReferenceCalibration calibration, final ImageSequence sequence,
        final RectifiedFrameHandler handler, final int index) {
        try(final CvMat raw = sequence.load(index);
            final RectifiedFrame frame = FrameRegistration.register(calibration, index, raw);) {
            handler.handle(frame);
            return FrameOutcome.succeeded(index, frame.frameFromLattice.rms);
        } catch(final DegenerateTransformException | InsufficientDataException | IOException e) {
            LOGGER.error("{}: failed to register frame {}: {}", config.key, index, e.getMessage(), e);
            return FrameOutcome.failed(index, e);
        }
    }

    private void awaitWorkers() {
        boolean stopped = false;
        while(!stopped) {
            try {
                stopped = executor.awaitTermination(1, TimeUnit.SECONDS);
                if(!stopped)
                    LOGGER.info("{}: waiting for the frame registrations in progress to stop", config.key);
            } catch(final InterruptedException ie) {
                LOGGER.debug("{}: interrupted again while waiting for the frame registrations to stop", config.key);
            }
        }
    }

    private static String nextThreadName() {
        return RegistrationPipeline.class.getSimpleName() + "-thread-" + threadSequence.getAndIncrement();
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
