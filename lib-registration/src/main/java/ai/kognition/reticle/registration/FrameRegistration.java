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

import java.util.ArrayList;
import java.util.List;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.correlate.CrossCorrelation;
import ai.kognition.reticle.image.correlate.Offset;
import ai.kognition.reticle.image.geometry.transform.AffineResampler;
import ai.kognition.reticle.image.geometry.transform.AffineTransform;
import ai.kognition.reticle.image.geometry.transform.DegenerateTransformException;
import ai.kognition.reticle.nr.AffineFit;
import ai.kognition.reticle.nr.InsufficientDataException;
import ai.kognition.reticle.registration.config.MissionConfig;
import ai.kognition.reticle.util.Timer;

/**
 * <p>
 * Registers a single frame onto the reference frame:
 * </p>
 *
 * <ol>
 * <li>scale the frame to the working resolution</li>
 * <li>for every mark, cut a window around its seed point, invert it so the dark marks are bright
 * like the templates, and correlate it with the mark's template to find the mark</li>
 * <li>fit this frame's <em>image&lt;-lattice</em></li>
 * <li>compose <em>reference&lt;-lattice</em>, <em>lattice&lt;-frame</em> and
 * <em>working&lt;-full</em> into <em>reference&lt;-full</em></li>
 * <li>resample the full resolution frame with it</li>
 * </ol>
 *
 * <p>
 * Transforms are always composed from the original fits so there's no error accumulated from
 * frame to frame.
 * </p>
 */
public class FrameRegistration {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameRegistration.class);

    static {
        CvMat.initOpenCv();
    }

    /**
     * <b>Note: The caller owns the RectifiedFrame returned</b>
     *
     * @param raw the full resolution, single channel 8-bit frame. It isn't modified.
     * @throws InsufficientDataException if the detected marks can't determine a lattice fit.
     * @throws DegenerateTransformException if this frame's lattice fit isn't invertible.
     */
    public static RectifiedFrame register(final ReferenceCalibration calibration, final int frameIndex, final Mat raw) {
        if(raw.empty() || raw.type() != CvType.CV_8UC1)
            throw new IllegalArgumentException("Frame " + frameIndex + " should be a non-empty single channel 8-bit image but was "
                + (raw.empty() ? "empty" : CvType.typeToString(raw.type())));

        final Timer timer = Timer.started();
        final MissionConfig config = calibration.config;
        final List<Point> seeds = calibration.seeds();
        final AffineTransform workingFromFull = AffineResampler.scaleToWidth(raw.size(), config.workingWidth);

        final List<Point> detected = new ArrayList<>(seeds.size());
        final List<Offset> offsets = new ArrayList<>(seeds.size());
        try(final CvMat working = AffineResampler.transform(raw, workingFromFull, AffineResampler.scaledSize(raw.size(), config.workingWidth));) {
            for(int i = 0; i < seeds.size(); i++) {
                final Point seed = seeds.get(i);
                try(final CvMat window = AffineResampler.window(working, seed, config.windowRadius);
                    final CvMat inverted = new CvMat();) {
                    Core.bitwise_not(window, inverted);
                    final Offset offset = CrossCorrelation.offset(inverted, calibration.template(i), config.searchRadius);
                    offsets.add(offset);
                    detected.add(new Point(seed.x + offset.dx, seed.y + offset.dy));
                }
            }
        }
        if(LOGGER.isTraceEnabled())
            LOGGER.trace("frame {}: mark offsets {}", frameIndex, offsets);

        final AffineFit frameFromLattice = LatticeCalibration.fit(config.lattice, detected);
        final AffineTransform latticeFromFrame = frameFromLattice.transform.inverse();
        final AffineTransform referenceFromFrame = calibration.referenceFromLattice.transform.mm(latticeFromFrame);
        final AffineTransform referenceFromFull = referenceFromFrame.mm(workingFromFull);

        final CvMat rectified = AffineResampler.transform(raw, referenceFromFull, config.outputSize);
        LOGGER.debug("frame {}: registered in {} seconds with an rms residual of {}", frameIndex, timer.stop(),
            String.format("%.3f", frameFromLattice.rms));
        return new RectifiedFrame(frameIndex, detected, offsets, frameFromLattice, referenceFromFrame, referenceFromFull, rectified);
    }
}
