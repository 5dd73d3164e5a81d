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

import java.util.Collections;
import java.util.List;

import org.opencv.core.Point;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.correlate.Offset;
import ai.kognition.reticle.image.geometry.transform.AffineTransform;
import ai.kognition.reticle.nr.AffineFit;

/**
 * The registration of one frame onto the reference frame along with the resampled image.
 * Closing this releases the image.
 */
public class RectifiedFrame implements AutoCloseable {
    public final int frameIndex;

    /**
     * Working resolution pixel location of each mark in this frame, in lattice order.
     */
    public final List<Point> detected;

    /**
     * How far each mark was from its seed.
     */
    public final List<Offset> offsets;

    /**
     * This frame's <em>image&lt;-lattice</em> fit.
     */
    public final AffineFit frameFromLattice;

    /**
     * Working resolution reference frame &lt;- working resolution of this frame.
     */
    public final AffineTransform referenceFromFrame;

    /**
     * Working resolution reference frame &lt;- full resolution of this frame. This is the
     * transform the image was resampled with.
     */
    public final AffineTransform referenceFromFull;

    private final CvMat image;

    RectifiedFrame(final int frameIndex, final List<Point> detected, final List<Offset> offsets, final AffineFit frameFromLattice,
        final AffineTransform referenceFromFrame, final AffineTransform referenceFromFull, final CvMat image) {
        this.frameIndex = frameIndex;
        this.detected = Collections.unmodifiableList(detected);
        this.offsets = Collections.unmodifiableList(offsets);
        this.frameFromLattice = frameFromLattice;
        this.referenceFromFrame = referenceFromFrame;
        this.referenceFromFull = referenceFromFull;
        this.image = image;
    }

    /**
     * The rectified raster. It's owned by this frame and is only valid until the frame is closed.
     */
    public CvMat image() {
        return image;
    }

    @Override
    public void close() {
        image.close();
    }

    @Override
    public String toString() {
        return "RectifiedFrame [frameIndex=" + frameIndex + ", referenceFromFrame=" + referenceFromFrame + ", rms=" + frameFromLattice.rms + "]";
    }
}
