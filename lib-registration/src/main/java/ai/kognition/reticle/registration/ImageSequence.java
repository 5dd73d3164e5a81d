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
import java.util.List;

import ai.kognition.reticle.image.CvMat;

/**
 * An ordered sequence of frames. The first index is the reference frame.
 */
public interface ImageSequence {

    /**
     * The frames in sequence order.
     */
    List<Integer> frameIndices();

    /**
     * Load the full resolution, single channel 8-bit raster of a frame. May be called
     * concurrently for different frames. <b>Note: The caller owns the CvMat returned</b>
     */
    CvMat load(int frameIndex) throws IOException;
}
