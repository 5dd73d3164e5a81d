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

/**
 * What happened to a single frame.
 */
public class FrameOutcome {
    public final int frameIndex;

    /**
     * Rms residual of the frame's lattice fit. {@code NaN} when the frame failed.
     */
    public final double rms;

    /**
     * Why the frame failed or {@code null} if it didn't.
     */
    public final Exception failure;

    private FrameOutcome(final int frameIndex, final double rms, final Exception failure) {
        this.frameIndex = frameIndex;
        this.rms = rms;
        this.failure = failure;
    }

    public static FrameOutcome succeeded(final int frameIndex, final double rms) {
        return new FrameOutcome(frameIndex, rms, null);
    }

    public static FrameOutcome failed(final int frameIndex, final Exception failure) {
        return new FrameOutcome(frameIndex, Double.NaN, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    @Override
    public String toString() {
        return succeeded() ? ("FrameOutcome [frame " + frameIndex + " succeeded, rms=" + rms + "]")
            : ("FrameOutcome [frame " + frameIndex + " failed: " + failure + "]");
    }
}
