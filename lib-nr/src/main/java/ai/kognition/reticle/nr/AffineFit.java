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

package ai.kognition.reticle.nr;

import java.util.Arrays;

import ai.kognition.reticle.image.geometry.transform.AffineTransform;

/**
 * The result of fitting an {@link AffineTransform} to a set of control points: the transform and
 * how far each control point lands from where it was observed.
 */
public class AffineFit {
    public final AffineTransform transform;
    private final double[] residuals;
    public final double rms;

    AffineFit(final AffineTransform transform, final double[] residuals) {
        this.transform = transform;
        this.residuals = residuals;
        double sumSq = 0.0;
        for(final double r: residuals)
            sumSq += r * r;
        rms = residuals.length == 0 ? 0.0 : Math.sqrt(sumSq / residuals.length);
    }

    /**
     * Euclidean distance, in the target frame, between the transformed control point and the
     * observed one. One per control point, in order.
     */
    public double[] residuals() {
        return Arrays.copyOf(residuals, residuals.length);
    }

    public double maxResidual() {
        return Arrays.stream(residuals).max().orElse(0.0);
    }

    @Override
    public String toString() {
        return "AffineFit [transform=" + transform + ", rms=" + rms + "]";
    }
}
