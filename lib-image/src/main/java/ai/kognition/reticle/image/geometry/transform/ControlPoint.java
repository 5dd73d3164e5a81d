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

package ai.kognition.reticle.image.geometry.transform;

import org.opencv.core.Point;

/**
 * A correspondence between a point in one frame ({@code from}) and where it's observed in
 * another ({@code to}). A transform fit to a set of these maps to&lt;-from.
 */
public class ControlPoint {
    public final Point from;
    public final Point to;

    public ControlPoint(final Point from, final Point to) {
        if(from == null || to == null)
            throw new NullPointerException("Cannot create a " + ControlPoint.class.getSimpleName() + " with a null point.");
        this.from = from;
        this.to = to;
    }

    /**
     * Distance between where {@code transform} puts {@link #from} and {@link #to}.
     */
    public double residual(final Transform2D transform) {
        final Point mapped = transform.transform(from);
        return Math.hypot(mapped.x - to.x, mapped.y - to.y);
    }

    @Override
    public String toString() {
        return "ControlPoint [from=" + from + ", to=" + to + "]";
    }
}
