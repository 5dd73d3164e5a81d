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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Point;

/**
 * An ordered, immutable set of {@link ControlPoint}s.
 */
public class ControlPoints {
    public final List<ControlPoint> controlPoints;

    public ControlPoints(final List<ControlPoint> controlPoints) {
        if(controlPoints == null)
            throw new NullPointerException("Cannot create " + ControlPoints.class.getSimpleName() + " from a null list.");
        if(controlPoints.stream().anyMatch(p -> p == null))
            throw new NullPointerException("Cannot create " + ControlPoints.class.getSimpleName() + " containing a null control point.");
        this.controlPoints = Collections.unmodifiableList(new ArrayList<>(controlPoints));
    }

    /**
     * Pair up {@code from.get(i)} with {@code to.get(i)}. The lists must be the same length.
     */
    public static ControlPoints pair(final List<Point> from, final List<Point> to) {
        if(from.size() != to.size())
            throw new IllegalArgumentException("Cannot pair " + from.size() + " points with " + to.size() + " points.");
        final List<ControlPoint> ret = new ArrayList<>(from.size());
        for(int i = 0; i < from.size(); i++)
            ret.add(new ControlPoint(from.get(i), to.get(i)));
        return new ControlPoints(ret);
    }

    public int size() {
        return controlPoints.size();
    }

    public ControlPoint get(final int index) {
        return controlPoints.get(index);
    }

    @Override
    public String toString() {
        return "ControlPoints " + controlPoints;
    }
}
