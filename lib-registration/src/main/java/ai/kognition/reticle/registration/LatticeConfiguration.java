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
import java.util.Collections;
import java.util.List;

import org.opencv.core.Point;

/**
 * <p>
 * The abstract grid the reticle marks sit on. The grid is given by an ordered list of x index
 * values and an ordered list of y index values. Lattice points are numbered row major so point
 * {@code i} is {@code (xs[i % rowWidth], ys[i / rowWidth])} where {@code rowWidth} is the number
 * of x values.
 * </p>
 *
 * <p>
 * The coordinates of a lattice point are the index <em>values</em> (for example {@code -2..2}),
 * not their positions in the lists.
 * </p>
 */
public class LatticeConfiguration {
    private final List<Integer> xs;
    private final List<Integer> ys;

    public LatticeConfiguration(final List<Integer> xs, final List<Integer> ys) {
        if(xs == null || ys == null || xs.isEmpty() || ys.isEmpty())
            throw new ConfigurationException("A lattice needs at least one x and one y index value but was given " + xs + " and " + ys);
        this.xs = Collections.unmodifiableList(new ArrayList<>(xs));
        this.ys = Collections.unmodifiableList(new ArrayList<>(ys));
    }

    public List<Integer> xs() {
        return xs;
    }

    public List<Integer> ys() {
        return ys;
    }

    public int rowWidth() {
        return xs.size();
    }

    public int rowCount() {
        return ys.size();
    }

    public int size() {
        return xs.size() * ys.size();
    }

    /**
     * Position of point {@code i} in its row.
     */
    public int column(final int i) {
        checkIndex(i);
        return i % rowWidth();
    }

    /**
     * Which row point {@code i} is in.
     */
    public int row(final int i) {
        checkIndex(i);
        return i / rowWidth();
    }

    public Point point(final int i) {
        return new Point(xs.get(column(i)), ys.get(row(i)));
    }

    public List<Point> points() {
        final List<Point> ret = new ArrayList<>(size());
        for(int i = 0; i < size(); i++)
            ret.add(point(i));
        return ret;
    }

    private void checkIndex(final int i) {
        if(i < 0 || i >= size())
            throw new IndexOutOfBoundsException("Lattice point " + i + " doesn't exist in a lattice of " + size() + " points.");
    }

    @Override
    public String toString() {
        return "LatticeConfiguration [xs=" + xs + ", ys=" + ys + "]";
    }
}
