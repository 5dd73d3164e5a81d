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

package ai.kognition.reticle.registration.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Point;
import org.opencv.core.Size;

import ai.kognition.reticle.image.template.MarkDescriptor;
import ai.kognition.reticle.registration.ConfigurationException;
import ai.kognition.reticle.registration.LatticeConfiguration;

/**
 * Everything needed to register the frames of one (mission, channel). Instances are immutable and
 * validated on construction so they can be shared by concurrent frame registrations.
 */
public class MissionConfig {
    public static final int DEFAULT_WORKING_WIDTH = 1150;
    public static final int DEFAULT_WINDOW_RADIUS = 50;
    public static final int DEFAULT_SEARCH_RADIUS = 20;
    public static final int DEFAULT_OUTPUT_WIDTH = 1150;
    public static final int DEFAULT_OUTPUT_HEIGHT = 1150;

    public final MissionKey key;
    public final LatticeConfiguration lattice;
    public final int workingWidth;
    public final int windowRadius;
    public final int searchRadius;
    public final Size outputSize;
    private final List<Point> seeds;
    private final List<MarkDescriptor> marks;

    /**
     * @param seeds working resolution pixel coordinates of each lattice point in the reference
     *     frame, in lattice order. May be empty when the seeds come from somewhere else.
     * @param marks one descriptor per lattice point, in lattice order. Their radius must be
     *     {@code windowRadius} so the templates are the size of the sampled windows.
     * @throws ConfigurationException if the pieces are inconsistent.
     */
    public MissionConfig(final MissionKey key, final LatticeConfiguration lattice, final int workingWidth, final List<Point> seeds,
        final List<MarkDescriptor> marks, final int windowRadius, final int searchRadius, final Size outputSize) {
        this.key = key;
        this.lattice = lattice;
        this.workingWidth = workingWidth;
        this.seeds = Collections.unmodifiableList(new ArrayList<>(seeds));
        this.marks = Collections.unmodifiableList(new ArrayList<>(marks));
        this.windowRadius = windowRadius;
        this.searchRadius = searchRadius;
        this.outputSize = outputSize;

        if(workingWidth <= 0)
            throw new ConfigurationException(key + ": the working width must be positive but was " + workingWidth);
        if(windowRadius <= 0 || searchRadius <= 0)
            throw new ConfigurationException(key + ": the window and search radii must be positive but were " + windowRadius + " and "
                + searchRadius);
        if(outputSize.width < 1 || outputSize.height < 1)
            throw new ConfigurationException(key + ": invalid output size " + outputSize);
        if(!this.seeds.isEmpty() && this.seeds.size() != lattice.size())
            throw new ConfigurationException(key + ": there are " + this.seeds.size() + " seeds for " + lattice.size() + " lattice points.");
        if(this.marks.size() != lattice.size())
            throw new ConfigurationException(key + ": there are " + this.marks.size() + " mark descriptors for " + lattice.size()
                + " lattice points.");
        for(final MarkDescriptor m: this.marks) {
            if(m.radius != windowRadius)
                throw new ConfigurationException(key + ": the mark " + m + " doesn't match the window radius " + windowRadius);
        }
    }

    /**
     * The configured seed points, empty if none are configured.
     */
    public List<Point> seeds() {
        return seeds;
    }

    public List<MarkDescriptor> marks() {
        return marks;
    }

    @Override
    public String toString() {
        return "MissionConfig [key=" + key + ", lattice=" + lattice + ", workingWidth=" + workingWidth + ", windowRadius=" + windowRadius
            + ", searchRadius=" + searchRadius + ", outputSize=" + outputSize + ", seeds=" + seeds.size() + "]";
    }
}
