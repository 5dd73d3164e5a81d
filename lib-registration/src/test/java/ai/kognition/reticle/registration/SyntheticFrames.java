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

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.geometry.transform.AffineTransform;
import ai.kognition.reticle.image.template.MarkDescriptor;
import ai.kognition.reticle.image.template.MarkTemplates;
import ai.kognition.reticle.registration.config.MissionConfig;
import ai.kognition.reticle.registration.config.MissionKey;

/**
 * Builds frames of dark crosses on a white background laid out on a 5x4 lattice.
 */
public class SyntheticFrames {
    public static final int WIDTH = 520;
    public static final int HEIGHT = 420;

    /**
     * image&lt;-lattice of the reference frame. Marks are 100 pixels apart starting at (60, 60).
     */
    public static final AffineTransform PLACEMENT = AffineTransform.of(100.0, 0.0, 260.0, 0.0, 100.0, 160.0);

    public static final LatticeConfiguration LATTICE = new LatticeConfiguration(List.of(-2, -1, 0, 1, 2), List.of(-1, 0, 1, 2));

    static {
        CvMat.initOpenCv();
    }

    public static MissionConfig config() {
        return new MissionConfig(MissionKey.of(99, "T"), LATTICE, WIDTH, seeds(), Collections.nCopies(LATTICE.size(), MarkDescriptor.FULL_CROSS),
            MarkDescriptor.DEFAULT_RADIUS, 20, new Size(WIDTH, HEIGHT));
    }

    public static List<Point> seeds() {
        return marks(0, 0);
    }

    public static List<Point> marks(final int dx, final int dy) {
        final List<Point> ret = new ArrayList<>();
        for(final Point p: LATTICE.points()) {
            final Point c = PLACEMENT.transform(p);
            ret.add(new Point(c.x + dx, c.y + dy));
        }
        return ret;
    }

    /**
     * A frame with every mark moved by {@code (dx, dy)} from the reference frame.
     * <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat frame(final int dx, final int dy) {
        final int r = MarkDescriptor.DEFAULT_RADIUS;
        try(final CvMat ret = new CvMat(HEIGHT, WIDTH, CvType.CV_8UC1, Scalar.all(255));
            final CvMat template = MarkTemplates.generate(MarkDescriptor.FULL_CROSS);
            final CvMat dark = new CvMat();) {
            Core.bitwise_not(template, dark);
            for(final Point c: marks(dx, dy)) {
                try(final CvMat region = CvMat.move(ret.submat(new Rect((int)c.x - r, (int)c.y - r, 2 * r, 2 * r)));) {
                    Core.min(region, dark, region);
                }
            }
            return ret.returnMe();
        }
    }
}
