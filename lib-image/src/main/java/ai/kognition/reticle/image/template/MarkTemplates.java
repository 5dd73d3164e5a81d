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

package ai.kognition.reticle.image.template;

import java.util.ArrayList;
import java.util.List;

import org.opencv.core.CvType;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.CvMat;

/**
 * Rasterizes {@link MarkDescriptor}s into {@code CV_8UC1} templates for the correlation matcher.
 */
public class MarkTemplates {
    private static final Logger LOGGER = LoggerFactory.getLogger(MarkTemplates.class);

    static {
        CvMat.initOpenCv();
    }

    /**
     * <p>
     * Draw the mark. With {@code r} the radius, {@code l} the arm length and {@code w2} the half
     * width, the arms cover (rows x columns, half open, clipped to the raster):
     * </p>
     *
     * <ul>
     * <li>north {@code [r-l, r+w2) x [r-w2, r+w2)}</li>
     * <li>south {@code [r-w2, r+l) x [r-w2, r+w2)}</li>
     * <li>east {@code [r-w2, r+w2) x [r-w2, r+l)}</li>
     * <li>west {@code [r-w2, r+w2) x [r-l, r+w2)}</li>
     * </ul>
     *
     * <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat generate(final MarkDescriptor mark) {
        final int r = mark.radius;
        final int l = mark.armLength;
        final int w2 = mark.halfWidth;
        final int side = 2 * r;

        try(final CvMat ret = new CvMat(side, side, CvType.CV_8UC1, Scalar.all(mark.background));) {
            final Scalar fg = Scalar.all(mark.foreground);
            if(mark.north)
                fill(ret, r - l, r + w2, r - w2, r + w2, fg);
            if(mark.south)
                fill(ret, r - w2, r + l, r - w2, r + w2, fg);
            if(mark.east)
                fill(ret, r - w2, r + w2, r - w2, r + l, fg);
            if(mark.west)
                fill(ret, r - w2, r + w2, r - l, r + w2, fg);
            return ret.returnMe();
        }
    }

    /**
     * One template per descriptor, in order. <b>Note: The caller owns the CvMats returned</b>
     */
    public static List<CvMat> generate(final List<MarkDescriptor> marks) {
        final List<CvMat> ret = new ArrayList<>(marks.size());
        try {
            for(final MarkDescriptor mark: marks)
                ret.add(generate(mark));
        } catch(final RuntimeException rte) {
            ret.forEach(CvMat::close);
            throw rte;
        }
        LOGGER.debug("Generated {} mark templates", ret.size());
        return ret;
    }

    private static void fill(final CvMat raster, final int row0, final int row1, final int col0, final int col1, final Scalar value) {
        final int r0 = Math.max(0, row0);
        final int r1 = Math.min(raster.rows(), row1);
        final int c0 = Math.max(0, col0);
        final int c1 = Math.min(raster.cols(), col1);
        if(r1 <= r0 || c1 <= c0)
            return;
        try(final CvMat arm = CvMat.move(raster.submat(new Rect(c0, r0, c1 - c0, r1 - r0)));) {
            arm.setTo(value);
        }
    }
}
