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

package ai.kognition.reticle.image.correlate;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Scalar;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.geometry.transform.AffineResampler;
import ai.kognition.reticle.image.geometry.transform.AffineTransform;
import ai.kognition.reticle.image.template.MarkDescriptor;
import ai.kognition.reticle.image.template.MarkTemplates;

public class CrossCorrelationTest {
    static {
        CvMat.initOpenCv();
    }

    @Test
    public void testAlignedTemplate() {
        try(final CvMat template = MarkTemplates.generate(MarkDescriptor.FULL_CROSS);) {
            assertEquals(Offset.ZERO, CrossCorrelation.offset(template, template, 20));
        }
    }

    @Test
    public void testRecoversShift() {
        try(final CvMat template = MarkTemplates.generate(MarkDescriptor.FULL_CROSS);
            // content moves 5 left and 7 down
            final CvMat shifted = AffineResampler.transform(template, AffineTransform.translation(-5.0, 7.0));) {
            assertEquals(new Offset(7, -5), CrossCorrelation.offset(shifted, template, 20));
        }
    }

    @Test
    public void testRecoversShiftOfCornerMark() {
        final MarkDescriptor corner = MarkDescriptor.parse("SE", MarkDescriptor.FULL_CROSS);
        try(final CvMat template = MarkTemplates.generate(corner);
            final CvMat shifted = AffineResampler.transform(template, AffineTransform.translation(3.0, -4.0));) {
            assertEquals(new Offset(-4, 3), CrossCorrelation.offset(shifted, template, 20));
        }
    }

    @Test
    public void testRecoversRolledShifts() {
        final int[][] shifts = {{19,-19},{-12,3},{0,15},{-20,0}};
        try(final CvMat template = MarkTemplates.generate(MarkDescriptor.FULL_CROSS);) {
            for(final int[] shift: shifts) {
                try(final CvMat rolled = roll(template, shift[0], shift[1]);) {
                    final Offset found = CrossCorrelation.offset(rolled, template, 20);
                    assertEquals("dy for " + shift[0] + "," + shift[1], shift[0], found.dy, 1.0);
                    assertEquals("dx for " + shift[0] + "," + shift[1], shift[1], found.dx, 1.0);
                }
            }
        }
    }

    @Test
    public void testSurfaceShape() {
        try(final CvMat template = MarkTemplates.generate(MarkDescriptor.FULL_CROSS.withRadius(25).withArmLength(15));
            final CvMat surface = CrossCorrelation.surface(template, template);) {
            assertEquals(50, surface.rows());
            assertEquals(50, surface.cols());
            assertEquals(CvType.CV_64FC1, surface.type());
        }
    }

    @Test
    public void testSearchRadiusBoundsThePeak() {
        try(final CvMat surface = new CvMat(20, 20, CvType.CV_64FC1, Scalar.all(0));) {
            surface.put(2, 2, 5.0);
            surface.put(12, 13, 3.0);
            // center is (10, 10), rows and columns [5, 15) are searched
            assertEquals(new Offset(2, 3), CrossCorrelation.offset(surface, 5));
            assertEquals(new Offset(-8, -8), CrossCorrelation.offset(surface, 10));
        }
    }

    @Test
    public void testTiesGoToFirstInRasterOrder() {
        try(final CvMat surface = new CvMat(10, 10, CvType.CV_64FC1, Scalar.all(0));) {
            surface.put(6, 3, 1.0);
            surface.put(3, 6, 1.0);
            assertEquals(new Offset(-2, 1), CrossCorrelation.offset(surface, 5));
        }
        try(final CvMat flat = new CvMat(10, 10, CvType.CV_64FC1, Scalar.all(4));) {
            assertEquals(new Offset(-3, -3), CrossCorrelation.offset(flat, 3));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSizeMismatch() {
        try(final CvMat a = new CvMat(10, 10, CvType.CV_8UC1, Scalar.all(0));
            final CvMat b = new CvMat(10, 12, CvType.CV_8UC1, Scalar.all(0));) {
            CrossCorrelation.surface(a, b);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmpty() {
        try(final CvMat a = new CvMat();
            final CvMat b = new CvMat();) {
            CrossCorrelation.surface(a, b);
        }
    }

    // circular shift, content at (r, c) moves to ((r + dy) mod rows, (c + dx) mod cols)
    private static CvMat roll(final CvMat src, final int dy, final int dx) {
        final int rows = src.rows();
        final int cols = src.cols();
        final byte[] in = new byte[rows * cols];
        src.get(0, 0, in);
        final byte[] out = new byte[rows * cols];
        for(int r = 0; r < rows; r++) {
            final int tr = Math.floorMod(r + dy, rows);
            for(int c = 0; c < cols; c++)
                out[tr * cols + Math.floorMod(c + dx, cols)] = in[r * cols + c];
        }
        try(final CvMat ret = new CvMat(rows, cols, src.type(), Scalar.all(0));) {
            ret.put(0, 0, out);
            return ret.returnMe();
        }
    }
}
