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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;

import ai.kognition.reticle.image.CvMat;

public class MarkTemplatesTest {
    static {
        CvMat.initOpenCv();
    }

    @Test
    public void testFullCrossGeometry() {
        try(final CvMat t = MarkTemplates.generate(MarkDescriptor.FULL_CROSS);) {
            assertEquals(100, t.rows());
            assertEquals(100, t.cols());
            assertEquals(CvType.CV_8UC1, t.type());

            assertEquals(255.0, t.get(50, 50)[0], 0.0);
            // north arm starts at r - l
            assertEquals(255.0, t.get(20, 50)[0], 0.0);
            assertEquals(0.0, t.get(19, 50)[0], 0.0);
            // south arm ends before r + l
            assertEquals(255.0, t.get(79, 50)[0], 0.0);
            assertEquals(0.0, t.get(80, 50)[0], 0.0);
            // east and west
            assertEquals(255.0, t.get(50, 79)[0], 0.0);
            assertEquals(0.0, t.get(50, 80)[0], 0.0);
            assertEquals(255.0, t.get(50, 20)[0], 0.0);
            assertEquals(0.0, t.get(50, 19)[0], 0.0);
            // arm width is 2 * halfWidth
            assertEquals(255.0, t.get(30, 48)[0], 0.0);
            assertEquals(255.0, t.get(30, 51)[0], 0.0);
            assertEquals(0.0, t.get(30, 47)[0], 0.0);
            assertEquals(0.0, t.get(30, 52)[0], 0.0);

            assertEquals(0.0, t.get(0, 0)[0], 0.0);
            assertEquals(464, Core.countNonZero(t));
        }
    }

    @Test
    public void testPartialMark() {
        final MarkDescriptor ne = MarkDescriptor.parse("NE", MarkDescriptor.FULL_CROSS);
        try(final CvMat t = MarkTemplates.generate(ne);) {
            assertEquals(255.0, t.get(25, 50)[0], 0.0);
            assertEquals(255.0, t.get(50, 75)[0], 0.0);
            assertEquals(0.0, t.get(75, 50)[0], 0.0);
            assertEquals(0.0, t.get(50, 25)[0], 0.0);
        }
    }

    @Test
    public void testArmsAreClipped() {
        final MarkDescriptor longArms = MarkDescriptor.FULL_CROSS.withArmLength(60);
        try(final CvMat t = MarkTemplates.generate(longArms);) {
            assertEquals(255.0, t.get(0, 50)[0], 0.0);
            assertEquals(255.0, t.get(99, 50)[0], 0.0);
            assertEquals(255.0, t.get(50, 0)[0], 0.0);
            assertEquals(255.0, t.get(50, 99)[0], 0.0);
        }
    }

    @Test
    public void testColors() {
        final MarkDescriptor inverted = MarkDescriptor.FULL_CROSS.withColors(255, 0).withRadius(20).withArmLength(10);
        try(final CvMat t = MarkTemplates.generate(inverted);) {
            assertEquals(40, t.rows());
            assertEquals(0.0, t.get(20, 20)[0], 0.0);
            assertEquals(255.0, t.get(0, 0)[0], 0.0);
        }
    }

    @Test
    public void testDeterministic() {
        final List<MarkDescriptor> marks = List.of(MarkDescriptor.FULL_CROSS, MarkDescriptor.FULL_CROSS);
        final List<CvMat> templates = MarkTemplates.generate(marks);
        try(final CvMat first = templates.get(0);
            final CvMat second = templates.get(1);
            final CvMat diff = new CvMat();) {
            assertFalse(first == second);
            Core.absdiff(first, second, diff);
            assertEquals(0, Core.countNonZero(diff));
        }
    }

    @Test
    public void testDescriptorParsing() {
        final MarkDescriptor d = MarkDescriptor.parse("sew:50", MarkDescriptor.FULL_CROSS);
        assertFalse(d.north);
        assertTrue(d.south);
        assertTrue(d.east);
        assertTrue(d.west);
        assertEquals(50, d.armLength);
        assertEquals(MarkDescriptor.DEFAULT_RADIUS, d.radius);
        assertEquals("SEW:50", d.toCompactString());
        assertEquals(d, MarkDescriptor.parse(d.toCompactString(), MarkDescriptor.FULL_CROSS));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadDescriptor() {
        MarkDescriptor.parse("NX", MarkDescriptor.FULL_CROSS);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadArmLength() {
        MarkDescriptor.parse("NS:long", MarkDescriptor.FULL_CROSS);
    }

    @Test
    public void testForLatticePosition() {
        final MarkDescriptor topLeft = MarkDescriptor.forLatticePosition(0, 0, 5, 4, MarkDescriptor.FULL_CROSS);
        assertEquals("SE:30", topLeft.toCompactString());
        final MarkDescriptor inside = MarkDescriptor.forLatticePosition(2, 1, 5, 4, MarkDescriptor.FULL_CROSS);
        assertEquals("NSEW:30", inside.toCompactString());
        final MarkDescriptor bottomRight = MarkDescriptor.forLatticePosition(4, 3, 5, 4, MarkDescriptor.FULL_CROSS);
        assertEquals("NW:30", bottomRight.toCompactString());
    }
}
