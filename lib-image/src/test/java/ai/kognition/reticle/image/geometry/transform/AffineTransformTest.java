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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.opencv.core.Point;

import ai.kognition.reticle.image.CvMat;

public class AffineTransformTest {
    private static final double EPSILON = 1e-9;

    private static final AffineTransform A = AffineTransform.of(1.2, 0.1, 5.0, -0.2, 0.9, -3.0);
    private static final AffineTransform B = AffineTransform.rotation(0.3).mm(AffineTransform.scale(2.0, 0.5));
    private static final AffineTransform C = AffineTransform.translation(-7.5, 12.25);

    @Test
    public void testCompositionIsAssociative() {
        final AffineTransform left = A.mm(B).mm(C);
        final AffineTransform right = A.mm(B.mm(C));
        assertTrue(left + " vs " + right, left.approximatelyEquals(right, EPSILON));
    }

    @Test
    public void testCompositionAppliesRightmostFirst() {
        // (translate after scale) applied to (1,1)
        final AffineTransform t = AffineTransform.translation(1.0, 0.0).mm(AffineTransform.scale(2.0));
        final Point p = t.transform(new Point(1.0, 1.0));
        assertEquals(3.0, p.x, EPSILON);
        assertEquals(2.0, p.y, EPSILON);
    }

    @Test
    public void testInverse() {
        assertTrue(A.mm(A.inverse()).approximatelyEquals(AffineTransform.identity(), EPSILON));
        assertTrue(A.inverse().mm(A).approximatelyEquals(AffineTransform.identity(), EPSILON));

        final Point p = new Point(13.0, -4.0);
        final Point back = A.inverse().transform(A.transform(p));
        assertEquals(p.x, back.x, EPSILON);
        assertEquals(p.y, back.y, EPSILON);
    }

    @Test
    public void testDegenerateInverse() {
        final AffineTransform singular = AffineTransform.of(1.0, 2.0, 3.0, 2.0, 4.0, 5.0);
        assertFalse(singular.isInvertible());
        try {
            singular.inverse();
            fail("Expected a " + DegenerateTransformException.class.getSimpleName());
        } catch(final DegenerateTransformException dte) {
            assertSame(singular, dte.transform);
        }

        assertFalse(AffineTransform.scale(0.0).isInvertible());
        assertTrue(AffineTransform.scale(1e-4).isInvertible());
    }

    @Test
    public void testFromMatrix() {
        final AffineTransform t = AffineTransform.fromMatrix(new double[][] {
            {1.2,0.1,5.0},
            {-0.2,0.9,-3.0},
            {0.0,0.0,1.0}
        });
        assertEquals(A, t);
        assertEquals(A.hashCode(), t.hashCode());
        assertEquals(A, AffineTransform.fromMatrix(A.toArray()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromMatrixRejectsProjective() {
        AffineTransform.fromMatrix(new double[][] {
            {1.0,0.0,0.0},
            {0.0,1.0,0.0},
            {0.1,0.0,1.0}
        });
    }

    @Test
    public void testToCvMat() {
        try(final CvMat m = A.toCvMat();) {
            assertEquals(2, m.rows());
            assertEquals(3, m.cols());
            assertEquals(5.0, m.get(0, 2)[0], EPSILON);
            assertEquals(-0.2, m.get(1, 0)[0], EPSILON);
        }
    }
}
