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

package ai.kognition.reticle.image;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

public class CvMatTest {
    private static final double EPSILON = 10e-8;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testReturnMeSurvivesTryWithResource() {
        final CvMat kept;
        try(final CvMat mat = new CvMat(3, 4, CvType.CV_8UC1, Scalar.all(9));) {
            kept = mat.returnMe();
        }
        try(final CvMat mat = kept;) {
            assertEquals(3, mat.rows());
            assertEquals(9.0, mat.get(2, 3)[0], EPSILON);
        }
    }

    @Test
    public void testMoveAndDoubles() {
        CvMat.initOpenCv();
        final Mat plain = new Mat(2, 3, CvType.CV_8UC1, Scalar.all(0));
        plain.put(1, 2, 42);
        try(final CvMat moved = CvMat.move(plain);) {
            assertEquals(2, moved.rows());
            assertArrayEquals(new double[] {0,0,0,0,0,42}, CvMat.toDoubles(moved), EPSILON);
        }
    }

    @Test
    public void testToMat() {
        try(final CvMat m = CvMat.toMat(new double[][] {{1,2},{3,4},{5,6}});) {
            assertEquals(3, m.rows());
            assertEquals(2, m.cols());
            assertEquals(CvType.CV_64FC1, m.type());
            assertArrayEquals(new double[] {1,2,3,4,5,6}, CvMat.toDoubles(m), EPSILON);
        }
    }

    @Test
    public void testImageFileRoundTrip() throws Exception {
        final File file = new File(tmp.getRoot(), "mark.png");
        try(final CvMat mat = new CvMat(8, 6, CvType.CV_8UC1, Scalar.all(12));) {
            mat.put(4, 3, 250);
            ImageFile.writeImageFile(mat, file.getAbsolutePath());
        }
        assertTrue(file.exists());
        try(final CvMat read = ImageFile.readGrayscale(file.getAbsolutePath());) {
            assertEquals(8, read.rows());
            assertEquals(6, read.cols());
            assertEquals(250.0, read.get(4, 3)[0], EPSILON);
            assertEquals(12.0, read.get(0, 0)[0], EPSILON);
        }
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingImageFile() throws Exception {
        ImageFile.readGrayscale(new File(tmp.getRoot(), "nothere.png").getAbsolutePath());
    }
}
