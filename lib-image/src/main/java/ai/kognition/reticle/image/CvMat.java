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

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.util.OpenCvLoader;

/**
 * <p>
 * An OpenCV {@link Mat} that can be managed as an {@link AutoCloseable}. The image data behind a
 * {@link Mat} lives off-heap so the garbage collector can't see how much memory is really in use.
 * Every {@link CvMat} should therefore be owned by a <em>"try-with-resource"</em> (or a
 * {@link Closer}) so the pixel data is released as soon as it's no longer needed.
 * </p>
 *
 * <p>
 * Methods in this project that return a {@link CvMat} hand ownership to the caller. Loading this
 * class loads the OpenCV native library.
 * </p>
 */
public class CvMat extends Mat implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CvMat.class);

    private boolean skipCloseOnceForReturn = false;
    private boolean releasedAlready = false;

    static {
        OpenCvLoader.load();
    }

    /**
     * Calling this guarantees the OpenCV native library is loaded.
     */
    public static void initOpenCv() {}

    public CvMat() {}

    public CvMat(final int rows, final int cols, final int type) {
        super(rows, cols, type);
    }

    public CvMat(final int rows, final int cols, final int type, final Scalar value) {
        super(rows, cols, type, value);
    }

    /**
     * Free the pixel data for this {@link CvMat}. Once closed it shouldn't be used.
     */
    @Override
    public void close() {
        if(!skipCloseOnceForReturn) {
            if(!releasedAlready) {
                release();
                releasedAlready = true;
            }
        } else
            skipCloseOnceForReturn = false; // next close counts.
    }

    /**
     * <p>
     * Allows a {@link CvMat} that's being managed by a <em>"try-with-resource"</em> to be returned
     * without its resources being freed:
     * </p>
     *
     * <pre>
     * <code>
     *   try (CvMat matToReturn = new CvMat(); ) {
     *      // do something to fill in the matToReturn
     *
     *      return matToReturn.returnMe();
     *   }
     * </code>
     * </pre>
     */
    public CvMat returnMe() {
        skipCloseOnceForReturn = true;
        return this;
    }

    /**
     * Hand the image data referenced by {@code mat} over to a new {@link CvMat}. The data is shared,
     * not copied, and {@code mat} is released so the returned {@link CvMat} is the only owner.
     * <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat move(final Mat mat) {
        if(mat == null)
            return null;
        if(mat instanceof CvMat)
            return (CvMat)mat;

        final CvMat ret = new CvMat();
        mat.assignTo(ret);
        mat.release();
        return ret;
    }

    /**
     * A complete copy of the provided {@code Mat}. Changes in one won't be reflected in the other.
     * <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat deepCopy(final Mat mat) {
        final CvMat ret = new CvMat();
        mat.copyTo(ret);
        return ret;
    }

    public static CvMat zeros(final int rows, final int cols, final int type) {
        return new CvMat(rows, cols, type, Scalar.all(0));
    }

    /**
     * Copy the single channel contents of {@code mat} into a row-major {@code double[]} of
     * {@code rows * cols} elements regardless of the depth of the {@code Mat}.
     */
    public static double[] toDoubles(final Mat mat) {
        if(mat.channels() != 1)
            throw new IllegalArgumentException("Expected a single channel image but got " + CvType.typeToString(mat.type()));

        final int size = mat.rows() * mat.cols();
        final double[] ret = new double[size];
        if(size == 0)
            return ret;

        if(mat.depth() == CvType.CV_64F && mat.isContinuous()) {
            mat.get(0, 0, ret);
            return ret;
        }

        try(CvMat asDouble = new CvMat();) {
            mat.convertTo(asDouble, CvType.CV_64F);
            asDouble.get(0, 0, ret);
        }
        return ret;
    }

    /**
     * Build a {@code CV_64FC1} {@link CvMat} from a rectangular 2D array.
     * <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat toMat(final double[][] values) {
        final int rows = values.length;
        final int cols = rows == 0 ? 0 : values[0].length;
        try(final CvMat ret = new CvMat(rows, cols, CvType.CV_64FC1);) {
            for(int r = 0; r < rows; r++) {
                if(values[r].length != cols)
                    throw new IllegalArgumentException("Row " + r + " has " + values[r].length + " columns but row 0 has " + cols);
                ret.put(r, 0, values[r]);
            }
            return ret.returnMe();
        }
    }

    @Override
    public String toString() {
        return "CvMat: (" + getClass().getName() + "@" + Integer.toHexString(hashCode()) + ") " + super.toString();
    }

    @Override
    protected void finalize() throws Throwable {
        if(!releasedAlready)
            LOGGER.debug("Finalizing a {} that hasn't been closed.", CvMat.class.getSimpleName());
        super.finalize();
    }
}
