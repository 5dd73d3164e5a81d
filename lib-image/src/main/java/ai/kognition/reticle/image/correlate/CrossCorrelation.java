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

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import ai.kognition.reticle.image.CvMat;

/**
 * <p>
 * Frequency domain cross-correlation between an image and a same sized reference. The surface is
 * the linear (zero padded, not circular) cross-correlation of the mean removed inputs cropped to
 * the input size so that element {@code [i][j]} holds the score for the reference displaced by
 * {@code (i - rows/2, j - cols/2)}. This is the {@code 'same'} mode convolution of the image
 * with the flipped reference.
 * </p>
 */
public class CrossCorrelation {
    static {
        CvMat.initOpenCv();
    }

    /**
     * The {@code CV_64FC1} correlation surface. Neither input is modified.
     * <b>Note: The caller owns the CvMat returned</b>
     *
     * @throws IllegalArgumentException if either input is empty, multi-channel or they differ in size.
     */
    public static CvMat surface(final Mat image, final Mat reference) {
        checkInputs(image, reference);

        final int rows = image.rows();
        final int cols = image.cols();
        final int padRows = Core.getOptimalDFTSize(2 * rows - 1);
        final int padCols = Core.getOptimalDFTSize(2 * cols - 1);

        final double[] circular;
        try(final CvMat imageSpectrum = spectrum(image, padRows, padCols);
            final CvMat referenceSpectrum = spectrum(reference, padRows, padCols);
            final CvMat product = new CvMat();
            final CvMat correlation = new CvMat();) {
            // conjugating the reference turns the product into a correlation
            Core.mulSpectrums(imageSpectrum, referenceSpectrum, product, 0, true);
            Core.dft(product, correlation, Core.DFT_INVERSE | Core.DFT_SCALE | Core.DFT_REAL_OUTPUT, 0);
            circular = CvMat.toDoubles(correlation);
        }

        // circular[k] for k in (-(rows-1), rows-1) lives at k mod padRows (same for columns).
        final int halfRows = rows / 2;
        final int halfCols = cols / 2;
        final double[] same = new double[rows * cols];
        for(int i = 0; i < rows; i++) {
            final int srcRow = Math.floorMod(i - halfRows, padRows);
            for(int j = 0; j < cols; j++) {
                final int srcCol = Math.floorMod(j - halfCols, padCols);
                same[i * cols + j] = circular[srcRow * padCols + srcCol];
            }
        }

        try(final CvMat ret = new CvMat(rows, cols, CvType.CV_64FC1);) {
            ret.put(0, 0, same);
            return ret.returnMe();
        }
    }

    /**
     * <p>
     * Locate the peak of a correlation surface within {@code searchRadius} of its center. With
     * {@code cy = rows/2} and {@code cx = cols/2} only rows {@code [cy-r, cy+r)} and columns
     * {@code [cx-r, cx+r)} (clipped to the surface) are searched. Ties go to the first maximum in
     * raster order.
     * </p>
     */
    public static Offset offset(final Mat surface, final int searchRadius) {
        if(surface.empty())
            throw new IllegalArgumentException("Cannot find the peak of an empty correlation surface.");
        if(searchRadius <= 0)
            throw new IllegalArgumentException("The search radius must be positive but was " + searchRadius);

        final int rows = surface.rows();
        final int cols = surface.cols();
        final int cy = rows / 2;
        final int cx = cols / 2;
        final int row0 = Math.max(0, cy - searchRadius);
        final int row1 = Math.min(rows, cy + searchRadius);
        final int col0 = Math.max(0, cx - searchRadius);
        final int col1 = Math.min(cols, cx + searchRadius);

        final double[] values = CvMat.toDoubles(surface);
        int bestRow = row0;
        int bestCol = col0;
        double best = Double.NEGATIVE_INFINITY;
        for(int r = row0; r < row1; r++) {
            for(int c = col0; c < col1; c++) {
                final double v = values[r * cols + c];
                if(v > best) {
                    best = v;
                    bestRow = r;
                    bestCol = c;
                }
            }
        }
        return new Offset(bestRow - cy, bestCol - cx);
    }

    /**
     * Where the content of {@code reference} appears in {@code image}, searched within
     * {@code searchRadius} pixels of perfect alignment.
     */
    public static Offset offset(final Mat image, final Mat reference, final int searchRadius) {
        try(final CvMat surface = surface(image, reference);) {
            return offset(surface, searchRadius);
        }
    }

    private static void checkInputs(final Mat image, final Mat reference) {
        if(image == null || reference == null)
            throw new IllegalArgumentException("Cannot correlate a null image.");
        if(image.empty() || reference.empty())
            throw new IllegalArgumentException("Cannot correlate an empty image.");
        if(image.channels() != 1 || reference.channels() != 1)
            throw new IllegalArgumentException("Only single channel images can be correlated.");
        if(image.rows() != reference.rows() || image.cols() != reference.cols())
            throw new IllegalArgumentException(
                "The image (" + image.size() + ") and reference (" + reference.size() + ") must be the same size.");
    }

    // mean removed, zero padded into the top left of a padRows x padCols raster, then transformed
    private static CvMat spectrum(final Mat src, final int padRows, final int padCols) {
        try(final CvMat asDouble = new CvMat();
            final CvMat padded = CvMat.zeros(padRows, padCols, CvType.CV_64FC1);
            final CvMat ret = new CvMat();) {
            src.convertTo(asDouble, CvType.CV_64F);
            Core.subtract(asDouble, Core.mean(asDouble), asDouble);
            try(final CvMat corner = CvMat.move(padded.submat(new Rect(0, 0, src.cols(), src.rows())));) {
                asDouble.copyTo(corner);
            }
            Core.dft(padded, ret, 0, 0);
            return ret.returnMe();
        }
    }
}
