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

package ai.kognition.reticle.nr;

import java.util.List;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.geometry.transform.AffineTransform;
import ai.kognition.reticle.image.geometry.transform.ControlPoint;
import ai.kognition.reticle.image.geometry.transform.ControlPoints;

/**
 * <p>
 * Linear least squares. The overdetermined system {@code A X = B} is solved with OpenCV's QR
 * decomposition after checking, from the singular values of {@code A}, that the columns of
 * {@code A} are independent.
 * </p>
 */
public class LeastSquares {
    private static final Logger LOGGER = LoggerFactory.getLogger(LeastSquares.class);

    /**
     * A design matrix is treated as rank deficient when its smallest singular value is no more
     * than this fraction of its largest.
     */
    public static final double RANK_TOLERANCE = 1.0e-9;

    static {
        CvMat.initOpenCv();
    }

    /**
     * Solve {@code design * X = rhs} for {@code X} in the least squares sense.
     *
     * @param design {@code N x k}, row major
     * @param rhs {@code N x m}, row major
     * @return {@code X}, {@code k x m}
     * @throws InsufficientDataException if there are fewer rows than unknowns or the columns of
     *     {@code design} aren't linearly independent.
     */
    public static double[][] solve(final double[][] design, final double[][] rhs) {
        if(design.length != rhs.length)
            throw new IllegalArgumentException("The design matrix has " + design.length + " rows but the right hand side has " + rhs.length);
        if(design.length == 0)
            throw new InsufficientDataException("Cannot solve a least squares problem without any observations.");

        final int unknowns = design[0].length;
        if(design.length < unknowns)
            throw new InsufficientDataException(
                "There are " + design.length + " observations but at least " + unknowns + " are needed to determine the fit.");

        try(final CvMat a = CvMat.toMat(design);
            final CvMat b = CvMat.toMat(rhs);
            final CvMat x = new CvMat();) {
            checkRank(a);
            if(!Core.solve(a, b, x, Core.DECOMP_QR))
                throw new InsufficientDataException("The least squares system is singular.");

            final int cols = x.cols();
            final double[] flat = CvMat.toDoubles(x);
            final double[][] ret = new double[x.rows()][cols];
            for(int r = 0; r < ret.length; r++)
                System.arraycopy(flat, r * cols, ret[r], 0, cols);
            return ret;
        }
    }

    /**
     * Fit the affine transform {@code to <- from} that minimizes the sum of squared distances
     * between the transformed {@code from} points and the {@code to} points.
     *
     * @throws InsufficientDataException if there are fewer than 3 control points or the
     *     {@code from} points are collinear (or coincident).
     */
    public static AffineFit fitAffine(final ControlPoints controlPoints) {
        final List<ControlPoint> cps = controlPoints.controlPoints;
        if(cps.size() < 3)
            throw new InsufficientDataException("An affine fit needs at least 3 control points but was given " + cps.size());

        final double[][] design = new double[cps.size()][];
        final double[][] rhs = new double[cps.size()][];
        for(int i = 0; i < cps.size(); i++) {
            final ControlPoint cp = cps.get(i);
            design[i] = new double[] {cp.from.x,cp.from.y,1.0};
            rhs[i] = new double[] {cp.to.x,cp.to.y};
        }

        // X is 3x2; its columns are the x and y rows of the transform
        final double[][] x = solve(design, rhs);
        final AffineTransform transform = AffineTransform.of(x[0][0], x[1][0], x[2][0], x[0][1], x[1][1], x[2][1]);

        final double[] residuals = new double[cps.size()];
        for(int i = 0; i < residuals.length; i++)
            residuals[i] = cps.get(i).residual(transform);

        final AffineFit ret = new AffineFit(transform, residuals);
        if(LOGGER.isDebugEnabled())
            LOGGER.debug("Fit {} to {} control points with an rms residual of {}", transform, cps.size(), String.format("%.4f", ret.rms));
        return ret;
    }

    private static void checkRank(final CvMat a) {
        try(final CvMat w = new CvMat();
            final CvMat u = new CvMat();
            final CvMat vt = new CvMat();) {
            Core.SVDecomp(a, w, u, vt);
            final double[] singular = CvMat.toDoubles(w);
            double max = 0.0;
            double min = Double.POSITIVE_INFINITY;
            for(final double s: singular) {
                max = Math.max(max, s);
                min = Math.min(min, s);
            }
            if(!(max > 0.0) || min <= max * RANK_TOLERANCE)
                throw new InsufficientDataException("The observations don't determine a unique fit. The singular values of the design matrix range from "
                    + min + " to " + max + ". Are the points collinear?");
        }
    }
}
