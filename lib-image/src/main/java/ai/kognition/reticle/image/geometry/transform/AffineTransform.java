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

import java.util.Arrays;

import org.opencv.core.CvType;
import org.opencv.core.Point;

import ai.kognition.reticle.image.CvMat;

/**
 * <p>
 * An immutable 2D affine transform held as the 3x3 homogeneous matrix
 * </p>
 *
 * <pre>
 *   [ sa  sb  tx ]
 *   [ sc  sd  ty ]
 *   [  0   0   1 ]
 * </pre>
 *
 * <p>
 * Transforms are named <em>to&lt;-from</em> and applied to a column vector {@code [x, y, 1]} in
 * the <em>from</em> frame by multiplying it on the right. Composition follows matrix
 * multiplication so, given {@code cFromB} (C&lt;-B) and {@code bFromA} (B&lt;-A),
 * {@code cFromB.mm(bFromA)} is C&lt;-A.
 * </p>
 */
public final class AffineTransform implements Transform2D {
    /**
     * Relative tolerance used to decide whether the linear part of a transform is singular.
     */
    public static final double SINGULARITY_TOLERANCE = 1.0e-12;

    private static final AffineTransform IDENTITY = new AffineTransform(1.0, 0.0, 0.0, 0.0, 1.0, 0.0);

    private final double sa;
    private final double sb;
    private final double tx;
    private final double sc;
    private final double sd;
    private final double ty;

    private AffineTransform(final double sa, final double sb, final double tx, final double sc, final double sd, final double ty) {
        this.sa = sa;
        this.sb = sb;
        this.tx = tx;
        this.sc = sc;
        this.sd = sd;
        this.ty = ty;
    }

    /**
     * Build the transform from the top two rows of the matrix, row major.
     */
    public static AffineTransform of(final double sa, final double sb, final double tx, final double sc, final double sd, final double ty) {
        return new AffineTransform(sa, sb, tx, sc, sd, ty);
    }

    /**
     * Build the transform from a 3x3 (or 2x3) row major matrix. A third row must be {@code [0, 0, 1]}.
     */
    public static AffineTransform fromMatrix(final double[][] m) {
        if(m == null || (m.length != 2 && m.length != 3))
            throw new IllegalArgumentException("An affine transform needs a 2x3 or 3x3 matrix.");
        for(final double[] row: m) {
            if(row == null || row.length != 3)
                throw new IllegalArgumentException("An affine transform needs a 2x3 or 3x3 matrix but a row was " + Arrays.toString(row));
        }
        if(m.length == 3 && (m[2][0] != 0.0 || m[2][1] != 0.0 || m[2][2] != 1.0))
            throw new IllegalArgumentException("The bottom row of an affine transform must be [0, 0, 1] but was " + Arrays.toString(m[2]));

        return new AffineTransform(m[0][0], m[0][1], m[0][2], m[1][0], m[1][1], m[1][2]);
    }

    public static AffineTransform identity() {
        return IDENTITY;
    }

    public static AffineTransform scale(final double s) {
        return scale(s, s);
    }

    public static AffineTransform scale(final double sx, final double sy) {
        return new AffineTransform(sx, 0.0, 0.0, 0.0, sy, 0.0);
    }

    public static AffineTransform translation(final double dx, final double dy) {
        return new AffineTransform(1.0, 0.0, dx, 0.0, 1.0, dy);
    }

    public static AffineTransform rotation(final double angleRad) {
        final double cos = Math.cos(angleRad);
        final double sin = Math.sin(angleRad);
        return new AffineTransform(cos, -sin, 0.0, sin, cos, 0.0);
    }

    /**
     * Matrix product {@code this * other}.
     */
    public AffineTransform mm(final AffineTransform other) {
        return new AffineTransform(
            sa * other.sa + sb * other.sc,
            sa * other.sb + sb * other.sd,
            sa * other.tx + sb * other.ty + tx,
            sc * other.sa + sd * other.sc,
            sc * other.sb + sd * other.sd,
            sc * other.tx + sd * other.ty + ty);
    }

    public double determinant() {
        return (sa * sd) - (sb * sc);
    }

    public boolean isInvertible() {
        final double det = determinant();
        if(!Double.isFinite(det))
            return false;
        final double scale = (Math.abs(sa) + Math.abs(sb)) * (Math.abs(sc) + Math.abs(sd));
        return scale > 0.0 && Math.abs(det) > SINGULARITY_TOLERANCE * scale;
    }

    /**
     * @throws DegenerateTransformException if this transform is singular.
     */
    public AffineTransform inverse() {
        if(!isInvertible())
            throw new DegenerateTransformException(this);

        final double det = determinant();
        final double ia = sd / det;
        final double ib = -sb / det;
        final double ic = -sc / det;
        final double id = sa / det;
        return new AffineTransform(ia, ib, -(ia * tx + ib * ty), ic, id, -(ic * tx + id * ty));
    }

    @Override
    public Point transform(final Point point) {
        final double x = point.x;
        final double y = point.y;
        return new Point(x * sa + y * sb + tx, x * sc + y * sd + ty);
    }

    /**
     * @return the full 3x3 matrix, row major.
     */
    public double[][] toArray() {
        return new double[][] {
            {sa,sb,tx},
            {sc,sd,ty},
            {0.0,0.0,1.0}
        };
    }

    /**
     * The top two rows as a {@code CV_64FC1} 2x3 {@link CvMat}, the layout OpenCV's
     * {@code warpAffine} expects. <b>Note: The caller owns the CvMat returned</b>
     */
    public CvMat toCvMat() {
        try(final CvMat ret = new CvMat(2, 3, CvType.CV_64FC1);) {
            ret.put(0, 0, sa, sb, tx, sc, sd, ty);
            return ret.returnMe();
        }
    }

    /**
     * Element-wise comparison of the top two rows within {@code tolerance}.
     */
    public boolean approximatelyEquals(final AffineTransform other, final double tolerance) {
        return Math.abs(sa - other.sa) <= tolerance
            && Math.abs(sb - other.sb) <= tolerance
            && Math.abs(tx - other.tx) <= tolerance
            && Math.abs(sc - other.sc) <= tolerance
            && Math.abs(sd - other.sd) <= tolerance
            && Math.abs(ty - other.ty) <= tolerance;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof AffineTransform))
            return false;
        final AffineTransform o = (AffineTransform)obj;
        return Double.compare(sa, o.sa) == 0 && Double.compare(sb, o.sb) == 0 && Double.compare(tx, o.tx) == 0
            && Double.compare(sc, o.sc) == 0 && Double.compare(sd, o.sd) == 0 && Double.compare(ty, o.ty) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new double[] {sa,sb,tx,sc,sd,ty});
    }

    @Override
    public String toString() {
        return String.format("[[%.6f, %.6f, %.6f], [%.6f, %.6f, %.6f], [0, 0, 1]]", sa, sb, tx, sc, sd, ty);
    }
}
