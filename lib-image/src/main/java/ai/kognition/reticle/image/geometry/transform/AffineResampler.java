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

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import ai.kognition.reticle.image.CvMat;

/**
 * <p>
 * Produces a new image from a source image and an affine transform <em>dst&lt;-src</em> (the
 * "forward" transform). Every destination pixel is pulled from the source through the inverse
 * transform with bilinear interpolation. Destination pixels whose pre-image falls outside of the
 * source are zero.
 * </p>
 *
 * <p>
 * All of the methods return a new image. <b>Note: The caller owns the CvMat returned</b>
 * </p>
 */
public class AffineResampler {
    static {
        CvMat.initOpenCv();
    }

    /**
     * Resample {@code src} into an image the same size as {@code src}.
     *
     * @throws DegenerateTransformException if {@code dstFromSrc} isn't invertible.
     */
    public static CvMat transform(final Mat src, final AffineTransform dstFromSrc) {
        return transform(src, dstFromSrc, src.size());
    }

    /**
     * Resample {@code src} into an image of {@code outputSize} (width x height).
     *
     * @throws DegenerateTransformException if {@code dstFromSrc} isn't invertible.
     */
    public static CvMat transform(final Mat src, final AffineTransform dstFromSrc, final Size outputSize) {
        if(outputSize.width <= 0 || outputSize.height <= 0)
            throw new IllegalArgumentException("Cannot resample into an image of size " + outputSize);

        // warpAffine with WARP_INVERSE_MAP wants the src<-dst mapping.
        final AffineTransform srcFromDst = dstFromSrc.inverse();
        try(final CvMat pull = srcFromDst.toCvMat();
            final CvMat dst = new CvMat();) {
            Imgproc.warpAffine(src, dst, pull, outputSize, Imgproc.INTER_LINEAR | Imgproc.WARP_INVERSE_MAP, Core.BORDER_CONSTANT,
                Scalar.all(0));
            return dst.returnMe();
        }
    }

    /**
     * The uniform scale that takes an image {@code sourceWidth} wide to {@code targetWidth} wide.
     */
    public static AffineTransform scaleToWidth(final Size sourceSize, final int targetWidth) {
        if(sourceSize.width <= 0 || targetWidth <= 0)
            throw new IllegalArgumentException("Widths must be positive but were " + sourceSize.width + " and " + targetWidth);
        return AffineTransform.scale(targetWidth / sourceSize.width);
    }

    /**
     * The size of {@code src} when uniformly scaled to {@code targetWidth}. The height is truncated.
     */
    public static Size scaledSize(final Size sourceSize, final int targetWidth) {
        final int height = (int)((targetWidth / sourceSize.width) * sourceSize.height);
        return new Size(targetWidth, height);
    }

    /**
     * Uniformly scale {@code src} so it's {@code targetWidth} wide.
     */
    public static CvMat scaleDown(final Mat src, final int targetWidth) {
        final Size size = src.size();
        return transform(src, scaleToWidth(size, targetWidth), scaledSize(size, targetWidth));
    }

    /**
     * <p>
     * Copy the {@code 2r x 2r} window of {@code src} whose top-left corner is
     * {@code ((int)center.x - r, (int)center.y - r)}. Parts of the window that fall outside
     * of {@code src} are zero.
     * </p>
     */
    public static CvMat window(final Mat src, final Point center, final int radius) {
        if(radius <= 0)
            throw new IllegalArgumentException("The window radius must be positive but was " + radius);
        final int cx = (int)center.x;
        final int cy = (int)center.y;
        final int side = 2 * radius;

        try(final CvMat ret = CvMat.zeros(side, side, src.type());) {
            final int x0 = cx - radius;
            final int y0 = cy - radius;
            final int sx0 = Math.max(0, x0);
            final int sy0 = Math.max(0, y0);
            final int sx1 = Math.min(src.cols(), x0 + side);
            final int sy1 = Math.min(src.rows(), y0 + side);

            if(sx1 > sx0 && sy1 > sy0) {
                try(final CvMat from = CvMat.move(src.submat(new Rect(sx0, sy0, sx1 - sx0, sy1 - sy0)));
                    final CvMat into = CvMat.move(ret.submat(new Rect(sx0 - x0, sy0 - y0, sx1 - sx0, sy1 - sy0)));) {
                    from.copyTo(into);
                }
            }
            return ret.returnMe();
        }
    }
}
