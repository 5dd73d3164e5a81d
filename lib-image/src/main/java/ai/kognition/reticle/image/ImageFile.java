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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading and writing of raster images through OpenCV's codecs.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    static {
        CvMat.initOpenCv();
    }

    /**
     * Read an image from a file as a single channel 8-bit intensity raster. Color images are
     * converted to grayscale. You should make sure this is assigned in a try-with-resource
     * or the CvMat will leak.
     *
     * @return a new {@link CvMat} constructed from the decoded file contents.
     *         <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat readGrayscale(final String filename) throws IOException {
        return readMatFromFile(filename, Imgcodecs.IMREAD_GRAYSCALE);
    }

    public static CvMat readMatFromFile(final String filename, final int mode) throws IOException {
        final File file = new File(filename);
        if(!file.exists())
            throw new FileNotFoundException("Failed to read image from \"" + file.getAbsolutePath() + "\" because it doesn't exist.");

        LOGGER.trace("Reading image from {}", filename);
        try(final CvMat ret = CvMat.move(Imgcodecs.imread(file.getAbsolutePath(), mode));) {
            if(ret.empty())
                throw new IOException("OpenCV couldn't decode an image from \"" + file.getAbsolutePath() + "\"");
            return ret.returnMe();
        }
    }

    /**
     * Write the image in the format implied by the filename's extension.
     */
    public static void writeImageFile(final Mat mat, final String filename) throws IOException {
        LOGGER.trace("Writing {}x{} image to {}", mat.cols(), mat.rows(), filename);
        if(!Imgcodecs.imwrite(filename, mat))
            throw new IOException("Failed to write the image to \"" + filename + "\"");
    }
}
