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

package ai.kognition.reticle.rectify;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.ImageFile;
import ai.kognition.reticle.registration.RectifiedFrame;
import ai.kognition.reticle.registration.RectifiedFrameHandler;
import ai.kognition.reticle.registration.config.MissionKey;

/**
 * Writes each rectified frame to {@code Rect<mission><channel><nnn>.png} in the output directory.
 */
public class PngFrameWriter implements RectifiedFrameHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PngFrameWriter.class);

    private final File directory;
    private final MissionKey key;

    private PngFrameWriter(final File directory, final MissionKey key) {
        this.directory = directory;
        this.key = key;
    }

    public static String outputFileName(final MissionKey key, final int frameIndex) {
        return String.format("Rect%d%s%03d.png", key.mission, key.channel, frameIndex);
    }

    /**
     * Create the output directory if it's not there and remove any {@code .png} files left in it.
     */
    public static PngFrameWriter prepare(final File directory, final MissionKey key) throws IOException {
        FileUtils.forceMkdir(directory);
        for(final File stale: FileUtils.listFiles(directory, new String[] {"png"}, false)) {
            LOGGER.debug("Removing {}", stale);
            FileUtils.forceDelete(stale);
        }
        return new PngFrameWriter(directory, key);
    }

    public File outputFile(final int frameIndex) {
        return new File(directory, outputFileName(key, frameIndex));
    }

    @Override
    public void handle(final RectifiedFrame frame) throws IOException {
        final File out = outputFile(frame.frameIndex);
        ImageFile.writeImageFile(frame.image(), out.getAbsolutePath());
        LOGGER.info("{}: wrote frame {} to {}", key, frame.frameIndex, out);
    }
}
