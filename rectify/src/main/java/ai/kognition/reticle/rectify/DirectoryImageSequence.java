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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.ImageFile;
import ai.kognition.reticle.registration.ImageSequence;
import ai.kognition.reticle.registration.config.MissionKey;

/**
 * The frames of a mission's camera found in a directory. Frames are named
 * {@code Ranger<mission><channel><nnn>.jpg} where {@code nnn} is the frame number.
 */
public class DirectoryImageSequence implements ImageSequence {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryImageSequence.class);

    private final MissionKey key;
    private final Map<Integer, File> frames;

    private DirectoryImageSequence(final MissionKey key, final Map<Integer, File> frames) {
        this.key = key;
        this.frames = frames;
    }

    public static String inputFileName(final MissionKey key, final int frameIndex) {
        return String.format("Ranger%d%s%03d.jpg", key.mission, key.channel, frameIndex);
    }

    /**
     * @throws IOException if {@code directory} isn't a readable directory.
     */
    public static DirectoryImageSequence scan(final File directory, final MissionKey key) throws IOException {
        if(!directory.isDirectory())
            throw new IOException("The input \"" + directory.getAbsolutePath() + "\" isn't a directory.");

        final Pattern name = Pattern.compile("^Ranger" + key.mission + Pattern.quote(key.channel) + "(\\d{3})\\.jpg$");
        final Map<Integer, File> frames = new TreeMap<>();
        for(final File f: FileUtils.listFiles(directory, new String[] {"jpg"}, false)) {
            final Matcher m = name.matcher(f.getName());
            if(m.matches())
                frames.put(Integer.parseInt(m.group(1)), f);
            else
                LOGGER.debug("Ignoring {}", f);
        }
        LOGGER.info("{}: found {} frames in {}", key, frames.size(), directory);
        return new DirectoryImageSequence(key, frames);
    }

    @Override
    public List<Integer> frameIndices() {
        return Collections.unmodifiableList(new ArrayList<>(frames.keySet()));
    }

    @Override
    public CvMat load(final int frameIndex) throws IOException {
        final File file = frames.get(frameIndex);
        if(file == null)
            throw new IOException("There's no frame " + frameIndex + " (" + inputFileName(key, frameIndex) + ") in the sequence.");
        return ImageFile.readGrayscale(file.getAbsolutePath());
    }
}
