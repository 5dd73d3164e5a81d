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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.nr.InsufficientDataException;
import ai.kognition.reticle.registration.ConfigurationException;
import ai.kognition.reticle.registration.FrameOutcome;
import ai.kognition.reticle.registration.RegistrationPipeline;
import ai.kognition.reticle.registration.SequenceReport;
import ai.kognition.reticle.registration.config.ConfiguredSeedPoints;
import ai.kognition.reticle.registration.config.MissionConfig;
import ai.kognition.reticle.registration.config.MissionConfigs;
import ai.kognition.reticle.registration.config.MissionKey;
import ai.kognition.reticle.util.CommandLineParser;
import ai.kognition.reticle.util.PropertiesUtils;

/**
 * Rectifies every frame of one mission's camera onto the first frame.
 *
 * <pre>
 * java -jar reticle-rectify.jar -mission 7 -channel A -input raw_images/7A -output rect_images/7A [-config file] [-threads n]
 * </pre>
 *
 * Exits with 0 if every frame was rectified, 1 if any frame failed and 2 if the run couldn't be
 * set up.
 */
public class RectifySequence {
    private static final Logger LOGGER = LoggerFactory.getLogger(RectifySequence.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FRAMES_FAILED = 1;
    public static final int EXIT_SETUP_FAILED = 2;

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    public static int run(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);
        if(cl.isSet("help") || cl.getTotalArgCount() == 0) {
            usage();
            return EXIT_SETUP_FAILED;
        }

        final MissionKey key;
        final File input;
        final File output;
        final int threads;
        try {
            key = MissionKey.of(cl.requireInt("mission"), cl.require("channel"));
            input = new File(cl.require("input"));
            output = new File(cl.require("output"));
            threads = cl.getInt("threads", Runtime.getRuntime().availableProcessors());
        } catch(final IllegalArgumentException iae) {
            System.out.println(iae.getMessage());
            usage();
            return EXIT_SETUP_FAILED;
        }

        try {
            MissionConfigs configs = MissionConfigs.builtIn();
            if(cl.isSet("config"))
                configs = configs.withOverrides(PropertiesUtils.loadProps(cl.getProperty("config")));
            final MissionConfig config = configs.get(key);

            final DirectoryImageSequence sequence = DirectoryImageSequence.scan(input, key);
            if(sequence.frameIndices().isEmpty()) {
                LOGGER.error("{}: there are no frames named like {} in {}", key, DirectoryImageSequence.inputFileName(key, 1), input);
                return EXIT_SETUP_FAILED;
            }
            final PngFrameWriter writer = PngFrameWriter.prepare(output, key);

            final SequenceReport report;
            try(final RegistrationPipeline pipeline = new RegistrationPipeline(config, ConfiguredSeedPoints.INSTANCE, threads);) {
                report = pipeline.run(sequence, writer);
            }

            for(final FrameOutcome failed: report.failures())
                LOGGER.warn("{}: frame {} wasn't rectified: {}", key, failed.frameIndex, failed.failure.getMessage());
            return report.allSucceeded() ? EXIT_OK : EXIT_FRAMES_FAILED;
        } catch(final IOException | ConfigurationException | InsufficientDataException | IllegalArgumentException e) {
            LOGGER.error("{}: couldn't rectify the sequence: {}", key, e.getMessage(), e);
            return EXIT_SETUP_FAILED;
        }
    }

    private static void usage() {
        System.out.println("usage: java [javaargs] " + RectifySequence.class.getName()
            + " -mission <number> -channel <letter> -input <dir> -output <dir> [-config <properties file>] [-threads <count>]");
        System.out.println("       input frames are named Ranger<mission><channel><nnn>.jpg, the first is the reference frame.");
        System.out.println("       output frames are written as Rect<mission><channel><nnn>.png, replacing any .png files already there.");
    }
}
