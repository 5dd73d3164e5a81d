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

package ai.kognition.reticle.util;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Loads the OpenCV native library that ships inside the {@code org.openpnp:opencv} jar. The
 * library is extracted to a temporary directory and loaded at most once per class loader.
 *
 * <p>
 * Classes that touch OpenCV should make sure this has been called before any
 * {@code org.opencv.core.Mat} is instantiated. {@code CvMat} does this from its static
 * initializer so most code never needs to call it directly.
 * </p>
 */
public class OpenCvLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvLoader.class);

    private static boolean loaded = false;

    public static synchronized void load() {
        if(loaded)
            return;

        final String platform = System.getProperty("os.name") + "-" + System.getProperty("os.arch");
        LOGGER.debug("Loading the OpenCV native library for {}", platform);
        try {
            OpenCV.loadLocally();
        } catch(final RuntimeException | UnsatisfiedLinkError e) {
            throw new IllegalStateException("Failed to load the OpenCV native library for " + platform, e);
        }
        loaded = true;
        LOGGER.info("Loaded OpenCV {}", Core.VERSION);
    }
}
