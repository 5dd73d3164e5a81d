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

package ai.kognition.reticle.registration.config;

import java.util.List;

import org.opencv.core.Mat;
import org.opencv.core.Point;

import ai.kognition.reticle.registration.ConfigurationException;

/**
 * Seeds taken from the mission's configuration.
 */
public class ConfiguredSeedPoints implements SeedPointProvider {
    public static final ConfiguredSeedPoints INSTANCE = new ConfiguredSeedPoints();

    @Override
    public List<Point> seedPoints(final MissionConfig config, final Mat referenceWorking) {
        final List<Point> ret = config.seeds();
        if(ret.isEmpty())
            throw new ConfigurationException("No seed points are configured for " + config.key);
        return ret;
    }
}
