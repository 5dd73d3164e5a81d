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

/**
 * Supplies the reference frame's seed points: the approximate working resolution pixel location
 * of every lattice point, in lattice order. Implementations might read them from configuration
 * or ask a person to click on them.
 */
@FunctionalInterface
public interface SeedPointProvider {

    /**
     * @param config the mission being registered.
     * @param referenceWorking the reference frame scaled to the working resolution. Read only.
     */
    List<Point> seedPoints(MissionConfig config, Mat referenceWorking);
}
