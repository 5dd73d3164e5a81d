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

package ai.kognition.reticle.registration;

import java.util.List;

import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.geometry.transform.ControlPoints;
import ai.kognition.reticle.nr.AffineFit;
import ai.kognition.reticle.nr.InsufficientDataException;
import ai.kognition.reticle.nr.LeastSquares;

/**
 * Fits the affine transform <em>image&lt;-lattice</em> that best maps the lattice onto where the
 * marks were found in an image.
 */
public class LatticeCalibration {
    private static final Logger LOGGER = LoggerFactory.getLogger(LatticeCalibration.class);

    /**
     * @param observed pixel coordinates of each lattice point, in lattice order.
     * @throws ConfigurationException if there isn't exactly one observed point per lattice point.
     * @throws InsufficientDataException if the lattice points can't determine an affine transform.
     */
    public static AffineFit fit(final LatticeConfiguration lattice, final List<Point> observed) {
        if(observed.size() != lattice.size())
            throw new ConfigurationException("The lattice has " + lattice.size() + " points but " + observed.size() + " were observed.");

        final AffineFit ret = LeastSquares.fitAffine(ControlPoints.pair(lattice.points(), observed));
        if(LOGGER.isDebugEnabled()) {
            final double[] residuals = ret.residuals();
            for(int i = 0; i < residuals.length; i++)
                LOGGER.debug("lattice point {} {} observed at {} is off by {}", i, lattice.point(i), observed.get(i),
                    String.format("%.3f", residuals[i]));
        }
        return ret;
    }
}
