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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.Closer;
import ai.kognition.reticle.image.CvMat;
import ai.kognition.reticle.image.geometry.transform.AffineResampler;
import ai.kognition.reticle.image.template.MarkTemplates;
import ai.kognition.reticle.nr.AffineFit;
import ai.kognition.reticle.nr.InsufficientDataException;
import ai.kognition.reticle.registration.config.MissionConfig;
import ai.kognition.reticle.registration.config.SeedPointProvider;

/**
 * <p>
 * Everything derived once from the reference frame and then shared, read only, by every frame's
 * registration: the seed points, a template per mark and the reference frame's
 * <em>image&lt;-lattice</em> fit.
 * </p>
 *
 * <p>
 * Closing this releases the templates so it must outlive every registration using it.
 * </p>
 */
public class ReferenceCalibration implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceCalibration.class);

    public final MissionConfig config;
    public final AffineFit referenceFromLattice;
    private final List<Point> seeds;
    private final List<CvMat> templates;
    private final Closer closer = new Closer();

    private ReferenceCalibration(final MissionConfig config, final List<Point> seeds, final List<CvMat> templates,
        final AffineFit referenceFromLattice) {
        this.config = config;
        this.seeds = Collections.unmodifiableList(new ArrayList<>(seeds));
        this.templates = Collections.unmodifiableList(templates);
        templates.forEach(closer::add);
        this.referenceFromLattice = referenceFromLattice;
    }

    /**
     * @param referenceRaw the reference frame at full resolution.
     * @throws ConfigurationException if the seeds don't line up with the lattice.
     * @throws InsufficientDataException if the seeds can't determine the lattice fit.
     */
    public static ReferenceCalibration calibrate(final MissionConfig config, final Mat referenceRaw, final SeedPointProvider seedProvider) {
        final List<Point> seeds;
        try(final CvMat working = AffineResampler.scaleDown(referenceRaw, config.workingWidth);) {
            LOGGER.debug("{}: reference frame {}x{} scaled to {}x{}", config.key, referenceRaw.cols(), referenceRaw.rows(), working.cols(),
                working.rows());
            seeds = seedProvider.seedPoints(config, working);
        }

        if(seeds == null || seeds.size() != config.lattice.size())
            throw new ConfigurationException(config.key + ": expected " + config.lattice.size() + " seed points but got "
                + (seeds == null ? "none" : seeds.size()));
        if(seeds.stream().anyMatch(p -> p == null))
            throw new ConfigurationException(config.key + ": a seed point is missing.");

        final AffineFit fit = LatticeCalibration.fit(config.lattice, seeds);
        LOGGER.info("{}: reference frame lattice fit {} (rms {})", config.key, fit.transform, String.format("%.3f", fit.rms));

        final List<CvMat> templates = MarkTemplates.generate(config.marks());
        if(templates.size() != seeds.size()) {
            templates.forEach(CvMat::close);
            throw new ConfigurationException(config.key + ": " + templates.size() + " templates for " + seeds.size() + " seed points.");
        }
        return new ReferenceCalibration(config, seeds, templates, fit);
    }

    public List<Point> seeds() {
        return seeds;
    }

    /**
     * The template for lattice point {@code i}. Owned by this calibration. Don't modify it.
     */
    public CvMat template(final int i) {
        return templates.get(i);
    }

    @Override
    public void close() {
        closer.close();
    }
}
