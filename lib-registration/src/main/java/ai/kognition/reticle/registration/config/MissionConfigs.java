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

import static ai.kognition.reticle.util.PropertiesUtils.getSection;
import static ai.kognition.reticle.util.PropertiesUtils.list;
import static ai.kognition.reticle.util.PropertiesUtils.overlay;
import static ai.kognition.reticle.util.PropertiesUtils.split;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.opencv.core.Point;
import org.opencv.core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.reticle.image.template.MarkDescriptor;
import ai.kognition.reticle.registration.ConfigurationException;
import ai.kognition.reticle.registration.LatticeConfiguration;
import ai.kognition.reticle.util.PropertiesUtils;

/**
 * <p>
 * The table of mission configurations, read from properties. Each (mission, channel) has its
 * entries under {@code mission.<mission>.<channel>.} and may override any entry of the
 * {@code defaults.} section:
 * </p>
 *
 * <pre>
 * mission.7.A.lattice.x=-2,-1,0,1,2
 * mission.7.A.lattice.y=-1,0,1,2
 * mission.7.A.workingWidth=1150
 * mission.7.A.seeds=74.571 235.829; 314.931 236.818; ...
 * mission.7.A.marks=NSE, SE, SEW, ...
 * defaults.windowRadius=50
 * defaults.searchRadius=20
 * defaults.outputWidth=1150
 * defaults.outputHeight=1150
 * defaults.mark.armLength=30
 * defaults.mark.halfWidth=2
 * defaults.mark.background=0
 * defaults.mark.foreground=255
 * </pre>
 *
 * <p>
 * When no {@code marks} are given, each mark's arms are derived from its place in the lattice.
 * </p>
 */
public class MissionConfigs {
    private static final Logger LOGGER = LoggerFactory.getLogger(MissionConfigs.class);

    public static final String BUILT_IN_RESOURCE = "missions.properties";
    public static final String DEFAULTS_SECTION = "defaults";

    private static final Pattern MISSION_ENTRY = Pattern.compile("^mission\\.(\\d+)\\.([^.]+)\\..+$");

    private final Properties props;

    public MissionConfigs(final Properties props) {
        this.props = props;
    }

    /**
     * The tables that ship on the classpath.
     */
    public static MissionConfigs builtIn() throws IOException {
        return new MissionConfigs(PropertiesUtils.loadResource(BUILT_IN_RESOURCE));
    }

    /**
     * A new table with every entry in {@code overrides} replacing or adding to these.
     */
    public MissionConfigs withOverrides(final Properties overrides) {
        return new MissionConfigs(overlay(props, overrides));
    }

    public List<MissionKey> keys() {
        final TreeSet<MissionKey> ret = new TreeSet<>();
        for(final String name: props.stringPropertyNames()) {
            final Matcher m = MISSION_ENTRY.matcher(name);
            if(m.matches())
                ret.add(MissionKey.of(Integer.parseInt(m.group(1)), m.group(2)));
        }
        return new ArrayList<>(ret);
    }

    /**
     * @throws ConfigurationException if the mission isn't configured or its entries are invalid.
     */
    public MissionConfig get(final MissionKey key) {
        final Properties section = getSection(props, key.section(), true);
        if(section.isEmpty())
            throw new ConfigurationException("There's no configuration for mission " + key.mission + " channel " + key.channel + ". Known are "
                + keys());
        final Properties p = overlay(getSection(props, DEFAULTS_SECTION, true), section);

        final LatticeConfiguration lattice = new LatticeConfiguration(ints(key, p, "lattice.x"), ints(key, p, "lattice.y"));
        final int workingWidth = intValue(key, p, "workingWidth", MissionConfig.DEFAULT_WORKING_WIDTH);
        final int windowRadius = intValue(key, p, "windowRadius", MissionConfig.DEFAULT_WINDOW_RADIUS);
        final int searchRadius = intValue(key, p, "searchRadius", MissionConfig.DEFAULT_SEARCH_RADIUS);
        final Size outputSize = new Size(intValue(key, p, "outputWidth", MissionConfig.DEFAULT_OUTPUT_WIDTH),
            intValue(key, p, "outputHeight", MissionConfig.DEFAULT_OUTPUT_HEIGHT));

        final MarkDescriptor base;
        try {
            base = MarkDescriptor.FULL_CROSS
                .withRadius(windowRadius)
                .withArmLength(intValue(key, p, "mark.armLength", MarkDescriptor.DEFAULT_ARM_LENGTH))
                .withHalfWidth(intValue(key, p, "mark.halfWidth", MarkDescriptor.DEFAULT_HALF_WIDTH))
                .withColors(intValue(key, p, "mark.background", MarkDescriptor.DEFAULT_BACKGROUND),
                    intValue(key, p, "mark.foreground", MarkDescriptor.DEFAULT_FOREGROUND));
        } catch(final IllegalArgumentException iae) {
            throw new ConfigurationException(key + ": invalid mark dimensions. " + iae.getMessage(), iae);
        }

        final List<MarkDescriptor> marks = marks(key, p.getProperty("marks"), lattice, base);
        final List<Point> seeds = seeds(key, p.getProperty("seeds"));

        final MissionConfig ret = new MissionConfig(key, lattice, workingWidth, seeds, marks, windowRadius, searchRadius, outputSize);
        LOGGER.debug("Loaded {}", ret);
        return ret;
    }

    private static List<MarkDescriptor> marks(final MissionKey key, final String value, final LatticeConfiguration lattice,
        final MarkDescriptor base) {
        final List<String> descriptors = list(value);
        if(descriptors.isEmpty()) {
            final List<MarkDescriptor> ret = new ArrayList<>(lattice.size());
            for(int i = 0; i < lattice.size(); i++)
                ret.add(MarkDescriptor.forLatticePosition(lattice.column(i), lattice.row(i), lattice.rowWidth(), lattice.rowCount(), base));
            return ret;
        }
        try {
            return descriptors.stream().map(d -> MarkDescriptor.parse(d, base)).collect(Collectors.toList());
        } catch(final IllegalArgumentException iae) {
            throw new ConfigurationException(key + ": invalid mark descriptor. " + iae.getMessage(), iae);
        }
    }

    // "x y; x y; ..."
    private static List<Point> seeds(final MissionKey key, final String value) {
        final List<Point> ret = new ArrayList<>();
        for(final String pair: split(value, ";")) {
            final List<String> xy = split(pair, "[\\s,]+");
            if(xy.size() != 2)
                throw new ConfigurationException(key + ": the seed \"" + pair + "\" should be an x and a y separated by a space.");
            try {
                ret.add(new Point(Double.parseDouble(xy.get(0)), Double.parseDouble(xy.get(1))));
            } catch(final NumberFormatException nfe) {
                throw new ConfigurationException(key + ": the seed \"" + pair + "\" isn't numeric.", nfe);
            }
        }
        return ret;
    }

    private static List<Integer> ints(final MissionKey key, final Properties p, final String name) {
        final String value = p.getProperty(name);
        if(value == null)
            throw new ConfigurationException(key + ": missing the required entry \"" + key.section() + "." + name + "\"");
        try {
            return list(value).stream().map(Integer::valueOf).collect(Collectors.toList());
        } catch(final NumberFormatException nfe) {
            throw new ConfigurationException(key + ": \"" + name + "\" should be a comma separated list of integers but was \"" + value + "\"",
                nfe);
        }
    }

    private static int intValue(final MissionKey key, final Properties p, final String name, final int defaultValue) {
        final String value = p.getProperty(name);
        if(value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch(final NumberFormatException nfe) {
            throw new ConfigurationException(key + ": \"" + name + "\" should be an integer but was \"" + value + "\"", nfe);
        }
    }
}
