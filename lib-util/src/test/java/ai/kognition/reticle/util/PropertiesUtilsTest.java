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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PropertiesUtilsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testGetSection() {
        final Properties props = new Properties();
        props.setProperty("mission.7.A.workingWidth", "1150");
        props.setProperty("mission.7.A.lattice.x", "-2,-1,0,1,2");
        props.setProperty("mission.7.B.workingWidth", "1200");
        props.setProperty("defaults.searchRadius", "20");

        final Properties stripped = PropertiesUtils.getSection(props, "mission.7.A", true);
        assertEquals(2, stripped.size());
        assertEquals("1150", stripped.getProperty("workingWidth"));
        assertEquals("-2,-1,0,1,2", stripped.getProperty("lattice.x"));

        final Properties kept = PropertiesUtils.getSection(props, "mission.7", false);
        assertEquals(3, kept.size());
        assertEquals("1200", kept.getProperty("mission.7.B.workingWidth"));
        assertNull(kept.getProperty("defaults.searchRadius"));
    }

    @Test
    public void testOverlay() {
        final Properties base = new Properties();
        base.setProperty("a", "1");
        base.setProperty("b", "2");
        final Properties over = new Properties();
        over.setProperty("b", "3");
        over.setProperty("c", "4");

        final Properties result = PropertiesUtils.overlay(base, over);
        assertEquals("1", result.getProperty("a"));
        assertEquals("3", result.getProperty("b"));
        assertEquals("4", result.getProperty("c"));
        assertEquals("2", base.getProperty("b"));
    }

    @Test
    public void testLoadProps() throws IOException {
        final File file = tmp.newFile("test.properties");
        final Properties props = new Properties();
        props.setProperty("mission.8.B.workingWidth", "1150");
        try(OutputStream os = new FileOutputStream(file);) {
            props.store(os, "test");
        }

        assertEquals("1150", PropertiesUtils.loadProps(file.getAbsolutePath()).getProperty("mission.8.B.workingWidth"));
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        PropertiesUtils.loadResource("no-such-resource.properties");
    }

    @Test
    public void testLists() {
        assertEquals(List.of("-2", "-1", "0"), PropertiesUtils.list(" -2, -1 ,0, "));
        assertEquals(List.of("1 2", "3 4"), PropertiesUtils.split("1 2; 3 4;", ";"));
        assertTrue(PropertiesUtils.list(null).isEmpty());
    }
}
