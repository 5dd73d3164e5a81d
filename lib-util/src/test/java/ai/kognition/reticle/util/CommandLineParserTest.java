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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class CommandLineParserTest {

    @Test
    public void testOptionsAndFlags() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"extra","-mission","7","-channel","A","-verbose"});

        assertEquals("7", clp.getProperty("mission"));
        assertEquals("A", clp.getProperty("channel"));
        assertEquals("true", clp.getProperty("verbose"));
        assertEquals(List.of("extra"), clp.getNonOptionArgs());
        assertEquals(6, clp.getTotalArgCount());
    }

    @Test
    public void testValueAfterFlagIsTaken() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-verbose","extra"});
        assertEquals("extra", clp.getProperty("verbose"));
        assertTrue(clp.getNonOptionArgs().isEmpty());
    }

    @Test
    public void testFlagFollowedByOption() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-verbose","-threads","4"});
        assertEquals("true", clp.getProperty("verbose"));
        assertEquals(4, clp.getInt("threads", 1));
    }

    @Test
    public void testNegativeNumberIsAValue() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-offset","-3"});
        assertEquals(-3, clp.requireInt("offset"));
    }

    @Test
    public void testDefaults() {
        final CommandLineParser clp = new CommandLineParser(null);
        assertFalse(clp.isSet("threads"));
        assertEquals(8, clp.getInt("threads", 8));
        assertEquals("x", clp.getProperty("config", "x"));
        assertTrue(clp.getNonOptionArgs().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequired() {
        new CommandLineParser(new String[] {"-channel","A"}).require("mission");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadInteger() {
        new CommandLineParser(new String[] {"-mission","seven"}).requireInt("mission");
    }
}
