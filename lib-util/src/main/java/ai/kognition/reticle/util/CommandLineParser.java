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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * Builds a map of options from a command line. Given:
 *
 * <pre>
 *   java Rectify unoptioned -mission 7 -channel A -verbose
 * </pre>
 *
 * the parser will hold {@code mission -> "7"}, {@code channel -> "A"} and
 * {@code verbose -> "true"}. Arguments not associated with an option, like
 * {@code unoptioned} above, are available from {@link #getNonOptionArgs()}.
 *
 * <p>
 * A value that itself starts with a {@code '-'} is treated as the next option, not as a value,
 * unless it parses as a number (so {@code -offset -3} works).
 * </p>
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 6310985442231637390L;

    private final List<String> noargs = new ArrayList<>();
    private int argc = 0;

    public CommandLineParser(final String[] args) {
        parse(args);
    }

    public int getTotalArgCount() {
        return argc;
    }

    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(noargs);
    }

    public String getProperty(final String key) {
        return get(key);
    }

    public String getProperty(final String key, final String defaultValue) {
        final String ret = get(key);
        return ret == null ? defaultValue : ret;
    }

    public boolean isSet(final String key) {
        return containsKey(key);
    }

    /**
     * @throws IllegalArgumentException if the option wasn't supplied.
     */
    public String require(final String key) {
        final String ret = get(key);
        if(ret == null)
            throw new IllegalArgumentException("The option \"-" + key + "\" is required.");
        return ret;
    }

    /**
     * @throws IllegalArgumentException if the option was supplied but isn't an integer.
     */
    public int getInt(final String key, final int defaultValue) {
        final String val = get(key);
        if(val == null)
            return defaultValue;
        return parseInt(key, val);
    }

    public int requireInt(final String key) {
        return parseInt(key, require(key));
    }

    private static int parseInt(final String key, final String val) {
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option \"-" + key + "\" requires an integer value but was given \"" + val + "\"", nfe);
        }
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        argc = args.length;

        for(int i = 0; i < argc; i++) {
            final String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(cur.charAt(0) == '-' && cur.length() > 1) {
                final String name = cur.substring(1);
                String val = null;
                if(i + 1 < argc && !looksLikeOption(args[i + 1]))
                    val = args[++i].trim();
                put(name, val == null ? "true" : val);
            } else
                noargs.add(cur);
        }
    }

    private static boolean looksLikeOption(final String arg) {
        final String trimmed = arg.trim();
        if(trimmed.length() < 2 || trimmed.charAt(0) != '-')
            return false;
        // negative numbers are values
        try {
            Double.parseDouble(trimmed);
            return false;
        } catch(final NumberFormatException nfe) {
            return true;
        }
    }
}
