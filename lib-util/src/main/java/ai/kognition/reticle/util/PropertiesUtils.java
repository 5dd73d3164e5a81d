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

import java.io.BufferedInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

public class PropertiesUtils {
    public static final String separator = ".";

    /**
     * Select all of the properties whose keys start with {@code sectionName + "."}. When
     * {@code removeSectionName} is set, the section prefix is stripped from the returned keys.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(prefix)) {
                final String newkey = removeSectionName ? key.substring(prefix.length()) : key;
                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName)
                ret.setProperty(key, props.getProperty(key));
        }

        return ret;
    }

    /**
     * Returns a new {@link Properties} holding everything in {@code base} with every entry in
     * {@code overrides} replacing (or adding to) it.
     */
    public static Properties overlay(final Properties base, final Properties overrides) {
        final Properties ret = new Properties();
        base.stringPropertyNames().forEach(k -> ret.setProperty(k, base.getProperty(k)));
        overrides.stringPropertyNames().forEach(k -> ret.setProperty(k, overrides.getProperty(k)));
        return ret;
    }

    public static Properties loadProps(final String fname) throws IOException {
        try(InputStream is = new BufferedInputStream(new FileInputStream(fname));) {
            final Properties ret = new Properties();
            ret.load(is);
            return ret;
        }
    }

    public static Properties loadResource(final String resource) throws IOException {
        try(InputStream is = PropertiesUtils.class.getClassLoader().getResourceAsStream(resource);) {
            if(is == null)
                throw new IOException("Couldn't find the resource \"" + resource + "\" on the classpath");
            final Properties ret = new Properties();
            ret.load(is);
            return ret;
        }
    }

    /**
     * Splits a comma separated value into trimmed, non-empty elements.
     */
    public static List<String> list(final String value) {
        return split(value, ",");
    }

    public static List<String> split(final String value, final String regex) {
        if(value == null)
            return List.of();
        return Arrays.stream(value.split(regex))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
