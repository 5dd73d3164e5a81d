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

package ai.kognition.reticle.image;

import java.util.LinkedList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manage resources from a single place. Resources are closed in the reverse of the order
 * they were added.
 */
public class Closer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Closer.class);

    private final List<AutoCloseable> toClose = new LinkedList<>();

    public <T extends AutoCloseable> T add(final T resource) {
        if(resource != null)
            toClose.add(0, resource);
        return resource;
    }

    @Override
    public void close() {
        RuntimeException first = null;
        for(final AutoCloseable r: toClose) {
            try {
                r.close();
            } catch(final Exception e) {
                LOGGER.warn("Failed to close {}", r, e);
                if(first == null)
                    first = (e instanceof RuntimeException) ? (RuntimeException)e : new IllegalStateException("Failed to close " + r, e);
            }
        }
        toClose.clear();
        if(first != null)
            throw first;
    }
}
