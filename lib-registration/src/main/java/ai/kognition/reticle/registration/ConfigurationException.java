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

/**
 * Thrown when a mission's configuration is missing, malformed or inconsistent (for example the
 * number of seeds doesn't match the number of lattice points).
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 3411925532879409174L;

    public ConfigurationException(final String msg) {
        super(msg);
    }

    public ConfigurationException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
