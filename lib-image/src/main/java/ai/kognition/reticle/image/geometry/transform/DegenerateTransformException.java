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

package ai.kognition.reticle.image.geometry.transform;

/**
 * Thrown when an {@link AffineTransform} that needs to be inverted is singular.
 */
public class DegenerateTransformException extends RuntimeException {
    private static final long serialVersionUID = -2294120377815536271L;

    public final AffineTransform transform;

    public DegenerateTransformException(final AffineTransform transform) {
        super("The transform " + transform + " is singular (determinant " + transform.determinant() + ") and has no inverse.");
        this.transform = transform;
    }

    public DegenerateTransformException(final String msg, final AffineTransform transform) {
        super(msg);
        this.transform = transform;
    }
}
