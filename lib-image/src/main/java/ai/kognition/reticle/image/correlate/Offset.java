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

package ai.kognition.reticle.image.correlate;

/**
 * The displacement of an image's content relative to a reference, in pixels. A positive
 * {@code dy} means the content sits below where it does in the reference and a positive
 * {@code dx} means it sits to the right.
 */
public final class Offset {
    public static final Offset ZERO = new Offset(0, 0);

    public final int dy;
    public final int dx;

    public Offset(final int dy, final int dx) {
        this.dy = dy;
        this.dx = dx;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof Offset))
            return false;
        final Offset o = (Offset)obj;
        return dy == o.dy && dx == o.dx;
    }

    @Override
    public int hashCode() {
        return 31 * dy + dx;
    }

    @Override
    public String toString() {
        return "Offset [dy=" + dy + ", dx=" + dx + "]";
    }
}
