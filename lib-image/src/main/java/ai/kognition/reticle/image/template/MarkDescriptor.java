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

package ai.kognition.reticle.image.template;

import java.util.Locale;
import java.util.Objects;

/**
 * <p>
 * Describes the shape of a reticle mark template: a cross centered in a {@code 2r x 2r} raster
 * with any subset of its four arms present. Instances are immutable; the {@code with*} methods
 * return modified copies.
 * </p>
 *
 * <p>
 * The compact text form used in configuration is the letters of the arms present, in any order,
 * optionally followed by {@code ':'} and an arm length. For example {@code "NSEW"} is a full cross
 * and {@code "NE:50"} is an upper right corner with 50 pixel arms.
 * </p>
 */
public final class MarkDescriptor {
    public static final int DEFAULT_RADIUS = 50;
    public static final int DEFAULT_ARM_LENGTH = 30;
    public static final int DEFAULT_HALF_WIDTH = 2;
    public static final int DEFAULT_BACKGROUND = 0;
    public static final int DEFAULT_FOREGROUND = 255;

    /**
     * A full cross with every dimension at its default.
     */
    public static final MarkDescriptor FULL_CROSS = new MarkDescriptor(true, true, true, true, DEFAULT_RADIUS, DEFAULT_ARM_LENGTH,
        DEFAULT_HALF_WIDTH, DEFAULT_BACKGROUND, DEFAULT_FOREGROUND);

    public final boolean north;
    public final boolean south;
    public final boolean east;
    public final boolean west;
    public final int radius;
    public final int armLength;
    public final int halfWidth;
    public final int background;
    public final int foreground;

    private MarkDescriptor(final boolean north, final boolean south, final boolean east, final boolean west, final int radius,
        final int armLength, final int halfWidth, final int background, final int foreground) {
        if(radius <= 0)
            throw new IllegalArgumentException("A mark radius must be positive but was " + radius);
        if(armLength < 0 || halfWidth < 0)
            throw new IllegalArgumentException("Mark arm length and half width can't be negative: " + armLength + ", " + halfWidth);
        checkPixel("background", background);
        checkPixel("foreground", foreground);
        this.north = north;
        this.south = south;
        this.east = east;
        this.west = west;
        this.radius = radius;
        this.armLength = armLength;
        this.halfWidth = halfWidth;
        this.background = background;
        this.foreground = foreground;
    }

    public MarkDescriptor withArms(final boolean n, final boolean s, final boolean e, final boolean w) {
        return new MarkDescriptor(n, s, e, w, radius, armLength, halfWidth, background, foreground);
    }

    public MarkDescriptor withRadius(final int r) {
        return new MarkDescriptor(north, south, east, west, r, armLength, halfWidth, background, foreground);
    }

    public MarkDescriptor withArmLength(final int length) {
        return new MarkDescriptor(north, south, east, west, radius, length, halfWidth, background, foreground);
    }

    public MarkDescriptor withHalfWidth(final int w2) {
        return new MarkDescriptor(north, south, east, west, radius, armLength, w2, background, foreground);
    }

    public MarkDescriptor withColors(final int bg, final int fg) {
        return new MarkDescriptor(north, south, east, west, radius, armLength, halfWidth, bg, fg);
    }

    /**
     * Parse the compact form (see the class comment). Anything not given in {@code text} is taken
     * from {@code base}.
     *
     * @throws IllegalArgumentException if {@code text} isn't a valid descriptor.
     */
    public static MarkDescriptor parse(final String text, final MarkDescriptor base) {
        if(text == null || text.trim().isEmpty())
            throw new IllegalArgumentException("Empty mark descriptor.");

        final String trimmed = text.trim();
        final int colon = trimmed.indexOf(':');
        final String arms = (colon < 0 ? trimmed : trimmed.substring(0, colon)).toUpperCase(Locale.ROOT);

        boolean n = false, s = false, e = false, w = false;
        for(final char c: arms.toCharArray()) {
            switch(c) {
                case 'N':
                    n = true;
                    break;
                case 'S':
                    s = true;
                    break;
                case 'E':
                    e = true;
                    break;
                case 'W':
                    w = true;
                    break;
                default:
                    throw new IllegalArgumentException("Invalid arm '" + c + "' in mark descriptor \"" + text + "\". Expected some of N, S, E or W.");
            }
        }

        MarkDescriptor ret = base.withArms(n, s, e, w);
        if(colon >= 0) {
            final String length = trimmed.substring(colon + 1).trim();
            try {
                ret = ret.withArmLength(Integer.parseInt(length));
            } catch(final NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid arm length \"" + length + "\" in mark descriptor \"" + text + "\"", nfe);
            }
        }
        return ret;
    }

    /**
     * Derive the arms from where a mark sits in a grid that's {@code columns} wide and {@code rows}
     * high with row 0 at the top. An arm is present only if there's another mark in that direction.
     */
    public static MarkDescriptor forLatticePosition(final int column, final int row, final int columns, final int rows,
        final MarkDescriptor base) {
        if(column < 0 || column >= columns || row < 0 || row >= rows)
            throw new IllegalArgumentException("Position (" + column + ", " + row + ") isn't in a " + columns + "x" + rows + " grid.");
        return base.withArms(row > 0, row < rows - 1, column < columns - 1, column > 0);
    }

    /**
     * The compact form of this descriptor's arms and arm length.
     */
    public String toCompactString() {
        final StringBuilder sb = new StringBuilder();
        if(north)
            sb.append('N');
        if(south)
            sb.append('S');
        if(east)
            sb.append('E');
        if(west)
            sb.append('W');
        return sb.append(':').append(armLength).toString();
    }

    private static void checkPixel(final String name, final int value) {
        if(value < 0 || value > 255)
            throw new IllegalArgumentException("The mark " + name + " must be in [0, 255] but was " + value);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof MarkDescriptor))
            return false;
        final MarkDescriptor o = (MarkDescriptor)obj;
        return north == o.north && south == o.south && east == o.east && west == o.west && radius == o.radius
            && armLength == o.armLength && halfWidth == o.halfWidth && background == o.background && foreground == o.foreground;
    }

    @Override
    public int hashCode() {
        return Objects.hash(north, south, east, west, radius, armLength, halfWidth, background, foreground);
    }

    @Override
    public String toString() {
        return "MarkDescriptor [" + toCompactString() + ", radius=" + radius + ", halfWidth=" + halfWidth + ", background=" + background
            + ", foreground=" + foreground + "]";
    }
}
