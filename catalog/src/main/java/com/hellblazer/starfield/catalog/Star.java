/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.starfield.catalog;

import javax.vecmath.Point3d;
import java.util.Comparator;
import java.util.Objects;

/**
 * One catalog object: a position in meters, an apparent magnitude (lower is brighter) and its provenance.
 *
 * @author hal.hildebrand
 */
public record Star(double x, double y, double z, float magnitude, Provenance provenance) {

    /** Magnitude assumed for catalog rows that carry none */
    public static final float DEFAULT_MAGNITUDE = 15.0f;

    /** Brightest first */
    public static final Comparator<Star> BY_BRIGHTNESS = Comparator.comparingDouble(Star::magnitude);

    public Star {
        Objects.requireNonNull(provenance, "provenance");
    }

    public Star(Point3d position, float magnitude, Provenance provenance) {
        this(position.x, position.y, position.z, magnitude, provenance);
    }

    public Point3d position() {
        return new Point3d(x, y, z);
    }
}
