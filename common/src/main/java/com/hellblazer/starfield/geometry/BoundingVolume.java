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

package com.hellblazer.starfield.geometry;

import javax.vecmath.Point3d;

/**
 * Axis aligned box in double precision, used as the volume of an octree node. Bounds are inclusive on both faces,
 * so a point lying on a face shared by two siblings is contained by both.
 * <p>
 * Octant indexing uses the three low bits of the index:
 *
 * <pre>
 *   bit 2 (4): upper half on X
 *   bit 1 (2): upper half on Y
 *   bit 0 (1): upper half on Z
 * </pre>
 *
 * So octant 0 is (-x, -y, -z) and octant 7 is (+x, +y, +z).
 *
 * @author hal.hildebrand
 */
public record BoundingVolume(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {

    /** The degenerate volume at the origin, used when a catalog has no stars */
    public static final BoundingVolume ZERO = new BoundingVolume(0, 0, 0, 0, 0, 0);

    public static final int OCTANTS = 8;

    public BoundingVolume {
        if (Double.isNaN(minX) || Double.isNaN(minY) || Double.isNaN(minZ) || Double.isNaN(maxX) || Double.isNaN(
        maxY) || Double.isNaN(maxZ)) {
            throw new IllegalArgumentException("Bounding volume coordinates must not be NaN");
        }
        if (minX > maxX || minY > maxY || minZ > maxZ) {
            throw new IllegalArgumentException(
            String.format("Inverted bounding volume: min=(%s, %s, %s) max=(%s, %s, %s)", minX, minY, minZ, maxX,
                          maxY, maxZ));
        }
    }

    public Point3d center() {
        return new Point3d((minX + maxX) / 2, (minY + maxY) / 2, (minZ + maxZ) / 2);
    }

    /**
     * Answer one of the eight children of this volume, split about the center on every axis. Siblings share the exact
     * same split coordinate, so the eight children tile this volume with no gap and overlap only on shared faces.
     *
     * @param index octant index, 0..7
     * @return the child volume
     */
    public BoundingVolume octant(int index) {
        if (index < 0 || index >= OCTANTS) {
            throw new IllegalArgumentException("Octant index must be in [0, 7]: " + index);
        }
        var center = center();
        var cx = center.x;
        var cy = center.y;
        var cz = center.z;

        var upperX = (index & 0b100) != 0;
        var upperY = (index & 0b010) != 0;
        var upperZ = (index & 0b001) != 0;

        return new BoundingVolume(upperX ? cx : minX, upperY ? cy : minY, upperZ ? cz : minZ, upperX ? maxX : cx,
                                  upperY ? maxY : cy, upperZ ? maxZ : cz);
    }

    /**
     * Inclusive containment: {@code min <= p <= max} on every axis.
     */
    public boolean contains(double x, double y, double z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    /**
     * Inclusive containment of a position.
     */
    public boolean contains(Point3d point) {
        return contains(point.x, point.y, point.z);
    }

    /**
     * Expand every axis by {@code fraction} of its extent on both sides. An axis with no extent is padded by
     * {@code fraction} of its largest absolute coordinate instead, so a flat or single point catalog still encloses
     * some volume. A volume sitting exactly on the origin stays degenerate.
     *
     * @param fraction padding fraction, must be non-negative
     * @return the padded volume
     */
    public BoundingVolume padded(double fraction) {
        if (!(fraction >= 0)) {
            throw new IllegalArgumentException("Padding fraction must be non-negative: " + fraction);
        }
        var padX = padding(extentX(), minX, maxX, fraction);
        var padY = padding(extentY(), minY, maxY, fraction);
        var padZ = padding(extentZ(), minZ, maxZ, fraction);
        return new BoundingVolume(minX - padX, minY - padY, minZ - padZ, maxX + padX, maxY + padY, maxZ + padZ);
    }

    public double extentX() {
        return maxX - minX;
    }

    public double extentY() {
        return maxY - minY;
    }

    public double extentZ() {
        return maxZ - minZ;
    }

    @Override
    public String toString() {
        return String.format("BoundingVolume[(%.4e, %.4e, %.4e) -> (%.4e, %.4e, %.4e)]", minX, minY, minZ, maxX, maxY,
                             maxZ);
    }

    private static double padding(double extent, double min, double max, double fraction) {
        if (extent > 0) {
            return extent * fraction;
        }
        return Math.max(Math.abs(min), Math.abs(max)) * fraction;
    }
}
