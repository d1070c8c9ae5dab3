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

package com.hellblazer.starfield.lod.io;

import java.nio.ByteOrder;

/**
 * Layout of an octree node file.
 *
 * <pre>
 * [Header: 4 bytes]
 *   starCount(int32), never negative
 * [Records: starCount * 20 bytes]
 *   x(float32) + y(float32) + z(float32) + magnitude(float32) + provenance(int32)
 * </pre>
 *
 * All values are little-endian. A node with no stars is exactly the 4 byte header.
 *
 * @author hal.hildebrand
 */
public final class NodeFileFormat {

    public static final ByteOrder BYTE_ORDER     = ByteOrder.LITTLE_ENDIAN;
    public static final int       HEADER_SIZE    = 4;
    public static final int       RECORD_SIZE    = 20;
    public static final String    FILE_EXTENSION = ".bin";

    /** Largest count whose file size still fits in an int sized buffer */
    public static final int MAX_STARS = (Integer.MAX_VALUE - HEADER_SIZE) / RECORD_SIZE;

    private NodeFileFormat() {
        // Utility class
    }

    /**
     * @return the exact size in bytes of a node file holding {@code starCount} stars
     */
    public static long expectedSize(int starCount) {
        if (starCount < 0) {
            throw new IllegalArgumentException("Star count must not be negative: " + starCount);
        }
        return HEADER_SIZE + (long) starCount * RECORD_SIZE;
    }
}
