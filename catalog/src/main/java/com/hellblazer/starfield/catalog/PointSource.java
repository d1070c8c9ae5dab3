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

import com.hellblazer.starfield.geometry.BoundingVolume;

import java.util.List;

/**
 * A store of catalog stars that answers volume queries. Implementations must be safe for concurrent use, since the
 * octree builder may query sibling octants in parallel.
 *
 * @author hal.hildebrand
 */
public interface PointSource extends AutoCloseable {

    /** Fraction of each axis' extent added on both sides of the global bounds */
    double BOUNDS_PADDING = 0.10;

    /**
     * The smallest volume containing every star admitted by the filter, padded by {@link #BOUNDS_PADDING}.
     *
     * @throws EmptyDatasetException      if no star matches the filter
     * @throws SourceUnavailableException if the store cannot be reached
     */
    BoundingVolume globalBounds(ProvenanceFilter filter);

    /**
     * Every star admitted by the filter whose position satisfies {@code min <= p <= max} on all axes. A star lying on
     * a face shared by sibling volumes is returned by each of them.
     *
     * @throws SourceUnavailableException if the store cannot be reached
     */
    List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter);

    /**
     * Release any held resources. The default does nothing.
     */
    @Override
    default void close() {
    }
}
