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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Point source over an immutable, in-memory list of stars. Queries are linear scans; safe for concurrent use.
 *
 * @author hal.hildebrand
 */
public class InMemoryPointSource implements PointSource {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPointSource.class);

    private final List<Star> stars;

    public InMemoryPointSource(Collection<Star> stars) {
        this.stars = List.copyOf(stars);
        log.debug("In memory point source created with {} stars", this.stars.size());
    }

    @Override
    public BoundingVolume globalBounds(ProvenanceFilter filter) {
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY, minZ = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY, maxZ = Double.NEGATIVE_INFINITY;
        int matched = 0;
        for (var star : stars) {
            if (!filter.accepts(star.provenance())) {
                continue;
            }
            matched++;
            minX = Math.min(minX, star.x());
            minY = Math.min(minY, star.y());
            minZ = Math.min(minZ, star.z());
            maxX = Math.max(maxX, star.x());
            maxY = Math.max(maxY, star.y());
            maxZ = Math.max(maxZ, star.z());
        }
        if (matched == 0) {
            throw new EmptyDatasetException(filter);
        }
        return new BoundingVolume(minX, minY, minZ, maxX, maxY, maxZ).padded(BOUNDS_PADDING);
    }

    @Override
    public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
        var result = new ArrayList<Star>();
        for (var star : stars) {
            if (filter.accepts(star.provenance()) && volume.contains(star.position())) {
                result.add(star);
            }
        }
        return result;
    }

    public int size() {
        return stars.size();
    }
}
