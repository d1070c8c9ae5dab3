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

package com.hellblazer.starfield.lod;

/**
 * Counts produced by building a subtree. Each node reports its own counts and a parent sums its children's into its
 * own, so no counter is shared between workers.
 *
 * @param nodes        node files written
 * @param internal     nodes that were split and hold a brightest subset
 * @param leaves       nodes holding every star in their volume
 * @param starsWritten star records written across all files
 * @param bytesWritten bytes written across all files
 * @param deepest      greatest depth of any node in the subtree
 * @author hal.hildebrand
 */
public record BuildResult(long nodes, long internal, long leaves, long starsWritten, long bytesWritten, int deepest) {

    public static BuildResult leaf(int depth, int stars, long bytes) {
        return new BuildResult(1, 0, 1, stars, bytes, depth);
    }

    public static BuildResult internal(int depth, int stars, long bytes) {
        return new BuildResult(1, 1, 0, stars, bytes, depth);
    }

    public BuildResult combine(BuildResult other) {
        return new BuildResult(nodes + other.nodes, internal + other.internal, leaves + other.leaves,
                               starsWritten + other.starsWritten, bytesWritten + other.bytesWritten,
                               Math.max(deepest, other.deepest));
    }

    @Override
    public String toString() {
        return String.format("BuildResult[nodes=%d (internal=%d, leaves=%d), stars=%d, bytes=%d, depth=%d]", nodes,
                             internal, leaves, starsWritten, bytesWritten, deepest);
    }
}
