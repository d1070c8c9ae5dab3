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
 * An octree build aborted. Files written before the failure are left in place and the tree must be treated as
 * incomplete.
 *
 * @author hal.hildebrand
 */
public class OctreeBuildException extends RuntimeException {

    private final NodeId failedNode;
    private final NodeId deepestReached;

    /**
     * @param failedNode     the node whose query or write failed
     * @param deepestReached the deepest node visited before the failure, or null if none was
     */
    public OctreeBuildException(NodeId failedNode, NodeId deepestReached, Throwable cause) {
        super(describe(failedNode, deepestReached, cause), cause);
        this.failedNode = failedNode;
        this.deepestReached = deepestReached;
    }

    public NodeId getFailedNode() {
        return failedNode;
    }

    /**
     * @return the deepest node visited before the build aborted, or null if it failed before visiting any
     */
    public NodeId getDeepestReached() {
        return deepestReached;
    }

    private static String describe(NodeId failedNode, NodeId deepestReached, Throwable cause) {
        return String.format("Octree build aborted at %s (%s); deepest node reached: %s; octree is incomplete: %s",
                             failedNode.name(), failedNode,
                             deepestReached == null ? "none" : deepestReached.name(),
                             cause == null ? "unknown cause" : cause.getMessage());
    }
}
