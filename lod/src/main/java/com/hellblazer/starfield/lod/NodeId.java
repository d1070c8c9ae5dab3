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

import com.hellblazer.starfield.geometry.BoundingVolume;
import com.hellblazer.starfield.lod.io.NodeFileFormat;

import java.util.Arrays;

/**
 * Position of a node in the octree: its depth and the octant taken at each level from the root. The path fully
 * determines the node's volume within the global bounds and its file name.
 * <p>
 * File names are {@code {depth}-{path joined by '-'}.bin}, except the root, which keeps the legacy four token
 * name {@code 0-0-0-0.bin}. A depth 0 name has three tokens after the depth while every other name has exactly
 * {@code depth}, so the mapping stays injective. Loaders rebuild the tree from these names alone.
 *
 * @author hal.hildebrand
 */
public final class NodeId implements Comparable<NodeId> {

    public static final String ROOT_NAME = "0-0-0-0";

    private static final NodeId ROOT = new NodeId(new byte[0]);

    private final byte[] path;

    private NodeId(byte[] path) {
        this.path = path;
    }

    public static NodeId root() {
        return ROOT;
    }

    /**
     * @param path octant indices from the root, each in 0..7
     */
    public static NodeId of(int... path) {
        var node = ROOT;
        for (var octant : path) {
            node = node.child(octant);
        }
        return node;
    }

    /**
     * Parse a node file name, with or without the {@code .bin} extension.
     *
     * @throws IllegalArgumentException if the name is not a node name
     */
    public static NodeId parse(String fileName) {
        var name = fileName;
        if (name.endsWith(NodeFileFormat.FILE_EXTENSION)) {
            name = name.substring(0, name.length() - NodeFileFormat.FILE_EXTENSION.length());
        }
        if (ROOT_NAME.equals(name)) {
            return ROOT;
        }
        var tokens = name.split("-", -1);
        int depth;
        try {
            depth = Integer.parseInt(tokens[0]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a node name: " + fileName, e);
        }
        if (depth <= 0) {
            throw new IllegalArgumentException("Not a node name: " + fileName);
        }
        if (tokens.length - 1 != depth) {
            throw new IllegalArgumentException(
            "Node name " + fileName + " declares depth " + depth + " but has " + (tokens.length - 1) + " octants");
        }
        var path = new byte[depth];
        for (int i = 0; i < depth; i++) {
            var token = tokens[i + 1];
            if (token.length() != 1 || token.charAt(0) < '0' || token.charAt(0) > '7') {
                throw new IllegalArgumentException("Invalid octant '" + token + "' in node name " + fileName);
            }
            path[i] = (byte) (token.charAt(0) - '0');
        }
        var node = new NodeId(path);
        // Reject non canonical spellings such as "01-3" so that parsing stays the inverse of naming
        if (!node.name().equals(name)) {
            throw new IllegalArgumentException("Not a canonical node name: " + fileName);
        }
        return node;
    }

    /**
     * @return true if the name has the node file extension and parses as a node name
     */
    public static boolean isNodeFileName(String fileName) {
        if (!fileName.endsWith(NodeFileFormat.FILE_EXTENSION)) {
            return false;
        }
        try {
            parse(fileName);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public NodeId child(int octant) {
        if (octant < 0 || octant >= BoundingVolume.OCTANTS) {
            throw new IllegalArgumentException("Octant index must be in [0, 7]: " + octant);
        }
        var childPath = Arrays.copyOf(path, path.length + 1);
        childPath[path.length] = (byte) octant;
        return new NodeId(childPath);
    }

    /**
     * @return the parent node, or null for the root
     */
    public NodeId parent() {
        if (isRoot()) {
            return null;
        }
        return new NodeId(Arrays.copyOf(path, path.length - 1));
    }

    public int depth() {
        return path.length;
    }

    public boolean isRoot() {
        return path.length == 0;
    }

    /**
     * @return the octant taken at the given level, 0 being the first step below the root
     */
    public int octant(int level) {
        return path[level];
    }

    /**
     * @return the octant this node occupies within its parent
     */
    public int lastOctant() {
        if (isRoot()) {
            throw new IllegalStateException("The root has no octant");
        }
        return path[path.length - 1];
    }

    public int[] path() {
        var result = new int[path.length];
        for (int i = 0; i < path.length; i++) {
            result[i] = path[i];
        }
        return result;
    }

    /**
     * Derive this node's volume by repeated subdivision of the global volume.
     */
    public BoundingVolume volumeWithin(BoundingVolume global) {
        var volume = global;
        for (var octant : path) {
            volume = volume.octant(octant);
        }
        return volume;
    }

    public String name() {
        if (isRoot()) {
            return ROOT_NAME;
        }
        var name = new StringBuilder().append(path.length);
        for (var octant : path) {
            name.append('-').append(octant);
        }
        return name.toString();
    }

    public String fileName() {
        return name() + NodeFileFormat.FILE_EXTENSION;
    }

    /**
     * Depth first order: a node sorts before its descendants, siblings by octant.
     */
    @Override
    public int compareTo(NodeId o) {
        return Arrays.compare(path, o.path);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeId other && Arrays.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(path);
    }

    @Override
    public String toString() {
        return "Node[depth=" + path.length + ", path=" + Arrays.toString(path()) + "]";
    }
}
