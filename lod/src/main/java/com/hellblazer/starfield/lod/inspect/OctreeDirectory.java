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

package com.hellblazer.starfield.lod.inspect;

import com.hellblazer.starfield.catalog.Star;
import com.hellblazer.starfield.geometry.BoundingVolume;
import com.hellblazer.starfield.lod.NodeId;
import com.hellblazer.starfield.lod.io.CorruptRecordException;
import com.hellblazer.starfield.lod.io.NodeDeserializer;
import com.hellblazer.starfield.lod.io.NodeFileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An octree output directory, reconstructed from node file names alone, the way a loader sees it. Inspection checks
 * that every file's size agrees with its header and that the names form a tree: a root, a parent for every other
 * node, and all eight children under every split node.
 *
 * @author hal.hildebrand
 */
public class OctreeDirectory {
    private static final Logger log        = LoggerFactory.getLogger(OctreeDirectory.class);
    private static final String TMP_SUFFIX = NodeFileFormat.FILE_EXTENSION + ".tmp";

    private final Path                                directory;
    private final NavigableMap<NodeId, NodeFileReport> nodes;
    private final List<String>                        problems;

    private OctreeDirectory(Path directory, NavigableMap<NodeId, NodeFileReport> nodes, List<String> problems) {
        this.directory = directory;
        this.nodes = Collections.unmodifiableNavigableMap(nodes);
        this.problems = Collections.unmodifiableList(problems);
    }

    /**
     * Scan and verify a directory.
     *
     * @throws IOException if the directory cannot be listed
     */
    public static OctreeDirectory scan(Path directory) throws IOException {
        var deserializer = new NodeDeserializer();
        var nodes = new TreeMap<NodeId, NodeFileReport>();
        var problems = new ArrayList<String>();

        List<Path> files;
        try (var entries = Files.list(directory)) {
            files = entries.sorted().toList();
        }
        for (var file : files) {
            var fileName = file.getFileName().toString();
            if (fileName.endsWith(TMP_SUFFIX)) {
                problems.add("Unpublished temporary file: " + fileName);
                continue;
            }
            if (!NodeId.isNodeFileName(fileName)) {
                log.debug("Ignoring {}", fileName);
                continue;
            }
            var report = verify(NodeId.parse(fileName), file, deserializer);
            if (!report.isValid()) {
                problems.add(fileName + ": " + report.problem());
            }
            nodes.put(report.node(), report);
        }

        if (!nodes.isEmpty() && !nodes.containsKey(NodeId.root())) {
            problems.add("Missing root " + NodeId.root().fileName());
        }
        var splitNodes = new TreeSet<NodeId>();
        for (var node : nodes.keySet()) {
            if (node.isRoot()) {
                continue;
            }
            var parent = node.parent();
            if (!nodes.containsKey(parent)) {
                problems.add(node.fileName() + ": missing parent " + parent.fileName());
            }
            splitNodes.add(parent);
        }
        for (var parent : splitNodes) {
            for (int octant = 0; octant < BoundingVolume.OCTANTS; octant++) {
                var child = parent.child(octant);
                if (!nodes.containsKey(child)) {
                    problems.add(parent.fileName() + ": split but missing child " + child.fileName());
                }
            }
        }
        log.info("Scanned {}: {} nodes, {} problems", directory, nodes.size(), problems.size());
        return new OctreeDirectory(directory, nodes, problems);
    }

    private static NodeFileReport verify(NodeId node, Path file, NodeDeserializer deserializer) throws IOException {
        var size = Files.size(file);
        int count;
        try {
            count = deserializer.readCount(file);
        } catch (CorruptRecordException e) {
            return new NodeFileReport(node, file, -1, size, e.getMessage());
        }
        var expected = NodeFileFormat.expectedSize(count);
        if (size != expected) {
            return new NodeFileReport(node, file, count, size,
                                      "header declares " + count + " stars (" + expected + " bytes) but file is "
                                      + size + " bytes");
        }
        return new NodeFileReport(node, file, count, size, null);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return every node found, in depth first order
     */
    public NavigableMap<NodeId, NodeFileReport> getNodes() {
        return nodes;
    }

    public List<String> getProblems() {
        return problems;
    }

    /**
     * @return true if a root exists, every file is valid and the names form a complete tree
     */
    public boolean isComplete() {
        return !nodes.isEmpty() && problems.isEmpty();
    }

    /**
     * @return true if the node was split, meaning its file holds a brightest subset rather than every star
     */
    public boolean isInternal(NodeId node) {
        return nodes.containsKey(node.child(0));
    }

    /**
     * @return the children present on disk, in octant order
     */
    public List<NodeId> children(NodeId node) {
        var children = new ArrayList<NodeId>();
        for (int octant = 0; octant < BoundingVolume.OCTANTS; octant++) {
            var child = node.child(octant);
            if (nodes.containsKey(child)) {
                children.add(child);
            }
        }
        return children;
    }

    public int maxDepth() {
        return nodes.keySet().stream().mapToInt(NodeId::depth).max().orElse(-1);
    }

    public long leafCount() {
        return nodes.keySet().stream().filter(n -> !isInternal(n)).count();
    }

    public long totalStars() {
        return nodes.values().stream().filter(NodeFileReport::isValid).mapToLong(NodeFileReport::starCount).sum();
    }

    /**
     * Decode one node's stars.
     *
     * @throws IllegalArgumentException if the node is not in this directory
     * @throws IOException              if the file cannot be read or is corrupt
     */
    public List<Star> read(NodeId node) throws IOException {
        var report = nodes.get(node);
        if (report == null) {
            throw new IllegalArgumentException("No such node in " + directory + ": " + node.name());
        }
        return new NodeDeserializer().read(report.file());
    }
}
