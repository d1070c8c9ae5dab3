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

import com.hellblazer.starfield.catalog.EmptyDatasetException;
import com.hellblazer.starfield.catalog.PointSource;
import com.hellblazer.starfield.geometry.BoundingVolume;
import com.hellblazer.starfield.lod.io.NodeSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Builds the level of detail octree of a star catalog as one node file per visited node.
 * <p>
 * Every node queries the catalog for the stars in its volume. A node holding more than
 * {@link OctreeBuildConfig#getMaxPointsPerNode()} stars above {@link OctreeBuildConfig#getMaxDepth()} is internal:
 * it writes the brightest {@link OctreeBuildConfig#getLodFraction()} of its stars and then builds its eight octants.
 * Any other node is a leaf and writes all of its stars. A node's file is complete before its children start.
 * <p>
 * With a parallelism of 1 the build is a depth first recursion on the calling thread. Otherwise sibling subtrees
 * are built as fork/join tasks; their volumes and file names are disjoint, so they share nothing but the point
 * source.
 * <p>
 * The first failure to query or write any node aborts the build with an {@link OctreeBuildException}. Workers
 * still running stop before their next query or write, and {@link #build()} returns only after they have.
 *
 * @author hal.hildebrand
 */
public class OctreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(OctreeBuilder.class);

    private final PointSource       source;
    private final OctreeBuildConfig config;
    private final NodeSerializer    serializer;

    /**
     * @throws InvalidConfigurationException if the configuration is invalid
     */
    public OctreeBuilder(PointSource source, OctreeBuildConfig config) {
        this(source, config, new NodeSerializer());
    }

    OctreeBuilder(PointSource source, OctreeBuildConfig config, NodeSerializer serializer) {
        this.config = config.validate();
        this.source = source;
        this.serializer = serializer;
    }

    /**
     * Build the whole octree.
     *
     * @return the counts of the completed build
     * @throws OctreeBuildException if any node could not be queried or written
     */
    public BuildResult build() {
        var start = System.currentTimeMillis();
        log.info("Building octree: {}", config);

        var progress = new Progress();
        BoundingVolume global;
        try {
            global = source.globalBounds(config.getProvenanceFilter());
        } catch (EmptyDatasetException e) {
            log.warn("{}; writing an empty root", e.getMessage());
            return finish(emptyRoot(progress), start);
        } catch (RuntimeException e) {
            throw new OctreeBuildException(NodeId.root(), null, e);
        }
        log.info("Global bounds: {}", global);

        BuildResult result;
        var parallelism = config.effectiveParallelism();
        if (parallelism == 1) {
            result = buildSubtree(NodeId.root(), global, progress);
        } else {
            var pool = new ForkJoinPool(parallelism);
            try {
                result = pool.invoke(new NodeTask(NodeId.root(), global, progress));
            } catch (RuntimeException e) {
                var failure = progress.failure();
                throw failure != null ? failure : e;
            } finally {
                shutdown(pool);
            }
        }
        return finish(result, start);
    }

    private BuildResult buildSubtree(NodeId node, BoundingVolume volume, Progress progress) {
        var visited = visit(node, volume, progress);
        var result = visited.result();
        if (visited.split()) {
            for (int octant = 0; octant < BoundingVolume.OCTANTS; octant++) {
                result = result.combine(buildSubtree(node.child(octant), volume.octant(octant), progress));
            }
        }
        return result;
    }

    /**
     * Query, decide and write a single node. Nothing is queried or written once any node has failed.
     */
    private Visit visit(NodeId node, BoundingVolume volume, Progress progress) {
        progress.checkRunning();
        progress.visit(node);
        try {
            var stars = source.pointsIn(volume, config.getProvenanceFilter());
            progress.checkRunning();
            var depth = node.depth();
            log.debug("Depth {}, octant path {}: {} stars", depth, node.name(), stars.size());

            if (config.shouldSplit(stars.size(), depth)) {
                var lod = LodSelector.brightestCount(stars, config.lodRetainCount(stars.size()));
                var bytes = serializer.write(lod, fileOf(node));
                return new Visit(BuildResult.internal(depth, lod.size(), bytes), true);
            }
            var bytes = serializer.write(stars, fileOf(node));
            return new Visit(BuildResult.leaf(depth, stars.size(), bytes), false);
        } catch (OctreeBuildException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw progress.fail(node, e);
        }
    }

    private BuildResult emptyRoot(Progress progress) {
        var root = NodeId.root();
        progress.visit(root);
        try {
            return BuildResult.leaf(0, 0, serializer.write(List.of(), fileOf(root)));
        } catch (IOException | RuntimeException e) {
            throw progress.fail(root, e);
        }
    }

    private Path fileOf(NodeId node) {
        return config.getOutputDirectory().resolve(node.fileName());
    }

    private BuildResult finish(BuildResult result, long start) {
        log.info("Octree complete in {} ms: {} nodes ({} internal, {} leaves), {} stars, depth {}, output {}",
                 System.currentTimeMillis() - start, result.nodes(), result.internal(), result.leaves(),
                 result.starsWritten(), result.deepest(), config.getOutputDirectory().toAbsolutePath());
        return result;
    }

    /**
     * Wait for tasks still draining after a failure, so that nothing touches the output once the build returns.
     */
    private static void shutdown(ForkJoinPool pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(60, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Visit(BuildResult result, boolean split) {
    }

    /**
     * Shared by every worker of one build: the deepest node visited and the first failure. Counts travel through
     * {@link BuildResult} instead.
     */
    private static class Progress {
        private final AtomicReference<NodeId>               deepest = new AtomicReference<>();
        private final AtomicReference<OctreeBuildException> failure = new AtomicReference<>();

        void visit(NodeId node) {
            deepest.accumulateAndGet(node, (current, candidate) -> {
                if (current == null || candidate.depth() > current.depth()) {
                    return candidate;
                }
                return current;
            });
        }

        NodeId deepest() {
            return deepest.get();
        }

        /**
         * Record a node failure.
         *
         * @return the first failure of the build, which aborts it
         */
        OctreeBuildException fail(NodeId node, Exception cause) {
            var candidate = new OctreeBuildException(node, deepest(), cause);
            if (!failure.compareAndSet(null, candidate)) {
                log.debug("Ignoring failure at {} after abort: {}", node.name(), cause.toString());
            }
            return failure.get();
        }

        OctreeBuildException failure() {
            return failure.get();
        }

        /**
         * @throws OctreeBuildException the first failure, once any node has failed
         */
        void checkRunning() {
            var first = failure.get();
            if (first != null) {
                throw first;
            }
        }
    }

    private class NodeTask extends RecursiveTask<BuildResult> {
        private final NodeId         node;
        private final BoundingVolume volume;
        private final Progress       progress;

        NodeTask(NodeId node, BoundingVolume volume, Progress progress) {
            this.node = node;
            this.volume = volume;
            this.progress = progress;
        }

        @Override
        protected BuildResult compute() {
            var visited = visit(node, volume, progress);
            var result = visited.result();
            if (!visited.split()) {
                return result;
            }
            progress.checkRunning();
            var children = new ArrayList<NodeTask>(BoundingVolume.OCTANTS);
            for (int octant = 0; octant < BoundingVolume.OCTANTS; octant++) {
                children.add(new NodeTask(node.child(octant), volume.octant(octant), progress));
            }
            for (var child : invokeAll(children)) {
                result = result.combine(child.join());
            }
            return result;
        }
    }
}
