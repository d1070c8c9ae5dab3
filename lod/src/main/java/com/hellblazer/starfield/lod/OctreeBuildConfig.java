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

import com.hellblazer.starfield.catalog.ProvenanceFilter;

import java.nio.file.Path;

/**
 * Policy and output settings for an octree build. Setters are fluent and do not validate individually; the builder
 * calls {@link #validate()} before touching the catalog or the file system, so a bad value is reported in full at
 * startup.
 *
 * @author hal.hildebrand
 */
public class OctreeBuildConfig {

    public static final int    DEFAULT_MAX_POINTS_PER_NODE = 50_000;
    public static final int    DEFAULT_MAX_DEPTH           = 5;
    public static final double DEFAULT_LOD_FRACTION        = 0.10;
    public static final Path   DEFAULT_OUTPUT_DIRECTORY    = Path.of("data", "octree");

    private int              maxPointsPerNode = DEFAULT_MAX_POINTS_PER_NODE;
    private int              maxDepth         = DEFAULT_MAX_DEPTH;
    private double           lodFraction      = DEFAULT_LOD_FRACTION;
    private ProvenanceFilter provenanceFilter = ProvenanceFilter.ALL;
    private Path             outputDirectory  = DEFAULT_OUTPUT_DIRECTORY;
    private int              parallelism      = 1;

    /**
     * Nodes holding more stars than this are split, depth permitting.
     */
    public int getMaxPointsPerNode() {
        return maxPointsPerNode;
    }

    /**
     * Nodes at this depth are always leaves.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Fraction of an internal node's stars, brightest first, kept in its own file.
     */
    public double getLodFraction() {
        return lodFraction;
    }

    public ProvenanceFilter getProvenanceFilter() {
        return provenanceFilter;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Worker threads used to build sibling subtrees. 1 builds depth first on the calling thread; 0 uses every
     * available processor.
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * @return the configured parallelism with 0 resolved to the processor count
     */
    public int effectiveParallelism() {
        return parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
    }

    /**
     * The split rule: strictly more stars than the threshold, and room to go deeper.
     */
    public boolean shouldSplit(int pointCount, int depth) {
        return pointCount > maxPointsPerNode && depth < maxDepth;
    }

    /**
     * @return how many stars an internal node of {@code pointCount} stars keeps, never less than one
     */
    public int lodRetainCount(int pointCount) {
        return Math.max(1, (int) Math.floor(pointCount * lodFraction));
    }

    public OctreeBuildConfig withMaxPointsPerNode(int maxPointsPerNode) {
        this.maxPointsPerNode = maxPointsPerNode;
        return this;
    }

    public OctreeBuildConfig withMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }

    public OctreeBuildConfig withLodFraction(double lodFraction) {
        this.lodFraction = lodFraction;
        return this;
    }

    public OctreeBuildConfig withProvenanceFilter(ProvenanceFilter provenanceFilter) {
        this.provenanceFilter = provenanceFilter;
        return this;
    }

    public OctreeBuildConfig withOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public OctreeBuildConfig withParallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    /**
     * @throws InvalidConfigurationException naming the first invalid setting
     */
    public OctreeBuildConfig validate() {
        if (maxPointsPerNode <= 0) {
            throw new InvalidConfigurationException("Max points per node must be positive: " + maxPointsPerNode);
        }
        if (maxDepth < 0) {
            throw new InvalidConfigurationException("Max depth must not be negative: " + maxDepth);
        }
        if (!(lodFraction > 0 && lodFraction <= 1)) {
            throw new InvalidConfigurationException("LOD fraction must be in (0, 1]: " + lodFraction);
        }
        if (parallelism < 0) {
            throw new InvalidConfigurationException("Parallelism must not be negative: " + parallelism);
        }
        if (provenanceFilter == null) {
            throw new InvalidConfigurationException("Provenance filter must be set, use ProvenanceFilter.ALL");
        }
        if (outputDirectory == null) {
            throw new InvalidConfigurationException("Output directory must be set");
        }
        return this;
    }

    /**
     * Build on every available processor.
     */
    public static OctreeBuildConfig parallel() {
        return new OctreeBuildConfig().withParallelism(0);
    }

    @Override
    public String toString() {
        return String.format(
        "OctreeBuildConfig[maxPointsPerNode=%d, maxDepth=%d, lodFraction=%.3f, filter=%s, output=%s, parallelism=%d]",
        maxPointsPerNode, maxDepth, lodFraction, provenanceFilter, outputDirectory, parallelism);
    }
}
