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

import com.hellblazer.starfield.catalog.InMemoryPointSource;
import com.hellblazer.starfield.catalog.PointSource;
import com.hellblazer.starfield.catalog.Provenance;
import com.hellblazer.starfield.catalog.ProvenanceFilter;
import com.hellblazer.starfield.catalog.SourceUnavailableException;
import com.hellblazer.starfield.catalog.Star;
import com.hellblazer.starfield.geometry.BoundingVolume;
import com.hellblazer.starfield.lod.io.NodeDeserializer;
import com.hellblazer.starfield.lod.io.NodeSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * End to end tests of the octree builder over in memory catalogs.
 *
 * @author hal.hildebrand
 */
public class OctreeBuilderTest {

    @TempDir
    Path tempDir;

    @Test
    public void testSmallCatalogIsSingleLeaf() throws IOException {
        var stars = randomStars(25, 1);
        var output = tempDir.resolve("small");
        var result = new OctreeBuilder(new InMemoryPointSource(stars), config(output)).build();

        assertEquals(new BuildResult(1, 0, 1, 25, 4 + 20 * 25, 0), result);
        assertEquals(List.of("0-0-0-0.bin"), fileNames(output));
        assertEquals(25, new NodeDeserializer().read(output.resolve("0-0-0-0.bin")).size());
    }

    @Test
    public void testEveryNodeHoldsItsVolumeOrBrightestSubset() throws IOException {
        var source = new InMemoryPointSource(randomStars(2_000, 7));
        var output = tempDir.resolve("tree");
        var config = config(output).withMaxPointsPerNode(100).withMaxDepth(4);

        var result = new OctreeBuilder(source, config).build();

        assertTrue(result.internal() > 0, "catalog should split");
        assertEquals(1 + 8 * result.internal(), result.nodes());
        var global = source.globalBounds(ProvenanceFilter.ALL);
        long headerTotal = 0;
        var files = filesByNode(output);
        assertEquals(result.nodes(), files.size());
        for (var entry : files.entrySet()) {
            var node = entry.getKey();
            var inVolume = source.pointsIn(node.volumeWithin(global), ProvenanceFilter.ALL);
            var split = files.containsKey(node.child(0));
            assertEquals(config.shouldSplit(inVolume.size(), node.depth()), split, node.name());

            var expected = split ? LodSelector.brightestCount(inVolume, config.lodRetainCount(inVolume.size()))
                                 : inVolume;
            assertArrayEquals(NodeSerializer.encode(expected).array(), Files.readAllBytes(entry.getValue()),
                              node.name());
            if (split) {
                assertEquals(Math.max(1, inVolume.size() / 10), expected.size());
            }
            headerTotal += new NodeDeserializer().readCount(entry.getValue());
        }
        assertEquals(result.starsWritten(), headerTotal);
    }

    @Test
    public void testRootSubsetIsBrightest() throws IOException {
        var stars = new ArrayList<Star>();
        var random = new Random(3);
        for (int i = 0; i < 200; i++) {
            stars.add(new Star(random.nextDouble(), random.nextDouble(), random.nextDouble(), 10f + i,
                               Provenance.OBSERVED));
        }
        var output = tempDir.resolve("bright");
        new OctreeBuilder(new InMemoryPointSource(stars), config(output).withMaxPointsPerNode(50)).build();

        var root = new NodeDeserializer().read(output.resolve("0-0-0-0.bin"));
        assertEquals(20, root.size());
        for (int i = 0; i < root.size(); i++) {
            assertEquals(10f + i, root.get(i).magnitude());
        }
    }

    @Test
    public void testParallelMatchesSequential() throws IOException {
        var source = new InMemoryPointSource(randomStars(5_000, 11));
        var sequentialDir = tempDir.resolve("sequential");
        var parallelDir = tempDir.resolve("parallel");

        var sequential = new OctreeBuilder(source, config(sequentialDir).withMaxPointsPerNode(150)).build();
        var parallel = new OctreeBuilder(source, config(parallelDir).withMaxPointsPerNode(150)
                                                                    .withParallelism(4)).build();

        assertEquals(sequential, parallel);
        var names = fileNames(sequentialDir);
        assertEquals(names, fileNames(parallelDir));
        for (var name : names) {
            assertArrayEquals(Files.readAllBytes(sequentialDir.resolve(name)),
                              Files.readAllBytes(parallelDir.resolve(name)), name);
        }
    }

    @Test
    public void testDepthCeiling() throws IOException {
        // Ten stars clustered in node 2-0-7 never fit the one star limit, so the cluster stops at max depth
        var stars = new ArrayList<Star>();
        stars.add(new Star(0, 0, 0, 5, Provenance.OBSERVED));
        stars.add(new Star(1, 1, 1, 6, Provenance.OBSERVED));
        for (int i = 0; i < 10; i++) {
            stars.add(new Star(0.3, 0.3, 0.3, 10 + i, Provenance.SIMULATED));
        }
        var output = tempDir.resolve("ceiling");
        var result = new OctreeBuilder(new InMemoryPointSource(stars),
                                       config(output).withMaxPointsPerNode(1).withMaxDepth(2)).build();

        assertEquals(1 + 8 + 8, result.nodes());
        assertEquals(2, result.internal());
        assertEquals(15, result.leaves());
        assertEquals(2, result.deepest());
        var reader = new NodeDeserializer();
        assertEquals(List.of(5f), reader.read(output.resolve("0-0-0-0.bin")).stream().map(Star::magnitude).toList());
        assertEquals(1, reader.readCount(output.resolve("1-0.bin")));
        assertEquals(1, reader.readCount(output.resolve("1-7.bin")));
        assertEquals(10, reader.readCount(output.resolve("2-0-7.bin")));
        assertEquals(1, reader.readCount(output.resolve("2-0-0.bin")));
        assertEquals(0, reader.readCount(output.resolve("2-0-3.bin")));
        assertFalse(Files.exists(output.resolve("3-0-7-0.bin")));
        assertFalse(Files.exists(output.resolve("2-7-0.bin")));
    }

    @Test
    public void testEmptyCatalogWritesEmptyRoot() throws IOException {
        var output = tempDir.resolve("empty");
        var result = new OctreeBuilder(new InMemoryPointSource(List.of()), config(output)).build();

        assertEquals(new BuildResult(1, 0, 1, 0, 4, 0), result);
        assertEquals(List.of("0-0-0-0.bin"), fileNames(output));
        assertEquals(4, Files.size(output.resolve("0-0-0-0.bin")));
    }

    @Test
    public void testProvenanceFilterAppliesToEveryQuery() throws IOException {
        var stars = randomStars(600, 5);
        var output = tempDir.resolve("filtered");
        var config = config(output).withMaxPointsPerNode(40)
                                   .withProvenanceFilter(ProvenanceFilter.only(Provenance.INFERRED));

        var result = new OctreeBuilder(new InMemoryPointSource(stars), config).build();

        var expectedInferred = stars.stream().filter(s -> s.provenance() == Provenance.INFERRED).count();
        long leafStars = 0;
        for (var entry : filesByNode(output).entrySet()) {
            var decoded = new NodeDeserializer().read(entry.getValue());
            assertTrue(decoded.stream().allMatch(s -> s.provenance() == Provenance.INFERRED));
            if (!Files.exists(output.resolve(entry.getKey().child(0).fileName()))) {
                leafStars += decoded.size();
            }
        }
        assertTrue(result.nodes() > 1);
        // Leaves hold every filtered star at least once; boundary stars may repeat
        assertTrue(leafStars >= expectedInferred);
    }

    @Test
    public void testQueryFailureAbortsWithNode() {
        var source = new FailingSource(new InMemoryPointSource(randomStars(1_000, 13)), 3);
        var output = tempDir.resolve("failed");
        var builder = new OctreeBuilder(source, config(output).withMaxPointsPerNode(50));

        var e = assertThrows(OctreeBuildException.class, builder::build);

        // Root, its first octant, then that octant's first octant
        assertEquals(NodeId.of(0, 0), e.getFailedNode());
        assertEquals(NodeId.of(0, 0), e.getDeepestReached());
        assertInstanceOf(SourceUnavailableException.class, e.getCause());
        assertTrue(e.getMessage().contains("2-0-0"));
        assertTrue(e.getMessage().contains("incomplete"));
        assertTrue(Files.exists(output.resolve("1-0.bin")));
        assertFalse(Files.exists(output.resolve("2-0-0.bin")));
        // No retry
        assertEquals(3, source.queries.get());
    }

    @Test
    public void testParallelQueryFailureAbortsWithNode() {
        var source = new FailingSource(new InMemoryPointSource(randomStars(1_000, 13)), 2);
        var builder = new OctreeBuilder(source, config(tempDir.resolve("failed-parallel")).withMaxPointsPerNode(50)
                                                                                           .withParallelism(4));

        var e = assertThrows(OctreeBuildException.class, builder::build);

        assertEquals(1, e.getFailedNode().depth());
        assertInstanceOf(SourceUnavailableException.class, e.getCause());
    }

    @Test
    public void testParallelFailureStopsAllWork() throws Exception {
        var source = new SlowFailingSource(new InMemoryPointSource(randomStars(5_000, 19)), 3);
        var lateWrites = new AtomicInteger();
        var serializer = new NodeSerializer() {
            @Override
            public long write(List<Star> stars, Path outputFile) throws IOException {
                if (source.isLate()) {
                    lateWrites.incrementAndGet();
                }
                return super.write(stars, outputFile);
            }
        };
        var output = tempDir.resolve("aborted");
        var config = config(output).withMaxPointsPerNode(20).withMaxDepth(4).withParallelism(4);

        var e = assertThrows(OctreeBuildException.class, () -> new OctreeBuilder(source, config, serializer).build());

        assertInstanceOf(SourceUnavailableException.class, e.getCause());
        assertEquals(0, source.lateQueries.get(), "queries started after the failure");
        assertEquals(0, lateWrites.get(), "writes started after the failure");
        assertTrue(source.queries.get() < 20, "queries: " + source.queries.get());

        var published = fileNames(output);
        Thread.sleep(100);
        assertEquals(published, fileNames(output));
        assertTrue(published.stream().noneMatch(name -> name.endsWith(".tmp")));
    }

    @Test
    public void testUnexpectedSourceErrorReportsNode() {
        var calls = new AtomicInteger();
        var delegate = new InMemoryPointSource(randomStars(500, 23));
        var source = new PointSource() {
            @Override
            public BoundingVolume globalBounds(ProvenanceFilter filter) {
                return delegate.globalBounds(filter);
            }

            @Override
            public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("cursor closed");
                }
                return delegate.pointsIn(volume, filter);
            }
        };

        var builder = new OctreeBuilder(source, config(tempDir.resolve("x")).withMaxPointsPerNode(50));

        var e = assertThrows(OctreeBuildException.class, builder::build);

        assertEquals(NodeId.of(0), e.getFailedNode());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    public void testUnexpectedWriteErrorReportsNode() {
        var serializer = new NodeSerializer() {
            @Override
            public long write(List<Star> stars, Path outputFile) {
                throw new IllegalArgumentException("Too many stars for one node file: " + stars.size());
            }
        };
        var builder = new OctreeBuilder(new InMemoryPointSource(randomStars(10, 29)), config(tempDir.resolve("y")),
                                        serializer);

        var e = assertThrows(OctreeBuildException.class, builder::build);

        assertTrue(e.getFailedNode().isRoot());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    public void testGlobalBoundsFailure() {
        var source = new PointSource() {
            @Override
            public BoundingVolume globalBounds(ProvenanceFilter filter) {
                throw new SourceUnavailableException("connection refused");
            }

            @Override
            public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
                throw new AssertionError("not reached");
            }
        };
        var output = tempDir.resolve("unreachable");

        var e = assertThrows(OctreeBuildException.class, () -> new OctreeBuilder(source, config(output)).build());
        assertTrue(e.getFailedNode().isRoot());
        assertNull(e.getDeepestReached());
        assertFalse(Files.exists(output));
    }

    @Test
    public void testWriteFailureAbortsBuild() throws IOException {
        // A regular file where the output directory should be
        var blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        var builder = new OctreeBuilder(new InMemoryPointSource(randomStars(10, 2)), config(blocked));

        var e = assertThrows(OctreeBuildException.class, builder::build);
        assertTrue(e.getFailedNode().isRoot());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    public void testInvalidConfigurationRejectedBeforeIo() {
        var source = mock(PointSource.class);
        assertThrows(InvalidConfigurationException.class,
                     () -> new OctreeBuilder(source, config(tempDir.resolve("x")).withLodFraction(0)));
        assertThrows(InvalidConfigurationException.class,
                     () -> new OctreeBuilder(source, config(tempDir.resolve("x")).withMaxPointsPerNode(-5)));
        verifyNoInteractions(source);
        assertFalse(Files.exists(tempDir.resolve("x")));
    }

    private static OctreeBuildConfig config(Path output) {
        return new OctreeBuildConfig().withOutputDirectory(output);
    }

    static List<Star> randomStars(int count, long seed) {
        var random = new Random(seed);
        var stars = new ArrayList<Star>(count);
        for (int i = 0; i < count; i++) {
            stars.add(new Star(random.nextGaussian() * 1.0e18, random.nextGaussian() * 1.0e18,
                               random.nextGaussian() * 2.0e17, (float) (random.nextDouble() * 20 - 1.5),
                               Provenance.values()[random.nextInt(3)]));
        }
        return stars;
    }

    private static List<String> fileNames(Path directory) throws IOException {
        try (var listing = Files.list(directory)) {
            return listing.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    private static TreeMap<NodeId, Path> filesByNode(Path directory) throws IOException {
        var files = new TreeMap<NodeId, Path>();
        try (var listing = Files.list(directory)) {
            listing.forEach(p -> files.put(NodeId.parse(p.getFileName().toString()), p));
        }
        return files;
    }

    /**
     * Every query takes a while except the failing one. Remembers when it failed so that work started well after
     * the failure can be counted.
     */
    private static class SlowFailingSource implements PointSource {
        private static final long LATE_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

        final AtomicInteger queries     = new AtomicInteger();
        final AtomicInteger lateQueries = new AtomicInteger();
        private final AtomicLong  failedAt = new AtomicLong(Long.MIN_VALUE);
        private final PointSource delegate;
        private final int         failOn;

        SlowFailingSource(PointSource delegate, int failOn) {
            this.delegate = delegate;
            this.failOn = failOn;
        }

        boolean isLate() {
            var failed = failedAt.get();
            return failed != Long.MIN_VALUE && System.nanoTime() - failed > LATE_NANOS;
        }

        @Override
        public BoundingVolume globalBounds(ProvenanceFilter filter) {
            return delegate.globalBounds(filter);
        }

        @Override
        public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
            if (isLate()) {
                lateQueries.incrementAndGet();
            }
            if (queries.incrementAndGet() == failOn) {
                failedAt.set(System.nanoTime());
                throw new SourceUnavailableException("connection reset");
            }
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceUnavailableException("interrupted");
            }
            return delegate.pointsIn(volume, filter);
        }
    }

    /**
     * Delegates until the given query number, which fails.
     */
    private static class FailingSource implements PointSource {
        final AtomicInteger queries = new AtomicInteger();
        private final PointSource delegate;
        private final int         failOn;

        FailingSource(PointSource delegate, int failOn) {
            this.delegate = delegate;
            this.failOn = failOn;
        }

        @Override
        public BoundingVolume globalBounds(ProvenanceFilter filter) {
            return delegate.globalBounds(filter);
        }

        @Override
        public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
            if (queries.incrementAndGet() == failOn) {
                throw new SourceUnavailableException("connection reset");
            }
            return delegate.pointsIn(volume, filter);
        }
    }
}
