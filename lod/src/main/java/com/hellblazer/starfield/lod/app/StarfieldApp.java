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

package com.hellblazer.starfield.lod.app;

import com.hellblazer.starfield.catalog.PointSource;
import com.hellblazer.starfield.catalog.PointSourceException;
import com.hellblazer.starfield.catalog.PostgisConfig;
import com.hellblazer.starfield.catalog.PostgisPointSource;
import com.hellblazer.starfield.catalog.ProvenanceFilter;
import com.hellblazer.starfield.lod.InvalidConfigurationException;
import com.hellblazer.starfield.lod.OctreeBuildException;
import com.hellblazer.starfield.lod.OctreeBuilder;
import com.hellblazer.starfield.lod.inspect.OctreeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Command line entry point.
 *
 * <pre>
 * export [--config FILE] [--max-depth N] [--max-points N] [--lod-fraction F]
 *        [--provenance-filter ALL|OBSERVED|INFERRED|SIMULATED] [--output-dir DIR] [--parallelism N]
 *        [--db-host HOST] [--db-port PORT] [--db-name NAME] [--db-user USER] [--db-password PASSWORD]
 * inspect DIR
 * </pre>
 *
 * Exit status is 0 on success, 1 when the export or inspection fails and 2 for usage or configuration errors.
 *
 * @author hal.hildebrand
 */
public class StarfieldApp {
    public static final int EXIT_OK     = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE  = 2;

    static final String USAGE = """
                                usage: starfield export [--config FILE] [--max-depth N] [--max-points N]
                                                        [--lod-fraction F] [--output-dir DIR] [--parallelism N]
                                                        [--provenance-filter ALL|OBSERVED|INFERRED|SIMULATED]
                                                        [--db-host HOST] [--db-port PORT] [--db-name NAME]
                                                        [--db-user USER] [--db-password PASSWORD]
                                       starfield inspect DIR""";

    private static final Logger log = LoggerFactory.getLogger(StarfieldApp.class);

    private final Function<PostgisConfig, PointSource> connector;
    private final ExportSettingsLoader                 loader = new ExportSettingsLoader();

    /**
     * @param connector opens the catalog for an export run
     */
    public StarfieldApp(Function<PostgisConfig, PointSource> connector) {
        this.connector = connector;
    }

    public static void main(String[] args) {
        System.exit(new StarfieldApp(PostgisPointSource::connect).run(args, System.out));
    }

    public int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        var command = args[0];
        try {
            return switch (command) {
                case "export" -> export(parseExport(args), out);
                case "inspect" -> {
                    if (args.length != 2) {
                        throw new UsageException("inspect takes exactly one directory");
                    }
                    yield inspect(Path.of(args[1]), out);
                }
                case "-h", "--help", "help" -> {
                    out.println(USAGE);
                    yield EXIT_OK;
                }
                default -> throw new UsageException("Unknown command: " + command);
            };
        } catch (UsageException | InvalidConfigurationException e) {
            out.println("error: " + e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }
    }

    ExportSettings parseExport(String[] args) {
        ExportSettings settings;
        // The settings file is the base that individual flags override, wherever it appears
        var configFile = findOption(args, "--config");
        try {
            settings = configFile == null ? loader.loadDefaults() : loader.load(Path.of(configFile));
        } catch (IOException e) {
            throw new UsageException("Cannot read settings " + (configFile == null ? "defaults" : configFile) + ": "
                                     + e.getMessage());
        }

        var build = settings.getBuild();
        var database = settings.getDatabase();
        for (int i = 1; i < args.length; i++) {
            var flag = args[i];
            if (i + 1 >= args.length) {
                throw new UsageException("Missing value for " + flag);
            }
            var value = args[++i];
            try {
                switch (flag) {
                    case "--config" -> {
                    }
                    case "--max-depth" -> build.withMaxDepth(parseInt(flag, value));
                    case "--max-points" -> build.withMaxPointsPerNode(parseInt(flag, value));
                    case "--lod-fraction" -> build.withLodFraction(parseDouble(flag, value));
                    case "--provenance-filter" -> build.withProvenanceFilter(provenanceFilter(flag, value));
                    case "--output-dir" -> build.withOutputDirectory(Path.of(value));
                    case "--parallelism" -> build.withParallelism(parseInt(flag, value));
                    case "--db-host" -> database = database.withHost(value);
                    case "--db-port" -> database = database.withPort(parseInt(flag, value));
                    case "--db-name" -> database = database.withDatabase(value);
                    case "--db-user" -> database = database.withUser(value);
                    case "--db-password" -> database = database.withPassword(value);
                    default -> throw new UsageException("Unknown option: " + flag);
                }
            } catch (InvalidConfigurationException | UsageException e) {
                throw e;
            } catch (IllegalArgumentException e) {
                throw new UsageException(flag + ": " + e.getMessage());
            }
        }
        build.validate();
        return settings.withDatabase(database);
    }

    private int export(ExportSettings settings, PrintStream out) {
        var build = settings.getBuild();
        out.printf("Exporting octree: max depth %d, max stars per node %d, LOD fraction %.1f%%, filter %s%n",
                   build.getMaxDepth(), build.getMaxPointsPerNode(), build.getLodFraction() * 100,
                   build.getProvenanceFilter());
        try (var source = connector.apply(settings.getDatabase())) {
            var result = new OctreeBuilder(source, build).build();
            out.printf("Export complete: %d nodes (%d internal, %d leaves), %d stars, %d bytes, depth %d%n",
                       result.nodes(), result.internal(), result.leaves(), result.starsWritten(),
                       result.bytesWritten(), result.deepest());
            out.printf("Output directory: %s%n", build.getOutputDirectory().toAbsolutePath());
            return EXIT_OK;
        } catch (OctreeBuildException e) {
            log.error("Export failed", e);
            var deepest = e.getDeepestReached();
            out.printf("Export aborted at node %s; deepest node reached: %s; the octree is incomplete%n",
                       e.getFailedNode().name(), deepest == null ? "none" : deepest.name());
            out.printf("Cause: %s%n", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return EXIT_FAILED;
        } catch (PointSourceException e) {
            log.error("Catalog unavailable", e);
            out.printf("Export failed: %s%n", e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int inspect(Path directory, PrintStream out) {
        if (!Files.isDirectory(directory)) {
            throw new UsageException("Not a directory: " + directory);
        }
        OctreeDirectory octree;
        try {
            octree = OctreeDirectory.scan(directory);
        } catch (IOException e) {
            log.error("Cannot scan {}", directory, e);
            out.printf("Inspection failed: %s%n", e.getMessage());
            return EXIT_FAILED;
        }
        out.printf("%s: %d nodes (%d leaves), %d stars, depth %d%n", directory, octree.getNodes().size(),
                   octree.leafCount(), octree.totalStars(), octree.maxDepth());
        for (var problem : octree.getProblems()) {
            out.println("  problem: " + problem);
        }
        if (octree.getNodes().isEmpty()) {
            out.println("  no node files found");
        }
        return octree.isComplete() ? EXIT_OK : EXIT_FAILED;
    }

    private static String findOption(String[] args, String flag) {
        for (int i = 1; i < args.length - 1; i++) {
            if (flag.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static ProvenanceFilter provenanceFilter(String flag, String value) {
        if ("ALL".equalsIgnoreCase(value)) {
            return ProvenanceFilter.ALL;
        }
        return ProvenanceFilter.only(ExportSettingsLoader.provenance(value, flag));
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer: " + value);
        }
    }

    private static double parseDouble(String flag, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
