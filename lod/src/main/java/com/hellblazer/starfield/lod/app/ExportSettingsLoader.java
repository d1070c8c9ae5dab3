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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.starfield.catalog.Provenance;
import com.hellblazer.starfield.catalog.ProvenanceFilter;
import com.hellblazer.starfield.lod.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Loads export settings from JSON. Defaults come from the bundled {@value #DEFAULTS_RESOURCE}; a settings file then
 * overrides any subset of them:
 *
 * <pre>
 * {
 *   "octree":   { "maxPointsPerNode": 50000, "maxDepth": 5, "lodFraction": 0.1,
 *                 "provenanceFilter": "OBSERVED", "outputDirectory": "data/octree", "parallelism": 1 },
 *   "database": { "host": "localhost", "port": 5432, "name": "epistemic_engine",
 *                 "user": "postgres", "password": "", "poolSize": 8 }
 * }
 * </pre>
 *
 * Unknown keys and mistyped values are rejected with {@link InvalidConfigurationException}.
 *
 * @author hal.hildebrand
 */
public class ExportSettingsLoader {
    static final         String DEFAULTS_RESOURCE = "/starfield-defaults.json";
    private static final Logger log               = LoggerFactory.getLogger(ExportSettingsLoader.class);

    private static final Set<String> SECTIONS      = Set.of("octree", "database");
    private static final Set<String> OCTREE_KEYS   = Set.of("maxPointsPerNode", "maxDepth", "lodFraction",
                                                            "provenanceFilter", "outputDirectory", "parallelism");
    private static final Set<String> DATABASE_KEYS = Set.of("host", "port", "name", "user", "password", "poolSize");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @return the bundled defaults, or the built in defaults if the resource is absent
     */
    public ExportSettings loadDefaults() throws IOException {
        var settings = ExportSettings.defaults();
        try (var is = ExportSettingsLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                log.debug("Settings resource not found: {}", DEFAULTS_RESOURCE);
                return settings;
            }
            return apply(settings, is, DEFAULTS_RESOURCE);
        }
    }

    /**
     * Load the defaults and override them from a settings file.
     */
    public ExportSettings load(Path file) throws IOException {
        var settings = loadDefaults();
        try (var is = Files.newInputStream(file)) {
            settings = apply(settings, is, file.toString());
        }
        log.info("Loaded export settings from {}", file);
        return settings;
    }

    /**
     * Override settings from a JSON document.
     */
    public ExportSettings apply(ExportSettings settings, InputStream json, String origin) throws IOException {
        var root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException(origin + ": settings must be a JSON object");
        }
        checkKeys(root, SECTIONS, origin);

        var octree = root.get("octree");
        if (octree != null) {
            checkKeys(octree, OCTREE_KEYS, origin + " octree");
            applyOctree(settings, octree, origin);
        }
        var database = root.get("database");
        if (database != null) {
            checkKeys(database, DATABASE_KEYS, origin + " database");
            applyDatabase(settings, database, origin);
        }
        return settings;
    }

    private void applyOctree(ExportSettings settings, JsonNode octree, String origin) {
        var build = settings.getBuild();
        if (octree.has("maxPointsPerNode")) {
            build.withMaxPointsPerNode(intValue(octree, "maxPointsPerNode", origin));
        }
        if (octree.has("maxDepth")) {
            build.withMaxDepth(intValue(octree, "maxDepth", origin));
        }
        if (octree.has("lodFraction")) {
            var node = octree.get("lodFraction");
            if (!node.isNumber()) {
                throw new InvalidConfigurationException(origin + ": lodFraction must be a number");
            }
            build.withLodFraction(node.asDouble());
        }
        if (octree.has("provenanceFilter")) {
            var node = octree.get("provenanceFilter");
            if (node.isNull() || "ALL".equalsIgnoreCase(node.asText())) {
                build.withProvenanceFilter(ProvenanceFilter.ALL);
            } else {
                build.withProvenanceFilter(ProvenanceFilter.only(provenance(textValue(octree, "provenanceFilter",
                                                                                      origin), origin)));
            }
        }
        if (octree.has("outputDirectory")) {
            build.withOutputDirectory(Path.of(textValue(octree, "outputDirectory", origin)));
        }
        if (octree.has("parallelism")) {
            build.withParallelism(intValue(octree, "parallelism", origin));
        }
    }

    private void applyDatabase(ExportSettings settings, JsonNode database, String origin) {
        var config = settings.getDatabase();
        try {
            if (database.has("host")) {
                config = config.withHost(textValue(database, "host", origin));
            }
            if (database.has("port")) {
                config = config.withPort(intValue(database, "port", origin));
            }
            if (database.has("name")) {
                config = config.withDatabase(textValue(database, "name", origin));
            }
            if (database.has("user")) {
                config = config.withUser(textValue(database, "user", origin));
            }
            if (database.has("password")) {
                config = config.withPassword(textValue(database, "password", origin));
            }
            if (database.has("poolSize")) {
                config = config.withPoolSize(intValue(database, "poolSize", origin));
            }
        } catch (InvalidConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(origin + ": " + e.getMessage());
        }
        settings.withDatabase(config);
    }

    static Provenance provenance(String label, String origin) {
        try {
            return Provenance.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(origin + ": " + e.getMessage());
        }
    }

    private static void checkKeys(JsonNode node, Set<String> allowed, String origin) {
        if (!node.isObject()) {
            throw new InvalidConfigurationException(origin + " must be a JSON object");
        }
        var names = node.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            if (!allowed.contains(name)) {
                throw new InvalidConfigurationException(origin + ": unknown setting '" + name + "'");
            }
        }
    }

    private static int intValue(JsonNode parent, String key, String origin) {
        var node = parent.get(key);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidConfigurationException(origin + ": " + key + " must be an integer, got " + node);
        }
        return node.asInt();
    }

    private static String textValue(JsonNode parent, String key, String origin) {
        var node = parent.get(key);
        if (!node.isTextual()) {
            throw new InvalidConfigurationException(origin + ": " + key + " must be a string, got " + node);
        }
        return node.asText();
    }
}
