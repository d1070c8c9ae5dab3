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

import java.util.Locale;

/**
 * How a star's data was obtained. The set is closed: every class has a fixed wire code, and labels from a catalog
 * that name anything else are rejected rather than mapped to a default.
 *
 * @author hal.hildebrand
 */
public enum Provenance {
    /** Directly measured */
    OBSERVED,
    /** Modeled or derived from measurements */
    INFERRED,
    /** Purely synthetic */
    SIMULATED;

    /**
     * The int32 code written into node files.
     */
    public int code() {
        return switch (this) {
            case OBSERVED -> 0;
            case INFERRED -> 1;
            case SIMULATED -> 2;
        };
    }

    /**
     * Decode a wire code.
     *
     * @throws IllegalArgumentException if the code is not 0, 1 or 2
     */
    public static Provenance fromCode(int code) {
        return switch (code) {
            case 0 -> OBSERVED;
            case 1 -> INFERRED;
            case 2 -> SIMULATED;
            default -> throw new IllegalArgumentException("Unknown provenance code: " + code);
        };
    }

    /**
     * Parse a catalog truth label, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the label is null or names no provenance class
     */
    public static Provenance fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Provenance label must not be null");
        }
        var normalized = label.trim().toUpperCase(Locale.ROOT);
        for (var provenance : values()) {
            if (provenance.name().equals(normalized)) {
                return provenance;
            }
        }
        throw new IllegalArgumentException("Unknown provenance label: " + label);
    }
}
