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

import java.util.Optional;

/**
 * Restricts catalog queries to a single provenance class, or admits every class. Point sources apply the filter
 * inside each query; it is never a post-filter over query results.
 *
 * @author hal.hildebrand
 */
public final class ProvenanceFilter {

    public static final ProvenanceFilter ALL = new ProvenanceFilter(null);

    private final Provenance only;

    private ProvenanceFilter(Provenance only) {
        this.only = only;
    }

    public static ProvenanceFilter only(Provenance provenance) {
        if (provenance == null) {
            throw new IllegalArgumentException("Provenance must not be null, use ALL to admit every class");
        }
        return new ProvenanceFilter(provenance);
    }

    public static ProvenanceFilter ofNullable(Provenance provenance) {
        return provenance == null ? ALL : only(provenance);
    }

    public boolean accepts(Provenance provenance) {
        return only == null || only == provenance;
    }

    public boolean isUnrestricted() {
        return only == null;
    }

    public Optional<Provenance> provenance() {
        return Optional.ofNullable(only);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProvenanceFilter other && other.only == only;
    }

    @Override
    public int hashCode() {
        return only == null ? 0 : only.hashCode();
    }

    @Override
    public String toString() {
        return only == null ? "ALL" : only.name();
    }
}
