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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ProvenanceTest {

    @Test
    public void testCodes() {
        assertEquals(0, Provenance.OBSERVED.code());
        assertEquals(1, Provenance.INFERRED.code());
        assertEquals(2, Provenance.SIMULATED.code());
    }

    @Test
    public void testCodeRoundTrip() {
        for (var provenance : Provenance.values()) {
            assertSame(provenance, Provenance.fromCode(provenance.code()));
        }
    }

    @Test
    public void testUnknownCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Provenance.fromCode(3));
        assertThrows(IllegalArgumentException.class, () -> Provenance.fromCode(-1));
    }

    @Test
    public void testLabels() {
        assertSame(Provenance.OBSERVED, Provenance.fromLabel("OBSERVED"));
        assertSame(Provenance.INFERRED, Provenance.fromLabel(" inferred "));
        assertSame(Provenance.SIMULATED, Provenance.fromLabel("Simulated"));
    }

    @Test
    public void testUnknownLabelRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> Provenance.fromLabel("UNKNOWN"));
        assertTrue(e.getMessage().contains("UNKNOWN"));
        assertThrows(IllegalArgumentException.class, () -> Provenance.fromLabel(null));
    }

    @Test
    public void testFilter() {
        assertTrue(ProvenanceFilter.ALL.accepts(Provenance.SIMULATED));
        assertTrue(ProvenanceFilter.ALL.isUnrestricted());

        var observed = ProvenanceFilter.only(Provenance.OBSERVED);
        assertTrue(observed.accepts(Provenance.OBSERVED));
        assertFalse(observed.accepts(Provenance.INFERRED));
        assertEquals(Provenance.OBSERVED, observed.provenance().orElseThrow());
        assertEquals(observed, ProvenanceFilter.ofNullable(Provenance.OBSERVED));
        assertSame(ProvenanceFilter.ALL, ProvenanceFilter.ofNullable(null));
    }
}
