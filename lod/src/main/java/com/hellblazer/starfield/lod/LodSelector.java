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

import com.hellblazer.starfield.catalog.Star;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Selects the brightest stars of a node for its level of detail file. Ties in magnitude keep their input order. How
 * many stars to keep is the build's policy, {@link OctreeBuildConfig#lodRetainCount(int)}.
 * <p>
 * When only a small share of the stars is kept, a bounded max-heap replaces the full sort. Both paths order by
 * magnitude then input position and so return the same list.
 *
 * @author hal.hildebrand
 */
public final class LodSelector {

    /** Use the heap when the kept count is at most this fraction of the input */
    static final double HEAP_SELECTION_RATIO = 0.25;

    private LodSelector() {
    }

    /**
     * Keep the {@code keep} brightest stars, or all of them if there are fewer.
     *
     * @return brightest first
     */
    public static List<Star> brightestCount(List<Star> stars, int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("Keep count must not be negative: " + keep);
        }
        return brightest(stars, keep, true);
    }

    static List<Star> brightest(List<Star> stars, int keep, boolean allowHeap) {
        var n = stars.size();
        var k = Math.min(keep, n);
        if (k == 0) {
            return new ArrayList<>();
        }
        if (allowHeap && k <= n * HEAP_SELECTION_RATIO) {
            return heapSelect(stars, k);
        }
        var sorted = new ArrayList<>(stars);
        sorted.sort(Star.BY_BRIGHTNESS);
        return new ArrayList<>(sorted.subList(0, k));
    }

    private static List<Star> heapSelect(List<Star> stars, int k) {
        Comparator<Ranked> order = Comparator.<Ranked>comparingDouble(r -> r.star.magnitude())
                                             .thenComparingInt(r -> r.index);
        // Dimmest retained star on top
        var heap = new PriorityQueue<>(k, order.reversed());
        var index = 0;
        for (var star : stars) {
            var candidate = new Ranked(star, index++);
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (order.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }
        var ranked = new ArrayList<>(heap);
        ranked.sort(order);
        var result = new ArrayList<Star>(k);
        for (var r : ranked) {
            result.add(r.star);
        }
        return result;
    }

    private record Ranked(Star star, int index) {
    }
}
