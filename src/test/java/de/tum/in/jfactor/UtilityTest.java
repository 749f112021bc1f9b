/*
 * This file is part of JFactor.
 * Copyright (c) 2026 Tobias Meggendorfer.
 *
 * JFactor is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JFactor is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JFactor. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jfactor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class UtilityTest {
    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int index : indices) {
            set.set(index);
        }
        return set;
    }

    @Test
    public void testIndexOrder() {
        List<BitSet> sets = new ArrayList<>(List.of(bits(1, 3), bits(0, 2, 5), bits(0, 2), bits(), bits(1, 2)));
        sets.sort(BitSets.INDEX_ORDER);
        assertThat(sets, contains(bits(), bits(0, 2), bits(0, 2, 5), bits(1, 2), bits(1, 3)));
    }

    @Test
    public void testSubset() {
        assertThat(BitSets.isSubset(bits(1), bits(1, 2)), is(true));
        assertThat(BitSets.isSubset(bits(1, 2), bits(1, 2)), is(true));
        assertThat(BitSets.isSubset(bits(0, 1), bits(1, 2)), is(false));
        assertThat(BitSets.toArray(bits(4, 1, 7)), is(new int[] {1, 4, 7}));
    }
}
