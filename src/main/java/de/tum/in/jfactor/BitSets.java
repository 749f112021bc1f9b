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

import java.util.BitSet;
import java.util.Comparator;

final class BitSets {
    /**
     * Orders sets by their ascending index sequences, lexicographically; a proper prefix comes first.
     */
    static final Comparator<BitSet> INDEX_ORDER = BitSets::compareIndices;

    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    static boolean isSubset(BitSet set, BitSet of) {
        if (set.cardinality() > of.cardinality()) {
            return false;
        }
        BitSet copy = copyOf(set);
        copy.andNot(of);
        return copy.isEmpty();
    }

    static int[] toArray(BitSet set) {
        int[] array = new int[set.cardinality()];
        int pos = 0;
        for (int bit = set.nextSetBit(0); bit >= 0; bit = set.nextSetBit(bit + 1)) {
            array[pos] = bit;
            pos += 1;
        }
        return array;
    }

    private static int compareIndices(BitSet one, BitSet other) {
        int i = one.nextSetBit(0);
        int j = other.nextSetBit(0);
        while (i >= 0 && j >= 0) {
            if (i != j) {
                return i < j ? -1 : 1;
            }
            i = one.nextSetBit(i + 1);
            j = other.nextSetBit(j + 1);
        }
        if (i < 0) {
            return j < 0 ? 0 : -1;
        }
        return 1;
    }
}
