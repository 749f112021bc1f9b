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

import static de.tum.in.jfactor.Util.checkArgument;

import java.util.BitSet;
import java.util.Comparator;

/**
 * A partial assignment, given by a {@code value} and a relevance {@code mask}. For every bit set in
 * the mask, the corresponding bit of the value is required; all other bits are don't-care. Hence a
 * cube covers all minterms {@code m} with {@code (m & mask) == value}.
 *
 * <p>Invariant: {@code (value & ~mask) == 0}.</p>
 */
final class Cube implements Comparable<Cube> {
    private static final Comparator<Cube> ORDER = Comparator.comparingInt(Cube::literalCount)
            .thenComparingInt(Cube::mask)
            .thenComparingInt(Cube::value);

    private final int value;
    private final int mask;

    Cube(int value, int mask) {
        checkArgument(mask >= 0, "Invalid mask %s", mask);
        checkArgument((value & ~mask) == 0, "Value %s has bits outside of mask %s", value, mask);
        this.value = value;
        this.mask = mask;
    }

    /**
     * Creates the cube covering exactly the given minterm.
     */
    static Cube ofMinterm(int minterm, int fullMask) {
        return new Cube(minterm, fullMask);
    }

    int value() {
        return value;
    }

    int mask() {
        return mask;
    }

    /**
     * Returns the number of relevant bits.
     */
    int literalCount() {
        return Integer.bitCount(mask);
    }

    /**
     * Returns the bits which are relevant and required to be 1.
     */
    int positiveLiterals() {
        return value;
    }

    boolean covers(int minterm) {
        return (minterm & mask) == value;
    }

    /**
     * Two cubes can be merged iff they have the same relevant bits and their values differ in
     * exactly one of them.
     */
    boolean isAdjacentTo(Cube other) {
        return mask == other.mask && Integer.bitCount(value ^ other.value) == 1;
    }

    /**
     * Returns the cube covering both this and the given adjacent cube, where the differing bit is
     * don't-care.
     */
    Cube merge(Cube other) {
        assert isAdjacentTo(other);
        int difference = value ^ other.value;
        return new Cube(value & other.value, mask & ~difference);
    }

    /**
     * Returns the minterms of {@code target} covered by this cube.
     */
    BitSet coveredMinterms(BitSet target) {
        BitSet covered = new BitSet(target.length());
        for (int minterm = target.nextSetBit(0); minterm >= 0; minterm = target.nextSetBit(minterm + 1)) {
            if (covers(minterm)) {
                covered.set(minterm);
            }
        }
        return covered;
    }

    /**
     * Returns all minterms over {@code variables} variables covered by this cube.
     */
    BitSet coveredMinterms(int variables) {
        int fullMask = (1 << variables) - 1;
        checkArgument((mask & ~fullMask) == 0, "Cube %s exceeds %s variables", this, variables);

        // Enumerate all submasks of the don't-care bits, including the empty one
        int free = fullMask & ~mask;
        BitSet covered = new BitSet(1 << variables);
        int assignment = free;
        while (true) {
            covered.set(value | assignment);
            if (assignment == 0) {
                break;
            }
            assignment = (assignment - 1) & free;
        }
        return covered;
    }

    /**
     * Renders the cube over the given number of variables, most significant bit first, using
     * {@code -} for don't-care positions, e.g. {@code 1-0}.
     */
    String pattern(int variables) {
        StringBuilder builder = new StringBuilder(variables);
        for (int bit = variables - 1; bit >= 0; bit--) {
            int position = 1 << bit;
            if ((mask & position) == 0) {
                builder.append('-');
            } else {
                builder.append((value & position) == 0 ? '0' : '1');
            }
        }
        return builder.toString();
    }

    @Override
    public int compareTo(Cube o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cube)) {
            return false;
        }
        Cube other = (Cube) o;
        return value == other.value && mask == other.mask;
    }

    @Override
    public int hashCode() {
        return 31 * mask + value;
    }

    @Override
    public String toString() {
        return String.format("Cube{value=%s, mask=%s}", Integer.toBinaryString(value), Integer.toBinaryString(mask));
    }
}
