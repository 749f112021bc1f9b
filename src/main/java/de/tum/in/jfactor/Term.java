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

/**
 * A conjunction of factor symbols, i.e. a set of factors which together grant access. Factor
 * symbols are the uppercase ASCII letters {@code A} to {@code Z}.
 *
 * <p>Terms are never empty. Two terms are equal iff they contain the same symbols, regardless of
 * the order in which they were given. Terms are ordered by their {@link #symbols() symbol string}.
 * </p>
 */
public final class Term implements Comparable<Term> {
    /** Number of distinct factor symbols. */
    public static final int ALPHABET_SIZE = 26;

    private final BitSet symbolIndices;
    private final String symbols;

    private Term(BitSet symbolIndices) {
        this.symbolIndices = symbolIndices;
        StringBuilder builder = new StringBuilder(symbolIndices.cardinality());
        for (int i = symbolIndices.nextSetBit(0); i >= 0; i = symbolIndices.nextSetBit(i + 1)) {
            builder.append(symbolOf(i));
        }
        this.symbols = builder.toString();
    }

    /**
     * Creates the term containing the given symbols. Duplicates are allowed.
     *
     * @throws IllegalArgumentException if {@code symbols} is empty or contains a non-symbol character.
     */
    public static Term of(CharSequence symbols) {
        BitSet indices = new BitSet(ALPHABET_SIZE);
        for (int i = 0; i < symbols.length(); i++) {
            char symbol = symbols.charAt(i);
            checkArgument(isSymbol(symbol), "Invalid factor symbol '%s' in %s", symbol, symbols);
            indices.set(indexOf(symbol));
        }
        return of(indices);
    }

    static Term of(BitSet symbolIndices) {
        checkArgument(!symbolIndices.isEmpty(), "Terms must not be empty");
        checkArgument(symbolIndices.length() <= ALPHABET_SIZE, "Invalid symbol indices %s", symbolIndices);
        return new Term(BitSets.copyOf(symbolIndices));
    }

    public static boolean isSymbol(char character) {
        return 'A' <= character && character <= 'Z';
    }

    static int indexOf(char symbol) {
        assert isSymbol(symbol);
        return symbol - 'A';
    }

    static char symbolOf(int index) {
        assert 0 <= index && index < ALPHABET_SIZE;
        return (char) ('A' + index);
    }

    /**
     * Returns whether every factor of this term is also a factor of {@code other}.
     */
    public boolean isSubsetOf(Term other) {
        return BitSets.isSubset(symbolIndices, other.symbolIndices);
    }

    public boolean intersects(Term other) {
        return symbolIndices.intersects(other.symbolIndices);
    }

    /**
     * Returns the symbols of this term in ascending order, e.g. {@code "AB"}.
     */
    public String symbols() {
        return symbols;
    }

    BitSet symbolIndices() {
        return BitSets.copyOf(symbolIndices);
    }

    @Override
    public int compareTo(Term o) {
        return symbols.compareTo(o.symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Term && symbols.equals(((Term) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return '[' + symbols + ']';
    }
}
