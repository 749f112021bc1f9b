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

import java.util.Arrays;
import java.util.BitSet;

/**
 * The ordered set of factor symbols a computation ranges over. Symbols are sorted ascending and the
 * symbol at index {@code i} is bound to bit {@code size() - 1 - i} of a minterm, so index 0 is the
 * most significant bit, as in the conventional numbering of truth table rows.
 */
public final class VariableUniverse {
    private static final VariableUniverse EMPTY = new VariableUniverse(new BitSet());

    private final BitSet symbolIndices;
    private final char[] symbols;

    private VariableUniverse(BitSet symbolIndices) {
        this.symbolIndices = symbolIndices;
        this.symbols = new char[symbolIndices.cardinality()];
        int pos = 0;
        for (int i = symbolIndices.nextSetBit(0); i >= 0; i = symbolIndices.nextSetBit(i + 1)) {
            symbols[pos] = Term.symbolOf(i);
            pos += 1;
        }
    }

    public static VariableUniverse empty() {
        return EMPTY;
    }

    /**
     * Builds the universe of all symbols occurring in any of the given expressions.
     */
    public static VariableUniverse of(Expression... expressions) {
        BitSet indices = new BitSet(Term.ALPHABET_SIZE);
        for (Expression expression : expressions) {
            indices.or(expression.symbolIndices());
        }
        return of(indices);
    }

    /**
     * Builds the universe of the given symbols, e.g. {@code "ABP"}. Order and duplicates are
     * irrelevant.
     *
     * @throws IllegalArgumentException if a character is not a factor symbol.
     */
    public static VariableUniverse ofSymbols(CharSequence symbols) {
        BitSet indices = new BitSet(Term.ALPHABET_SIZE);
        for (int i = 0; i < symbols.length(); i++) {
            char symbol = symbols.charAt(i);
            checkArgument(Term.isSymbol(symbol), "Invalid factor symbol '%s' in %s", symbol, symbols);
            indices.set(Term.indexOf(symbol));
        }
        return of(indices);
    }

    private static VariableUniverse of(BitSet indices) {
        return indices.isEmpty() ? EMPTY : new VariableUniverse(indices);
    }

    public VariableUniverse union(VariableUniverse other) {
        if (BitSets.isSubset(other.symbolIndices, symbolIndices)) {
            return this;
        }
        BitSet union = BitSets.copyOf(symbolIndices);
        union.or(other.symbolIndices);
        return of(union);
    }

    /**
     * Returns this universe without the given symbol. The relative order of the remaining symbols
     * is unchanged.
     */
    public VariableUniverse without(char symbol) {
        if (!contains(symbol)) {
            return this;
        }
        BitSet remaining = BitSets.copyOf(symbolIndices);
        remaining.clear(Term.indexOf(symbol));
        return of(remaining);
    }

    public int size() {
        return symbols.length;
    }

    public boolean isEmpty() {
        return symbols.length == 0;
    }

    public boolean contains(char symbol) {
        return Term.isSymbol(symbol) && symbolIndices.get(Term.indexOf(symbol));
    }

    /**
     * Returns whether every symbol of the term is part of this universe.
     */
    public boolean contains(Term term) {
        return BitSets.isSubset(term.symbolIndices(), symbolIndices);
    }

    /**
     * Returns the position of the given symbol or {@code -1} if it is not part of this universe.
     */
    public int indexOf(char symbol) {
        if (!contains(symbol)) {
            return -1;
        }
        return Arrays.binarySearch(symbols, symbol);
    }

    public char symbolAt(int index) {
        return symbols[index];
    }

    /**
     * Returns the minterm bit the symbol at the given position is bound to.
     */
    int bitAt(int index) {
        assert 0 <= index && index < symbols.length;
        return 1 << (symbols.length - 1 - index);
    }

    /**
     * Returns the minterm bit the given symbol is bound to.
     *
     * @throws IllegalArgumentException if the symbol is not part of this universe.
     */
    public int bitOf(char symbol) {
        int index = indexOf(symbol);
        checkArgument(index >= 0, "Symbol %s not in universe %s", symbol, this);
        return bitAt(index);
    }

    /**
     * Returns the mask with all bits of this universe set.
     */
    public int fullMask() {
        return mintermCount() - 1;
    }

    /**
     * Returns the number of assignments over this universe, i.e. {@code 2^size()}.
     */
    public int mintermCount() {
        return 1 << symbols.length;
    }

    /**
     * Returns the bit mask of the given term, i.e. the set of bits which have to be 1 for the term to
     * be satisfied.
     *
     * @throws IllegalArgumentException if the term is not contained in this universe.
     */
    int maskOf(Term term) {
        int mask = 0;
        BitSet indices = term.symbolIndices();
        for (int i = indices.nextSetBit(0); i >= 0; i = indices.nextSetBit(i + 1)) {
            mask |= bitOf(Term.symbolOf(i));
        }
        return mask;
    }

    public String symbols() {
        return String.valueOf(symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VariableUniverse && symbolIndices.equals(((VariableUniverse) o).symbolIndices);
    }

    @Override
    public int hashCode() {
        return symbolIndices.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(3 * symbols.length + 2).append('{');
        for (int i = 0; i < symbols.length; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(symbols[i]);
        }
        return builder.append('}').toString();
    }
}
