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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * A disjunction of {@link Term terms}. The empty expression is never satisfied.
 *
 * <p>Expressions are duplicate free and keep their terms in ascending order, hence
 * {@link #toString()} yields the canonical (but not minimized) bracket notation, e.g.
 * {@code [AB][C]}.</p>
 */
public final class Expression implements Iterable<Term> {
    private static final Expression EMPTY = new Expression(List.of());

    private final List<Term> terms;

    private Expression(List<Term> terms) {
        this.terms = terms;
    }

    public static Expression empty() {
        return EMPTY;
    }

    public static Expression of(Term... terms) {
        return of(Arrays.asList(terms));
    }

    public static Expression of(Collection<Term> terms) {
        if (terms.isEmpty()) {
            return EMPTY;
        }
        return new Expression(List.copyOf(new TreeSet<>(terms)));
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int size() {
        return terms.size();
    }

    public boolean contains(Term term) {
        return terms.contains(term);
    }

    public List<Term> terms() {
        return terms;
    }

    /**
     * Returns the indices of all symbols occurring in some term.
     */
    BitSet symbolIndices() {
        BitSet indices = new BitSet(Term.ALPHABET_SIZE);
        for (Term term : terms) {
            indices.or(term.symbolIndices());
        }
        return indices;
    }

    @Override
    public Iterator<Term> iterator() {
        return terms.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Expression && terms.equals(((Expression) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        terms.forEach(builder::append);
        return builder.toString();
    }
}
