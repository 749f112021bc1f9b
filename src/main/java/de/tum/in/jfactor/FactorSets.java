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
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Predicates relating expressions to sets of presented factors.
 */
public final class FactorSets {
    private FactorSets() {}

    /**
     * Returns whether a user presenting all of {@code factors} at once is granted access, i.e. whether
     * some term of the expression only needs factors from {@code factors}.
     */
    public static boolean grantsAccess(Expression expression, Term factors) {
        for (Term term : expression) {
            if (term.isSubsetOf(factors)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether access is impossible without at least one factor of {@code combination}, i.e.
     * whether every term shares a factor with it. The empty expression never grants access, hence no
     * combination is necessary for it.
     */
    public static boolean isNecessary(Expression expression, Term combination) {
        if (expression.isEmpty()) {
            return false;
        }
        for (Term term : expression) {
            if (!term.intersects(combination)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Iterates all non-empty sets of symbols of the given universe.
     */
    public static Iterator<Term> combinations(VariableUniverse universe) {
        return new CombinationIterator(universe);
    }

    /**
     * Counts through the non-empty assignments of the universe, read as symbol sets.
     */
    private static final class CombinationIterator implements Iterator<Term> {
        private final VariableUniverse universe;
        private final int limit;
        private int next = 1;

        CombinationIterator(VariableUniverse universe) {
            this.universe = universe;
            this.limit = universe.mintermCount();
        }

        @Override
        public boolean hasNext() {
            return next < limit;
        }

        @Override
        public Term next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            BitSet symbols = new BitSet(Term.ALPHABET_SIZE);
            for (int index = 0; index < universe.size(); index++) {
                if ((next & universe.bitAt(index)) != 0) {
                    symbols.set(Term.indexOf(universe.symbolAt(index)));
                }
            }
            next += 1;
            return Term.of(symbols);
        }
    }
}
