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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;

/**
 * Renders covers in canonical bracket notation.
 *
 * <p>Only literals which are required to be 1 are rendered; relevant bits required to be 0 are
 * dropped. This is exact only for monotone functions, whose minimal covers use positive literals
 * exclusively. All functions built from {@link Expression expressions} are monotone. After a pivot
 * substitution the function is monotone in all other symbols and the pivot is required to be 0, so
 * dropping its literal eliminates the pivot from the result.</p>
 */
final class CoverFormatter {
    private CoverFormatter() {}

    static String format(Collection<Cube> cover, VariableUniverse universe) {
        return toExpression(cover, universe).toString();
    }

    static Expression toExpression(Collection<Cube> cover, VariableUniverse universe) {
        List<Term> terms = new ArrayList<>(cover.size());
        for (Cube cube : cover) {
            terms.add(toTerm(cube, universe));
        }
        return Expression.of(terms);
    }

    /**
     * Returns the term made of the positive literals of the cube.
     *
     * @throws IllegalArgumentException if the cube has no positive literal.
     */
    static Term toTerm(Cube cube, VariableUniverse universe) {
        checkArgument(cube.positiveLiterals() != 0, "%s has no positive literal", cube.pattern(universe.size()));
        BitSet symbols = new BitSet(Term.ALPHABET_SIZE);
        for (int index = 0; index < universe.size(); index++) {
            if ((cube.positiveLiterals() & universe.bitAt(index)) != 0) {
                symbols.set(Term.indexOf(universe.symbolAt(index)));
            }
        }
        return Term.of(symbols);
    }
}
