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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class VariableUniverseTest {
    @Test
    public void testOfExpressions() {
        VariableUniverse universe = VariableUniverse.of(
                ExpressionParser.parse("[PA][C]"), ExpressionParser.parse("[BA]"));
        assertThat(universe.symbols(), is("ABCP"));
        assertThat(universe.toString(), is("{A, B, C, P}"));
        assertThat(universe.indexOf('C'), is(2));
        assertThat(universe.indexOf('D'), is(-1));
        assertThat(universe.bitOf('A'), is(0b1000));
        assertThat(universe.bitOf('P'), is(0b0001));
        assertThat(universe.fullMask(), is(0b1111));
    }

    @Test
    public void testEmpty() {
        VariableUniverse universe = VariableUniverse.of(Expression.empty(), ExpressionParser.parse("-"));
        assertThat(universe, sameInstance(VariableUniverse.empty()));
        assertThat(universe.size(), is(0));
        assertThat(universe.mintermCount(), is(1));
        assertThat(universe.fullMask(), is(0));
    }

    @Test
    public void testUnionAndWithout() {
        VariableUniverse universe = VariableUniverse.ofSymbols("BA");
        assertThat(universe.union(VariableUniverse.ofSymbols("A")), sameInstance(universe));
        assertThat(universe.union(VariableUniverse.ofSymbols("PB")).symbols(), is("ABP"));
        assertThat(universe.without('A').symbols(), is("B"));
        assertThat(universe.without('Q'), sameInstance(universe));
        assertThat(universe.without('A').without('B').isEmpty(), is(true));
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> VariableUniverse.ofSymbols("A1"));
        assertThrows(IllegalArgumentException.class, () -> VariableUniverse.ofSymbols("A").bitOf('B'));
        assertThrows(IllegalArgumentException.class, () -> Term.of(""));
        assertThrows(IllegalArgumentException.class, () -> Term.of("a"));
    }
}
