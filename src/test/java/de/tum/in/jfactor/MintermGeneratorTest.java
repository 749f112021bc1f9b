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

import java.util.BitSet;
import org.junit.jupiter.api.Test;

public class MintermGeneratorTest {
    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int index : indices) {
            set.set(index);
        }
        return set;
    }

    @Test
    public void testMinterms() {
        VariableUniverse universe = VariableUniverse.ofSymbols("ABC");
        BitSet minterms = MintermGenerator.minterms(ExpressionParser.parse("[A][BC]"), universe);
        assertThat(minterms, is(bits(3, 4, 5, 6, 7)));
    }

    @Test
    public void testBitOrder() {
        VariableUniverse universe = VariableUniverse.ofSymbols("BA");
        assertThat(universe.bitOf('A'), is(0b10));
        assertThat(universe.bitOf('B'), is(0b01));
        assertThat(MintermGenerator.minterms(ExpressionParser.parse("[A]"), universe), is(bits(2, 3)));
    }

    @Test
    public void testTermOutsideUniverse() {
        VariableUniverse universe = VariableUniverse.ofSymbols("A");
        assertThat(MintermGenerator.minterms(ExpressionParser.parse("[AB]"), universe).isEmpty(), is(true));
        assertThat(MintermGenerator.minterms(ExpressionParser.parse("[AB][A]"), universe), is(bits(1)));
    }

    @Test
    public void testEmpty() {
        assertThat(MintermGenerator.minterms(Expression.empty(), VariableUniverse.empty()).isEmpty(), is(true));
        assertThat(MintermGenerator.minterms(Expression.empty(), VariableUniverse.ofSymbols("AB")).isEmpty(),
                is(true));
    }

    @Test
    public void testExpand() {
        VariableUniverse full = VariableUniverse.ofSymbols("ABP");
        VariableUniverse reduced = full.without('P');
        assertThat(reduced.symbols(), is("AB"));
        assertThat(MintermGenerator.expand(0b11, reduced, full), is(0b110));
        assertThat(MintermGenerator.expand(0b01, reduced, full), is(0b010));
    }

    @Test
    public void testSubstitute() {
        VariableUniverse universe = VariableUniverse.ofSymbols("ABP");
        BitSet primary = MintermGenerator.minterms(ExpressionParser.parse("[A][P]"), universe);
        assertThat(primary, is(bits(1, 3, 4, 5, 6, 7)));

        BitSet secondary = MintermGenerator.minterms(ExpressionParser.parse("[B]"), universe.without('P'));
        assertThat(secondary, is(bits(1, 3)));

        BitSet substituted = MintermGenerator.substitute(primary, universe, 'P', secondary);
        assertThat(substituted, is(bits(2, 4, 6)));
    }

    @Test
    public void testSubstituteEmptySecondary() {
        VariableUniverse universe = VariableUniverse.ofSymbols("AP");
        BitSet primary = MintermGenerator.minterms(ExpressionParser.parse("[A][P]"), universe);
        BitSet substituted = MintermGenerator.substitute(primary, universe, 'P', new BitSet());
        assertThat(substituted, is(bits(2)));
    }
}
