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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class CoverFormatterTest {
    private static final VariableUniverse ABC = VariableUniverse.ofSymbols("ABC");

    @Test
    public void testNegativeLiteralsDropped() {
        // A = 1, C = 0
        assertThat(CoverFormatter.format(List.of(new Cube(0b100, 0b101)), ABC), is("[A]"));
        // P = 0, Q = 1 as left by a pivot substitution
        assertThat(CoverFormatter.format(List.of(new Cube(0b01, 0b11)), VariableUniverse.ofSymbols("PQ")),
                is("[Q]"));
    }

    @Test
    public void testOrdering() {
        List<Cube> cover = List.of(new Cube(0b011, 0b011), new Cube(0b100, 0b100), new Cube(0b110, 0b111));
        assertThat(CoverFormatter.format(cover, ABC), is("[A][AB][BC]"));
        assertThat(CoverFormatter.toTerm(new Cube(0b111, 0b111), ABC).symbols(), is("ABC"));
    }

    @Test
    public void testDuplicateTermsMerged() {
        List<Cube> cover = List.of(new Cube(0b100, 0b101), new Cube(0b100, 0b100));
        assertThat(CoverFormatter.toExpression(cover, ABC).size(), is(1));
    }

    @Test
    public void testEmptyCover() {
        assertThat(CoverFormatter.format(List.of(), ABC), is(""));
    }

    @Test
    public void testNoPositiveLiteral() {
        VariableUniverse universe = VariableUniverse.ofSymbols("AB");
        assertThrows(IllegalArgumentException.class,
                () -> CoverFormatter.format(List.of(new Cube(0, 0b11)), universe));
        assertThrows(IllegalArgumentException.class,
                () -> CoverFormatter.toTerm(new Cube(0, 0), universe));
    }
}
