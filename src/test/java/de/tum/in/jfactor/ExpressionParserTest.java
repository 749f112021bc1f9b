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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

public class ExpressionParserTest {
    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "-", " - ", "[]", "[ ]", "[12][ab]", "no brackets at all"})
    public void testNoAccess(String text) {
        assertThat(ExpressionParser.parse(text).isEmpty(), is(true));
    }

    @Test
    public void testTerms() {
        Expression expression = ExpressionParser.parse("[AB][C]");
        assertThat(expression, is(Expression.of(Term.of("AB"), Term.of("C"))));
        assertThat(expression.size(), is(2));
    }

    @Test
    public void testTermsAreSets() {
        Expression expression = ExpressionParser.parse("[BA][AB][ABA]");
        assertThat(expression.size(), is(1));
        assertThat(expression.contains(Term.of("AB")), is(true));
    }

    @Test
    public void testWhitespaceAndNoise() {
        assertThat(ExpressionParser.parse("[ A B ]").toString(), is("[AB]"));
        assertThat(ExpressionParser.parse("foo [A] bar [[B]] [C-D]").toString(), is("[A][B][CD]"));
        assertThat(ExpressionParser.parse("[A][]").toString(), is("[A]"));
    }

    @Test
    public void testCanonicalOrder() {
        assertThat(ExpressionParser.parse("[C][BA][B]").toString(), is("[AB][B][C]"));
    }
}
