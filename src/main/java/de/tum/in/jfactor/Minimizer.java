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

import javax.annotation.Nullable;

/**
 * Computes exact minimal sum-of-products forms of access expressions.
 *
 * <p>All methods are pure: every call is an independent computation and implementations keep no
 * state between calls, so an instance may be shared freely between threads. Results are given in
 * canonical bracket notation, where the empty string means "never satisfied". If the universe of a
 * computation exceeds {@link MinimizerConfiguration#maxVariables()}, the result is the empty string
 * as well.</p>
 *
 * @see ExpressionParser
 */
public interface Minimizer {
    MinimizerConfiguration configuration();

    /**
     * Minimizes the given expression over the universe of its own symbols.
     *
     * @param expression The expression text, see {@link ExpressionParser#parse(String)}.
     * @return The minimal cover in canonical notation.
     * @throws UncoverableMintermException if the cover computation fails due to an internal defect.
     */
    default String minimize(@Nullable String expression) {
        return minimize(ExpressionParser.parse(expression));
    }

    /**
     * Minimizes the given expression over the universe of its own symbols extended by {@code hint}.
     */
    default String minimize(@Nullable String expression, VariableUniverse hint) {
        return minimize(ExpressionParser.parse(expression), hint);
    }

    default String minimize(Expression expression) {
        return minimize(expression, VariableUniverse.empty());
    }

    String minimize(Expression expression, VariableUniverse hint);

    /**
     * Minimizes {@code primary} after substituting the {@link MinimizerConfiguration#pivot()
     * configured pivot} by {@code secondary}.
     *
     * @see #minimizeWithSubstitution(String, String, char)
     */
    default String minimizeWithSubstitution(@Nullable String primary, @Nullable String secondary) {
        return minimizeWithSubstitution(primary, secondary, configuration().pivot());
    }

    /**
     * Minimizes {@code primary} after substituting {@code pivot} by {@code secondary}. The pivot
     * denotes a gate which can also be passed through a more detailed, alternative condition: wherever
     * the primary expression requires the pivot, the secondary expression is required instead.
     *
     * <p>Both expressions share one universe. A {@code null} or empty secondary text means that no
     * secondary expression is given and the substitution is skipped; any other text, including blank
     * text and the placeholder {@code -}, is parsed and substituted. The substitution is also skipped if the pivot
     * does not occur in either expression.</p>
     *
     * @param primary The primary expression text.
     * @param secondary The secondary expression text or {@code null}.
     * @param pivot The substituted symbol.
     * @return The minimal cover of the substituted function in canonical notation.
     */
    default String minimizeWithSubstitution(@Nullable String primary, @Nullable String secondary, char pivot) {
        Expression secondaryExpression =
                secondary == null || secondary.isEmpty() ? null : ExpressionParser.parse(secondary);
        return minimizeWithSubstitution(ExpressionParser.parse(primary), secondaryExpression, pivot);
    }

    String minimizeWithSubstitution(Expression primary, @Nullable Expression secondary, char pivot);
}
