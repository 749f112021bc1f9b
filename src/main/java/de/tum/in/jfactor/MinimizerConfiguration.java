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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class MinimizerConfiguration {
    public static final int DEFAULT_MAX_VARIABLES = 6;
    public static final char DEFAULT_PIVOT = 'P';

    /**
     * The largest universe which is minimized. Larger universes yield the empty result.
     */
    @Value.Default
    public int maxVariables() {
        return DEFAULT_MAX_VARIABLES;
    }

    /**
     * The symbol replaced by the secondary expression if none is given explicitly.
     */
    @Value.Default
    public char pivot() {
        return DEFAULT_PIVOT;
    }

    /**
     * Whether to check that every computed cover describes exactly the target minterms.
     */
    @Value.Default
    public boolean verifyCovers() {
        return false;
    }

    @Value.Check
    protected void check() {
        checkArgument(0 <= maxVariables() && maxVariables() <= Term.ALPHABET_SIZE,
                "Variable bound %s not in [0, %s]", maxVariables(), Term.ALPHABET_SIZE);
        checkArgument(Term.isSymbol(pivot()), "Pivot '%s' is not a factor symbol", pivot());
    }
}
