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
import static de.tum.in.jfactor.Util.checkState;

import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

final class MinimizerImpl implements Minimizer {
    private static final Logger logger = Logger.getLogger(MinimizerImpl.class.getName());

    private final MinimizerConfiguration configuration;

    MinimizerImpl(MinimizerConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public MinimizerConfiguration configuration() {
        return configuration;
    }

    @Override
    public String minimize(Expression expression, VariableUniverse hint) {
        VariableUniverse universe = VariableUniverse.of(expression).union(hint);
        if (!isTractable(universe)) {
            return "";
        }
        return minimize(MintermGenerator.minterms(expression, universe), universe);
    }

    @Override
    public String minimizeWithSubstitution(Expression primary, @Nullable Expression secondary, char pivot) {
        checkArgument(Term.isSymbol(pivot), "Pivot '%s' is not a factor symbol", pivot);
        if (secondary == null) {
            return minimize(primary);
        }

        VariableUniverse universe = VariableUniverse.of(primary, secondary);
        if (!isTractable(universe)) {
            return "";
        }
        BitSet minterms = MintermGenerator.minterms(primary, universe);
        if (universe.contains(pivot)) {
            BitSet secondaryMinterms = MintermGenerator.minterms(secondary, universe.without(pivot));
            minterms = MintermGenerator.substitute(minterms, universe, pivot, secondaryMinterms);
        }
        return minimize(minterms, universe);
    }

    private boolean isTractable(VariableUniverse universe) {
        if (universe.size() <= configuration.maxVariables()) {
            return true;
        }
        logger.log(Level.FINE, "Universe {0} exceeds the limit of {1} variables, not minimizing",
                new Object[] {universe, configuration.maxVariables()});
        return false;
    }

    private String minimize(BitSet target, VariableUniverse universe) {
        if (target.isEmpty()) {
            return "";
        }
        List<Cube> primes = PrimeImplicants.find(target, universe.size(), configuration.maxVariables());
        List<Cube> cover = CoverSolver.minimalCover(primes, target);
        if (configuration.verifyCovers()) {
            verify(cover, target, universe);
        }

        String result = CoverFormatter.format(cover, universe);
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Minimized {0} minterms over {1} with {2} prime implicants to {3}",
                    new Object[] {target.cardinality(), universe, primes.size(), result});
        }
        return result;
    }

    private static void verify(List<Cube> cover, BitSet target, VariableUniverse universe) {
        BitSet covered = new BitSet(universe.mintermCount());
        for (Cube cube : cover) {
            covered.or(cube.coveredMinterms(universe.size()));
        }
        checkState(covered.equals(target), "Cover %s of %s describes %s instead of %s",
                cover, universe, covered, target);
    }

    @Override
    public String toString() {
        return String.format("Minimizer{maxVariables=%d, pivot=%s}", configuration.maxVariables(),
                configuration.pivot());
    }
}
