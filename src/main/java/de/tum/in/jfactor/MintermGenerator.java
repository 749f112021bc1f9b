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

import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates expressions over a universe into minterm sets. Bit {@code m} of a minterm set is set iff
 * the assignment encoded by {@code m} satisfies the expression.
 */
final class MintermGenerator {
    private static final Logger logger = Logger.getLogger(MintermGenerator.class.getName());

    private MintermGenerator() {}

    /**
     * Computes the minterms of {@code expression} by evaluating every assignment of the universe. A
     * term mentioning a symbol outside of the universe is never satisfied.
     */
    static BitSet minterms(Expression expression, VariableUniverse universe) {
        int mintermCount = universe.mintermCount();
        BitSet minterms = new BitSet(mintermCount);

        int[] termMasks = expression.terms().stream()
                .filter(universe::contains)
                .mapToInt(universe::maskOf)
                .toArray();
        if (termMasks.length == 0) {
            return minterms;
        }

        for (int assignment = 0; assignment < mintermCount; assignment++) {
            for (int termMask : termMasks) {
                if ((assignment & termMask) == termMask) {
                    minterms.set(assignment);
                    break;
                }
            }
        }
        return minterms;
    }

    /**
     * Replaces the {@code pivot} by a secondary condition. Minterms where the pivot is 0 are kept
     * unchanged. Every minterm where the pivot is 1 is dropped and instead, for each secondary
     * minterm, the minterm with the pivot cleared and the secondary bits added is included.
     *
     * @param primary The minterms over {@code universe}.
     * @param universe The universe, containing the pivot.
     * @param pivot The substituted symbol.
     * @param secondary The minterms over {@code universe.without(pivot)}.
     */
    static BitSet substitute(BitSet primary, VariableUniverse universe, char pivot, BitSet secondary) {
        checkArgument(universe.contains(pivot), "Pivot %s not in universe %s", pivot, universe);
        VariableUniverse reduced = universe.without(pivot);
        int pivotBit = universe.bitOf(pivot);

        int[] expanded = new int[secondary.cardinality()];
        int pos = 0;
        for (int minterm = secondary.nextSetBit(0); minterm >= 0; minterm = secondary.nextSetBit(minterm + 1)) {
            expanded[pos] = expand(minterm, reduced, universe);
            pos += 1;
        }

        BitSet result = new BitSet(universe.mintermCount());
        for (int minterm = primary.nextSetBit(0); minterm >= 0; minterm = primary.nextSetBit(minterm + 1)) {
            if ((minterm & pivotBit) == 0) {
                result.set(minterm);
            } else {
                int base = minterm & ~pivotBit;
                for (int secondaryMinterm : expanded) {
                    result.set(base | secondaryMinterm);
                }
            }
        }

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Substituted {0} over {1}: {2} minterms became {3}",
                    new Object[] {pivot, universe, primary.cardinality(), result.cardinality()});
        }
        return result;
    }

    /**
     * Maps a minterm over {@code from} onto {@code to}, moving each bit to the position of the same
     * symbol. All symbols of {@code from} must be part of {@code to}.
     */
    static int expand(int minterm, VariableUniverse from, VariableUniverse to) {
        int result = 0;
        for (int index = 0; index < from.size(); index++) {
            if ((minterm & from.bitAt(index)) != 0) {
                result |= to.bitOf(from.symbolAt(index));
            }
        }
        return result;
    }
}
