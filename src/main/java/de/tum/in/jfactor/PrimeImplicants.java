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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Quine-McCluskey computation of prime implicants.
 */
final class PrimeImplicants {
    private static final Logger logger = Logger.getLogger(PrimeImplicants.class.getName());

    private PrimeImplicants() {}

    /**
     * Computes all prime implicants of the given minterm set, in ascending {@link Cube} order. If
     * {@code variables} exceeds {@code maxVariables}, no search is attempted and the result is empty.
     *
     * @param minterms The target minterms.
     * @param variables The number of variables the minterms range over.
     * @param maxVariables The largest number of variables to minimize over.
     */
    static List<Cube> find(BitSet minterms, int variables, int maxVariables) {
        if (variables > maxVariables) {
            logger.log(Level.FINE, "Not searching prime implicants over {0} variables (limit {1})",
                    new Object[] {variables, maxVariables});
            return List.of();
        }
        if (minterms.isEmpty()) {
            return List.of();
        }
        assert minterms.length() <= (1 << variables);

        int fullMask = (1 << variables) - 1;
        Set<Cube> generation = new LinkedHashSet<>();
        for (int minterm = minterms.nextSetBit(0); minterm >= 0; minterm = minterms.nextSetBit(minterm + 1)) {
            generation.add(Cube.ofMinterm(minterm, fullMask));
        }

        Set<Cube> primes = new TreeSet<>();
        int round = 0;
        while (!generation.isEmpty()) {
            Set<Cube> next = new LinkedHashSet<>();
            Set<Cube> merged = new HashSet<>();

            // Only cubes with equal masks can be adjacent
            for (List<Cube> candidates : byMask(generation).values()) {
                for (int i = 0; i < candidates.size(); i++) {
                    Cube cube = candidates.get(i);
                    for (int j = i + 1; j < candidates.size(); j++) {
                        Cube other = candidates.get(j);
                        if (cube.isAdjacentTo(other)) {
                            next.add(cube.merge(other));
                            merged.add(cube);
                            merged.add(other);
                        }
                    }
                }
            }

            for (Cube cube : generation) {
                if (!merged.contains(cube)) {
                    primes.add(cube);
                }
            }
            if (logger.isLoggable(Level.FINEST)) {
                logger.log(Level.FINEST, "Round {0}: {1} cubes, {2} merged, {3} primes so far",
                        new Object[] {round, generation.size(), merged.size(), primes.size()});
            }
            generation = next;
            round += 1;
        }
        return List.copyOf(primes);
    }

    private static Map<Integer, List<Cube>> byMask(Set<Cube> cubes) {
        Map<Integer, List<Cube>> groups = new LinkedHashMap<>();
        for (Cube cube : cubes) {
            groups.computeIfAbsent(cube.mask(), mask -> new ArrayList<>()).add(cube);
        }
        return groups;
    }
}
