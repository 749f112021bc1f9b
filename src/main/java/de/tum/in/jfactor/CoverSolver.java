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
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selects a minimal cover from a set of prime implicants: first all essential implicants, then an
 * exact choice for the remaining minterms by Petrick's method.
 *
 * <p>A cover is minimal if it has the least number of implicants and, among those, the least total
 * number of literals. Remaining ties are broken by choosing the lexicographically smallest sequence
 * of implicant indices, so the result only depends on the order of the given implicants.</p>
 */
final class CoverSolver {
    private static final Logger logger = Logger.getLogger(CoverSolver.class.getName());

    private CoverSolver() {}

    /**
     * Computes a minimal cover of {@code target}.
     *
     * @param primes The prime implicants of {@code target}.
     * @param target The minterms to be covered.
     * @return The essential implicants followed by the chosen remaining implicants.
     * @throws UncoverableMintermException if some minterm of {@code target} is not covered by any of
     *     the {@code primes}.
     */
    static List<Cube> minimalCover(List<Cube> primes, BitSet target) {
        if (target.isEmpty()) {
            return List.of();
        }

        int size = primes.size();
        BitSet[] coverage = new BitSet[size];
        int[] literalCounts = new int[size];
        for (int i = 0; i < size; i++) {
            Cube prime = primes.get(i);
            coverage[i] = prime.coveredMinterms(target);
            literalCounts[i] = prime.literalCount();
        }

        BitSet essential = new BitSet(size);
        for (int minterm = target.nextSetBit(0); minterm >= 0; minterm = target.nextSetBit(minterm + 1)) {
            int coveringIndex = -1;
            int coveringCount = 0;
            for (int i = 0; i < size && coveringCount < 2; i++) {
                if (coverage[i].get(minterm)) {
                    coveringIndex = i;
                    coveringCount += 1;
                }
            }
            if (coveringCount == 1) {
                essential.set(coveringIndex);
            }
        }

        BitSet remaining = BitSets.copyOf(target);
        for (int i = essential.nextSetBit(0); i >= 0; i = essential.nextSetBit(i + 1)) {
            remaining.andNot(coverage[i]);
        }

        List<Cube> cover = new ArrayList<>();
        for (int i = essential.nextSetBit(0); i >= 0; i = essential.nextSetBit(i + 1)) {
            cover.add(primes.get(i));
        }
        if (remaining.isEmpty()) {
            logger.log(Level.FINER, "Cover consists of {0} essential implicants", cover.size());
            return cover;
        }

        List<BitSet> clauses = new ArrayList<>(remaining.cardinality());
        for (int minterm = remaining.nextSetBit(0); minterm >= 0; minterm = remaining.nextSetBit(minterm + 1)) {
            BitSet clause = new BitSet(size);
            for (int i = 0; i < size; i++) {
                if (coverage[i].get(minterm)) {
                    clause.set(i);
                }
            }
            if (clause.isEmpty()) {
                throw new UncoverableMintermException(minterm);
            }
            clauses.add(clause);
        }

        BitSet chosen = petrick(clauses, literalCounts);
        for (int i = chosen.nextSetBit(0); i >= 0; i = chosen.nextSetBit(i + 1)) {
            cover.add(primes.get(i));
        }
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Cover consists of {0} essential and {1} chosen implicants for {2} clauses",
                    new Object[] {essential.cardinality(), chosen.cardinality(), clauses.size()});
        }
        return cover;
    }

    /**
     * Multiplies out the product of the given clauses (each a sum of implicant indices) into a sum of
     * products, discarding every product which contains another one, and returns the cheapest product.
     */
    static BitSet petrick(List<BitSet> clauses, int[] literalCounts) {
        Comparator<BitSet> cost = costOrder(literalCounts);
        List<BitSet> products = List.of(new BitSet());
        for (BitSet clause : clauses) {
            Set<BitSet> expanded = new HashSet<>();
            for (BitSet product : products) {
                for (int i = clause.nextSetBit(0); i >= 0; i = clause.nextSetBit(i + 1)) {
                    BitSet extended = BitSets.copyOf(product);
                    extended.set(i);
                    expanded.add(extended);
                }
            }
            products = absorb(expanded, cost);
        }
        // absorb keeps products sorted by cost
        return products.get(0);
    }

    /**
     * Removes all products which are a superset of another product. The result is sorted by the given
     * order, which has to be compatible with set inclusion, i.e. order every set before its supersets.
     */
    static List<BitSet> absorb(Collection<BitSet> products, Comparator<BitSet> order) {
        List<BitSet> sorted = new ArrayList<>(products);
        sorted.sort(order);

        List<BitSet> minimal = new ArrayList<>(sorted.size());
        for (BitSet product : sorted) {
            boolean absorbed = false;
            for (BitSet smaller : minimal) {
                if (BitSets.isSubset(smaller, product)) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                minimal.add(product);
            }
        }
        return minimal;
    }

    static Comparator<BitSet> costOrder(int[] literalCounts) {
        return Comparator.comparingInt(BitSet::cardinality)
                .thenComparingInt((BitSet product) -> literalCount(product, literalCounts))
                .thenComparing(BitSets.INDEX_ORDER);
    }

    private static int literalCount(BitSet product, int[] literalCounts) {
        int count = 0;
        for (int i = product.nextSetBit(0); i >= 0; i = product.nextSetBit(i + 1)) {
            count += literalCounts[i];
        }
        return count;
    }
}
