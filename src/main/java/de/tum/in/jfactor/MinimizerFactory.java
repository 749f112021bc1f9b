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

public final class MinimizerFactory {
    private MinimizerFactory() {}

    public static Minimizer buildMinimizer() {
        return buildMinimizer(ImmutableMinimizerConfiguration.builder().build());
    }

    public static Minimizer buildMinimizer(MinimizerConfiguration configuration) {
        return new MinimizerImpl(configuration);
    }
}
