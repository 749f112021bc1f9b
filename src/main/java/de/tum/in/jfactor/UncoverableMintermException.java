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

/**
 * Signals that a target minterm is not covered by any prime implicant. This can only be caused by a
 * defect in the prime implicant computation, never by the input.
 */
public class UncoverableMintermException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int minterm;

    public UncoverableMintermException(int minterm) {
        super(String.format("Minterm %d is not covered by any prime implicant", minterm));
        this.minterm = minterm;
    }

    public int minterm() {
        return minterm;
    }
}
