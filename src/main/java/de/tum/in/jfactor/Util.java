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

final class Util {
    private Util() {}

    public static void checkArgument(boolean argument, String formatString, Object... format) {
        if (!argument) {
            throw new IllegalArgumentException(String.format(formatString, format));
        }
    }

    public static void checkState(boolean state, String formatString, Object... format) {
        if (!state) {
            throw new IllegalStateException(String.format(formatString, format));
        }
    }
}
