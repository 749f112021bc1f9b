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

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Reads expressions in bracket notation, e.g. {@code [AB][C]} for "A and B together, or C alone".
 *
 * <p>Parsing is lenient and never fails: text outside of bracket groups and characters inside a
 * group which are not factor symbols are ignored, groups without any symbol are dropped. The empty
 * string and the placeholder {@code -} denote the empty expression.</p>
 */
public final class ExpressionParser {
    public static final String NO_ACCESS = "-";

    private static final Pattern GROUP = Pattern.compile("\\[([^\\[\\]]*)]");

    private ExpressionParser() {}

    public static Expression parse(@Nullable String text) {
        if (text == null) {
            return Expression.empty();
        }
        String stripped = text.strip();
        if (stripped.isEmpty() || NO_ACCESS.equals(stripped)) {
            return Expression.empty();
        }

        Set<Term> terms = new HashSet<>();
        Matcher matcher = GROUP.matcher(stripped);
        while (matcher.find()) {
            String group = matcher.group(1);
            BitSet symbols = new BitSet(Term.ALPHABET_SIZE);
            for (int i = 0; i < group.length(); i++) {
                char character = group.charAt(i);
                if (Term.isSymbol(character)) {
                    symbols.set(Term.indexOf(character));
                }
            }
            if (!symbols.isEmpty()) {
                terms.add(Term.of(symbols));
            }
        }
        return Expression.of(terms);
    }
}
