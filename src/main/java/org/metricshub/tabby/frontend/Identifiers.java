package org.metricshub.tabby.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Tabby
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.tabby.Diagnostic;

/**
 * Rules for function, parameter and variable names.
 */
public final class Identifiers {

	/** Longest name accepted. */
	public static final int MAX_LENGTH = 12;

	/** Regular expression of one identifier, without anchors. */
	public static final String REGEX = "[A-Za-z_][A-Za-z0-9_]*";

	private static final Pattern IDENTIFIER = Pattern.compile(REGEX);

	/**
	 * Names that cannot be declared: C keywords, and the names the generated
	 * unit defines or calls itself.
	 */
	private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"auto", "break", "case", "char", "const", "continue", "default", "do",
			"double", "else", "enum", "extern", "float", "for", "goto", "if",
			"inline", "int", "long", "register", "restrict", "return", "short", "signed",
			"sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
			"volatile", "while", "_Bool", "_Complex", "_Imaginary",
			"main", "argc", "argv", StatementTranslator.PRINT_FUNCTION,
			"printf", "fabs", "atof")));

	private Identifiers() {}

	/**
	 * @param name candidate name
	 * @return {@code true} when {@code name} is a well-formed identifier of at most {@link #MAX_LENGTH} characters
	 */
	public static boolean isValid(String name) {
		return name != null && name.length() <= MAX_LENGTH && IDENTIFIER.matcher(name).matches();
	}

	/**
	 * @param name a valid identifier
	 * @return {@code true} when {@code name} clashes with C or with the generated unit,
	 *         so no variable, parameter nor function can be declared under it
	 */
	public static boolean isReserved(String name) {
		return RESERVED.contains(name);
	}

	/**
	 * Same as {@link #require(int, String)}, also rejecting reserved names.
	 *
	 * @param lineNumber line the name appears on
	 * @param name name about to be declared
	 * @return {@code name}
	 * @throws TranslationException when {@code name} is not a valid identifier or is reserved
	 */
	public static String requireUnreserved(int lineNumber, String name) {
		require(lineNumber, name);
		if (isReserved(name)) {
			throw new TranslationException(lineNumber, Diagnostic.Kind.INVALID_IDENTIFIER, "'" + name + "' is reserved");
		}
		return name;
	}

	/**
	 * @param lineNumber line the name appears on
	 * @param name name to check
	 * @return {@code name}
	 * @throws TranslationException when {@code name} is not a valid identifier
	 */
	public static String require(int lineNumber, String name) {
		if (!isValid(name)) {
			String reason = name != null && name.length() > MAX_LENGTH
					? "'" + name + "' is longer than " + MAX_LENGTH + " characters"
					: "'" + name + "'";
			throw new TranslationException(lineNumber, Diagnostic.Kind.INVALID_IDENTIFIER, reason);
		}
		return name;
	}
}
