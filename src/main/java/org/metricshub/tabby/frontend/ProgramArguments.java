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

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The identifiers {@code arg0} to {@code arg9} stand for the numeric
 * command-line arguments of the generated program.
 */
public final class ProgramArguments {

	/** Number of program arguments addressable by name. */
	public static final int COUNT = 10;

	private static final Pattern NAME = Pattern.compile("^arg([0-9])$");

	private static final Pattern REFERENCE = Pattern.compile("(?<![A-Za-z0-9_])arg([0-9])(?![A-Za-z0-9_])");

	private ProgramArguments() {}

	/**
	 * @param name an identifier
	 * @return {@code true} when {@code name} is one of {@code arg0} to {@code arg9}
	 */
	public static boolean isArgumentName(String name) {
		return name != null && NAME.matcher(name).matches();
	}

	/**
	 * @param index position of the argument, 0 to 9
	 * @return the identifier naming it
	 */
	public static String nameOf(int index) {
		return "arg" + index;
	}

	/**
	 * Adds to {@code used} the index of every argument referenced in {@code text}.
	 *
	 * @param text expression or argument list, copied verbatim into the generated code
	 * @param used receives the indexes found
	 */
	public static void collect(String text, Set<Integer> used) {
		Matcher m = REFERENCE.matcher(text);
		while (m.find()) {
			used.add(Integer.valueOf(m.group(1)));
		}
	}
}
