package org.metricshub.tabby.backend;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import org.metricshub.tabby.frontend.ProgramArguments;
import org.metricshub.tabby.frontend.StatementTranslator;

/**
 * Collects the generated C code and assembles the translation unit.
 * <p>
 * C has no nested functions, so the unit is built in sections: function
 * definitions and entry-point statements are collected separately, each
 * in source order, then laid out as
 * <ol>
 * <li>includes,</li>
 * <li>file-scope variables: program arguments, then the variables first assigned at top level,</li>
 * <li>the number printing helper,</li>
 * <li>function prototypes,</li>
 * <li>function definitions,</li>
 * <li>the entry point.</li>
 * </ol>
 */
public class CodeEmitter {

	static final String NEWLINE = "\n";

	static final String INDENT = "\t";

	static final String[] INCLUDES = {
		"#include <stdio.h>",
		"#include <stdlib.h>",
		"#include <math.h>"
	};

	static final String[] PRINT_HELPER = {
		"void " + StatementTranslator.PRINT_FUNCTION + "(double value) {",
		"\tif (fabs(value) < 9.0e18 && value == (double) (long long) value) {",
		"\t\tprintf(\"%lld\\n\", (long long) value);",
		"\t} else {",
		"\t\tprintf(\"%.6f\\n\", value);",
		"\t}",
		"}"
	};

	static final String ENTRY_POINT = "int main(int argc, char *argv[]) {";

	static final String EXIT = "return 0;";

	static final String CLOSE = "}";

	private final List<String> prototypes = new ArrayList<String>();
	private final StringBuilder functions = new StringBuilder();
	private final StringBuilder entryPoint = new StringBuilder();
	private boolean functionOpen;

	/**
	 * Starts a function definition.
	 *
	 * @param declarator the C declarator, e.g. {@code double f(double a)}
	 */
	public void openFunction(String declarator) {
		if (functionOpen) {
			throw new IllegalStateException("Function still open when opening " + declarator);
		}
		prototypes.add(declarator + ";");
		functions.append(declarator).append(" {").append(NEWLINE);
		functionOpen = true;
	}

	/**
	 * Ends the function definition started last.
	 */
	public void closeFunction() {
		if (!functionOpen) {
			throw new IllegalStateException("No function to close");
		}
		functions.append(CLOSE).append(NEWLINE).append(NEWLINE);
		functionOpen = false;
	}

	public boolean isFunctionOpen() {
		return functionOpen;
	}

	/**
	 * Appends a statement to the open function, or to the entry point when no function is open.
	 *
	 * @param statement one C statement, without indentation
	 */
	public void statement(String statement) {
		StringBuilder target = functionOpen ? functions : entryPoint;
		target.append(INDENT).append(statement).append(NEWLINE);
	}

	/**
	 * Assembles the complete translation unit.
	 *
	 * @param programArguments indexes of the program arguments referenced by the program
	 * @param globals variables first assigned at top level, in declaration order
	 * @return the C source
	 */
	public String render(SortedSet<Integer> programArguments, Set<String> globals) {
		if (functionOpen) {
			throw new IllegalStateException("Function still open at end of translation unit");
		}
		StringBuilder unit = new StringBuilder();
		appendLines(unit, INCLUDES);
		unit.append(NEWLINE);

		if (!programArguments.isEmpty() || !globals.isEmpty()) {
			for (Integer index : programArguments) {
				appendGlobal(unit, ProgramArguments.nameOf(index));
			}
			for (String variable : globals) {
				appendGlobal(unit, variable);
			}
			unit.append(NEWLINE);
		}

		appendLines(unit, PRINT_HELPER);
		unit.append(NEWLINE);

		if (!prototypes.isEmpty()) {
			for (String prototype : prototypes) {
				unit.append(prototype).append(NEWLINE);
			}
			unit.append(NEWLINE);
		}

		unit.append(functions);

		unit.append(ENTRY_POINT).append(NEWLINE);
		for (Integer index : programArguments) {
			int argvIndex = index + 1;
			unit
					.append(INDENT)
					.append(ProgramArguments.nameOf(index))
					.append(" = argc > ")
					.append(argvIndex)
					.append(" ? atof(argv[")
					.append(argvIndex)
					.append("]) : 0.0;")
					.append(NEWLINE);
		}
		unit.append(entryPoint);
		unit.append(INDENT).append(EXIT).append(NEWLINE);
		unit.append(CLOSE).append(NEWLINE);
		return unit.toString();
	}

	private static void appendGlobal(StringBuilder unit, String name) {
		unit.append("double ").append(name).append(" = 0.0;").append(NEWLINE);
	}

	private static void appendLines(StringBuilder unit, String[] lines) {
		for (String line : lines) {
			unit.append(line).append(NEWLINE);
		}
	}
}
