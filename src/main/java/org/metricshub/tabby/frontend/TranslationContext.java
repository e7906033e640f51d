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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * State of one translation run, handed to every translation step.
 * A new context is created for every run, so runs never see each other's variables.
 */
public class TranslationContext {

	private final SymbolTable symbolTable = new SymbolTable();

	private final SortedSet<Integer> programArguments = new TreeSet<Integer>();

	private Set<String> parameters = Collections.emptySet();

	private String function;

	public SymbolTable getSymbolTable() {
		return symbolTable;
	}

	/**
	 * @return indexes of the program arguments referenced so far, ascending
	 */
	public SortedSet<Integer> getProgramArguments() {
		return Collections.unmodifiableSortedSet(programArguments);
	}

	/**
	 * Records the program arguments referenced in a piece of verbatim text.
	 *
	 * @param text expression or argument list
	 */
	public void noteReferences(String text) {
		ProgramArguments.collect(text, programArguments);
	}

	/**
	 * Enters a function body: its parameters are variables that need no declaration.
	 *
	 * @param signature the function being translated
	 */
	public void enterFunction(FunctionSignature signature) {
		parameters = new LinkedHashSet<String>(signature.getParameters());
		function = signature.getName();
	}

	/**
	 * Leaves the current function body, if any.
	 */
	public void leaveFunction() {
		parameters = Collections.emptySet();
		function = null;
	}

	/**
	 * @return name of the function being translated, {@code null} at top level
	 */
	public String getFunctionName() {
		return function;
	}

	/**
	 * @param name an identifier
	 * @return {@code true} when {@code name} is a parameter of the function being translated
	 */
	public boolean isParameter(String name) {
		return parameters.contains(name);
	}
}
