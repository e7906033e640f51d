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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Names already declared as numeric variables during one translation.
 * Names are only ever added: once declared, a variable is never declared again
 * in the same scope.
 * <p>
 * A variable first assigned at top level is global: it is declared once at
 * file scope and every function sees it. A variable first assigned inside a
 * function is local to that function. When such a variable is later assigned
 * anywhere else, it becomes global too; the local declaration keeps shadowing
 * it inside the function that owns it.
 */
public class SymbolTable {

	/** Variable name to owning function, {@code null} for top level. */
	private final Map<String, String> owners = new HashMap<String, String>();

	private final Set<String> declared = new LinkedHashSet<String>();

	private final Set<String> globals = new LinkedHashSet<String>();

	/**
	 * Records an assignment to {@code name}.
	 *
	 * @param name variable name
	 * @param function name of the function being translated, {@code null} at top level
	 * @return {@code true} when a local declaration must be emitted right before the assignment
	 */
	public boolean declare(String name, String function) {
		if (!owners.containsKey(name)) {
			owners.put(name, function);
			declared.add(name);
			if (function == null) {
				globals.add(name);
				return false;
			}
			return true;
		}
		if (!Objects.equals(owners.get(name), function)) {
			globals.add(name);
		}
		return false;
	}

	/**
	 * @return the names declared at file scope, in declaration order
	 */
	public Set<String> getGlobals() {
		return Collections.unmodifiableSet(globals);
	}

	boolean isDeclared(String name) {
		return declared.contains(name);
	}

	boolean isGlobal(String name) {
		return globals.contains(name);
	}

	Set<String> getDeclared() {
		return Collections.unmodifiableSet(declared);
	}

	int size() {
		return declared.size();
	}
}
