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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Name and parameters of a function, as declared by its header line.
 */
public final class FunctionSignature {

	private final String name;
	private final List<String> parameters;

	/**
	 * @param name function name
	 * @param parameters parameter names, in declaration order
	 */
	public FunctionSignature(String name, List<String> parameters) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	@Override
	public String toString() {
		return name + parameters;
	}
}
