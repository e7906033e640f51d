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

/**
 * A step of the {@link FunctionBoundaryTracker}.
 */
public final class Transition {

	private final Scope from;
	private final Scope to;
	private final boolean closesFunction;
	private final boolean skipsLine;

	Transition(Scope from, Scope to, boolean closesFunction) {
		this(from, to, closesFunction, false);
	}

	Transition(Scope from, Scope to, boolean closesFunction, boolean skipsLine) {
		this.from = from;
		this.to = to;
		this.closesFunction = closesFunction;
		this.skipsLine = skipsLine;
	}

	public Scope getFrom() {
		return from;
	}

	public Scope getTo() {
		return to;
	}

	/**
	 * @return {@code true} when the open function must be closed before anything else is emitted
	 */
	public boolean closesFunction() {
		return closesFunction;
	}

	/**
	 * @return {@code true} when the line belongs to the body of a rejected function and must not be translated
	 */
	public boolean skipsLine() {
		return skipsLine;
	}

	@Override
	public String toString() {
		return from + " -> " + to + (closesFunction ? " (close)" : "") + (skipsLine ? " (skip)" : "");
	}
}
