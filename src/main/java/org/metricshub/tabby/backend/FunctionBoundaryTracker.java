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
 * Finite-state machine telling where functions start and end.
 * <table>
 * <caption>Transitions</caption>
 * <tr><th>Event</th><th>From</th><th>To</th><th>Closes function</th></tr>
 * <tr><td>header</td><td>OUTSIDE</td><td>INSIDE</td><td>no</td></tr>
 * <tr><td>header</td><td>INSIDE</td><td>INSIDE</td><td>yes</td></tr>
 * <tr><td>malformed header</td><td>any</td><td>OUTSIDE</td><td>when INSIDE</td></tr>
 * <tr><td>indented statement</td><td>any</td><td>unchanged</td><td>no</td></tr>
 * <tr><td>unindented statement</td><td>INSIDE</td><td>OUTSIDE</td><td>yes</td></tr>
 * <tr><td>unindented statement</td><td>OUTSIDE</td><td>OUTSIDE</td><td>no</td></tr>
 * <tr><td>end of input</td><td>any</td><td>OUTSIDE</td><td>when INSIDE</td></tr>
 * </table>
 * <p>
 * The indented lines right after a malformed header form the body of a
 * function that does not exist: their transitions are flagged with
 * {@link Transition#skipsLine()} until the next header or unindented line.
 */
public class FunctionBoundaryTracker {

	private Scope scope = Scope.OUTSIDE;

	private boolean discardingBody;

	public Scope getScope() {
		return scope;
	}

	/**
	 * A valid function header starts a new function.
	 *
	 * @return the transition taken
	 */
	public Transition onHeader() {
		discardingBody = false;
		return moveTo(Scope.INSIDE, scope == Scope.INSIDE);
	}

	/**
	 * A header that could not be parsed ends the current function, if any.
	 * The indented lines that follow are skipped rather than translated,
	 * so they end up neither in that function nor in the entry point.
	 *
	 * @return the transition taken
	 */
	public Transition onMalformedHeader() {
		discardingBody = true;
		return moveTo(Scope.OUTSIDE, scope == Scope.INSIDE);
	}

	/**
	 * @param indented whether the statement line starts with a tab
	 * @return the transition taken
	 */
	public Transition onStatement(boolean indented) {
		if (discardingBody) {
			if (indented) {
				return new Transition(scope, scope, false, true);
			}
			discardingBody = false;
		}
		if (scope == Scope.INSIDE && !indented) {
			return moveTo(Scope.OUTSIDE, true);
		}
		return moveTo(scope, false);
	}

	/**
	 * @return the transition taken
	 */
	public Transition onEndOfInput() {
		discardingBody = false;
		return moveTo(Scope.OUTSIDE, scope == Scope.INSIDE);
	}

	private Transition moveTo(Scope target, boolean closesFunction) {
		Transition transition = new Transition(scope, target, closesFunction);
		scope = target;
		return transition;
	}
}
