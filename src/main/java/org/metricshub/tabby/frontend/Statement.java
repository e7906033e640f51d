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

/**
 * One classified body statement.
 * The expression and argument texts are kept verbatim: they are never parsed,
 * and end up unchanged in the generated code.
 */
public final class Statement {

	/**
	 * The statement forms of the language.
	 */
	public enum Kind {
		/** {@code return <expr>} */
		RETURN,
		/** {@code <identifier> <- <expr>} */
		ASSIGN,
		/** {@code print <expr>} */
		PRINT,
		/** {@code <identifier>(<args>)} */
		CALL
	}

	private final Kind kind;
	private final String identifier;
	private final String text;

	private Statement(Kind kind, String identifier, String text) {
		this.kind = kind;
		this.identifier = identifier;
		this.text = text;
	}

	static Statement returning(String expression) {
		return new Statement(Kind.RETURN, null, expression);
	}

	static Statement assigning(String identifier, String expression) {
		return new Statement(Kind.ASSIGN, identifier, expression);
	}

	static Statement printing(String expression) {
		return new Statement(Kind.PRINT, null, expression);
	}

	static Statement calling(String identifier, String arguments) {
		return new Statement(Kind.CALL, identifier, arguments);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the assigned variable or the called function, {@code null} for other kinds
	 */
	public String getIdentifier() {
		return identifier;
	}

	/**
	 * @return the expression, or the argument list of a call (without parentheses)
	 */
	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return identifier == null ? kind + "(" + text + ")" : kind + "(" + identifier + ", " + text + ")";
	}
}
