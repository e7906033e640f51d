package org.metricshub.tabby;

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
 * One problem detected while translating a program.
 * Diagnostics never stop the translation, except {@link Kind#INPUT_UNAVAILABLE}.
 */
public final class Diagnostic {

	/**
	 * Category of a diagnostic.
	 */
	public enum Kind {
		/** The program text could not be read at all. */
		INPUT_UNAVAILABLE("cannot open input"),
		/** A header line could not be parsed into a name and parameters. */
		INVALID_FUNCTION_DEFINITION("invalid function definition"),
		/** A body line matched none of the statement forms. */
		UNKNOWN_STATEMENT("unknown statement"),
		/** A name is not a valid identifier or has too many characters. */
		INVALID_IDENTIFIER("invalid identifier");

		private final String label;

		Kind(String label) {
			this.label = label;
		}

		/**
		 * @return the text printed in front of the details
		 */
		public String getLabel() {
			return label;
		}
	}

	private final int lineNumber;
	private final Kind kind;
	private final String detail;

	/**
	 * @param lineNumber 1-based line number, or {@code -1} when not tied to a line
	 * @param kind category of the problem
	 * @param detail offending text or additional explanation, may be {@code null}
	 */
	public Diagnostic(int lineNumber, Kind kind, String detail) {
		this.lineNumber = lineNumber;
		this.kind = kind;
		this.detail = detail;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public Kind getKind() {
		return kind;
	}

	public String getDetail() {
		return detail;
	}

	/**
	 * @return the full message, without location
	 */
	public String getMessage() {
		if (detail == null || detail.isEmpty()) {
			return kind.getLabel();
		}
		return kind.getLabel() + ": " + detail;
	}

	/**
	 * Formats this diagnostic the way it is printed on the diagnostic stream,
	 * one line, prefixed with an exclamation mark.
	 *
	 * @return e.g. {@code !line 3: unknown statement: x ?? y}
	 */
	public String format() {
		if (lineNumber < 0) {
			return "!" + getMessage();
		}
		return "!line " + lineNumber + ": " + getMessage();
	}

	@Override
	public String toString() {
		return format();
	}
}
