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

import org.metricshub.tabby.Diagnostic;

/**
 * Reports a problem with a single source line. The translation driver
 * turns it into a {@link Diagnostic} and continues with the next line.
 */
public class TranslationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;
	private final Diagnostic.Kind kind;
	private final String detail;

	/**
	 * @param lineno 1-based number of the offending line
	 * @param kind category of the problem
	 * @param detail offending text
	 */
	public TranslationException(int lineno, Diagnostic.Kind kind, String detail) {
		super(kind.getLabel() + ": " + detail);
		this.lineNumber = lineno;
		this.kind = kind;
		this.detail = detail;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public Diagnostic.Kind getKind() {
		return kind;
	}

	/**
	 * @return this exception as a diagnostic
	 */
	public Diagnostic toDiagnostic() {
		return new Diagnostic(lineNumber, kind, detail);
	}
}
