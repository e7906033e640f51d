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
 * One non-blank program line, comment already removed.
 */
public final class SourceLine {

	private final int lineNumber;
	private final String text;
	private final boolean indented;
	private final boolean hadComment;

	SourceLine(int lineNumber, String text, boolean indented, boolean hadComment) {
		this.lineNumber = lineNumber;
		this.text = text;
		this.indented = indented;
		this.hadComment = hadComment;
	}

	/**
	 * @return 1-based position of this line in the program
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the line without its comment and trailing blanks, leading tabs kept
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the line without any leading blanks
	 */
	public String getBody() {
		return text.trim();
	}

	/**
	 * @return {@code true} when the line starts with a tab, i.e. belongs to a function body
	 */
	public boolean isIndented() {
		return indented;
	}

	/**
	 * @return {@code true} when a {@code #} comment was cut off this line
	 */
	public boolean hadComment() {
		return hadComment;
	}

	@Override
	public String toString() {
		return lineNumber + ": " + text;
	}
}
