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
 * Removes comments and trailing blanks from raw program lines,
 * and drops the lines left empty.
 */
public final class LineNormalizer {

	/** Starts a comment running to the end of the line. */
	public static final char COMMENT_MARKER = '#';

	/** The only indentation character recognized. */
	public static final char INDENT = '\t';

	private LineNormalizer() {}

	/**
	 * @param lineNumber 1-based position of the line in the program
	 * @param raw the line as read, without line terminator
	 * @return the normalized line, or {@code null} when nothing is left to translate
	 */
	public static SourceLine normalize(int lineNumber, String raw) {
		if (raw == null) {
			return null;
		}
		int commentIdx = raw.indexOf(COMMENT_MARKER);
		String text = commentIdx >= 0 ? raw.substring(0, commentIdx) : raw;
		text = stripTrailing(text);
		if (text.trim().isEmpty()) {
			return null;
		}
		return new SourceLine(lineNumber, text, raw.charAt(0) == INDENT, commentIdx >= 0);
	}

	private static String stripTrailing(String text) {
		int end = text.length();
		while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(0, end);
	}
}
