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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizers of the statement forms, declared in priority order:
 * a line is classified by the first constant whose {@link #match(String)}
 * does not return {@code null}.
 * <p>
 * The order matters: the later forms are more permissive and would
 * shadow the earlier ones.
 */
public enum StatementMatcher {

	/** {@code return <expr>} */
	RETURN {
		@Override
		public Statement match(String body) {
			String expression = afterKeyword(body, "return ");
			return expression == null ? null : Statement.returning(expression);
		}
	},

	/** {@code <identifier> <- <expr>} */
	ASSIGN {
		private final Pattern pattern = Pattern.compile("^(" + Identifiers.REGEX + ")\\s*<-\\s*(\\S.*)$");

		@Override
		public Statement match(String body) {
			Matcher m = pattern.matcher(body);
			return m.matches() ? Statement.assigning(m.group(1), m.group(2)) : null;
		}
	},

	/** {@code print <expr>} */
	PRINT {
		@Override
		public Statement match(String body) {
			String expression = afterKeyword(body, "print ");
			return expression == null ? null : Statement.printing(expression);
		}
	},

	/** {@code <identifier>(<args>)} */
	CALL {
		private final Pattern pattern = Pattern.compile("^(" + Identifiers.REGEX + ")\\((.*)\\)$");

		@Override
		public Statement match(String body) {
			Matcher m = pattern.matcher(body);
			return m.matches() ? Statement.calling(m.group(1), m.group(2)) : null;
		}
	},

	/** {@code <identifier> (<args>)} */
	SPACED_CALL {
		private final Pattern pattern = Pattern.compile("^(" + Identifiers.REGEX + ")\\s+\\((.*)$");

		@Override
		public Statement match(String body) {
			Matcher m = pattern.matcher(body);
			return m.matches() ? Statement.calling(m.group(1), dropUnmatchedParenthesis(m.group(2))) : null;
		}
	};

	/**
	 * @param body a statement line, without indentation nor comment
	 * @return the statement when {@code body} has this form, {@code null} otherwise
	 */
	public abstract Statement match(String body);

	/**
	 * Classifies a statement line.
	 *
	 * @param body a statement line, without indentation nor comment
	 * @return the statement of the first matching form, or {@code null} when none matches
	 */
	public static Statement classify(String body) {
		for (StatementMatcher matcher : values()) {
			Statement statement = matcher.match(body);
			if (statement != null) {
				return statement;
			}
		}
		return null;
	}

	private static String afterKeyword(String body, String keyword) {
		if (!body.startsWith(keyword)) {
			return null;
		}
		String rest = body.substring(keyword.length()).trim();
		return rest.isEmpty() ? null : rest;
	}

	/**
	 * The argument text of a spaced call still holds the closing parenthesis
	 * of the call: remove it when it is not matched within the text.
	 */
	static String dropUnmatchedParenthesis(String arguments) {
		String trimmed = arguments.trim();
		if (!trimmed.endsWith(")")) {
			return trimmed;
		}
		int depth = 0;
		for (int i = 0; i < trimmed.length(); i++) {
			char c = trimmed.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
			}
		}
		return depth < 0 ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
	}
}
