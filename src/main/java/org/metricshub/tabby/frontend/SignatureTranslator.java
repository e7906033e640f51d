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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.tabby.Diagnostic;
import org.metricshub.tabby.util.TabbyLogger;
import org.slf4j.Logger;

/**
 * Parses function header lines, {@code function <name> <params...>}, and
 * renders them as C function headers.
 * <p>
 * Parameters are separated by blanks and/or commas. All values are
 * {@code double}s, so the function returns a {@code double} and takes
 * {@code double} parameters.
 */
public class SignatureTranslator {

	private static final Logger LOG = TabbyLogger.getLogger(SignatureTranslator.class);

	/** Keyword introducing a header line. */
	public static final String KEYWORD = "function";

	/** The single numeric type of the target language. */
	public static final String NUMERIC_TYPE = "double";

	private static final Pattern HEADER = Pattern.compile("^" + KEYWORD + "(\\s.*)?$");

	private static final Pattern NAME_AND_PARAMETERS = Pattern.compile("^" + KEYWORD + "\\s+(\\S+)\\s+(\\S.*)$");

	private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

	/**
	 * Tells whether a line is a function header. Only unindented lines can be.
	 *
	 * @param line a normalized line
	 * @return {@code true} when {@code line} starts with the {@code function} keyword
	 */
	public boolean isHeader(SourceLine line) {
		return HEADER.matcher(line.getText()).matches();
	}

	/**
	 * Parses a header line.
	 *
	 * @param line a line for which {@link #isHeader(SourceLine)} holds
	 * @return the declared signature
	 * @throws TranslationException when the name or the parameter list is missing or invalid,
	 *         or a parameter is declared twice
	 */
	public FunctionSignature parse(SourceLine line) {
		Matcher m = NAME_AND_PARAMETERS.matcher(line.getText());
		if (!m.matches()) {
			throw invalid(line, line.getText());
		}
		String name = m.group(1);
		if (!Identifiers.isValid(name) || Identifiers.isReserved(name)) {
			throw invalid(line, "bad function name '" + name + "'");
		}

		List<String> parameters = new ArrayList<String>();
		Set<String> seen = new HashSet<String>();
		for (String parameter : SEPARATORS.split(m.group(2))) {
			if (parameter.isEmpty()) {
				continue;
			}
			if (!Identifiers.isValid(parameter) || Identifiers.isReserved(parameter)) {
				throw invalid(line, "bad parameter name '" + parameter + "'");
			}
			if (!seen.add(parameter)) {
				throw invalid(line, "parameter '" + parameter + "' declared twice");
			}
			parameters.add(parameter);
		}
		if (parameters.isEmpty()) {
			throw invalid(line, line.getText());
		}

		FunctionSignature signature = new FunctionSignature(name, parameters);
		LOG.debug("line {}: function {}", line.getLineNumber(), signature);
		return signature;
	}

	/**
	 * @param signature a parsed signature
	 * @return the C declarator, e.g. {@code double add(double a, double b)}
	 */
	public String render(FunctionSignature signature) {
		StringBuilder sb = new StringBuilder();
		sb.append(NUMERIC_TYPE).append(' ').append(signature.getName()).append('(');
		boolean first = true;
		for (String parameter : signature.getParameters()) {
			if (!first) {
				sb.append(", ");
			}
			sb.append(NUMERIC_TYPE).append(' ').append(parameter);
			first = false;
		}
		return sb.append(')').toString();
	}

	/**
	 * Translates a header line into the opening line of a C function definition.
	 *
	 * @param line a header line
	 * @return e.g. <code>double add(double a, double b) {</code>
	 * @throws TranslationException when the header is invalid
	 */
	public String translate(SourceLine line) {
		return render(parse(line)) + " {";
	}

	private static TranslationException invalid(SourceLine line, String detail) {
		return new TranslationException(line.getLineNumber(), Diagnostic.Kind.INVALID_FUNCTION_DEFINITION, detail);
	}
}
