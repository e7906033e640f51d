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
import java.util.List;
import org.metricshub.tabby.Diagnostic;
import org.metricshub.tabby.util.TabbyLogger;
import org.slf4j.Logger;

/**
 * Translates one body statement into C statements.
 * <p>
 * The first assignment to a variable inside a function is preceded by its
 * declaration, initialized to zero; later assignments to the same variable
 * are not. A variable first assigned at top level, or assigned outside the
 * function that declared it, is only recorded: it is declared at file scope
 * when the unit is assembled. Which variables are
 * declared is tracked by the {@link SymbolTable} of the {@link TranslationContext}.
 */
public class StatementTranslator {

	private static final Logger LOG = TabbyLogger.getLogger(StatementTranslator.class);

	/** Name of the helper printing a number, emitted with every translation unit. */
	public static final String PRINT_FUNCTION = "print_number";

	/**
	 * Classifies a line without translating it.
	 *
	 * @param line a normalized body line
	 * @return the statement
	 * @throws TranslationException when the line has none of the statement forms,
	 *         or names an invalid identifier
	 */
	public Statement classify(SourceLine line) {
		Statement statement = StatementMatcher.classify(line.getBody());
		if (statement == null) {
			throw new TranslationException(line.getLineNumber(), Diagnostic.Kind.UNKNOWN_STATEMENT, line.getBody());
		}
		if (statement.getIdentifier() != null) {
			if (statement.getKind() == Statement.Kind.ASSIGN) {
				Identifiers.requireUnreserved(line.getLineNumber(), statement.getIdentifier());
			} else {
				Identifiers.require(line.getLineNumber(), statement.getIdentifier());
			}
		}
		LOG.debug("line {}: {}", line.getLineNumber(), statement);
		return statement;
	}

	/**
	 * Translates a body line.
	 *
	 * @param line a normalized body line
	 * @param context state of the current translation, updated when a variable gets declared
	 * @return the C statements, without indentation nor line terminator
	 * @throws TranslationException when the line cannot be translated
	 */
	public List<String> translate(SourceLine line, TranslationContext context) {
		Statement statement = classify(line);
		List<String> result = new ArrayList<String>(2);
		context.noteReferences(statement.getText());

		switch (statement.getKind()) {
		case RETURN:
			result.add("return " + statement.getText() + ";");
			break;
		case ASSIGN:
			String variable = statement.getIdentifier();
			if (ProgramArguments.isArgumentName(variable)) {
				context.noteReferences(variable);
			} else if (!context.isParameter(variable)) {
				// globals are declared at file scope by the emitter
				if (context.getSymbolTable().declare(variable, context.getFunctionName())) {
					result.add(SignatureTranslator.NUMERIC_TYPE + " " + variable + " = 0.0;");
				}
			}
			result.add(variable + " = " + statement.getText() + ";");
			break;
		case PRINT:
			result.add(PRINT_FUNCTION + "(" + statement.getText() + ");");
			break;
		case CALL:
			result.add(statement.getIdentifier() + "(" + statement.getText() + ");");
			break;
		default:
			throw new IllegalStateException("Unhandled statement kind: " + statement.getKind());
		}
		return result;
	}
}
