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

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.List;
import org.metricshub.tabby.Diagnostic;
import org.metricshub.tabby.frontend.FunctionSignature;
import org.metricshub.tabby.frontend.LineNormalizer;
import org.metricshub.tabby.frontend.SignatureTranslator;
import org.metricshub.tabby.frontend.SourceLine;
import org.metricshub.tabby.frontend.StatementTranslator;
import org.metricshub.tabby.frontend.TranslationContext;
import org.metricshub.tabby.frontend.TranslationException;
import org.metricshub.tabby.util.TabbyLogger;
import org.slf4j.Logger;

/**
 * Runs one translation: reads the program line by line, follows function
 * boundaries with a {@link FunctionBoundaryTracker}, and hands header lines to
 * the {@link SignatureTranslator} and all other lines to the
 * {@link StatementTranslator}.
 * <p>
 * A line that cannot be translated is reported to the diagnostic list and
 * skipped; the translation goes on with the next line. The body of a function
 * whose header was rejected is skipped along with it.
 * <p>
 * Instances are single-use: create one driver per translation.
 */
public class TranslationDriver {

	private static final Logger LOG = TabbyLogger.getLogger(TranslationDriver.class);

	private final TranslationContext context = new TranslationContext();
	private final FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
	private final SignatureTranslator signatureTranslator = new SignatureTranslator();
	private final StatementTranslator statementTranslator = new StatementTranslator();
	private final CodeEmitter emitter = new CodeEmitter();
	private final List<Diagnostic> diagnostics;
	private boolean used;

	/**
	 * @param diagnostics receives one entry per line that could not be translated
	 */
	public TranslationDriver(List<Diagnostic> diagnostics) {
		this.diagnostics = diagnostics;
	}

	/**
	 * Translates a whole program.
	 *
	 * @param program the program text
	 * @return the C translation unit
	 * @throws IOException when the program cannot be read
	 */
	public String translate(Reader program) throws IOException {
		if (used) {
			throw new IllegalStateException("A translation driver can only be used once");
		}
		used = true;

		LineNumberReader reader = new LineNumberReader(program);
		String raw;
		while ((raw = reader.readLine()) != null) {
			SourceLine line = LineNormalizer.normalize(reader.getLineNumber(), raw);
			if (line == null) {
				continue;
			}
			try {
				if (signatureTranslator.isHeader(line)) {
					translateHeader(line);
				} else {
					translateStatement(line);
				}
			} catch (TranslationException e) {
				Diagnostic diagnostic = e.toDiagnostic();
				LOG.warn("{}", diagnostic.format());
				diagnostics.add(diagnostic);
			}
		}
		apply(tracker.onEndOfInput());
		return emitter.render(context.getProgramArguments(), context.getSymbolTable().getGlobals());
	}

	/**
	 * @return the state of this translation, e.g. to inspect the declared variables
	 */
	public TranslationContext getContext() {
		return context;
	}

	private void translateHeader(SourceLine line) {
		FunctionSignature signature;
		try {
			signature = signatureTranslator.parse(line);
		} catch (TranslationException e) {
			apply(tracker.onMalformedHeader());
			throw e;
		}
		apply(tracker.onHeader());
		emitter.openFunction(signatureTranslator.render(signature));
		context.enterFunction(signature);
	}

	private void translateStatement(SourceLine line) {
		Transition transition = tracker.onStatement(line.isIndented());
		if (transition.skipsLine()) {
			LOG.warn("line {}: skipped, body of a rejected function", line.getLineNumber());
			return;
		}
		apply(transition);
		for (String statement : statementTranslator.translate(line, context)) {
			emitter.statement(statement);
		}
	}

	private void apply(Transition transition) {
		if (transition.getFrom() != transition.getTo() || transition.closesFunction()) {
			LOG.debug("scope {}", transition);
		}
		if (transition.closesFunction()) {
			emitter.closeFunction();
			context.leaveFunction();
		}
	}
}
