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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.tabby.backend.TranslationDriver;
import org.metricshub.tabby.util.ScriptSource;
import org.metricshub.tabby.util.TabbyLogger;
import org.slf4j.Logger;

/**
 * Entry point into the translation of a Tabby program into C.
 * This entry point is used both when Tabby is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Read the program line by line, dropping comments and blank lines.
 * <li>Follow function boundaries, given by the {@code function} headers
 * and the tab indentation of function bodies.
 * <li>Translate each header into a C function header, and each other line
 * into C statements, declaring variables on their first assignment.
 * <li>Assemble the C translation unit, with an entry point holding all
 * top-level statements.
 * </ul>
 * Compiling and running the generated code is left to the caller, see
 * {@link org.metricshub.tabby.toolchain.NativeToolchain}.
 * <p>
 * Each call translates with fresh state, so an instance can be shared,
 * including between threads.
 *
 * @see org.metricshub.tabby.backend.TranslationDriver
 */
public class Tabby {

	private static final Logger LOG = TabbyLogger.getLogger(Tabby.class);

	/**
	 * Translates a program.
	 *
	 * @param source where to read the program from
	 * @return the translation unit with its diagnostics; unsuccessful, with no
	 *         output, when the program could not be read
	 */
	public TranslationResult translate(ScriptSource source) {
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
		try (Reader reader = source.getReader()) {
			if (reader == null) {
				throw new IOException("No reader available");
			}
			String output = new TranslationDriver(diagnostics).translate(reader);
			LOG.debug("Translated {} with {} diagnostic(s)", source.getDescription(), diagnostics.size());
			return TranslationResult.success(output, diagnostics);
		} catch (IOException | UncheckedIOException e) {
			LOG.error("Cannot read {}: {}", source.getDescription(), e.getMessage());
			diagnostics.add(new Diagnostic(-1, Diagnostic.Kind.INPUT_UNAVAILABLE, source.getDescription()));
			return TranslationResult.failure(diagnostics);
		}
	}

	/**
	 * Translates a program read from a {@link Reader}.
	 *
	 * @param program the program text; closed once read
	 * @return the translation unit with its diagnostics
	 */
	public TranslationResult translate(Reader program) {
		return translate(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_PROGRAM, program));
	}

	/**
	 * Translates the specified program text.
	 *
	 * @param program the program text
	 * @return the translation unit with its diagnostics
	 */
	public TranslationResult translate(String program) {
		return translate(new StringReader(program));
	}
}
