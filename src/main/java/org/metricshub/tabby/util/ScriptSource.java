package org.metricshub.tabby.util;

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

/**
 * Where the text of a program comes from, and how to name it in messages.
 * Programs are either handed over as text by an embedding application or
 * read from a file named on the command line, see {@link ScriptFileSource}.
 * <p>
 * The reader is opened by the source and closed by whoever translates it.
 */
public class ScriptSource {

	/** Name of a program given as text rather than as a file. */
	public static final String DESCRIPTION_INLINE_PROGRAM = "<inline-program>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the program in diagnostics, e.g. its path
	 * @param reader the program text, or {@code null} when a subclass opens it lazily
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @return name of the program in diagnostics
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * @return the program text
	 * @throws IOException when the program cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
