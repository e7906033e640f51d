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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one translation: the generated C unit, the diagnostics
 * collected on the way, and whether the translation could run at all.
 * <p>
 * {@link #isSuccess()} only turns {@code false} when the input could not be
 * read. Per-line problems are reported as diagnostics and leave it {@code true};
 * the caller decides whether they make the overall invocation fail.
 */
public final class TranslationResult {

	private final String output;
	private final List<Diagnostic> diagnostics;
	private final boolean success;

	private TranslationResult(String output, List<Diagnostic> diagnostics, boolean success) {
		this.output = output;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
		this.success = success;
	}

	static TranslationResult success(String output, List<Diagnostic> diagnostics) {
		return new TranslationResult(output, diagnostics, true);
	}

	static TranslationResult failure(List<Diagnostic> diagnostics) {
		return new TranslationResult("", diagnostics, false);
	}

	/**
	 * @return the generated translation unit, empty when the translation failed
	 */
	public String getOutput() {
		return output;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean hasDiagnostics() {
		return !diagnostics.isEmpty();
	}

	public boolean isSuccess() {
		return success;
	}
}
