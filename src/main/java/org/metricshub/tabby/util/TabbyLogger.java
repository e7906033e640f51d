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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for the loggers of the translator, the command line
 * and the native toolchain runner.
 * <p>
 * SLF4J reports which provider it bound to on first use; that report would
 * end up in the middle of the diagnostics printed on the error stream, so it
 * is limited to warnings before any logger is created.
 */
public final class TabbyLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private TabbyLogger() {}

	/**
	 * @param owner class the logger is named after
	 * @return the logger of {@code owner}
	 */
	public static Logger getLogger(Class<?> owner) {
		return LoggerFactory.getLogger(owner);
	}
}
