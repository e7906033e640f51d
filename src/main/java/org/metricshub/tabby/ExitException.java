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

/**
 * Thrown by the command-line front end to report the exit code
 * the process must terminate with.
 */
public class ExitException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int code;

	/**
	 * @param code exit code of the process
	 */
	public ExitException(int code) {
		this(code, "Exit code " + code);
	}

	/**
	 * @param code exit code of the process
	 * @param message why the process exits
	 */
	public ExitException(int code, String message) {
		super(message);
		this.code = code;
	}

	/**
	 * @return the exit code of the process
	 */
	public int getCode() {
		return code;
	}
}
