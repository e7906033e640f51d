package org.metricshub.tabby.toolchain;

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
 * The native compiler could not be run, or rejected the generated code.
 */
public class ToolchainException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int exitCode;

	/**
	 * @param msg what failed
	 * @param exitCode exit code of the failed process, {@code -1} when it could not be started
	 */
	public ToolchainException(String msg, int exitCode) {
		super(msg);
		this.exitCode = exitCode;
	}

	/**
	 * @param msg what failed
	 * @param cause underlying error
	 */
	public ToolchainException(String msg, Throwable cause) {
		super(msg, cause);
		this.exitCode = -1;
	}

	/**
	 * @return exit code of the failed process, or {@code -1}
	 */
	public int getExitCode() {
		return exitCode;
	}
}
