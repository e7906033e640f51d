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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A simple container for the parameters of a single Tabby invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Tabby programmatically, from within Java code.
 */
public class TabbySettings {

	/**
	 * Name of the environment variable that overrides the default
	 * native compiler command.
	 */
	public static final String COMPILER_ENVIRONMENT_VARIABLE = "CC";

	/**
	 * Native compiler used when neither the command line nor the
	 * environment specify one.
	 */
	public static final String DEFAULT_COMPILER = "cc";

	/**
	 * Native compiler command, split on whitespace when invoked.
	 * Seeded from the <code>CC</code> environment variable, <code>cc</code> otherwise.
	 */
	private String compilerCommand = defaultCompilerCommand();

	/**
	 * Arguments handed over to the generated program when it runs.
	 */
	private List<String> programArguments = new ArrayList<String>();

	/**
	 * Whether the intermediate C file and executable are kept
	 * after the run; <code>false</code> by default.
	 */
	private boolean keepIntermediateFiles = false;

	/**
	 * Whether the translation is only printed, not compiled;
	 * <code>false</code> by default.
	 */
	private boolean emitOnly = false;

	/**
	 * Whether any diagnostic turns the invocation into a failure;
	 * <code>false</code> by default.
	 */
	private boolean warningsAsErrors = false;

	/**
	 * File receiving the translation instead of compiling it.
	 * <code>null</code> means compile and run.
	 */
	private File outputFile = null;

	/**
	 * Directory in which intermediate files are created.
	 * <code>null</code> means the system temporary directory.
	 */
	private File workingDirectory = null;

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Diagnostic stream;
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	private static String defaultCompilerCommand() {
		String fromEnvironment = System.getenv(COMPILER_ENVIRONMENT_VARIABLE);
		if (fromEnvironment == null || fromEnvironment.trim().isEmpty()) {
			return DEFAULT_COMPILER;
		}
		return fromEnvironment.trim();
	}

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("compilerCommand = ").append(getCompilerCommand()).append(newLine);
		desc.append("programArguments = ").append(getProgramArguments()).append(newLine);
		desc.append("keepIntermediateFiles = ").append(isKeepIntermediateFiles()).append(newLine);
		desc.append("emitOnly = ").append(isEmitOnly()).append(newLine);
		desc.append("warningsAsErrors = ").append(isWarningsAsErrors()).append(newLine);
		desc.append("outputFile = ").append(getOutputFile()).append(newLine);

		return desc.toString();
	}

	public String getCompilerCommand() {
		return compilerCommand;
	}

	/**
	 * @param compilerCommand the native compiler executable, optionally followed by flags
	 */
	public void setCompilerCommand(String compilerCommand) {
		if (compilerCommand == null || compilerCommand.trim().isEmpty()) {
			throw new IllegalArgumentException("Compiler command must not be empty");
		}
		this.compilerCommand = compilerCommand.trim();
	}

	/**
	 * @return the compiler command split into the executable and its flags
	 */
	public List<String> getCompilerCommandLine() {
		return Arrays.asList(compilerCommand.split("\\s+"));
	}

	public List<String> getProgramArguments() {
		return Collections.unmodifiableList(programArguments);
	}

	/**
	 * @param argument one more argument for the generated program
	 */
	public void addProgramArgument(String argument) {
		programArguments.add(argument);
	}

	public boolean isKeepIntermediateFiles() {
		return keepIntermediateFiles;
	}

	public void setKeepIntermediateFiles(boolean keepIntermediateFiles) {
		this.keepIntermediateFiles = keepIntermediateFiles;
	}

	public boolean isEmitOnly() {
		return emitOnly;
	}

	public void setEmitOnly(boolean emitOnly) {
		this.emitOnly = emitOnly;
	}

	public boolean isWarningsAsErrors() {
		return warningsAsErrors;
	}

	public void setWarningsAsErrors(boolean warningsAsErrors) {
		this.warningsAsErrors = warningsAsErrors;
	}

	public File getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(File outputFile) {
		this.outputFile = outputFile;
	}

	public File getWorkingDirectory() {
		return workingDirectory;
	}

	public void setWorkingDirectory(File workingDirectory) {
		this.workingDirectory = workingDirectory;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}
}
