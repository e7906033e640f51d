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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.tabby.util.TabbyLogger;
import org.metricshub.tabby.util.TabbySettings;
import org.slf4j.Logger;

/**
 * Compiles a generated translation unit with the native C compiler and runs
 * the resulting executable.
 * <p>
 * The C file and the executable are created next to each other, in the
 * configured working directory or the system temporary directory, and deleted
 * after the run unless {@link TabbySettings#isKeepIntermediateFiles()}.
 */
public class NativeToolchain {

	private static final Logger LOG = TabbyLogger.getLogger(NativeToolchain.class);

	private static final boolean IS_WINDOWS = System
			.getProperty("os.name", "")
			.toLowerCase(Locale.ROOT)
			.contains("win");

	private final TabbySettings settings;

	/**
	 * @param settings compiler command, streams and clean-up policy
	 */
	public NativeToolchain(TabbySettings settings) {
		this.settings = settings;
	}

	/**
	 * Writes {@code unit} to a new C file.
	 *
	 * @param unit the translation unit
	 * @return the C file
	 * @throws IOException when the file cannot be written
	 */
	public Path writeSource(String unit) throws IOException {
		File dir = settings.getWorkingDirectory();
		Path source = dir == null
				? Files.createTempFile("tabby-", ".c")
				: Files.createTempFile(dir.toPath(), "tabby-", ".c");
		Files.write(source, unit.getBytes(StandardCharsets.UTF_8));
		LOG.debug("Wrote {}", source);
		return source;
	}

	/**
	 * Compiles a C file into an executable next to it.
	 *
	 * @param source the C file
	 * @return the executable
	 * @throws ToolchainException when the compiler cannot be started or fails
	 */
	public Path compile(Path source) throws ToolchainException {
		Path executable = executableFor(source);
		List<String> command = new ArrayList<String>(settings.getCompilerCommandLine());
		command.add("-o");
		command.add(executable.toString());
		command.add(source.toString());
		command.add("-lm");

		int exitCode = execute(command);
		if (exitCode != 0) {
			throw new ToolchainException(command.get(0) + " failed to compile " + source + " (exit code " + exitCode + ")", exitCode);
		}
		return executable;
	}

	/**
	 * Runs an executable, its output going to the configured streams.
	 *
	 * @param executable the program to run
	 * @param arguments its command-line arguments
	 * @return its exit code
	 * @throws ToolchainException when it cannot be started
	 */
	public int run(Path executable, List<String> arguments) throws ToolchainException {
		List<String> command = new ArrayList<String>();
		command.add(executable.toAbsolutePath().toString());
		command.addAll(arguments);
		return execute(command);
	}

	/**
	 * Writes, compiles and runs a translation unit, then removes the
	 * intermediate files unless told to keep them.
	 *
	 * @param unit the translation unit
	 * @param arguments command-line arguments of the program
	 * @return the exit code of the program
	 * @throws IOException when the C file cannot be written
	 * @throws ToolchainException when compiling or starting the program fails
	 */
	public int compileAndRun(String unit, List<String> arguments) throws IOException, ToolchainException {
		Path source = writeSource(unit);
		Path executable = executableFor(source);
		try {
			compile(source);
			return run(executable, arguments);
		} finally {
			if (settings.isKeepIntermediateFiles()) {
				settings.getErrorStream().println("Kept " + source + " and " + executable);
			} else {
				delete(source);
				delete(executable);
			}
		}
	}

	/**
	 * @param source a C file
	 * @return the executable the C file compiles into
	 */
	public static Path executableFor(Path source) {
		String name = source.getFileName().toString();
		if (name.endsWith(".c")) {
			name = name.substring(0, name.length() - 2);
		}
		if (IS_WINDOWS) {
			name += ".exe";
		}
		return source.resolveSibling(name);
	}

	private int execute(List<String> command) throws ToolchainException {
		LOG.debug("Executing {}", command);
		Process p;
		try {
			p = new ProcessBuilder(command).start();
		} catch (IOException e) {
			throw new ToolchainException("Cannot execute " + command.get(0) + ": " + e.getMessage(), e);
		}
		try {
			// no input to this process!
			p.getOutputStream().close();
		} catch (IOException e) {
			LOG.debug("Cannot close the input of {}: {}", command.get(0), e.getMessage());
		}
		StreamPump err = StreamPump.dump(command.get(0), p.getErrorStream(), settings.getErrorStream());
		StreamPump out = StreamPump.dump(command.get(0), p.getInputStream(), settings.getOutputStream());
		try {
			int exitCode = p.waitFor();
			out.join();
			err.join();
			LOG.debug("{} exited with {}", command.get(0), exitCode);
			return exitCode;
		} catch (InterruptedException e) {
			p.destroy();
			Thread.currentThread().interrupt();
			throw new ToolchainException("Interrupted while waiting for " + command.get(0), e);
		}
	}

	private static void delete(Path path) {
		try {
			Files.deleteIfExists(path);
		} catch (IOException e) {
			LOG.warn("Cannot delete {}: {}", path, e.getMessage());
		}
	}
}
