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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.metricshub.tabby.toolchain.NativeToolchain;
import org.metricshub.tabby.toolchain.ToolchainException;
import org.metricshub.tabby.util.ScriptFileSource;
import org.metricshub.tabby.util.ScriptSource;
import org.metricshub.tabby.util.TabbyLogger;
import org.metricshub.tabby.util.TabbySettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Tabby: translates a program, compiles the
 * translation with the native C compiler, and runs it.
 */
public final class Cli {

	private static final Logger LOG = TabbyLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Tabby.jar";
		}
		JAR_NAME = myName;
	}

	private final TabbySettings settings = new TabbySettings();
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource programSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream receiving the translation or the program output
	 * @param err stream receiving diagnostics and the program error output
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link TabbySettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TabbySettings getSettings() {
		return settings;
	}

	/**
	 * @return the program given on the command line, {@code null} when only usage was requested
	 */
	public ScriptSource getProgramSource() {
		return programSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the program file comes next
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-E") || arg.equals("--emit")) {
				// -E/--emit : print the translation and exit
				settings.setEmitOnly(true);
			} else if (arg.equals("-o")) {
				// -o filename : write the translation to a file and exit
				checkParameterHasArgument(args, argIdx);
				settings.setOutputFile(new File(args[++argIdx]));
			} else if (arg.equals("--cc")) {
				// --cc command : native compiler
				checkParameterHasArgument(args, argIdx);
				settings.setCompilerCommand(args[++argIdx]);
			} else if (arg.equals("-k") || arg.equals("--keep")) {
				// -k/--keep : keep the intermediate files
				settings.setKeepIntermediateFiles(true);
			} else if (arg.equals("-W") || arg.equals("--werror")) {
				// -W/--werror : diagnostics make the run fail
				settings.setWarningsAsErrors(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("Tabby program not provided.");
		}
		programSource = new ScriptFileSource(args[argIdx++]);

		while (argIdx < args.length) {
			settings.addProgramArgument(args[argIdx++]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws ExitException when the invocation must end with a non-zero exit code
	 * @throws IOException when the translation cannot be written
	 * @throws ToolchainException when the native compiler fails
	 */
	public void run() throws ExitException, IOException, ToolchainException {
		if (printUsage) {
			usage(out);
			return;
		}
		LOG.debug("Settings:\n{}", settings.toDescriptionString());

		TranslationResult result = new Tabby().translate(programSource);
		for (Diagnostic diagnostic : result.getDiagnostics()) {
			err.println(diagnostic.format());
		}
		if (!result.isSuccess()) {
			throw new ExitException(1, "Cannot read " + programSource.getDescription());
		}
		if (settings.isWarningsAsErrors() && result.hasDiagnostics()) {
			throw new ExitException(1, result.getDiagnostics().size() + " diagnostic(s) reported");
		}

		if (settings.isEmitOnly()) {
			out.print(result.getOutput());
			out.flush();
			return;
		}
		if (settings.getOutputFile() != null) {
			Files.write(settings.getOutputFile().toPath(), result.getOutput().getBytes(StandardCharsets.UTF_8));
			return;
		}

		int exitCode = new NativeToolchain(settings).compileAndRun(result.getOutput(), settings.getProgramArguments());
		if (exitCode != 0) {
			throw new ExitException(exitCode, programSource.getDescription() + " exited with " + exitCode);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-E|--emit]" +
								" [-o output-filename]" +
								" [--cc compiler]" +
								" [-k|--keep]" +
								" [-W|--werror]" +
								" program-filename" +
								" [program-argument]...");
		dest.println();
		dest.println(" -E, --emit = Print the C translation and exit.");
		dest.println(" -o filename = Write the C translation to filename and exit.");
		dest.println(" --cc compiler = Native compiler command (default: $" + TabbySettings.COMPILER_ENVIRONMENT_VARIABLE
				+ " or " + TabbySettings.DEFAULT_COMPILER + ").");
		dest.println(" -k, --keep = Keep the intermediate C file and executable.");
		dest.println(" -W, --werror = Fail when any line could not be translated.");
		dest.println();
		dest.println(" Program arguments are available to the program as arg0 to arg9.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the translation or program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es) throws Exception {
		Cli cli = new Cli(os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			LOG.debug("{}", e.getMessage());
			System.exit(e.getCode());
		} catch (ToolchainException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
