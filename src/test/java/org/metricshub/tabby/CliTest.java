package org.metricshub.tabby;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.tabby.util.ScriptFileSource;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
	private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
	private final PrintStream out = new PrintStream(outBytes, true);
	private final PrintStream err = new PrintStream(errBytes, true);

	private String program(String... lines) throws IOException {
		File file = folder.newFile("program.tb");
		Files.write(file.toPath(), (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
		return file.getPath();
	}

	private String out() {
		return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testParseOptions() throws Exception {
		Cli cli = new Cli(out, err);
		cli.parse(new String[] { "--cc", "gcc -O2", "-k", "-W", "prog.tb", "3", "4.5" });
		assertEquals("gcc -O2", cli.getSettings().getCompilerCommand());
		assertEquals(Arrays.asList("gcc", "-O2"), cli.getSettings().getCompilerCommandLine());
		assertTrue(cli.getSettings().isKeepIntermediateFiles());
		assertTrue(cli.getSettings().isWarningsAsErrors());
		assertFalse(cli.getSettings().isEmitOnly());
		assertTrue(cli.getProgramSource() instanceof ScriptFileSource);
		assertEquals("prog.tb", ((ScriptFileSource) cli.getProgramSource()).getFilePath());
		assertEquals(Arrays.asList("3", "4.5"), cli.getSettings().getProgramArguments());
	}

	@Test
	public void testDoubleDashEndsOptions() {
		Cli cli = new Cli(out, err);
		cli.parse(new String[] { "--", "-weird.tb", "-1" });
		assertEquals("-weird.tb", cli.getProgramSource().getDescription());
		assertEquals(Arrays.asList("-1"), cli.getSettings().getProgramArguments());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownOption() {
		new Cli(out, err).parse(new String[] { "--bogus", "prog.tb" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingOptionValue() {
		new Cli(out, err).parse(new String[] { "-o" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingProgram() {
		new Cli(out, err).parse(new String[] { "-E" });
	}

	@Test
	public void testUsage() throws Exception {
		Cli.create(new String[] { "-h" }, out, err);
		assertTrue(out().startsWith("Usage:"));
		assertTrue(out().contains("--emit"));
	}

	@Test
	public void testNoArgumentsPrintsUsage() throws Exception {
		Cli.create(new String[0], out, err);
		assertTrue(out().startsWith("Usage:"));
	}

	@Test
	public void testEmit() throws Exception {
		String path = program("function add a b", "\treturn a + b", "x <- add(1, 2)", "print x");
		Cli.create(new String[] { "-E", path }, out, err);
		assertEquals(new Tabby().translate("function add a b\n\treturn a + b\nx <- add(1, 2)\nprint x\n").getOutput(), out());
		assertEquals("", err());
	}

	@Test
	public void testOutputFile() throws Exception {
		String path = program("print 1");
		File target = new File(folder.getRoot(), "program.c");
		Cli.create(new String[] { "-o", target.getPath(), path }, out, err);
		String written = new String(Files.readAllBytes(target.toPath()), StandardCharsets.UTF_8);
		assertTrue(written.contains("\tprint_number(1);\n"));
		assertEquals("", out());
	}

	@Test
	public void testDiagnosticsArePrinted() throws Exception {
		String path = program("x ?? y", "print 1");
		Cli.create(new String[] { "-E", path }, out, err);
		assertEquals("!line 1: unknown statement: x ?? y" + System.lineSeparator(), err());
		assertTrue(out().contains("\tprint_number(1);\n"));
	}

	@Test
	public void testWarningsAsErrors() throws Exception {
		String path = program("x ?? y", "print 1");
		try {
			Cli.create(new String[] { "-W", "-E", path }, out, err);
			fail("diagnostics must fail the run with -W");
		} catch (ExitException e) {
			assertEquals(1, e.getCode());
		}
		assertEquals("Nothing is emitted", "", out());
	}

	@Test
	public void testMissingProgramFile() throws Exception {
		try {
			Cli.create(new String[] { "-E", new File(folder.getRoot(), "missing.tb").getPath() }, out, err);
			fail("a missing program must fail the run");
		} catch (ExitException e) {
			assertEquals(1, e.getCode());
		}
		assertTrue(err().startsWith("!cannot open input: "));
		assertEquals("", out());
	}
}
