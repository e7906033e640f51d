package org.metricshub.tabby;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.tabby.frontend.FunctionSignature;
import org.metricshub.tabby.frontend.LineNormalizer;
import org.metricshub.tabby.frontend.SourceLine;
import org.metricshub.tabby.frontend.StatementTranslator;
import org.metricshub.tabby.frontend.TranslationContext;
import org.metricshub.tabby.frontend.TranslationException;

public class StatementTranslatorTest {

	private StatementTranslator translator;
	private TranslationContext context;

	@Before
	public void setUp() {
		translator = new StatementTranslator();
		context = new TranslationContext();
	}

	private static SourceLine line(String text) {
		return LineNormalizer.normalize(3, text);
	}

	@Test
	public void testReturn() {
		assertEquals(Collections.singletonList("return a + b;"), translator.translate(line("\treturn a + b"), context));
	}

	@Test
	public void testFirstAssignmentDeclares() {
		assertEquals("top-level variables are declared at file scope", Collections.singletonList("x = 1;"), translator.translate(line("x <- 1"), context));
		assertEquals(Collections.singleton("x"), context.getSymbolTable().getGlobals());
	}

	@Test
	public void testFirstAssignmentInFunctionDeclaresLocal() {
		context.enterFunction(new FunctionSignature("f", Collections.singletonList("n")));
		assertEquals(Arrays.asList("double r = 0.0;", "r = n;"), translator.translate(line("\tr <- n"), context));
		assertEquals(Collections.singletonList("r = r + 1;"), translator.translate(line("\tr <- r + 1"), context));
		assertTrue(context.getSymbolTable().getGlobals().isEmpty());

		context.leaveFunction();
		assertEquals("no declaration in place", Collections.singletonList("r = 2;"), translator.translate(line("r <- 2"), context));
		assertEquals("declared at file scope instead", Collections.singleton("r"), context.getSymbolTable().getGlobals());
	}

	@Test
	public void testGlobalAssignedInFunctionIsNotRedeclared() {
		translator.translate(line("total <- 5"), context);
		context.enterFunction(new FunctionSignature("bump", Collections.singletonList("n")));
		assertEquals(Collections.singletonList("total = total + n;"), translator.translate(line("\ttotal <- total + n"), context));
		assertEquals(Collections.singleton("total"), context.getSymbolTable().getGlobals());
	}

	@Test
	public void testLaterAssignmentsDoNotDeclare() {
		translator.translate(line("x <- 1"), context);
		assertEquals(Collections.singletonList("x = x + 1;"), translator.translate(line("x <- x + 1"), context));
		assertEquals(Collections.singletonList("x = 0;"), translator.translate(line("\tx <- 0"), context));
		assertEquals(1, context.getSymbolTable().getGlobals().size());
	}

	@Test
	public void testParameterAssignmentDoesNotDeclare() {
		context.enterFunction(new FunctionSignature("f", Collections.singletonList("a")));
		assertEquals(Collections.singletonList("a = a * 2;"), translator.translate(line("\ta <- a * 2"), context));
		assertTrue(context.getSymbolTable().getGlobals().isEmpty());

		context.leaveFunction();
		assertEquals(Collections.singletonList("a = 1;"), translator.translate(line("a <- 1"), context));
		assertEquals(Collections.singleton("a"), context.getSymbolTable().getGlobals());
	}

	@Test
	public void testPrint() {
		assertEquals(Collections.singletonList("print_number(x / 3);"), translator.translate(line("print x / 3"), context));
	}

	@Test
	public void testCalls() {
		assertEquals(Collections.singletonList("foo(1,2,3);"), translator.translate(line("foo(1,2,3)"), context));
		assertEquals(Collections.singletonList("foo(1, 2);"), translator.translate(line("foo (1, 2)"), context));
		assertTrue("Calls declare nothing", context.getSymbolTable().getGlobals().isEmpty());
	}

	@Test
	public void testCommentDoesNotChangeTranslation() {
		TranslationContext other = new TranslationContext();
		assertEquals(
				translator.translate(line("x <- 1"), other),
				translator.translate(line("x <- 1 # comment"), context));
	}

	@Test
	public void testProgramArguments() {
		assertEquals(Collections.singletonList("print_number(arg0 + arg2);"), translator.translate(line("print arg0 + arg2"), context));
		assertEquals("argument assignments are not declarations", Collections.singletonList("arg5 = 1;"), translator.translate(line("arg5 <- 1"), context));
		assertEquals(Arrays.asList(0, 2, 5), Arrays.asList(context.getProgramArguments().toArray()));
		assertFalse(context.getSymbolTable().getGlobals().contains("arg5"));

		translator.translate(line("print argument + arg10 + xarg1"), context);
		assertEquals(
				"only arg0 to arg9 are program arguments",
				Arrays.asList(0, 2, 5),
				Arrays.asList(context.getProgramArguments().toArray()));
	}

	@Test
	public void testUnknownStatement() {
		try {
			translator.translate(line("x ?? y"), context);
			fail("'x ?? y' is not a statement");
		} catch (TranslationException e) {
			assertEquals(Diagnostic.Kind.UNKNOWN_STATEMENT, e.getKind());
			assertEquals(3, e.getLineNumber());
			assertEquals("!line 3: unknown statement: x ?? y", e.toDiagnostic().format());
		}
	}

	@Test
	public void testIdentifierTooLong() {
		try {
			translator.translate(line("thirteenchars <- 1"), context);
			fail("identifiers are at most 12 characters long");
		} catch (TranslationException e) {
			assertEquals(Diagnostic.Kind.INVALID_IDENTIFIER, e.getKind());
		}
		assertTrue("nothing declared", context.getSymbolTable().getGlobals().isEmpty());
	}

	@Test
	public void testReservedNamesCannotBeAssigned() {
		for (String name : Arrays.asList("int", "double", "argc", "argv", "main", "print_number")) {
			try {
				translator.translate(line(name + " <- 1"), context);
				fail("'" + name + "' clashes with the generated C");
			} catch (TranslationException e) {
				assertEquals(Diagnostic.Kind.INVALID_IDENTIFIER, e.getKind());
			}
		}
		assertTrue(context.getSymbolTable().getGlobals().isEmpty());
	}

	@Test
	public void testLibraryFunctionsCanBeCalled() {
		assertEquals(Collections.singletonList("printf(\"%d\", 1);"), translator.translate(line("printf(\"%d\", 1)"), context));
	}
}
