package org.metricshub.tabby;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.tabby.frontend.FunctionSignature;
import org.metricshub.tabby.frontend.LineNormalizer;
import org.metricshub.tabby.frontend.SignatureTranslator;
import org.metricshub.tabby.frontend.SourceLine;
import org.metricshub.tabby.frontend.TranslationException;

public class SignatureTranslatorTest {

	private final SignatureTranslator translator = new SignatureTranslator();

	private static SourceLine line(String text) {
		return LineNormalizer.normalize(7, text);
	}

	@Test
	public void testIsHeader() {
		assertTrue(translator.isHeader(line("function add a b")));
		assertTrue(translator.isHeader(line("function")));
		assertFalse("Indented lines are body lines", translator.isHeader(line("\tfunction add a b")));
		assertFalse(translator.isHeader(line("functions <- 3")));
		assertFalse(translator.isHeader(line("print function")));
	}

	@Test
	public void testParameters() {
		FunctionSignature signature = translator.parse(line("function add a b"));
		assertEquals("add", signature.getName());
		assertEquals(Arrays.asList("a", "b"), signature.getParameters());
	}

	@Test
	public void testCommaSeparatedParameters() {
		FunctionSignature signature = translator.parse(line("function mix x, y,z   w"));
		assertEquals(Arrays.asList("x", "y", "z", "w"), signature.getParameters());
	}

	@Test
	public void testTranslate() {
		assertEquals("double add(double a, double b) {", translator.translate(line("function add a b")));
		assertEquals("double twice(double n) {", translator.translate(line("function twice n # doubles")));
	}

	@Test
	public void testRender() {
		FunctionSignature signature = new FunctionSignature("f", Collections.singletonList("p"));
		assertEquals("double f(double p)", translator.render(signature));
	}

	@Test
	public void testMissingParameterList() {
		assertInvalid("function f");
		assertInvalid("function");
		assertInvalid("function f ,");
	}

	@Test
	public void testBadNames() {
		assertInvalid("function 2f a");
		assertInvalid("function f a-b");
		assertInvalid("function thirteenchars a");
		assertInvalid("function f thirteenchars");
	}

	@Test
	public void testReservedNames() {
		assertInvalid("function main a");
		assertInvalid("function print_number a");
		assertInvalid("function f int");
		assertInvalid("function f a argc");
	}

	@Test
	public void testDuplicateParameter() {
		assertInvalid("function f a b a");
	}

	@Test
	public void testTwelveCharacterNamesAreAccepted() {
		FunctionSignature signature = translator.parse(line("function twelve_chars twelve_param"));
		assertEquals("twelve_chars", signature.getName());
		assertEquals(Collections.singletonList("twelve_param"), signature.getParameters());
	}

	private void assertInvalid(String header) {
		try {
			translator.parse(line(header));
			fail("'" + header + "' must be rejected");
		} catch (TranslationException e) {
			assertEquals(Diagnostic.Kind.INVALID_FUNCTION_DEFINITION, e.getKind());
			assertEquals(7, e.getLineNumber());
		}
	}
}
