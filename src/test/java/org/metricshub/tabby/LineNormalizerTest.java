package org.metricshub.tabby;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.tabby.frontend.LineNormalizer;
import org.metricshub.tabby.frontend.SourceLine;

public class LineNormalizerTest {

	@Test
	public void testBlankLinesAreSkipped() {
		assertNull(LineNormalizer.normalize(1, ""));
		assertNull(LineNormalizer.normalize(2, "   \t  "));
		assertNull(LineNormalizer.normalize(3, null));
	}

	@Test
	public void testCommentOnlyLinesAreSkipped() {
		assertNull(LineNormalizer.normalize(1, "# a comment"));
		assertNull(LineNormalizer.normalize(2, "\t   # indented comment"));
	}

	@Test
	public void testCommentIsCutOff() {
		SourceLine line = LineNormalizer.normalize(4, "x <- 1 # set x");
		assertEquals("x <- 1", line.getText());
		assertTrue(line.hadComment());
		assertEquals(4, line.getLineNumber());
	}

	@Test
	public void testPlainLineIsKept() {
		SourceLine line = LineNormalizer.normalize(1, "print 42");
		assertEquals("print 42", line.getText());
		assertFalse(line.hadComment());
		assertFalse(line.isIndented());
	}

	@Test
	public void testIndentation() {
		SourceLine line = LineNormalizer.normalize(1, "\treturn a + b\r");
		assertTrue("A leading tab marks a function body line", line.isIndented());
		assertEquals("\treturn a + b", line.getText());
		assertEquals("return a + b", line.getBody());

		assertFalse("Spaces are not indentation", LineNormalizer.normalize(2, "    return a").isIndented());
	}
}
