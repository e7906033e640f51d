package org.metricshub.tabby;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.tabby.frontend.Statement;
import org.metricshub.tabby.frontend.StatementMatcher;

/**
 * Each recognizer on its own, then the priority between them.
 */
public class StatementMatcherTest {

	@Test
	public void testReturn() {
		Statement statement = StatementMatcher.RETURN.match("return a + b");
		assertEquals(Statement.Kind.RETURN, statement.getKind());
		assertEquals("a + b", statement.getText());
		assertNull(statement.getIdentifier());
		assertNull(StatementMatcher.RETURN.match("returned <- 1"));
	}

	@Test
	public void testAssign() {
		Statement statement = StatementMatcher.ASSIGN.match("x <- add(1, 2)");
		assertEquals(Statement.Kind.ASSIGN, statement.getKind());
		assertEquals("x", statement.getIdentifier());
		assertEquals("add(1, 2)", statement.getText());

		assertEquals("3", StatementMatcher.ASSIGN.match("y<-3").getText());
		assertNull("Missing expression", StatementMatcher.ASSIGN.match("x <-"));
		assertNull("Not an identifier", StatementMatcher.ASSIGN.match("1x <- 2"));
	}

	@Test
	public void testPrint() {
		Statement statement = StatementMatcher.PRINT.match("print x * 2");
		assertEquals(Statement.Kind.PRINT, statement.getKind());
		assertEquals("x * 2", statement.getText());
		assertNull(StatementMatcher.PRINT.match("printer(1)"));
	}

	@Test
	public void testCall() {
		Statement statement = StatementMatcher.CALL.match("foo(1,2,3)");
		assertEquals(Statement.Kind.CALL, statement.getKind());
		assertEquals("foo", statement.getIdentifier());
		assertEquals("1,2,3", statement.getText());
		assertEquals("", StatementMatcher.CALL.match("tick()").getText());
		assertNull(StatementMatcher.CALL.match("foo (1)"));
	}

	@Test
	public void testSpacedCall() {
		Statement statement = StatementMatcher.SPACED_CALL.match("foo (1, 2)");
		assertEquals(Statement.Kind.CALL, statement.getKind());
		assertEquals("foo", statement.getIdentifier());
		assertEquals("Closing parenthesis of the call is dropped", "1, 2", statement.getText());

		assertEquals("(a + b) * c", StatementMatcher.SPACED_CALL.match("foo ((a + b) * c)").getText());
		assertEquals("Balanced text is kept", "(a + b)", StatementMatcher.SPACED_CALL.match("foo ((a + b)").getText());
		assertNull(StatementMatcher.SPACED_CALL.match("foo bar"));
	}

	@Test
	public void testPriority() {
		assertEquals(
				"return wins over call",
				Statement.Kind.RETURN,
				StatementMatcher.classify("return (x)").getKind());
		assertEquals(
				"assignment wins over call",
				Statement.Kind.ASSIGN,
				StatementMatcher.classify("x <- f(1)").getKind());
		assertEquals(
				"print wins over spaced call",
				Statement.Kind.PRINT,
				StatementMatcher.classify("print (x)").getKind());
		assertEquals("foo", StatementMatcher.classify("foo (1)").getIdentifier());
	}

	@Test
	public void testNoMatch() {
		assertNull(StatementMatcher.classify("x ?? y"));
		assertNull(StatementMatcher.classify("return"));
		assertNull(StatementMatcher.classify("print"));
	}
}
