package org.metricshub.tabby;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.tabby.backend.FunctionBoundaryTracker;
import org.metricshub.tabby.backend.Scope;
import org.metricshub.tabby.backend.Transition;

public class FunctionBoundaryTrackerTest {

	@Test
	public void testInitialScope() {
		assertEquals(Scope.OUTSIDE, new FunctionBoundaryTracker().getScope());
	}

	@Test
	public void testHeaderOpensFunction() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		assertTransition("first header", tracker.onHeader(), Scope.OUTSIDE, Scope.INSIDE, false);
		assertTransition("next header closes the previous function", tracker.onHeader(), Scope.INSIDE, Scope.INSIDE, true);
	}

	@Test
	public void testIndentedStatements() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		assertTransition("indented, outside", tracker.onStatement(true), Scope.OUTSIDE, Scope.OUTSIDE, false);
		tracker.onHeader();
		assertTransition("indented, inside", tracker.onStatement(true), Scope.INSIDE, Scope.INSIDE, false);
		assertTransition("indented, still inside", tracker.onStatement(true), Scope.INSIDE, Scope.INSIDE, false);
	}

	@Test
	public void testUnindentedStatementLeavesFunction() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		tracker.onHeader();
		assertTransition("leaving", tracker.onStatement(false), Scope.INSIDE, Scope.OUTSIDE, true);
		assertTransition("outside", tracker.onStatement(false), Scope.OUTSIDE, Scope.OUTSIDE, false);
	}

	@Test
	public void testMalformedHeader() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		assertTransition("outside", tracker.onMalformedHeader(), Scope.OUTSIDE, Scope.OUTSIDE, false);
		tracker.onHeader();
		assertTransition("inside", tracker.onMalformedHeader(), Scope.INSIDE, Scope.OUTSIDE, true);
	}

	@Test
	public void testRejectedFunctionBodyIsSkipped() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		tracker.onHeader();
		tracker.onMalformedHeader();
		Transition skipped = tracker.onStatement(true);
		assertTransition("body of the rejected function", skipped, Scope.OUTSIDE, Scope.OUTSIDE, false);
		assertTrue(skipped.skipsLine());
		assertTrue("whole body", tracker.onStatement(true).skipsLine());

		assertFalse("unindented line ends the body", tracker.onStatement(false).skipsLine());
		assertFalse("indented line after that is a statement again", tracker.onStatement(true).skipsLine());
	}

	@Test
	public void testHeaderEndsRejectedFunctionBody() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		tracker.onMalformedHeader();
		tracker.onHeader();
		Transition body = tracker.onStatement(true);
		assertFalse(body.skipsLine());
		assertEquals(Scope.INSIDE, body.getTo());
	}

	@Test
	public void testEndOfInput() {
		FunctionBoundaryTracker tracker = new FunctionBoundaryTracker();
		assertTransition("outside", tracker.onEndOfInput(), Scope.OUTSIDE, Scope.OUTSIDE, false);
		tracker.onHeader();
		tracker.onStatement(true);
		assertTransition("inside", tracker.onEndOfInput(), Scope.INSIDE, Scope.OUTSIDE, true);
	}

	private static void assertTransition(String message, Transition transition, Scope from, Scope to, boolean closes) {
		assertEquals(message, from, transition.getFrom());
		assertEquals(message, to, transition.getTo());
		assertEquals(message, closes, transition.closesFunction());
	}
}
