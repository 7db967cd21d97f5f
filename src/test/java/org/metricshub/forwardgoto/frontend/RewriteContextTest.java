package org.metricshub.forwardgoto.frontend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.forwardgoto.ErrorKind;
import org.metricshub.forwardgoto.RewriteException;
import org.metricshub.forwardgoto.frontend.ast.SourcePosition;
import org.metricshub.forwardgoto.util.RewriteSettings;

public class RewriteContextTest {

	private static final SourcePosition POSITION = new SourcePosition("test", 3);

	private final RewriteContext context = new RewriteContext(new RewriteSettings());

	@Test
	public void testScopeIsLeftOnError() {
		try (RewriteContext.Scope statement = context.enterStatement(4)) {
			assertEquals(1, context.getLedger().getLevel());
			try (RewriteContext.Scope nested = context.enter()) {
				assertEquals(2, context.getLedger().getLevel());
				assertEquals(4, context.getLedger().getIndex());
				context.registerTarget("L", POSITION);
			}
			fail("a target without branch must be rejected");
		} catch (RewriteException e) {
			assertEquals(ErrorKind.UNMATCHED_TARGET, e.getKind());
		}
		assertEquals(0, context.getLedger().getLevel());
		assertEquals(-1, context.getLedger().getIndex());
	}

	@Test
	public void testCutRejectsPendingTarget() {
		try (RewriteContext.Scope statement = context.enterStatement(0)) {
			context.registerBranch("L", POSITION);
		}
		try (RewriteContext.Scope statement = context.enterStatement(1)) {
			RewriteContext.Cut cut = context.cut();
			try {
				try (RewriteContext.Scope inner = context.enterStatement(0)) {
					context.registerTarget("L", POSITION);
				}
				RewriteException e = assertThrows(RewriteException.class, cut::ensureResolved);
				assertEquals(ErrorKind.INACCESSIBLE_TARGET, e.getKind());
				assertEquals(POSITION, e.getPosition());
			} finally {
				cut.close();
			}
			assertFalse(context.getLedger().hasActiveTargets());
			assertTrue(context.getGraph().isEmpty());
		}
	}

	@Test
	public void testFinishReportsPendingBranch() {
		try (RewriteContext.Scope statement = context.enterStatement(0)) {
			context.registerBranch("L", POSITION);
		}
		RewriteException e = assertThrows(RewriteException.class, context::finish);
		assertEquals(ErrorKind.UNMATCHED_BRANCH, e.getKind());
		assertEquals(POSITION, e.getPosition());
	}

	@Test
	public void testTargetReusingLoopLabel() {
		context.reserveLoopLabel("outer");
		try (RewriteContext.Scope statement = context.enterStatement(0)) {
			context.registerBranch("outer", POSITION);
			RewriteException e = assertThrows(RewriteException.class, () -> context.registerTarget("outer", POSITION));
			assertEquals(ErrorKind.DUPLICATE_TARGET, e.getKind());
		}
	}
}
