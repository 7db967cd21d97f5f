package org.metricshub.forwardgoto;

import static org.junit.Assert.*;
import static org.metricshub.forwardgoto.RewriteTestSupport.rewriteTest;
import static org.metricshub.forwardgoto.frontend.ast.AstFactory.*;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.forwardgoto.frontend.ast.FunctionBody;

public class RewriteErrorTest {

	@Test
	public void testTargetWithoutBranch() {
		rewriteTest("target never branched to")
				.function(function("f", emit("a"), stmt(at(2, targetMarker("lonely")))))
				.expectError(ErrorKind.UNMATCHED_TARGET, 2)
				.runAndAssert();
	}

	@Test
	public void testBranchWithoutTarget() {
		rewriteTest("branch to nowhere")
				.function(function("f", stmt(at(1, branchMarker("nowhere"))), emit("a")))
				.expectError(ErrorKind.UNMATCHED_BRANCH, 1)
				.runAndAssert();
	}

	@Test
	public void testBackwardBranch() {
		rewriteTest("branch after its target")
				.function(function(
						"f",
						branch("back"),
						emit("a"),
						target("back"),
						stmt(at(4, branchMarker("back")))))
				.expectError(ErrorKind.UNMATCHED_BRANCH, 4)
				.runAndAssert();
	}

	@Test
	public void testDuplicateTarget() {
		rewriteTest("target defined twice")
				.function(function(
						"f",
						branch("twice"),
						target("twice"),
						emit("a"),
						stmt(at(4, targetMarker("twice")))))
				.expectError(ErrorKind.DUPLICATE_TARGET, 4)
				.runAndAssert();
	}

	@Test
	public void testTargetReusingLoopLabel() {
		rewriteTest("target named like a loop")
				.function(function(
						"f",
						branch("outer"),
						stmt(loop("outer", breakStmt("outer"))),
						stmt(at(3, targetMarker("outer")))))
				.expectError(ErrorKind.DUPLICATE_TARGET, 3)
				.runAndAssert();
	}

	@Test
	public void testValueAfterUnresolvedTarget() {
		rewriteTest("value follows a nested target")
				.function(function(
						"f",
						Arrays.asList("c"),
						stmt(ifThen(variable("c"), branch("inside"))),
						tail(blockExpr(emit("x"), target("inside"), at(5, tail(literal("v")))))))
				.expectError(ErrorKind.INVALID_RESULT_POSITION, 5)
				.runAndAssert();
	}

	@Test
	public void testValueInsideMergedRegion() {
		rewriteTest("value-producing statement holds the target")
				.function(function(
						"f",
						Arrays.asList("c"),
						stmt(ifThen(variable("c"), branch("inside"))),
						at(9, tail(blockExpr(emit("x"), target("inside"))))))
				.expectError(ErrorKind.INVALID_RESULT_POSITION, 9)
				.runAndAssert();
	}

	@Test
	public void testTargetInsideLoopFromOutside() {
		rewriteTest("branch into a loop")
				.function(function(
						"f",
						branch("inside"),
						stmt(loop(null, stmt(at(3, targetMarker("inside"))), breakStmt(null))),
						emit("end")))
				.expectError(ErrorKind.INACCESSIBLE_TARGET, 3)
				.runAndAssert();
	}

	@Test
	public void testTargetInsideLetInitializer() {
		rewriteTest("branch into an initializer")
				.function(function(
						"f",
						branch("inside"),
						let("x", blockExpr(emit("a"), stmt(at(7, targetMarker("inside"))))),
						emit("end")))
				.expectError(ErrorKind.INACCESSIBLE_TARGET, 7)
				.runAndAssert();
	}

	@Test
	public void testTargetInsideMatchSelector() {
		rewriteTest("branch into a selector")
				.function(function(
						"f",
						branch("inside"),
						stmt(match(blockExpr(emit("a"), stmt(at(2, targetMarker("inside")))), otherwise())),
						emit("end")))
				.expectError(ErrorKind.INACCESSIBLE_TARGET, 2)
				.runAndAssert();
	}

	@Test
	public void testErrorMessage() {
		FunctionBody function = function("f", emit("a"), stmt(at(2, targetMarker("lonely"))));
		RewriteException e = assertThrows(RewriteException.class, () -> new ForwardGoto().rewrite(function));
		assertEquals(ErrorKind.UNMATCHED_TARGET, e.getKind());
		assertEquals("<input>", e.getPosition().getSourceDescription());
		assertEquals(e.getDetail() + " (<input>:2)", e.getMessage());
		assertTrue(e.getMessage(), e.getMessage().contains("'lonely"));
	}

	@Test
	public void testFirstErrorWins() {
		rewriteTest("first error aborts")
				.function(function(
						"f",
						stmt(at(1, targetMarker("a"))),
						stmt(at(2, targetMarker("b")))))
				.expectError(ErrorKind.UNMATCHED_TARGET, 1)
				.runAndAssert();
	}
}
