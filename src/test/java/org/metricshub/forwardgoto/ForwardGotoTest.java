package org.metricshub.forwardgoto;

import static org.junit.Assert.*;
import static org.metricshub.forwardgoto.RewriteTestSupport.rewriteTest;
import static org.metricshub.forwardgoto.frontend.ast.AstFactory.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.forwardgoto.backend.ExecutionResult;
import org.metricshub.forwardgoto.frontend.ast.FunctionBody;
import org.metricshub.forwardgoto.frontend.ast.MatchArm;
import org.metricshub.forwardgoto.util.RewriteSettings;

public class ForwardGotoTest {

	private static FunctionBody skipForward() {
		return function(
				"skip_forward",
				emit("begin"),
				branch("test"),
				emit("should not happen"),
				target("test"),
				emit("end"));
	}

	private static FunctionBody conditionalSkip() {
		return function(
				"conditional_skip",
				Arrays.asList("b"),
				emit("begin"),
				stmt(ifThen(not(variable("b")), branch("test"))),
				emit("happens if b"),
				target("test"),
				emit("end"));
	}

	private static FunctionBody sharedTarget() {
		return function(
				"shared_target",
				Arrays.asList("three"),
				stmt(match(
						variable("three"),
						MatchArm.of("A", branchMarker("done")),
						MatchArm.of("B", branchMarker("done")),
						otherwise())),
				emit("common"),
				target("done"),
				emit("after"));
	}

	private static FunctionBody jumpIntoIf() {
		return function(
				"jump_into_if",
				Arrays.asList("three", "b"),
				emit("begin"),
				stmt(match(
						variable("three"),
						arm("A", branch("test")),
						arm("B", branch("test_2")),
						arm("C"))),
				emit("in between"),
				stmt(ifElse(
						variable("b"),
						block(emit("before label"), target("test"), emit("after label")),
						block(emit("before label 2"), target("test_2"), emit("after label 2")))),
				emit("end"));
	}

	private static FunctionBody jumpIntoDoubleIf() {
		return function(
				"jump_into_double_if",
				Arrays.asList("three", "b1", "b2"),
				emit("begin"),
				stmt(match(
						variable("three"),
						arm("A", branch("test")),
						arm("B", branch("test_2")),
						arm("C"))),
				emit("in between"),
				stmt(ifElse(
						variable("b1"),
						block(
								stmt(ifElse(
										variable("b2"),
										block(emit("before label"), target("test"), emit("after label")),
										block(emit("before label 2"), target("test_2"), emit("after label 2")))),
								emit("after after")),
						block(emit("alternative")))),
				emit("end"));
	}

	private static FunctionBody fallThroughAroundTarget() {
		return function(
				"fall_through_around_target",
				Arrays.asList("three", "b1", "b2"),
				stmt(match(variable("three"), arm("A", branch("inner")), otherwise())),
				stmt(ifThen(
						variable("b1"),
						stmt(ifThen(variable("b2"), emit("x"), target("inner"), emit("y"))),
						emit("z"))),
				emit("end"));
	}

	@Test
	public void testSkipForward() {
		rewriteTest("unconditional branch").function(skipForward()).expectTrace("begin", "end").runAndAssert();
	}

	@Test
	public void testConditionalSkip() {
		rewriteTest("conditional branch not taken")
				.function(conditionalSkip())
				.argument("b", true)
				.expectTrace("begin", "happens if b", "end")
				.runAndAssert();
		rewriteTest("conditional branch taken")
				.function(conditionalSkip())
				.argument("b", false)
				.expectTrace("begin", "end")
				.runAndAssert();
	}

	@Test
	public void testSharedTarget() {
		rewriteTest("arm A branches").function(sharedTarget()).argument("three", "A").expectTrace("after").runAndAssert();
		rewriteTest("arm B branches").function(sharedTarget()).argument("three", "B").expectTrace("after").runAndAssert();
		rewriteTest("arm C falls through")
				.function(sharedTarget())
				.argument("three", "C")
				.expectTrace("common", "after")
				.runAndAssert();
	}

	@Test
	public void testJumpIntoIf() {
		for (boolean b : new boolean[] { true, false }) {
			rewriteTest("A, " + b)
					.function(jumpIntoIf())
					.argument("three", "A")
					.argument("b", b)
					.expectTrace("begin", "after label", "end")
					.runAndAssert();
			rewriteTest("B, " + b)
					.function(jumpIntoIf())
					.argument("three", "B")
					.argument("b", b)
					.expectTrace("begin", "after label 2", "end")
					.runAndAssert();
		}
		rewriteTest("C, true")
				.function(jumpIntoIf())
				.argument("three", "C")
				.argument("b", true)
				.expectTrace("begin", "in between", "before label", "after label", "end")
				.runAndAssert();
		rewriteTest("C, false")
				.function(jumpIntoIf())
				.argument("three", "C")
				.argument("b", false)
				.expectTrace("begin", "in between", "before label 2", "after label 2", "end")
				.runAndAssert();
	}

	@Test
	public void testJumpIntoDoubleIf() {
		for (boolean b1 : new boolean[] { true, false }) {
			for (boolean b2 : new boolean[] { true, false }) {
				rewriteTest("A, " + b1 + ", " + b2)
						.function(jumpIntoDoubleIf())
						.argument("three", "A")
						.argument("b1", b1)
						.argument("b2", b2)
						.expectTrace("begin", "after label", "after after", "end")
						.runAndAssert();
				rewriteTest("B, " + b1 + ", " + b2)
						.function(jumpIntoDoubleIf())
						.argument("three", "B")
						.argument("b1", b1)
						.argument("b2", b2)
						.expectTrace("begin", "after label 2", "after after", "end")
						.runAndAssert();
			}
			rewriteTest("C, false, " + b1)
					.function(jumpIntoDoubleIf())
					.argument("three", "C")
					.argument("b1", false)
					.argument("b2", b1)
					.expectTrace("begin", "in between", "alternative", "end")
					.runAndAssert();
		}
		rewriteTest("C, true, true")
				.function(jumpIntoDoubleIf())
				.argument("three", "C")
				.argument("b1", true)
				.argument("b2", true)
				.expectTrace("begin", "in between", "before label", "after label", "after after", "end")
				.runAndAssert();
		rewriteTest("C, true, false")
				.function(jumpIntoDoubleIf())
				.argument("three", "C")
				.argument("b1", true)
				.argument("b2", false)
				.expectTrace("begin", "in between", "before label 2", "after label 2", "after after", "end")
				.runAndAssert();
	}

	@Test
	public void testFallThroughAroundNestedTarget() {
		Object[][] cases = {
				{ "A", true, true, new String[] { "y", "z", "end" } },
				{ "A", false, false, new String[] { "y", "z", "end" } },
				{ "C", true, true, new String[] { "x", "y", "z", "end" } },
				{ "C", true, false, new String[] { "z", "end" } },
				{ "C", false, true, new String[] { "end" } },
		};
		for (Object[] c : cases) {
			rewriteTest("fall through " + Arrays.toString(Arrays.copyOf(c, 3)))
					.function(fallThroughAroundTarget())
					.argument("three", c[0])
					.argument("b1", c[1])
					.argument("b2", c[2])
					.expectTrace((String[]) c[3])
					.runAndAssert();
		}
	}

	@Test
	public void testSequentialTargets() {
		FunctionBody function = function(
				"sequential_targets",
				Arrays.asList("a", "b"),
				stmt(ifThen(variable("a"), branch("x"))),
				stmt(ifThen(variable("b"), branch("y"))),
				emit("1"),
				target("x"),
				emit("2"),
				target("y"),
				emit("3"));
		rewriteTest("no branch").function(function).argument("a", false).argument("b", false).expectTrace("1", "2", "3").runAndAssert();
		rewriteTest("to x").function(function).argument("a", true).argument("b", false).expectTrace("2", "3").runAndAssert();
		rewriteTest("to y").function(function).argument("a", false).argument("b", true).expectTrace("3").runAndAssert();
		rewriteTest("to x first").function(function).argument("a", true).argument("b", true).expectTrace("2", "3").runAndAssert();
	}

	@Test
	public void testTargetInsideLoopBody() {
		FunctionBody function = function(
				"loop_body",
				Arrays.asList("c", "d"),
				stmt(loop(
						null,
						stmt(ifThen(variable("c"), branch("skip"))),
						stmt(ifThen(variable("d"), breakStmt(null))),
						emit("a"),
						target("skip"),
						emit("b"),
						breakStmt(null))),
				emit("end"));
		rewriteTest("branch taken").function(function).argument("c", true).argument("d", false).expectTrace("b", "end").runAndAssert();
		rewriteTest("branch not taken")
				.function(function)
				.argument("c", false)
				.argument("d", false)
				.expectTrace("a", "b", "end")
				.runAndAssert();
		rewriteTest("unlabeled break exits the user loop")
				.function(function)
				.argument("c", false)
				.argument("d", true)
				.expectTrace("end")
				.runAndAssert();
	}

	@Test
	public void testValueAfterTarget() {
		FunctionBody function = function(
				"value",
				Arrays.asList("c"),
				stmt(ifThen(variable("c"), branch("out"))),
				emit("a"),
				target("out"),
				tail(literal(42L)));
		rewriteTest("value kept").function(function).argument("c", true).expectTrace().expectValue(42L).runAndAssert();
		rewriteTest("value kept, fall through")
				.function(function)
				.argument("c", false)
				.expectTrace("a")
				.expectValue(42L)
				.runAndAssert();
	}

	@Test
	public void testSyntheticLabelsAvoidUserNames() {
		RewriteSettings settings = new RewriteSettings();
		settings.setContinuationLabelPrefix("test_");
		rewriteTest("continuation prefix clashes with target names")
				.settings(settings)
				.function(jumpIntoIf())
				.argument("three", "B")
				.argument("b", true)
				.expectTrace("begin", "after label 2", "end")
				.runAndAssert();
	}

	@Test
	public void testCustomPrefix() {
		RewriteSettings settings = new RewriteSettings();
		settings.setContinuationLabelPrefix("merge");
		FunctionBody rewritten = new ForwardGoto(settings).rewrite(jumpIntoIf());
		assertTrue(RewriteTestSupport.loopLabels(rewritten).contains("merge0"));
		assertFalse(rewritten.dump().contains("_continuation"));
	}

	@Test
	public void testNoMarkersIsIdentity() {
		FunctionBody function = function(
				"plain",
				Arrays.asList("c"),
				let("x", literal("v")),
				stmt(ifElse(variable("c"), block(emit("yes")), block(emit("no")))),
				stmt(loop("outer", emit("once"), breakStmt("outer"))),
				tail(variable("x")));
		FunctionBody rewritten = new ForwardGoto().rewrite(function);
		assertEquals(function.dump(), rewritten.dump());
		assertNotSame(function.getBody(), rewritten.getBody());
	}

	@Test
	public void testRewriteIsIdempotent() {
		ForwardGoto forwardGoto = new ForwardGoto();
		FunctionBody once = forwardGoto.rewrite(jumpIntoDoubleIf());
		FunctionBody twice = forwardGoto.rewrite(once);
		assertEquals(once.dump(), twice.dump());
	}

	@Test
	public void testInputIsNeverModified() {
		FunctionBody function = jumpIntoIf();
		String before = function.dump();
		new ForwardGoto().rewrite(function);
		assertEquals(before, function.dump());
		assertEquals(4, RewriteTestSupport.countMarkers(function));
	}

	@Test
	public void testFailedRewriteLeavesInputUntouched() {
		FunctionBody function = function("broken", branch("nowhere"), emit("a"));
		String before = function.dump();
		assertThrows(RewriteException.class, () -> new ForwardGoto().rewrite(function));
		assertEquals(before, function.dump());
	}

	@Test
	public void testRewrittenShape() {
		FunctionBody function = function(
				"scenario",
				Arrays.asList("cond"),
				stmt(ifThen(variable("cond"), branch("L"))),
				emit("mid"),
				target("L"),
				emit("end"));
		String expected = String.join(
				"\n",
				"fn scenario(cond) {",
				"  'L: repeat {",
				"    if cond {",
				"      break 'L;",
				"    };",
				"    emit \"mid\";",
				"    break 'L;",
				"    break 'L;",
				"  };",
				"  emit \"end\";",
				"}");
		assertEquals(expected, new ForwardGoto().rewrite(function).dump());
	}

	@Test
	public void testDumpSyntaxTree() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RewriteSettings settings = new RewriteSettings();
		settings.setDumpSyntaxTree(true);
		settings.setOutputStream(new PrintStream(out, true));
		new ForwardGoto(settings).rewrite(skipForward());
		String dump = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.contains("// skip_forward, before rewrite"));
		assertTrue(dump, dump.contains("branch 'test;"));
		assertTrue(dump, dump.contains("// skip_forward, after rewrite"));
		assertTrue(dump, dump.contains("'test: repeat {"));
	}

	@Test
	public void testRun() {
		Map<String, Object> arguments = new HashMap<>();
		arguments.put("b", false);
		ExecutionResult result = new ForwardGoto().run(conditionalSkip(), arguments);
		assertEquals(Arrays.asList("begin", "end"), result.getTrace());
		assertNull(result.getValue());
		assertEquals(
				Arrays.asList("begin", "end"),
				new ForwardGoto().run(skipForward(), Collections.<String, Object>emptyMap()).getTrace());
	}
}
