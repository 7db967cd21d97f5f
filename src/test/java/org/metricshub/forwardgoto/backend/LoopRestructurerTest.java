package org.metricshub.forwardgoto.backend;

import static org.junit.Assert.*;
import static org.metricshub.forwardgoto.frontend.ast.AstFactory.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.forwardgoto.ErrorKind;
import org.metricshub.forwardgoto.RewriteException;
import org.metricshub.forwardgoto.frontend.ast.Statement;
import org.metricshub.forwardgoto.intermediate.ContinuationGraph;
import org.metricshub.forwardgoto.intermediate.ContinuationPlan;
import org.metricshub.forwardgoto.intermediate.LabelManager;

public class LoopRestructurerTest {

	private final LabelManager labels = new LabelManager("_c");
	private final ContinuationGraph graph = new ContinuationGraph(labels);
	private final LoopRestructurer restructurer = new LoopRestructurer();

	private static List<Statement> statements(Statement... statements) {
		return new ArrayList<>(Arrays.asList(statements));
	}

	@Test
	public void testRegionOnly() {
		graph.addIncoming(labels.named("L"));
		ContinuationPlan plan = graph.drain(1);
		List<Statement> sequence = statements(emit("before"), breakStmt("L"), emit("skipped"), breakStmt("L"), emit("after"));

		assertEquals(1, restructurer.restructure(sequence, 3, plan));

		assertEquals(3, sequence.size());
		assertEquals("emit \"before\";", sequence.get(0).dump());
		assertEquals(
				String.join(
						"\n",
						"'L: repeat {",
						"  break 'L;",
						"  emit \"skipped\";",
						"  break 'L;",
						"  break 'L;",
						"};"),
				sequence.get(1).dump());
		assertEquals("emit \"after\";", sequence.get(2).dump());
	}

	@Test
	public void testContinuationWrapsPredecessor() {
		graph.addIncoming(labels.named("L"));
		graph.pushContinuation(statements(emit("after")));
		ContinuationPlan plan = graph.drain(0);
		List<Statement> sequence = statements(emit("a"), breakStmt("L"));

		assertEquals(0, restructurer.restructure(sequence, 1, plan));

		assertEquals(1, sequence.size());
		assertEquals(
				String.join(
						"\n",
						"'_c0: repeat {",
						"  'L: repeat {",
						"    emit \"a\";",
						"    break 'L;",
						"    break '_c0;",
						"    break 'L;",
						"  };",
						"  emit \"after\";",
						"  break '_c0;",
						"};"),
				sequence.get(0).dump());
	}

	@Test
	public void testValueInRegion() {
		graph.addIncoming(labels.named("L"));
		ContinuationPlan plan = graph.drain(0);
		List<Statement> sequence = statements(breakStmt("L"), at(3, tail(literal(1L))));

		RewriteException e = assertThrows(RewriteException.class, () -> restructurer.restructure(sequence, 1, plan));
		assertEquals(ErrorKind.INVALID_RESULT_POSITION, e.getKind());
		assertEquals(3, e.getPosition().getLineNo());
	}

	@Test
	public void testInvalidRegion() {
		graph.addIncoming(labels.named("L"));
		ContinuationPlan plan = graph.drain(2);
		assertThrows(IllegalStateException.class, () -> restructurer.restructure(statements(emit("a")), 0, plan));
	}
}
