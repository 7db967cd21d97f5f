package org.metricshub.forwardgoto.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Forward Goto
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;
import org.metricshub.forwardgoto.ErrorKind;
import org.metricshub.forwardgoto.RewriteException;
import org.metricshub.forwardgoto.frontend.ast.Block;
import org.metricshub.forwardgoto.frontend.ast.BreakExpression;
import org.metricshub.forwardgoto.frontend.ast.ExpressionStatement;
import org.metricshub.forwardgoto.frontend.ast.RepeatBlock;
import org.metricshub.forwardgoto.frontend.ast.SourcePosition;
import org.metricshub.forwardgoto.frontend.ast.Statement;
import org.metricshub.forwardgoto.intermediate.Continuation;
import org.metricshub.forwardgoto.intermediate.ContinuationPlan;
import org.metricshub.forwardgoto.intermediate.Label;
import org.metricshub.forwardgoto.util.ForwardGotoLogger;
import org.slf4j.Logger;

/**
 * Splices a resolved continuation plan into a statement sequence.
 * <p>
 * The statements from the plan's lowest index to the statement just walked
 * (the region) are moved into the innermost repeat-block. Every label in the
 * plan then gets a repeat-block wrapping all that was built so far, so that
 * exiting it lands on the statements of the continuation it leads to:
 *
 * <pre>
 * 'end: repeat {
 *   'c: repeat {
 *     'target: repeat {
 *       region...
 *       break 'end;
 *     }
 *     break 'target;
 *   }
 *   continuation statements...
 *   break 'c;
 * }
 * </pre>
 *
 * Every repeat-block ends with an early exit, so none of them ever runs twice.
 */
public class LoopRestructurer {

	private static final Logger LOGGER = ForwardGotoLogger.getLogger(LoopRestructurer.class);

	/**
	 * @param statements the sequence to restructure, modified in place
	 * @param current index of the statement just walked
	 * @param plan the continuations to splice
	 * @return index of the spliced repeat-block, where the walk resumes
	 * @throws RewriteException if the region holds the value of the sequence
	 */
	public int restructure(List<Statement> statements, int current, ContinuationPlan plan) {
		int lowestIndex = plan.getLowestIndex();
		if (lowestIndex < 0 || lowestIndex > current) {
			throw new IllegalStateException("Invalid region [" + lowestIndex + ", " + current + "]");
		}

		List<Statement> tail = statements.subList(current + 1, statements.size());
		List<Statement> rest = new ArrayList<Statement>(tail);
		tail.clear();
		List<Statement> regionView = statements.subList(lowestIndex, statements.size());
		List<Statement> region = new ArrayList<Statement>(regionView);
		regionView.clear();

		for (Statement statement : region) {
			if (statement.isValueProducing()) {
				throw new RewriteException(
						ErrorKind.INVALID_RESULT_POSITION,
						"The value of this block cannot be moved into a merge block",
						statement.getPosition());
			}
		}

		SourcePosition position = region.get(0).getPosition();
		Label endLabel = plan.getEndLabel();

		List<Statement> content = region;
		content.add(exit(endLabel, position));
		for (Continuation continuation : plan.getContinuations()) {
			List<Label> predecessors = continuation.getPredecessors();
			if (!predecessors.isEmpty()) {
				Label last = predecessors.get(predecessors.size() - 1);
				for (Label predecessor : predecessors) {
					content.add(exit(last, position));
					content = wrap(predecessor, content, position);
				}
			}
			content.addAll(continuation.getStatements());
			content.add(exit(continuation.getLabel(), position));
		}

		statements.add(new ExpressionStatement(
				new RepeatBlock(endLabel.getName(), new Block(content), position),
				true,
				position));
		statements.addAll(rest);

		LOGGER.debug(
				"Spliced {} continuation(s) ending at {} over statements [{}, {}]",
				plan.getContinuations().size(),
				endLabel,
				lowestIndex,
				current);
		return lowestIndex;
	}

	private static Statement exit(Label label, SourcePosition position) {
		return new ExpressionStatement(new BreakExpression(label.getName(), position), true, position);
	}

	private static List<Statement> wrap(Label label, List<Statement> content, SourcePosition position) {
		List<Statement> wrapped = new ArrayList<Statement>();
		wrapped.add(new ExpressionStatement(new RepeatBlock(label.getName(), new Block(content), position), true, position));
		return wrapped;
	}
}
