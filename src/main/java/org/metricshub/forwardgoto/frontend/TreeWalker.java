package org.metricshub.forwardgoto.frontend;

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
import org.metricshub.forwardgoto.backend.LoopRestructurer;
import org.metricshub.forwardgoto.frontend.ast.AstVisitor;
import org.metricshub.forwardgoto.frontend.ast.Block;
import org.metricshub.forwardgoto.frontend.ast.BlockExpression;
import org.metricshub.forwardgoto.frontend.ast.BranchMarker;
import org.metricshub.forwardgoto.frontend.ast.BreakExpression;
import org.metricshub.forwardgoto.frontend.ast.EmitExpression;
import org.metricshub.forwardgoto.frontend.ast.Expression;
import org.metricshub.forwardgoto.frontend.ast.ExpressionStatement;
import org.metricshub.forwardgoto.frontend.ast.FunctionBody;
import org.metricshub.forwardgoto.frontend.ast.IfExpression;
import org.metricshub.forwardgoto.frontend.ast.LiteralExpression;
import org.metricshub.forwardgoto.frontend.ast.LocalStatement;
import org.metricshub.forwardgoto.frontend.ast.LoopExpression;
import org.metricshub.forwardgoto.frontend.ast.MatchArm;
import org.metricshub.forwardgoto.frontend.ast.MatchExpression;
import org.metricshub.forwardgoto.frontend.ast.NotExpression;
import org.metricshub.forwardgoto.frontend.ast.RepeatBlock;
import org.metricshub.forwardgoto.frontend.ast.Statement;
import org.metricshub.forwardgoto.frontend.ast.TargetMarker;
import org.metricshub.forwardgoto.frontend.ast.VariableExpression;
import org.metricshub.forwardgoto.intermediate.ContinuationPlan;
import org.metricshub.forwardgoto.intermediate.Label;
import org.metricshub.forwardgoto.util.ForwardGotoLogger;
import org.slf4j.Logger;

/**
 * Depth-first traversal that replaces branch and target markers with early
 * exits and, whenever a target is resolved, has the enclosing statement
 * sequence restructured into nested repeat-blocks.
 * <p>
 * Visiting an expression returns the expression that replaces it.
 * Visiting a statement returns {@code null}; statements are updated in
 * place.
 */
public class TreeWalker implements AstVisitor<Expression> {

	private static final Logger LOGGER = ForwardGotoLogger.getLogger(TreeWalker.class);

	private final RewriteContext context;
	private final LoopRestructurer restructurer = new LoopRestructurer();

	public TreeWalker(RewriteContext context) {
		this.context = context;
	}

	/**
	 * Rewrites a function body in place.
	 *
	 * @param function the function to rewrite
	 * @throws RewriteException if its markers cannot be rewritten
	 */
	public void walk(FunctionBody function) {
		LOGGER.debug("Rewriting {}", function);
		new ReservedNameScanner(context).scan(function);
		walkSequence(function.getBody().getStatements());
		context.finish();
	}

	/**
	 * Walks the statements of a sequence from left to right. After a target
	 * is resolved, the walk resumes at the spliced repeat-block so that the
	 * relocated statements are walked too. When a target is still waiting for
	 * an outer sequence, the remaining statements are split off as a
	 * continuation and the sequence ends with an early exit.
	 */
	private void walkSequence(List<Statement> statements) {
		int i = 0;
		while (i < statements.size()) {
			Statement statement = statements.get(i);
			try (RewriteContext.Scope scope = context.enterStatement(i)) {
				statement.accept(this);
			}

			ContinuationPlan plan = context.retrieveContinuations();
			if (plan != null) {
				i = restructurer.restructure(statements, i, plan);
				continue;
			}

			if (context.shouldSplit()) {
				List<Statement> tail = statements.subList(i + 1, statements.size());
				List<Statement> rest = new ArrayList<Statement>(tail);
				tail.clear();
				for (Statement moved : rest) {
					if (moved.isValueProducing()) {
						throw new RewriteException(
								ErrorKind.INVALID_RESULT_POSITION,
								"The value of this block would follow a target that is not resolved yet",
								moved.getPosition());
					}
				}
				Label jump = context.pushContinuation(rest);
				statements.add(new ExpressionStatement(
						new BreakExpression(jump.getName(), statement.getPosition()),
						true,
						statement.getPosition()));
				return;
			}
			i++;
		}
	}

	private void walkBlock(Block block) {
		walkSequence(block.getStatements());
	}

	private Expression walkIsolated(Expression expression) {
		try (RewriteContext.Cut cut = context.cut()) {
			Expression result = expression.accept(this);
			cut.ensureResolved();
			return result;
		}
	}

	private void walkIsolated(Block block) {
		try (RewriteContext.Cut cut = context.cut()) {
			walkBlock(block);
			cut.ensureResolved();
		}
	}

	@Override
	public Expression visit(LocalStatement node) {
		node.setInitializer(walkIsolated(node.getInitializer()));
		return null;
	}

	@Override
	public Expression visit(ExpressionStatement node) {
		node.setExpression(node.getExpression().accept(this));
		return null;
	}

	@Override
	public Expression visit(BranchMarker node) {
		context.registerBranch(node.getTarget(), node.getPosition());
		return new BreakExpression(node.getTarget(), node.getPosition());
	}

	@Override
	public Expression visit(TargetMarker node) {
		context.registerTarget(node.getName(), node.getPosition());
		return new BreakExpression(node.getName(), node.getPosition());
	}

	@Override
	public Expression visit(IfExpression node) {
		node.setCondition(walkIsolated(node.getCondition()));
		try (RewriteContext.Scope scope = context.enter()) {
			walkBlock(node.getThenBlock());
		}
		if (node.getElseBranch() != null) {
			try (RewriteContext.Scope scope = context.enter()) {
				node.setElseBranch(node.getElseBranch().accept(this));
			}
		}
		return node;
	}

	@Override
	public Expression visit(MatchExpression node) {
		node.setSelector(walkIsolated(node.getSelector()));
		for (MatchArm arm : node.getArms()) {
			try (RewriteContext.Scope scope = context.enter()) {
				arm.setBody(arm.getBody().accept(this));
			}
		}
		return node;
	}

	@Override
	public Expression visit(BlockExpression node) {
		try (RewriteContext.Scope scope = context.enter()) {
			walkBlock(node.getBlock());
		}
		return node;
	}

	@Override
	public Expression visit(LoopExpression node) {
		walkIsolated(node.getBody());
		return node;
	}

	@Override
	public Expression visit(RepeatBlock node) {
		walkIsolated(node.getBody());
		return node;
	}

	@Override
	public Expression visit(NotExpression node) {
		node.setOperand(node.getOperand().accept(this));
		return node;
	}

	@Override
	public Expression visit(BreakExpression node) {
		return node;
	}

	@Override
	public Expression visit(EmitExpression node) {
		return node;
	}

	@Override
	public Expression visit(LiteralExpression node) {
		return node;
	}

	@Override
	public Expression visit(VariableExpression node) {
		return node;
	}
}
