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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.forwardgoto.frontend.ast.AstNode;
import org.metricshub.forwardgoto.frontend.ast.AstVisitor;
import org.metricshub.forwardgoto.frontend.ast.Block;
import org.metricshub.forwardgoto.frontend.ast.BlockExpression;
import org.metricshub.forwardgoto.frontend.ast.BranchMarker;
import org.metricshub.forwardgoto.frontend.ast.BreakExpression;
import org.metricshub.forwardgoto.frontend.ast.EmitExpression;
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
import org.metricshub.forwardgoto.util.ForwardGotoLogger;
import org.metricshub.forwardgoto.util.RewriteSettings;
import org.slf4j.Logger;

/**
 * Executes a marker-free statement tree.
 * <p>
 * Blocks open a variable scope and evaluate to the value of their
 * value-producing statement, if any. Loops repeat their body until a
 * {@code break} exits them: an unlabeled {@code break} exits the innermost
 * user loop, a labeled one exits the loop or repeat-block with that label.
 * Repeat-blocks only catch breaks carrying their own label.
 * <p>
 * An instance keeps the state of the current execution and is not
 * thread-safe.
 */
public class TreeInterpreter implements AstVisitor<Object> {

	private static final Logger LOGGER = ForwardGotoLogger.getLogger(TreeInterpreter.class);

	/**
	 * Unwinds the evaluation up to the loop a {@code break} exits.
	 */
	private static final class BreakSignal extends RuntimeException {

		private static final long serialVersionUID = 1L;

		private final String label;
		private final int lineNumber;

		BreakSignal(String label, int lineNumber) {
			super(label == null ? "break" : "break '" + label, null, false, false);
			this.label = label;
			this.lineNumber = lineNumber;
		}
	}

	private final int maxLoopIterations;
	private List<String> trace;
	private Deque<Map<String, Object>> scopes;

	public TreeInterpreter() {
		this(new RewriteSettings());
	}

	public TreeInterpreter(RewriteSettings settings) {
		this.maxLoopIterations = settings.getMaxLoopIterations();
	}

	/**
	 * Runs a function.
	 *
	 * @param function the function to run, free of branch and target markers
	 * @param arguments value of each parameter of the function
	 * @return the emitted messages and the value of the function body
	 * @throws TreeRuntimeException if the tree cannot be executed
	 */
	public ExecutionResult execute(FunctionBody function, Map<String, Object> arguments) {
		trace = new ArrayList<String>();
		scopes = new ArrayDeque<Map<String, Object>>();
		Map<String, Object> frame = new HashMap<String, Object>();
		for (String parameter : function.getParameters()) {
			if (!arguments.containsKey(parameter)) {
				throw new TreeRuntimeException(
						function.getPosition().getLineNo(),
						"No value given for parameter " + parameter + " of " + function.getName());
			}
			frame.put(parameter, arguments.get(parameter));
		}
		scopes.push(frame);
		try {
			Object value = evaluate(function.getBody());
			LOGGER.debug("{} emitted {} and returned {}", function, trace, value);
			return new ExecutionResult(trace, value);
		} catch (BreakSignal signal) {
			throw new TreeRuntimeException(signal.lineNumber, signal.getMessage() + " outside of any enclosing loop");
		} finally {
			scopes = null;
		}
	}

	private Object evaluate(Block block) {
		Object value = null;
		scopes.push(new HashMap<String, Object>());
		try {
			for (Statement statement : block.getStatements()) {
				Object result = statement.accept(this);
				value = statement.isValueProducing() ? result : null;
			}
		} finally {
			scopes.pop();
		}
		return value;
	}

	private Object repeat(String label, boolean catchesUnlabeled, Block body, AstNode node) {
		int iterations = 0;
		while (true) {
			if (maxLoopIterations > 0 && ++iterations > maxLoopIterations) {
				throw new TreeRuntimeException(
						line(node),
						"Loop exceeded " + maxLoopIterations + " iterations");
			}
			try {
				evaluate(body);
			} catch (BreakSignal signal) {
				if (signal.label == null ? catchesUnlabeled : signal.label.equals(label)) {
					return null;
				}
				throw signal;
			}
		}
	}

	private boolean condition(Object value, AstNode node) {
		if (!(value instanceof Boolean)) {
			throw new TreeRuntimeException(line(node), "Expected a boolean but got " + value);
		}
		return ((Boolean) value).booleanValue();
	}

	private static int line(AstNode node) {
		return node.getPosition().getLineNo();
	}

	@Override
	public Object visit(LocalStatement node) {
		Object value = node.getInitializer().accept(this);
		scopes.peek().put(node.getName(), value);
		return null;
	}

	@Override
	public Object visit(ExpressionStatement node) {
		return node.getExpression().accept(this);
	}

	@Override
	public Object visit(BranchMarker node) {
		throw new TreeRuntimeException(line(node), "Cannot execute the unresolved branch to '" + node.getTarget());
	}

	@Override
	public Object visit(TargetMarker node) {
		throw new TreeRuntimeException(line(node), "Cannot execute the unresolved target '" + node.getName());
	}

	@Override
	public Object visit(IfExpression node) {
		if (condition(node.getCondition().accept(this), node.getCondition())) {
			return evaluate(node.getThenBlock());
		}
		if (node.getElseBranch() != null) {
			return node.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Object visit(MatchExpression node) {
		Object selector = node.getSelector().accept(this);
		for (MatchArm arm : node.getArms()) {
			if (arm.matches(selector)) {
				return arm.getBody().accept(this);
			}
		}
		throw new TreeRuntimeException(line(node), "No arm matches " + selector);
	}

	@Override
	public Object visit(BlockExpression node) {
		return evaluate(node.getBlock());
	}

	@Override
	public Object visit(LoopExpression node) {
		return repeat(node.getLabel(), true, node.getBody(), node);
	}

	@Override
	public Object visit(RepeatBlock node) {
		return repeat(node.getLabel(), false, node.getBody(), node);
	}

	@Override
	public Object visit(BreakExpression node) {
		throw new BreakSignal(node.getLabel(), line(node));
	}

	@Override
	public Object visit(EmitExpression node) {
		trace.add(node.getMessage());
		return null;
	}

	@Override
	public Object visit(LiteralExpression node) {
		return node.getValue();
	}

	@Override
	public Object visit(VariableExpression node) {
		for (Map<String, Object> scope : scopes) {
			if (scope.containsKey(node.getName())) {
				return scope.get(node.getName());
			}
		}
		throw new TreeRuntimeException(line(node), "Unknown variable " + node.getName());
	}

	@Override
	public Object visit(NotExpression node) {
		return !condition(node.getOperand().accept(this), node.getOperand());
	}
}
