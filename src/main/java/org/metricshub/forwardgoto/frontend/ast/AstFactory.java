package org.metricshub.forwardgoto.frontend.ast;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static builders for statement trees, meant to be imported statically.
 * Nodes are created without a position; use {@link #at(int, AstNode)} to
 * give one.
 */
public final class AstFactory {

	/** Source description given to positions set by {@link #at(int, AstNode)}. */
	public static final String DEFAULT_SOURCE = "<input>";

	private AstFactory() {}

	public static FunctionBody function(String name, List<String> parameters, Statement... statements) {
		return new FunctionBody(name, parameters, block(statements), SourcePosition.UNKNOWN);
	}

	public static FunctionBody function(String name, Statement... statements) {
		return function(name, Collections.<String>emptyList(), statements);
	}

	public static Block block(Statement... statements) {
		return new Block(Arrays.asList(statements));
	}

	/**
	 * Sets the position of a node.
	 *
	 * @param line line number in {@link #DEFAULT_SOURCE}
	 * @param node the node
	 * @param <T> type of the node
	 * @return the same node
	 */
	public static <T extends AstNode> T at(int line, T node) {
		node.setPosition(new SourcePosition(DEFAULT_SOURCE, line));
		return node;
	}

	// Statements

	public static LocalStatement let(String name, Expression initializer) {
		return new LocalStatement(name, initializer, null);
	}

	/**
	 * @return a terminated expression statement: {@code expression;}
	 */
	public static ExpressionStatement stmt(Expression expression) {
		return new ExpressionStatement(expression, true, null);
	}

	/**
	 * @return a value-producing expression statement
	 */
	public static ExpressionStatement tail(Expression expression) {
		return new ExpressionStatement(expression, false, null);
	}

	public static ExpressionStatement branch(String target) {
		return stmt(branchMarker(target));
	}

	public static ExpressionStatement target(String name) {
		return stmt(targetMarker(name));
	}

	public static ExpressionStatement emit(String message) {
		return stmt(emitExpr(message));
	}

	public static ExpressionStatement breakStmt(String label) {
		return stmt(breakTo(label));
	}

	// Expressions

	public static BranchMarker branchMarker(String target) {
		return new BranchMarker(target, null);
	}

	public static TargetMarker targetMarker(String name) {
		return new TargetMarker(name, null);
	}

	public static EmitExpression emitExpr(String message) {
		return new EmitExpression(message, null);
	}

	public static IfExpression ifThen(Expression condition, Statement... then) {
		return new IfExpression(condition, block(then), null, null);
	}

	public static IfExpression ifElse(Expression condition, Block then, Block otherwise) {
		return new IfExpression(condition, then, blockExpr(otherwise), null);
	}

	public static IfExpression ifElseIf(Expression condition, Block then, IfExpression otherwise) {
		return new IfExpression(condition, then, otherwise, null);
	}

	public static MatchExpression match(Expression selector, MatchArm... arms) {
		return new MatchExpression(selector, Arrays.asList(arms), null);
	}

	public static MatchArm arm(Object pattern, Statement... body) {
		return MatchArm.of(pattern, blockExpr(block(body)));
	}

	public static MatchArm otherwise(Statement... body) {
		return MatchArm.wildcard(blockExpr(block(body)));
	}

	public static BlockExpression blockExpr(Block block) {
		return new BlockExpression(block, null);
	}

	public static BlockExpression blockExpr(Statement... statements) {
		return blockExpr(block(statements));
	}

	public static LoopExpression loop(String label, Statement... body) {
		return new LoopExpression(label, block(body), null);
	}

	public static RepeatBlock repeat(String label, Statement... body) {
		return new RepeatBlock(label, block(body), null);
	}

	public static BreakExpression breakTo(String label) {
		return new BreakExpression(label, null);
	}

	public static LiteralExpression literal(Object value) {
		return new LiteralExpression(value, null);
	}

	public static VariableExpression variable(String name) {
		return new VariableExpression(name, null);
	}

	public static NotExpression not(Expression operand) {
		return new NotExpression(operand, null);
	}
}
