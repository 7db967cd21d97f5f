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

/**
 * A visitor that walks every node of a tree and does nothing else.
 * Subclasses override the nodes they care about and call {@code super}
 * to keep descending.
 */
public abstract class AstScanner implements AstVisitor<Void> {

	public void scan(Block block) {
		for (Statement statement : block.getStatements()) {
			statement.accept(this);
		}
	}

	public void scan(FunctionBody function) {
		scan(function.getBody());
	}

	@Override
	public Void visit(LocalStatement node) {
		node.getInitializer().accept(this);
		return null;
	}

	@Override
	public Void visit(ExpressionStatement node) {
		node.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(BranchMarker node) {
		return null;
	}

	@Override
	public Void visit(TargetMarker node) {
		return null;
	}

	@Override
	public Void visit(IfExpression node) {
		node.getCondition().accept(this);
		scan(node.getThenBlock());
		if (node.getElseBranch() != null) {
			node.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(MatchExpression node) {
		node.getSelector().accept(this);
		for (MatchArm arm : node.getArms()) {
			arm.getBody().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(BlockExpression node) {
		scan(node.getBlock());
		return null;
	}

	@Override
	public Void visit(LoopExpression node) {
		scan(node.getBody());
		return null;
	}

	@Override
	public Void visit(RepeatBlock node) {
		scan(node.getBody());
		return null;
	}

	@Override
	public Void visit(BreakExpression node) {
		return null;
	}

	@Override
	public Void visit(EmitExpression node) {
		return null;
	}

	@Override
	public Void visit(LiteralExpression node) {
		return null;
	}

	@Override
	public Void visit(VariableExpression node) {
		return null;
	}

	@Override
	public Void visit(NotExpression node) {
		node.getOperand().accept(this);
		return null;
	}
}
