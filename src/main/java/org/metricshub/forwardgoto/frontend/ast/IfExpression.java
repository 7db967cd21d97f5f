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
 * {@code if condition { then } else otherwise}. The else branch is either
 * absent, a {@link BlockExpression}, or another {@link IfExpression}.
 */
public final class IfExpression extends Expression {

	private Expression condition;
	private final Block thenBlock;
	private Expression elseBranch;

	public IfExpression(Expression condition, Block thenBlock, Expression elseBranch, SourcePosition position) {
		super(position);
		this.condition = condition;
		this.thenBlock = thenBlock;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition() {
		return condition;
	}

	public void setCondition(Expression condition) {
		this.condition = condition;
	}

	public Block getThenBlock() {
		return thenBlock;
	}

	/**
	 * @return the else branch, or {@code null}
	 */
	public Expression getElseBranch() {
		return elseBranch;
	}

	public void setElseBranch(Expression elseBranch) {
		this.elseBranch = elseBranch;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public IfExpression copy() {
		return new IfExpression(
				condition.copy(),
				thenBlock.copy(),
				elseBranch == null ? null : elseBranch.copy(),
				getPosition());
	}
}
