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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code match selector { arms }}: the first arm whose pattern equals the
 * selector's value is evaluated.
 */
public final class MatchExpression extends Expression {

	private Expression selector;
	private final List<MatchArm> arms;

	public MatchExpression(Expression selector, List<MatchArm> arms, SourcePosition position) {
		super(position);
		this.selector = selector;
		this.arms = new ArrayList<MatchArm>(arms);
	}

	public Expression getSelector() {
		return selector;
	}

	public void setSelector(Expression selector) {
		this.selector = selector;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<MatchArm> getArms() {
		return arms;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public MatchExpression copy() {
		List<MatchArm> armsCopy = new ArrayList<MatchArm>();
		for (MatchArm arm : arms) {
			armsCopy.add(arm.copy());
		}
		return new MatchExpression(selector.copy(), armsCopy, getPosition());
	}
}
