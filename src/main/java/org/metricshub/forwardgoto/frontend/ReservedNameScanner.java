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

import org.metricshub.forwardgoto.frontend.ast.AstScanner;
import org.metricshub.forwardgoto.frontend.ast.LoopExpression;
import org.metricshub.forwardgoto.frontend.ast.RepeatBlock;
import org.metricshub.forwardgoto.frontend.ast.TargetMarker;

/**
 * Reserves every label name used by a body before it is rewritten, so that
 * synthesized labels cannot shadow them.
 */
class ReservedNameScanner extends AstScanner {

	private final RewriteContext context;

	ReservedNameScanner(RewriteContext context) {
		this.context = context;
	}

	@Override
	public Void visit(TargetMarker node) {
		context.reserveTargetName(node.getName());
		return null;
	}

	@Override
	public Void visit(LoopExpression node) {
		if (node.getLabel() != null) {
			context.reserveLoopLabel(node.getLabel());
		}
		return super.visit(node);
	}

	@Override
	public Void visit(RepeatBlock node) {
		context.reserveLoopLabel(node.getLabel());
		return super.visit(node);
	}
}
