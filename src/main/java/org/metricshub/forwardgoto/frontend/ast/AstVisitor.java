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
 * Visitor over the nodes of the statement tree. {@link Block},
 * {@link MatchArm} and {@link FunctionBody} are containers walked by the
 * visitor itself.
 *
 * @param <R> type returned by each visit
 */
public interface AstVisitor<R> {

	R visit(LocalStatement node);

	R visit(ExpressionStatement node);

	R visit(BranchMarker node);

	R visit(TargetMarker node);

	R visit(IfExpression node);

	R visit(MatchExpression node);

	R visit(BlockExpression node);

	R visit(LoopExpression node);

	R visit(RepeatBlock node);

	R visit(BreakExpression node);

	R visit(EmitExpression node);

	R visit(LiteralExpression node);

	R visit(VariableExpression node);

	R visit(NotExpression node);
}
