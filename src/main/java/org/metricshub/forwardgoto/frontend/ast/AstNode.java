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

import java.io.PrintStream;

/**
 * Base class of every node of the statement tree.
 * <p>
 * Nodes are mutable: the rewriter replaces children in place. Use
 * {@link #copy()} to obtain an independent deep copy.
 */
public abstract class AstNode {

	private SourcePosition position;

	protected AstNode(SourcePosition position) {
		this.position = position == null ? SourcePosition.UNKNOWN : position;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public void setPosition(SourcePosition position) {
		this.position = position == null ? SourcePosition.UNKNOWN : position;
	}

	/**
	 * Dispatches to the {@code visit} overload matching this node.
	 *
	 * @param visitor the visitor
	 * @param <R> type returned by the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * @return a deep copy of this node and all of its children
	 */
	public abstract AstNode copy();

	/**
	 * Prints this node as indented pseudo-source.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		ps.println(dump());
	}

	/**
	 * @return this node as indented pseudo-source
	 */
	public String dump() {
		return AstDumper.dump(this);
	}

	@Override
	public String toString() {
		return getClass().getName().replaceFirst(".*[$.]", "");
	}
}
