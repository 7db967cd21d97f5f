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
import java.util.Collection;
import java.util.List;

/**
 * An ordered, mutable sequence of statements.
 */
public final class Block {

	private final List<Statement> statements;

	public Block() {
		this.statements = new ArrayList<Statement>();
	}

	public Block(Collection<? extends Statement> statements) {
		this.statements = new ArrayList<Statement>(statements);
	}

	/**
	 * @return the live list of statements; the rewriter splices it in place
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<Statement> getStatements() {
		return statements;
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	public Block copy() {
		Block copy = new Block();
		for (Statement statement : statements) {
			copy.statements.add(statement.copy());
		}
		return copy;
	}
}
