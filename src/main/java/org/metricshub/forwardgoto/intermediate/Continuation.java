package org.metricshub.forwardgoto.intermediate;

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
import java.util.Collections;
import java.util.List;
import org.metricshub.forwardgoto.frontend.ast.Statement;

/**
 * A statement suffix split off its sequence, to run once control arrives
 * from any of its predecessors.
 */
public final class Continuation {

	private final Label label;
	private final List<Statement> statements;
	private final List<Label> predecessors;

	Continuation(Label label, List<Statement> statements, List<Label> predecessors) {
		this.label = label;
		this.statements = statements;
		this.predecessors = Collections.unmodifiableList(new ArrayList<Label>(predecessors));
	}

	public Label getLabel() {
		return label;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<Statement> getStatements() {
		return statements;
	}

	/**
	 * @return labels of the blocks that exit into this continuation, in
	 *         order
	 */
	public List<Label> getPredecessors() {
		return predecessors;
	}

	@Override
	public String toString() {
		return label + " <- " + predecessors;
	}
}
