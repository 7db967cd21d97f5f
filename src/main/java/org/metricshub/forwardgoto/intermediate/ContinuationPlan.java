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

import java.util.Collections;
import java.util.List;

/**
 * A completed continuation graph, ready to be spliced into the sequence
 * starting at {@code lowestIndex}.
 */
public final class ContinuationPlan {

	private final int lowestIndex;
	private final Label endLabel;
	private final List<Continuation> continuations;

	ContinuationPlan(int lowestIndex, Label endLabel, List<Continuation> continuations) {
		this.lowestIndex = lowestIndex;
		this.endLabel = endLabel;
		this.continuations = Collections.unmodifiableList(continuations);
	}

	public int getLowestIndex() {
		return lowestIndex;
	}

	/**
	 * @return the label exited once control has gone through the whole graph
	 */
	public Label getEndLabel() {
		return endLabel;
	}

	/**
	 * @return the continuations, each one after all of its predecessors
	 */
	public List<Continuation> getContinuations() {
		return continuations;
	}

	@Override
	public String toString() {
		return "ContinuationPlan[" + lowestIndex + ", " + endLabel + ", " + continuations + "]";
	}
}
