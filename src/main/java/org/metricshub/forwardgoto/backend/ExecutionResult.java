package org.metricshub.forwardgoto.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What running a function produced: the messages it emitted, in order, and
 * the value of its body.
 */
public final class ExecutionResult {

	private final List<String> trace;
	private final Object value;

	public ExecutionResult(List<String> trace, Object value) {
		this.trace = Collections.unmodifiableList(new ArrayList<String>(trace));
		this.value = value;
	}

	public List<String> getTrace() {
		return trace;
	}

	/**
	 * @return the value of the function body, {@code null} for unit
	 */
	public Object getValue() {
		return value;
	}

	@Override
	public String toString() {
		return "ExecutionResult[trace=" + trace + ", value=" + value + "]";
	}
}
