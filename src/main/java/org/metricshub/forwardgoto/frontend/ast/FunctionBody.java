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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The unit of rewriting: a named body with its parameter names.
 */
public final class FunctionBody {

	private final String name;
	private final List<String> parameters;
	private final Block body;
	private final SourcePosition position;

	public FunctionBody(String name, List<String> parameters, Block body, SourcePosition position) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
		this.body = body;
		this.position = position == null ? SourcePosition.UNKNOWN : position;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public Block getBody() {
		return body;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public FunctionBody copy() {
		return new FunctionBody(name, parameters, body.copy(), position);
	}

	/**
	 * @return this function as indented pseudo-source
	 */
	public String dump() {
		return AstDumper.dump(this);
	}

	@Override
	public String toString() {
		return "FunctionBody " + name;
	}
}
