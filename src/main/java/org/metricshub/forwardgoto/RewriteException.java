package org.metricshub.forwardgoto;

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

import org.metricshub.forwardgoto.frontend.ast.SourcePosition;

/**
 * Thrown when a statement tree cannot be rewritten. The first error aborts
 * the rewrite; the caller's tree is left untouched.
 */
public class RewriteException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;
	private final String detail;
	private final SourcePosition position;

	/**
	 * @param kind what went wrong
	 * @param detail human readable description, without the position
	 * @param position position of the offending marker or statement
	 */
	public RewriteException(ErrorKind kind, String detail, SourcePosition position) {
		super(detail + " (" + position + ")");
		this.kind = kind;
		this.detail = detail;
		this.position = position;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public String getDetail() {
		return detail;
	}

	public SourcePosition getPosition() {
		return position;
	}
}
