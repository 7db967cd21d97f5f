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
 * One arm of a {@link MatchExpression}: a literal pattern, or the wildcard,
 * and the body evaluated when it matches.
 */
public final class MatchArm {

	private final Object pattern;
	private final boolean wildcard;
	private Expression body;

	private MatchArm(Object pattern, boolean wildcard, Expression body) {
		this.pattern = pattern;
		this.wildcard = wildcard;
		this.body = body;
	}

	public static MatchArm of(Object pattern, Expression body) {
		if (pattern == null) {
			throw new IllegalArgumentException("A match pattern cannot be null, use the wildcard arm");
		}
		return new MatchArm(pattern, false, body);
	}

	public static MatchArm wildcard(Expression body) {
		return new MatchArm(null, true, body);
	}

	/**
	 * @return the literal pattern, or {@code null} for the wildcard arm
	 */
	public Object getPattern() {
		return pattern;
	}

	public boolean isWildcard() {
		return wildcard;
	}

	public boolean matches(Object value) {
		return wildcard || pattern.equals(value);
	}

	public Expression getBody() {
		return body;
	}

	public void setBody(Expression body) {
		this.body = body;
	}

	public MatchArm copy() {
		return new MatchArm(pattern, wildcard, body.copy());
	}
}
