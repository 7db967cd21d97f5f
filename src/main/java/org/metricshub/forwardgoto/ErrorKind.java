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

/**
 * The kinds of failures reported by the rewriter.
 */
public enum ErrorKind {
	/** A target marker whose name was never branched to. */
	UNMATCHED_TARGET,
	/** A branch marker whose target never follows it. */
	UNMATCHED_BRANCH,
	/** A target marker whose name is already defined. */
	DUPLICATE_TARGET,
	/** A value-producing statement would have to move into a merge block. */
	INVALID_RESULT_POSITION,
	/**
	 * A target placed where branches from outside cannot reach it: inside a
	 * loop body, a condition, a match selector or a let initializer.
	 */
	INACCESSIBLE_TARGET
}
