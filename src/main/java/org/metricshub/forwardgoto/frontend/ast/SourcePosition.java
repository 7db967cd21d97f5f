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
 * Where a node of the statement tree comes from: a source description
 * (usually a file name) and a line number.
 */
public final class SourcePosition {

	/** Position of nodes built without any source information. */
	public static final SourcePosition UNKNOWN = new SourcePosition("<unknown>", -1);

	private final String sourceDescription;
	private final int lineNo;

	public SourcePosition(String sourceDescription, int lineNo) {
		this.sourceDescription = sourceDescription == null ? "<unknown>" : sourceDescription;
		this.lineNo = lineNo;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return the line number, or {@code -1} if unavailable
	 */
	public int getLineNo() {
		return lineNo;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof SourcePosition)) {
			return false;
		}
		SourcePosition that = (SourcePosition) other;
		return lineNo == that.lineNo && sourceDescription.equals(that.sourceDescription);
	}

	@Override
	public int hashCode() {
		return 31 * sourceDescription.hashCode() + lineNo;
	}

	@Override
	public String toString() {
		return sourceDescription + ":" + lineNo;
	}
}
