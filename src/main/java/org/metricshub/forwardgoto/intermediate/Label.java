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

/**
 * A name that early-exit statements can refer to.
 * <p>
 * Labels have the following properties:
 * <ul>
 * <li>A name, unique within a function body.
 * <li>Whether it was synthesized for a continuation, or named by a target
 * marker.
 * </ul>
 * Two labels are equal when their names are.
 */
public final class Label {

	private final String name;
	private final boolean synthetic;

	Label(String name, boolean synthetic) {
		this.name = name;
		this.synthetic = synthetic;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return whether this label was created for a continuation block
	 */
	public boolean isSynthetic() {
		return synthetic;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof Label && name.equals(((Label) other).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return "'" + name;
	}
}
