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

import java.util.HashSet;
import java.util.Set;

/**
 * Manages creation of {@link Label} instances for a single function body.
 * Synthesized labels never take a name reserved by the body itself.
 */
public class LabelManager {

	private final String prefix;
	private final Set<String> reservedNames = new HashSet<String>();
	private int counter;

	public LabelManager(String prefix) {
		this.prefix = prefix;
	}

	/**
	 * Marks a name used by the body (a target or a loop label) so that no
	 * synthesized label takes it.
	 *
	 * @param name the name to reserve
	 */
	public void reserve(String name) {
		reservedNames.add(name);
	}

	public boolean isReserved(String name) {
		return reservedNames.contains(name);
	}

	/**
	 * @param name name of a target marker
	 * @return the label of that target
	 */
	public Label named(String name) {
		return new Label(name, false);
	}

	/**
	 * @return a fresh synthesized label, {@code prefix0}, {@code prefix1}...
	 */
	public Label createLabel() {
		String name;
		do {
			name = prefix + counter++;
		} while (reservedNames.contains(name));
		reservedNames.add(name);
		return new Label(name, true);
	}
}
