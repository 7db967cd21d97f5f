package org.metricshub.forwardgoto.util;

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
import java.io.PrintStream;

/**
 * A simple container for the parameters of a rewrite (and of the optional
 * execution of its result). These values have defaults, which may be changed
 * when invoking the rewriter programmatically.
 */
public class RewriteSettings {

	/**
	 * Prefix of the labels synthesized for continuation blocks;
	 * <code>_continuation</code> by default.
	 */
	private String continuationLabelPrefix = "_continuation";

	/**
	 * Whether to dump the syntax tree before and after the rewrite;
	 * <code>false</code> by default.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * Where syntax tree dumps are printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum number of iterations a single loop may run when a rewritten
	 * tree is executed, <code>100000</code> by default.
	 * A non-positive value disables the limit.
	 */
	private int maxLoopIterations = 100000;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("continuationLabelPrefix = ").append(getContinuationLabelPrefix()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);
		desc.append("maxLoopIterations = ").append(getMaxLoopIterations()).append(newLine);

		return desc.toString();
	}

	public String getContinuationLabelPrefix() {
		return continuationLabelPrefix;
	}

	/**
	 * Sets the prefix of synthesized continuation labels.
	 *
	 * @param continuationLabelPrefix a non-empty prefix
	 */
	public void setContinuationLabelPrefix(String continuationLabelPrefix) {
		if (continuationLabelPrefix == null || continuationLabelPrefix.isEmpty()) {
			throw new IllegalArgumentException("The continuation label prefix must not be empty");
		}
		this.continuationLabelPrefix = continuationLabelPrefix;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public int getMaxLoopIterations() {
		return maxLoopIterations;
	}

	public void setMaxLoopIterations(int maxLoopIterations) {
		this.maxLoopIterations = maxLoopIterations;
	}
}
