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

import java.io.PrintStream;
import java.util.Map;
import org.metricshub.forwardgoto.backend.ExecutionResult;
import org.metricshub.forwardgoto.backend.TreeInterpreter;
import org.metricshub.forwardgoto.frontend.RewriteContext;
import org.metricshub.forwardgoto.frontend.TreeWalker;
import org.metricshub.forwardgoto.frontend.ast.FunctionBody;
import org.metricshub.forwardgoto.util.ForwardGotoLogger;
import org.metricshub.forwardgoto.util.RewriteSettings;
import org.slf4j.Logger;

/**
 * Entry point of the rewriter.
 * <p>
 * A function body may contain branch markers ({@code branch 'name}) and
 * target markers ({@code target 'name}). Every branch transfers control
 * forward to the target of the same name. {@link #rewrite(FunctionBody)}
 * replaces them with nested labeled repeat-blocks and early exits, which
 * any language with labeled loops and labeled breaks can express:
 *
 * <pre>
 * FunctionBody function = function("f", Arrays.asList("cond"),
 * 		stmt(ifThen(variable("cond"), branch("skip"))),
 * 		emit("mid"),
 * 		target("skip"),
 * 		emit("end"));
 * FunctionBody rewritten = new ForwardGoto().rewrite(function);
 * </pre>
 *
 * Instances only hold their settings and may be reused.
 */
public class ForwardGoto {

	private static final Logger LOGGER = ForwardGotoLogger.getLogger(ForwardGoto.class);

	private final RewriteSettings settings;

	public ForwardGoto() {
		this(new RewriteSettings());
	}

	public ForwardGoto(RewriteSettings settings) {
		this.settings = settings;
	}

	public RewriteSettings getSettings() {
		return settings;
	}

	/**
	 * Rewrites a copy of the function. The function itself is never
	 * modified, so nothing is left half-rewritten on failure.
	 *
	 * @param function the function to rewrite
	 * @return the rewritten copy, free of branch and target markers
	 * @throws RewriteException if the markers cannot be rewritten
	 */
	public FunctionBody rewrite(FunctionBody function) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Rewriting {} with settings:\n{}", function, settings.toDescriptionString());
		}
		FunctionBody copy = function.copy();
		if (settings.isDumpSyntaxTree()) {
			dump("before rewrite", copy);
		}
		try {
			new TreeWalker(new RewriteContext(settings)).walk(copy);
		} catch (RewriteException e) {
			LOGGER.debug("Cannot rewrite {}: {}", function, e.getMessage());
			throw e;
		}
		if (settings.isDumpSyntaxTree()) {
			dump("after rewrite", copy);
		}
		return copy;
	}

	/**
	 * Rewrites the function, then runs the result.
	 *
	 * @param function the function to run
	 * @param arguments value of each parameter of the function
	 * @return the emitted messages and the value of the function
	 * @throws RewriteException if the markers cannot be rewritten
	 * @throws org.metricshub.forwardgoto.backend.TreeRuntimeException if
	 *         the rewritten function cannot be executed
	 */
	public ExecutionResult run(FunctionBody function, Map<String, Object> arguments) {
		return new TreeInterpreter(settings).execute(rewrite(function), arguments);
	}

	private void dump(String title, FunctionBody function) {
		PrintStream ps = settings.getOutputStream();
		ps.println("// " + function.getName() + ", " + title);
		ps.println(function.dump());
	}
}
