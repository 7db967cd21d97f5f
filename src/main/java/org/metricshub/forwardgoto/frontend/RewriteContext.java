package org.metricshub.forwardgoto.frontend;

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
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.forwardgoto.ErrorKind;
import org.metricshub.forwardgoto.RewriteException;
import org.metricshub.forwardgoto.frontend.ast.SourcePosition;
import org.metricshub.forwardgoto.frontend.ast.Statement;
import org.metricshub.forwardgoto.intermediate.BranchLedger;
import org.metricshub.forwardgoto.intermediate.ContinuationGraph;
import org.metricshub.forwardgoto.intermediate.ContinuationPlan;
import org.metricshub.forwardgoto.intermediate.Label;
import org.metricshub.forwardgoto.intermediate.LabelManager;
import org.metricshub.forwardgoto.util.ForwardGotoLogger;
import org.metricshub.forwardgoto.util.RewriteSettings;
import org.slf4j.Logger;

/**
 * State of the rewrite of one function body: the branch ledger, the
 * continuation graph and the label manager, with scope guards meant for
 * try-with-resources so that leaving a scope happens on every exit path.
 */
public class RewriteContext {

	private static final Logger LOGGER = ForwardGotoLogger.getLogger(RewriteContext.class);

	/**
	 * A scope entered by the walker. Closing it leaves the scope.
	 */
	public interface Scope extends AutoCloseable {
		@Override
		void close();
	}

	/**
	 * A read-only traversal of a sub-expression: branches recorded inside
	 * remain visible, but targets and continuations must be resolved before
	 * the cut ends.
	 */
	public final class Cut implements Scope {
		private final BranchLedger.Snapshot ledgerSnapshot;
		private final ContinuationGraph.Snapshot graphSnapshot;

		private Cut() {
			ledgerSnapshot = ledger.cut();
			graphSnapshot = graph.cut();
		}

		/**
		 * @throws RewriteException if a target inside the cut is still
		 *         waiting for branches from outside it
		 */
		public void ensureResolved() {
			Map.Entry<Label, SourcePosition> pending = ledger.firstActiveTarget();
			if (pending != null) {
				throw new RewriteException(
						ErrorKind.INACCESSIBLE_TARGET,
						"Target " + pending.getKey() + " cannot be reached from branches outside of the enclosing "
								+ "loop, condition, selector, initializer or merge block",
						pending.getValue());
			}
			if (!graph.isEmpty()) {
				throw new IllegalStateException("Continuations left over in a nested expression");
			}
		}

		@Override
		public void close() {
			ledger.restore(ledgerSnapshot);
			graph.restore(graphSnapshot);
		}
	}

	private final LabelManager labelManager;
	private final BranchLedger ledger = new BranchLedger();
	private final ContinuationGraph graph;
	private final Set<String> loopLabels = new HashSet<String>();

	public RewriteContext(RewriteSettings settings) {
		labelManager = new LabelManager(settings.getContinuationLabelPrefix());
		graph = new ContinuationGraph(labelManager);
	}

	public BranchLedger getLedger() {
		return ledger;
	}

	public ContinuationGraph getGraph() {
		return graph;
	}

	/**
	 * Reserves the label of a user loop. Targets may not reuse it.
	 *
	 * @param name the loop label
	 */
	public void reserveLoopLabel(String name) {
		loopLabels.add(name);
		labelManager.reserve(name);
	}

	public void reserveTargetName(String name) {
		labelManager.reserve(name);
	}

	/**
	 * Enters the statement at {@code index} of the current sequence.
	 *
	 * @param index index of the statement
	 * @return the scope to close once the statement is walked
	 */
	public Scope enterStatement(int index) {
		final int previousIndex = ledger.enter(index);
		final List<Label> savedIncoming = graph.enterScope();
		return new Scope() {
			@Override
			public void close() {
				ledger.leave(previousIndex);
				graph.leaveScope(savedIncoming);
			}
		};
	}

	/**
	 * Enters a nested scope of the current statement: a branch of an
	 * {@code if}, an arm of a {@code match}, a block.
	 *
	 * @return the scope to close once the nested scope is walked
	 */
	public Scope enter() {
		return enterStatement(ledger.getIndex());
	}

	public Cut cut() {
		return new Cut();
	}

	public void registerBranch(String target, SourcePosition position) {
		Label label = labelManager.named(target);
		ledger.registerBranch(label, position);
		LOGGER.trace("Branch to {} at level {}, index {}", label, ledger.getLevel(), ledger.getIndex());
	}

	public void registerTarget(String name, SourcePosition position) {
		if (loopLabels.contains(name)) {
			throw new RewriteException(
					ErrorKind.DUPLICATE_TARGET,
					"Target '" + name + "' reuses the label of a loop",
					position);
		}
		Label label = labelManager.named(name);
		ledger.registerTarget(label, position);
		graph.addIncoming(label);
		LOGGER.trace("Target {} at level {}, index {}", label, ledger.getLevel(), ledger.getIndex());
	}

	public boolean shouldSplit() {
		return ledger.shouldSplit();
	}

	/**
	 * @param statements the suffix split off the current sequence
	 * @return the label the fall-through path exits to
	 */
	public Label pushContinuation(List<Statement> statements) {
		Label jump = graph.pushContinuation(statements);
		LOGGER.debug("Split {} statement(s) at level {}, fall-through exits to {}", statements.size(), ledger.getLevel(), jump);
		return jump;
	}

	/**
	 * @return the continuations to splice after the statement just walked, or
	 *         {@code null} if the active targets are not all resolved at this
	 *         level
	 */
	public ContinuationPlan retrieveContinuations() {
		BranchLedger.Resolution resolution = ledger.resolveActiveTargets();
		if (resolution == null) {
			return null;
		}
		ContinuationPlan plan = graph.drain(resolution.getLowestIndex());
		LOGGER.debug("Resolved {} at level {}: {}", resolution.getTargets(), ledger.getLevel(), plan);
		return plan;
	}

	/**
	 * Checks that the traversal left nothing behind.
	 *
	 * @throws RewriteException if a branch never met its target
	 */
	public void finish() {
		Map.Entry<Label, BranchLedger.BranchRecord> pending = ledger.firstPendingBranch();
		if (pending != null) {
			throw new RewriteException(
					ErrorKind.UNMATCHED_BRANCH,
					"No target " + pending.getKey() + " follows this branch",
					pending.getValue().getPosition());
		}
		if (ledger.hasActiveTargets() || !graph.isEmpty()) {
			throw new IllegalStateException("Unresolved targets or continuations at the end of the function body");
		}
	}
}
