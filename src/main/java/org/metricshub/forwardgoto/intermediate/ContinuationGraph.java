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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.forwardgoto.frontend.ast.Statement;

/**
 * Arena of the continuations split off during a traversal, keyed by label.
 * Edges are labels: each continuation lists the labels of the blocks that
 * exit into it. Targets are the leaves and have no continuation record.
 * <p>
 * The incoming set holds the labels control may currently arrive from
 * once the current scope falls through: a target just seen, or the last
 * continuation created.
 */
public class ContinuationGraph {

	/**
	 * Incoming labels and continuations set aside while a sub-expression is
	 * walked in isolation.
	 */
	public static final class Snapshot {
		private final List<Label> incoming;
		private final Map<Label, Continuation> continuations;

		private Snapshot(List<Label> incoming, Map<Label, Continuation> continuations) {
			this.incoming = incoming;
			this.continuations = continuations;
		}
	}

	private final LabelManager labelManager;
	private Map<Label, Continuation> continuations = new LinkedHashMap<Label, Continuation>();
	private List<Label> incoming = new ArrayList<Label>();

	public ContinuationGraph(LabelManager labelManager) {
		this.labelManager = labelManager;
	}

	public void addIncoming(Label label) {
		incoming.add(label);
	}

	public List<Label> getIncoming() {
		return Collections.unmodifiableList(incoming);
	}

	public Continuation getContinuation(Label label) {
		return continuations.get(label);
	}

	/**
	 * @return whether no continuation and no incoming label is pending
	 */
	public boolean isEmpty() {
		return continuations.isEmpty() && incoming.isEmpty();
	}

	/**
	 * Starts a child scope with an empty incoming set.
	 *
	 * @return the incoming set of the parent scope
	 */
	public List<Label> enterScope() {
		List<Label> saved = incoming;
		incoming = new ArrayList<Label>();
		return saved;
	}

	/**
	 * Merges the child scope's incoming labels with the parent's, child first.
	 *
	 * @param saved what {@link #enterScope()} returned
	 */
	public void leaveScope(List<Label> saved) {
		incoming.addAll(saved);
	}

	public Snapshot cut() {
		Snapshot snapshot = new Snapshot(incoming, continuations);
		incoming = new ArrayList<Label>();
		continuations = new LinkedHashMap<Label, Continuation>();
		return snapshot;
	}

	public void restore(Snapshot snapshot) {
		incoming = snapshot.incoming;
		continuations = snapshot.continuations;
	}

	/**
	 * Records {@code statements} as a continuation of every incoming label.
	 * The new continuation becomes the only incoming label. If a single label
	 * is incoming and there is nothing to record, that label is kept as is.
	 *
	 * @param statements the split-off suffix, possibly empty
	 * @return the label that the fall-through path must exit to in order to
	 *         reach the start of the continuation
	 */
	public Label pushContinuation(List<Statement> statements) {
		if (incoming.isEmpty()) {
			throw new IllegalStateException("Cannot split a continuation with no incoming label");
		}
		if (incoming.size() == 1 && statements.isEmpty()) {
			return incoming.get(0);
		}
		Label label = labelManager.createLabel();
		continuations.put(label, new Continuation(label, statements, incoming));
		Label jump = incoming.get(0);
		incoming = new ArrayList<Label>();
		incoming.add(label);
		return jump;
	}

	/**
	 * Collapses the incoming set into a single end label and removes every
	 * continuation leading to it from the arena.
	 *
	 * @param lowestIndex where the plan will be spliced
	 * @return the continuations, each one after all of its predecessors
	 */
	public ContinuationPlan drain(int lowestIndex) {
		if (incoming.size() > 1) {
			pushContinuation(new ArrayList<Statement>());
		}
		if (incoming.isEmpty()) {
			throw new IllegalStateException("Cannot drain continuations with no incoming label");
		}
		Label endLabel = incoming.get(0);
		incoming = new ArrayList<Label>();
		List<Continuation> ordered = new ArrayList<Continuation>();
		collect(endLabel, ordered);
		return new ContinuationPlan(lowestIndex, endLabel, ordered);
	}

	private void collect(Label label, List<Continuation> ordered) {
		Continuation continuation = continuations.remove(label);
		if (continuation == null) {
			return;
		}
		for (Label predecessor : continuation.getPredecessors()) {
			collect(predecessor, ordered);
		}
		ordered.add(continuation);
	}
}
