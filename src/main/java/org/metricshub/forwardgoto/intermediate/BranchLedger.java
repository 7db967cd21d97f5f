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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.forwardgoto.ErrorKind;
import org.metricshub.forwardgoto.RewriteException;
import org.metricshub.forwardgoto.frontend.ast.SourcePosition;

/**
 * Bookkeeping of pending branches and active targets during the traversal
 * of one function body.
 * <p>
 * Positions are {@code (level, index)} pairs: the nesting level of a
 * statement sequence and the index of a statement in it. Each pending
 * branch records the shallowest position known to enclose it. When the
 * traversal leaves a statement, branches recorded deeper are hoisted to
 * that statement, so that once a target is found, its branches and the
 * target meet in the same sequence.
 */
public class BranchLedger {

	/**
	 * Shallowest known position of the first branch seen for a target.
	 */
	public static final class BranchRecord {
		private int level;
		private int index;
		private final SourcePosition position;

		BranchRecord(int level, int index, SourcePosition position) {
			this.level = level;
			this.index = index;
			this.position = position;
		}

		public int getLevel() {
			return level;
		}

		public int getIndex() {
			return index;
		}

		public SourcePosition getPosition() {
			return position;
		}
	}

	/**
	 * Active targets and continuation level set aside while a
	 * sub-expression is walked in isolation.
	 */
	public static final class Snapshot {
		private final Map<Label, SourcePosition> activeTargets;
		private final int continuationLevel;

		private Snapshot(Map<Label, SourcePosition> activeTargets, int continuationLevel) {
			this.activeTargets = activeTargets;
			this.continuationLevel = continuationLevel;
		}
	}

	/**
	 * Targets resolved at the current level, with the lowest statement
	 * index any of their branches was recorded at.
	 */
	public static final class Resolution {
		private final int lowestIndex;
		private final List<Label> targets;

		Resolution(int lowestIndex, List<Label> targets) {
			this.lowestIndex = lowestIndex;
			this.targets = Collections.unmodifiableList(targets);
		}

		public int getLowestIndex() {
			return lowestIndex;
		}

		public List<Label> getTargets() {
			return targets;
		}
	}

	private int level;
	private int index = -1;
	private int continuationLevel;
	private final Map<Label, BranchRecord> branches = new LinkedHashMap<Label, BranchRecord>();
	private Map<Label, SourcePosition> activeTargets = new LinkedHashMap<Label, SourcePosition>();
	private final Set<Label> definedTargets = new HashSet<Label>();

	public int getLevel() {
		return level;
	}

	public int getIndex() {
		return index;
	}

	public int getContinuationLevel() {
		return continuationLevel;
	}

	/**
	 * Enters a child scope for the statement at {@code statementIndex}.
	 *
	 * @param statementIndex index of the statement in its sequence
	 * @return the index to give back to {@link #leave(int)}
	 */
	public int enter(int statementIndex) {
		int previousIndex = index;
		level++;
		index = statementIndex;
		return previousIndex;
	}

	/**
	 * Leaves the current scope: every branch recorded deeper than the new
	 * level is hoisted to the statement being left. Records at an equal or
	 * shallower level are kept, so the leftmost one wins a tie.
	 *
	 * @param previousIndex what {@link #enter(int)} returned
	 */
	public void leave(int previousIndex) {
		level--;
		continuationLevel = Math.min(continuationLevel, level);
		for (BranchRecord record : branches.values()) {
			if (level < record.level) {
				record.level = level;
				record.index = index;
			}
		}
		index = previousIndex;
	}

	/**
	 * Records a branch at the current position. Only the first branch to a
	 * given target is recorded; later ones share its merge point.
	 *
	 * @param target label of the target
	 * @param position position of the branch marker
	 * @throws RewriteException if the target was already seen, since only
	 *         forward branches are supported
	 */
	public void registerBranch(Label target, SourcePosition position) {
		if (index < 0) {
			throw new IllegalStateException("Branch to " + target + " registered outside of any statement");
		}
		if (definedTargets.contains(target)) {
			throw new RewriteException(
					ErrorKind.UNMATCHED_BRANCH,
					"Branch to " + target + " does not precede its target; only forward branches are supported",
					position);
		}
		if (!branches.containsKey(target)) {
			branches.put(target, new BranchRecord(level, index, position));
		}
	}

	/**
	 * Marks a target as active at the current level.
	 *
	 * @param target label of the target
	 * @param position position of the target marker
	 * @throws RewriteException if the target is defined twice, or never
	 *         branched to
	 */
	public void registerTarget(Label target, SourcePosition position) {
		if (definedTargets.contains(target)) {
			throw new RewriteException(ErrorKind.DUPLICATE_TARGET, "Target " + target + " is already defined", position);
		}
		if (!branches.containsKey(target)) {
			throw new RewriteException(ErrorKind.UNMATCHED_TARGET, "No branch to target " + target + " precedes it", position);
		}
		definedTargets.add(target);
		activeTargets.put(target, position);
		continuationLevel = level;
	}

	/**
	 * @return whether the rest of the current sequence must become a
	 *         continuation, because a target is active at or below this level
	 */
	public boolean shouldSplit() {
		return !activeTargets.isEmpty() && continuationLevel >= level;
	}

	public boolean hasActiveTargets() {
		return !activeTargets.isEmpty();
	}

	/**
	 * Resolves the active targets, provided all of their branches meet at
	 * the current level. Resolved targets and their records are dropped.
	 * Other branches recorded in the region spanning from the lowest index
	 * to the current statement are moved to the lowest index, as that region
	 * becomes a single statement.
	 *
	 * @return the resolution, or {@code null} if not every active target can
	 *         be resolved here
	 */
	public Resolution resolveActiveTargets() {
		if (activeTargets.isEmpty()) {
			return null;
		}
		int lowestIndex = Integer.MAX_VALUE;
		for (Label target : activeTargets.keySet()) {
			BranchRecord record = branches.get(target);
			if (record == null) {
				throw new IllegalStateException("Active target " + target + " has no recorded branch");
			}
			if (record.level != level) {
				return null;
			}
			lowestIndex = Math.min(lowestIndex, record.index);
		}
		List<Label> resolved = new ArrayList<Label>(activeTargets.keySet());
		for (Label target : resolved) {
			branches.remove(target);
		}
		activeTargets.clear();
		for (BranchRecord record : branches.values()) {
			if (record.level == level && record.index > lowestIndex) {
				record.index = lowestIndex;
			}
		}
		return new Resolution(lowestIndex, resolved);
	}

	/**
	 * Sets the active targets and the continuation level aside. Branch
	 * records stay shared.
	 *
	 * @return what to give back to {@link #restore(Snapshot)}
	 */
	public Snapshot cut() {
		Snapshot snapshot = new Snapshot(activeTargets, continuationLevel);
		activeTargets = new LinkedHashMap<Label, SourcePosition>();
		return snapshot;
	}

	public void restore(Snapshot snapshot) {
		activeTargets = snapshot.activeTargets;
		continuationLevel = snapshot.continuationLevel;
	}

	/**
	 * @return the first active target with its position, or {@code null}
	 */
	public Map.Entry<Label, SourcePosition> firstActiveTarget() {
		if (activeTargets.isEmpty()) {
			return null;
		}
		return activeTargets.entrySet().iterator().next();
	}

	/**
	 * @return the record of the first branch still waiting for its target,
	 *         or {@code null}
	 */
	public Map.Entry<Label, BranchRecord> firstPendingBranch() {
		if (branches.isEmpty()) {
			return null;
		}
		return branches.entrySet().iterator().next();
	}

	public BranchRecord getBranchRecord(Label target) {
		return branches.get(target);
	}
}
