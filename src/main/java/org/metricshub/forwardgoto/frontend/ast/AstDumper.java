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

import java.util.Iterator;
import java.util.List;

/**
 * Renders a tree as indented pseudo-source, one statement per line.
 */
final class AstDumper implements AstVisitor<Void> {

	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int level;

	private AstDumper() {}

	static String dump(AstNode node) {
		AstDumper dumper = new AstDumper();
		node.accept(dumper);
		return dumper.out.toString();
	}

	static String dump(FunctionBody function) {
		AstDumper dumper = new AstDumper();
		dumper.out.append("fn ").append(function.getName()).append('(');
		Iterator<String> parameters = function.getParameters().iterator();
		while (parameters.hasNext()) {
			dumper.out.append(parameters.next());
			if (parameters.hasNext()) {
				dumper.out.append(", ");
			}
		}
		dumper.out.append(") ");
		dumper.block(function.getBody());
		return dumper.out.toString();
	}

	private void indent() {
		for (int i = 0; i < level; i++) {
			out.append(INDENT);
		}
	}

	private void block(Block block) {
		out.append('{');
		List<Statement> statements = block.getStatements();
		if (statements.isEmpty()) {
			out.append('}');
			return;
		}
		out.append('\n');
		level++;
		for (Statement statement : statements) {
			indent();
			statement.accept(this);
			out.append('\n');
		}
		level--;
		indent();
		out.append('}');
	}

	private static String label(String label) {
		return "'" + label;
	}

	@Override
	public Void visit(LocalStatement node) {
		out.append("let ").append(node.getName()).append(" = ");
		node.getInitializer().accept(this);
		out.append(';');
		return null;
	}

	@Override
	public Void visit(ExpressionStatement node) {
		node.getExpression().accept(this);
		if (node.isTerminated()) {
			out.append(';');
		}
		return null;
	}

	@Override
	public Void visit(BranchMarker node) {
		out.append("branch ").append(label(node.getTarget()));
		return null;
	}

	@Override
	public Void visit(TargetMarker node) {
		out.append("target ").append(label(node.getName()));
		return null;
	}

	@Override
	public Void visit(IfExpression node) {
		out.append("if ");
		node.getCondition().accept(this);
		out.append(' ');
		block(node.getThenBlock());
		if (node.getElseBranch() != null) {
			out.append(" else ");
			node.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(MatchExpression node) {
		out.append("match ");
		node.getSelector().accept(this);
		out.append(" {\n");
		level++;
		for (MatchArm arm : node.getArms()) {
			indent();
			if (arm.isWildcard()) {
				out.append('_');
			} else {
				literal(arm.getPattern());
			}
			out.append(" => ");
			arm.getBody().accept(this);
			out.append(",\n");
		}
		level--;
		indent();
		out.append('}');
		return null;
	}

	@Override
	public Void visit(BlockExpression node) {
		block(node.getBlock());
		return null;
	}

	@Override
	public Void visit(LoopExpression node) {
		if (node.getLabel() != null) {
			out.append(label(node.getLabel())).append(": ");
		}
		out.append("loop ");
		block(node.getBody());
		return null;
	}

	@Override
	public Void visit(RepeatBlock node) {
		out.append(label(node.getLabel())).append(": repeat ");
		block(node.getBody());
		return null;
	}

	@Override
	public Void visit(BreakExpression node) {
		out.append("break");
		if (node.getLabel() != null) {
			out.append(' ').append(label(node.getLabel()));
		}
		return null;
	}

	@Override
	public Void visit(EmitExpression node) {
		out.append("emit ");
		literal(node.getMessage());
		return null;
	}

	@Override
	public Void visit(LiteralExpression node) {
		literal(node.getValue());
		return null;
	}

	@Override
	public Void visit(VariableExpression node) {
		out.append(node.getName());
		return null;
	}

	@Override
	public Void visit(NotExpression node) {
		out.append('!');
		node.getOperand().accept(this);
		return null;
	}

	private void literal(Object value) {
		if (value == null) {
			out.append("()");
		} else if (value instanceof String) {
			out.append('"').append(((String) value).replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
		} else {
			out.append(value);
		}
	}
}
