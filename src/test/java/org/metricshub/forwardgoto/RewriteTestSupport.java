package org.metricshub.forwardgoto;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.forwardgoto.backend.ExecutionResult;
import org.metricshub.forwardgoto.backend.TreeInterpreter;
import org.metricshub.forwardgoto.frontend.ast.AstScanner;
import org.metricshub.forwardgoto.frontend.ast.BranchMarker;
import org.metricshub.forwardgoto.frontend.ast.FunctionBody;
import org.metricshub.forwardgoto.frontend.ast.LoopExpression;
import org.metricshub.forwardgoto.frontend.ast.RepeatBlock;
import org.metricshub.forwardgoto.frontend.ast.TargetMarker;
import org.metricshub.forwardgoto.util.RewriteSettings;

/**
 * Reusable helpers for rewrite tests. The fluent builder returned by
 * {@link #rewriteTest(String)} describes a function, its arguments and the
 * expected trace, value or error; running it rewrites the function and
 * executes the result.
 */
public final class RewriteTestSupport {

	private RewriteTestSupport() {}

	/**
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static RewriteTestBuilder rewriteTest(String description) {
		return new RewriteTestBuilder(description);
	}

	/**
	 * @param function a function
	 * @return how many branch and target markers it contains
	 */
	public static int countMarkers(FunctionBody function) {
		final int[] count = new int[1];
		new AstScanner() {
			@Override
			public Void visit(BranchMarker node) {
				count[0]++;
				return null;
			}

			@Override
			public Void visit(TargetMarker node) {
				count[0]++;
				return null;
			}
		}.scan(function);
		return count[0];
	}

	/**
	 * @param function a function
	 * @return the labels of its loops and repeat-blocks, duplicates included
	 */
	public static List<String> loopLabels(FunctionBody function) {
		final List<String> labels = new ArrayList<>();
		new AstScanner() {
			@Override
			public Void visit(LoopExpression node) {
				if (node.getLabel() != null) {
					labels.add(node.getLabel());
				}
				return super.visit(node);
			}

			@Override
			public Void visit(RepeatBlock node) {
				labels.add(node.getLabel());
				return super.visit(node);
			}
		}.scan(function);
		return labels;
	}

	/**
	 * Outcome of a rewrite test: the rewritten function and what running it
	 * produced, or the exception that was thrown.
	 */
	public static final class TestResult {
		private final String description;
		private final FunctionBody rewritten;
		private final ExecutionResult execution;
		private final Throwable thrownException;
		private final List<String> expectedTrace;
		private final boolean checkValue;
		private final Object expectedValue;
		private final ErrorKind expectedError;
		private final Integer expectedErrorLine;

		private TestResult(RewriteTestBuilder builder, FunctionBody rewritten, ExecutionResult execution, Throwable thrown) {
			this.description = builder.description;
			this.rewritten = rewritten;
			this.execution = execution;
			this.thrownException = thrown;
			this.expectedTrace = builder.expectedTrace;
			this.checkValue = builder.checkValue;
			this.expectedValue = builder.expectedValue;
			this.expectedError = builder.expectedError;
			this.expectedErrorLine = builder.expectedErrorLine;
		}

		public FunctionBody rewritten() {
			return rewritten;
		}

		public ExecutionResult execution() {
			return execution;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Verifies the trace, value or error against the expectations defined
		 * in the builder. A successful rewrite must also be free of markers and
		 * must not reuse a loop label.
		 */
		public void assertExpected() {
			if (expectedError != null) {
				if (!(thrownException instanceof RewriteException)) {
					throw new AssertionError(
							"Expected " + expectedError + " for " + description + " but got " + thrownException,
							thrownException);
				}
				RewriteException e = (RewriteException) thrownException;
				assertEquals("Unexpected error kind for " + description, expectedError, e.getKind());
				if (expectedErrorLine != null) {
					assertEquals(
							"Unexpected error line for " + description,
							expectedErrorLine.intValue(),
							e.getPosition().getLineNo());
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			assertEquals("Markers left in " + description, 0, countMarkers(rewritten));
			List<String> labels = loopLabels(rewritten);
			Set<String> unique = new HashSet<>(labels);
			assertEquals("Duplicate loop labels in " + description + ": " + labels, unique.size(), labels.size());
			if (expectedTrace != null) {
				assertEquals("Unexpected trace for " + description, expectedTrace, execution.getTrace());
			}
			if (checkValue) {
				assertEquals("Unexpected value for " + description, expectedValue, execution.getValue());
			}
		}
	}

	/**
	 * Fluent description of a rewrite test.
	 */
	public static final class RewriteTestBuilder {
		private final String description;
		private FunctionBody function;
		private final Map<String, Object> arguments = new LinkedHashMap<>();
		private RewriteSettings settings = new RewriteSettings();
		private List<String> expectedTrace;
		private boolean checkValue;
		private Object expectedValue;
		private ErrorKind expectedError;
		private Integer expectedErrorLine;

		private RewriteTestBuilder(String description) {
			this.description = description;
		}

		public RewriteTestBuilder function(FunctionBody functionParam) {
			this.function = functionParam;
			return this;
		}

		public RewriteTestBuilder argument(String name, Object value) {
			arguments.put(name, value);
			return this;
		}

		public RewriteTestBuilder settings(RewriteSettings settingsParam) {
			this.settings = settingsParam;
			return this;
		}

		public RewriteTestBuilder expectTrace(String... messages) {
			this.expectedTrace = Arrays.asList(messages);
			return this;
		}

		public RewriteTestBuilder expectValue(Object value) {
			this.checkValue = true;
			this.expectedValue = value;
			return this;
		}

		public RewriteTestBuilder expectError(ErrorKind kind) {
			this.expectedError = kind;
			return this;
		}

		public RewriteTestBuilder expectError(ErrorKind kind, int line) {
			this.expectedError = kind;
			this.expectedErrorLine = line;
			return this;
		}

		/**
		 * Rewrites then executes the function, capturing any exception.
		 *
		 * @return the outcome
		 */
		public TestResult run() {
			if (function == null) {
				throw new IllegalStateException("No function given for " + description);
			}
			FunctionBody rewritten = null;
			ExecutionResult execution = null;
			Throwable thrown = null;
			try {
				rewritten = new ForwardGoto(settings).rewrite(function);
				execution = new TreeInterpreter(settings).execute(rewritten, arguments);
			} catch (RuntimeException e) {
				thrown = e;
			}
			return new TestResult(this, rewritten, execution, thrown);
		}

		public void runAndAssert() {
			run().assertExpected();
		}
	}
}
