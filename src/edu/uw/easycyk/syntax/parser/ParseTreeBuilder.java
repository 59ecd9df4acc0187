package edu.uw.easycyk.syntax.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

import edu.uw.easycyk.syntax.grammar.Grammar;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeBinary;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeLeaf;
import edu.uw.easycyk.syntax.grammar.ParseTreeNode.ParseTreeNodeUnary;

/**
 * Rebuilds a parse tree from the backpointers in a chart, always following the first derivation recorded for each
 * variable. Uses an explicit stack, so long inputs can't overflow the call stack.
 */
public class ParseTreeBuilder {

	private ParseTreeBuilder() {
	}

	/**
	 * Returns the tree for the start symbol over the whole input, or empty if the start symbol isn't in the top cell.
	 */
	public static Optional<ParseTreeNode> build(final Grammar grammar, final List<String> tokens, final Chart chart) {
		Preconditions.checkArgument(chart.size() == tokens.size(), "Chart covers %s tokens, but input has %s",
				chart.size(), tokens.size());
		final int numTokens = tokens.size();
		if (numTokens == 0 || !chart.contains(0, numTokens - 1, grammar.getStartSymbol())) {
			return Optional.empty();
		}
		return Optional.of(build(chart, grammar.getStartSymbol(), 0, numTokens - 1));
	}

	/**
	 * Tree for the variable over tokens start..end. A variable with no recorded derivation becomes a childless node.
	 */
	public static ParseTreeNode build(final Chart chart, final String variable, final int start, final int end) {
		final Deque<Task> tasks = new ArrayDeque<>();
		final Deque<ParseTreeNode> built = new ArrayDeque<>();
		tasks.push(new Task(variable, start, end, false));

		while (!tasks.isEmpty()) {
			final Task task = tasks.pop();
			if (task.combine) {
				final ParseTreeNode right = built.pop();
				final ParseTreeNode left = built.pop();
				built.push(new ParseTreeNodeBinary(task.variable, left, right));
				continue;
			}

			final List<Derivation> derivations = chart.getDerivations(task.start, task.end, task.variable);
			if (derivations.isEmpty()) {
				built.push(new ParseTreeNodeLeaf(task.variable));
				continue;
			}

			final Derivation first = derivations.get(0);
			if (first.isTerminal()) {
				built.push(new ParseTreeNodeUnary(task.variable, first.getToken()));
			} else {
				// Pushed in reverse, so the left subtree is built first.
				tasks.push(new Task(task.variable, task.start, task.end, true));
				tasks.push(new Task(first.getRight(), first.getSplit() + 1, task.end, false));
				tasks.push(new Task(first.getLeft(), task.start, first.getSplit(), false));
			}
		}

		return built.pop();
	}

	private static class Task {
		private final String variable;
		private final int start;
		private final int end;
		private final boolean combine;

		private Task(final String variable, final int start, final int end, final boolean combine) {
			this.variable = variable;
			this.start = start;
			this.end = end;
			this.combine = combine;
		}
	}
}
